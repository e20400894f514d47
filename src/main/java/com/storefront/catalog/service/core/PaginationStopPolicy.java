package com.storefront.catalog.service.core;

/**
 * Decides when a paginated search query has reached its last page.
 */
@FunctionalInterface
public interface PaginationStopPolicy {

    /**
     * @param rawCount items located on the page, before any rejection
     * @param pageSize page size that was requested
     * @return {@code true} when no further page should be requested
     */
    boolean isLastPage(int rawCount, int pageSize);
}
