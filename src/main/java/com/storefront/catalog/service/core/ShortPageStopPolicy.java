package com.storefront.catalog.service.core;

/**
 * Ends a query at the first page holding fewer raw items than requested.
 * <p>
 * Counts raw items rather than accepted records: a full page whose items
 * all fail validation still means more pages exist.
 * </p>
 */
public class ShortPageStopPolicy implements PaginationStopPolicy {

    @Override
    public boolean isLastPage(final int rawCount, final int pageSize) {
        return rawCount < pageSize;
    }
}
