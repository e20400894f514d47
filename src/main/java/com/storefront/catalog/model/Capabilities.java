package com.storefront.catalog.model;

/**
 * What an adapter declares about its sources.
 *
 * @param pagination          the search API can be paged past the first page
 * @param returnsPartialPrice prices may arrive as display strings rather than amounts
 */
public record Capabilities(boolean pagination, boolean returnsPartialPrice) {
}
