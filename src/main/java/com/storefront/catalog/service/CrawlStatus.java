package com.storefront.catalog.service;

/**
 * Outcome of one store's crawl.
 */
public enum CrawlStatus {
    /** The catalog was written, possibly with zero records. */
    COMPLETED,
    /** The store name resolved to no configured store. */
    SKIPPED,
    /**
     * The crawl failed, the adapter could not be set up, or the catalog could
     * not be written. A crawl or serialization failure leaves the previous
     * catalog in place.
     */
    FAILED
}
