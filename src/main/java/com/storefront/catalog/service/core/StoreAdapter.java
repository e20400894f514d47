package com.storefront.catalog.service.core;

import com.storefront.catalog.model.Capabilities;
import com.storefront.catalog.model.Store;

/**
 * Contract every storefront integration implements.
 * <p>
 * An adapter is cheap to create and holds no network resources; each crawl
 * run calls {@link #open()} once and closes the returned session when the
 * run ends.
 * </p>
 */
public interface StoreAdapter {

    /**
     * @return the store this adapter reads
     */
    Store store();

    /**
     * @return what the store's sources support
     */
    Capabilities capabilities();

    /**
     * Starts one crawl run.
     *
     * @return a session owning the run's connections
     */
    CrawlSession open();
}
