package com.storefront.catalog.service.core;

import com.storefront.catalog.model.CanonicalRecord;
import reactor.core.publisher.Flux;

/**
 * One crawl run of one store.
 */
public interface CrawlSession extends AutoCloseable {

    /**
     * Lazily crawls the store. Nothing is requested before subscription;
     * page and item failures are recovered inside the stream.
     *
     * @return records in extraction order, API items first
     */
    Flux<CanonicalRecord> iterateRecords();

    /**
     * Releases the run's connections. Safe to call more than once.
     */
    @Override
    void close();
}
