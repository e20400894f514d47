package com.storefront.catalog.service.core;

import reactor.netty.resources.ConnectionProvider;

/**
 * A {@link StoreHttpClient} bound to a connection pool owned by one crawl run.
 * Closing the lease disposes the pool.
 *
 * @param client fetch layer of the run
 * @param pool   connections of the run
 */
public record HttpClientLease(StoreHttpClient client, ConnectionProvider pool) implements AutoCloseable {

    @Override
    public void close() {
        pool.dispose();
    }
}
