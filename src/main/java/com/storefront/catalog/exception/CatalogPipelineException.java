package com.storefront.catalog.exception;

/**
 * Root of the crawl pipeline's error taxonomy.
 * <p>
 * Every subtype is recoverable at some level of the pipeline: a page, a
 * query or a single item is skipped and the crawl of the store goes on.
 * </p>
 */
public abstract class CatalogPipelineException extends RuntimeException {

    protected CatalogPipelineException(final String message) {
        super(message);
    }

    protected CatalogPipelineException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
