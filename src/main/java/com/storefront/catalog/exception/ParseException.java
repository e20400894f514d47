package com.storefront.catalog.exception;

/**
 * Malformed embedded-script or linked-data payload inside an HTML page.
 */
public class ParseException extends CatalogPipelineException {

    public ParseException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
