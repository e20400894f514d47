package com.storefront.catalog.exception;

/**
 * A record violates a required-field rule, e.g. an empty title.
 */
public class ValidationException extends CatalogPipelineException {

    public ValidationException(final String message) {
        super(message);
    }
}
