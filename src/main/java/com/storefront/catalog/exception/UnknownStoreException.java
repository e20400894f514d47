package com.storefront.catalog.exception;

/**
 * No adapter can be built for the requested store name.
 * This is a caller configuration error rather than a pipeline failure.
 */
public class UnknownStoreException extends IllegalArgumentException {

    public UnknownStoreException(final String name) {
        super("Unknown store: " + name);
    }

    public UnknownStoreException(final String name, final String reason) {
        super("Store " + name + " unavailable: " + reason);
    }
}
