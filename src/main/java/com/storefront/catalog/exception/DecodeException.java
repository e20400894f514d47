package com.storefront.catalog.exception;

import lombok.Getter;

import java.net.URI;

/**
 * The response body of a JSON request was not valid JSON.
 */
@Getter
public class DecodeException extends CatalogPipelineException {

    private final URI uri;

    public DecodeException(final URI uri, final Throwable cause) {
        super("Response of " + uri + " is not valid JSON", cause);
        this.uri = uri;
    }
}
