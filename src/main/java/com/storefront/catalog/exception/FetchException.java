package com.storefront.catalog.exception;

import lombok.Getter;

import java.net.URI;

/**
 * A single HTTP request failed: connection error, timeout or a non-2xx status.
 */
@Getter
public class FetchException extends CatalogPipelineException {

    /** Request target. */
    private final URI uri;

    /** HTTP status, or {@code -1} when no response was received. */
    private final int status;

    public FetchException(final URI uri, final int status) {
        super("GET " + uri + " returned HTTP " + status);
        this.uri = uri;
        this.status = status;
    }

    public FetchException(final URI uri, final Throwable cause) {
        super("GET " + uri + " failed: " + cause.getMessage(), cause);
        this.uri = uri;
        this.status = -1;
    }
}
