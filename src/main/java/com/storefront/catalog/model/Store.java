package com.storefront.catalog.model;

import com.fasterxml.jackson.annotation.JsonValue;
import com.storefront.catalog.exception.UnknownStoreException;

import java.util.Arrays;
import java.util.Locale;

/**
 * The storefronts the crawler knows how to read.
 */
public enum Store {

    STEAM("steam"),
    PSN("psn"),
    XBOX("xbox"),
    NINTENDO("nintendo");

    private final String id;

    Store(final String id) {
        this.id = id;
    }

    /**
     * @return lower-case identifier used in configuration keys and output directories
     */
    @JsonValue
    public String id() {
        return id;
    }

    /**
     * Resolves a store by its identifier, ignoring case and surrounding blanks.
     *
     * @param name store identifier, e.g. {@code "Nintendo"}
     * @return the matching store
     * @throws UnknownStoreException if no store carries that identifier
     */
    public static Store fromId(final String name) {
        String key = name == null ? "" : name.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(s -> s.id.equals(key))
                .findFirst()
                .orElseThrow(() -> new UnknownStoreException(name));
    }
}
