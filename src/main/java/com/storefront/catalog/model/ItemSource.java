package com.storefront.catalog.model;

/**
 * Which extraction path produced an item.
 */
public enum ItemSource {

    API("api"),
    EMBEDDED("embedded"),
    LINKED_DATA("linked-data");

    private final String label;

    ItemSource(final String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
