package com.storefront.catalog.parser;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds the item array in a search API response.
 * <p>
 * The first non-empty array among {@code products}, {@code items} and
 * {@code results} wins; when the top level has none, the same keys are probed
 * one level down inside {@code data}.
 * </p>
 */
public final class ApiItemLocator {

    private static final List<String> CONTAINER_KEYS = List.of("products", "items", "results");

    private static final String DATA = "data";

    private ApiItemLocator() {
    }

    /**
     * @param response decoded API response
     * @return the raw items of the page, every element kept whatever its kind
     */
    public static List<JsonNode> locate(final JsonNode response) {
        if (response == null || !response.isObject()) {
            return List.of();
        }
        List<JsonNode> items = probe(response);
        if (items.isEmpty()) {
            JsonNode data = response.get(DATA);
            if (data != null && data.isObject()) {
                items = probe(data);
            }
        }
        return items;
    }

    private static List<JsonNode> probe(final JsonNode node) {
        for (String key : CONTAINER_KEYS) {
            JsonNode v = node.get(key);
            if (v != null && v.isArray() && !v.isEmpty()) {
                List<JsonNode> out = new ArrayList<>(v.size());
                v.forEach(out::add);
                return out;
            }
        }
        return List.of();
    }
}
