package com.storefront.catalog.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Age ratings accepted in the output, stored with their lower-case labels.
 */
public enum Rating {

    EVERYONE("everyone"),
    EVERYONE_10_PLUS("everyone 10+"),
    RATING_PENDING("rating pending"),
    TEEN("teen"),
    MATURE_17_PLUS("mature 17+"),
    NONE("none");

    private final String label;

    Rating(final String label) {
        this.label = label;
    }

    @JsonValue
    public String label() {
        return label;
    }

    /**
     * Matches a source rating after lower-casing it.
     *
     * @param raw rating as exposed by a storefront, may be {@code null}
     * @return the rating, or empty when the label is not one of the known ones
     */
    public static Optional<Rating> fromLabel(final String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String key = raw.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(r -> r.label.equals(key))
                .findFirst();
    }
}
