package com.storefront.catalog.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.apache.commons.lang3.math.NumberUtils;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * A loosely-typed item as a storefront delivered it.
 * <p>
 * Values are Jackson nodes, i.e. one of string, number, boolean, object,
 * array or null. The accessors never throw on a shape mismatch: a field of
 * the wrong kind reads as absent.
 * </p>
 */
public final class RawItem {

    private final ObjectNode node;

    private RawItem(final ObjectNode node) {
        this.node = node;
    }

    public static RawItem of(final ObjectNode node) {
        return new RawItem(node);
    }

    /**
     * Wraps an arbitrary node; anything but an object becomes an empty item.
     */
    public static RawItem from(final JsonNode node) {
        if (node instanceof ObjectNode obj) {
            return new RawItem(obj);
        }
        return empty();
    }

    public static RawItem empty() {
        return new RawItem(JsonNodeFactory.instance.objectNode());
    }

    public ObjectNode node() {
        return node;
    }

    public boolean isEmpty() {
        return node.isEmpty();
    }

    /**
     * @return the first field holding a non-blank text or number, rendered as text
     */
    public Optional<String> firstText(final String... fields) {
        return firstText(node, fields);
    }

    /**
     * @return the first field holding something that is not null or blank
     */
    public Optional<JsonNode> firstPresent(final String... fields) {
        for (String f : fields) {
            JsonNode v = node.get(f);
            if (isPresent(v)) {
                return Optional.of(v);
            }
        }
        return Optional.empty();
    }

    /**
     * @return the first field holding a number, or text that parses as one
     */
    public Optional<BigDecimal> firstNumber(final String... fields) {
        return firstAmount(node, fields);
    }

    public Optional<ObjectNode> object(final String field) {
        JsonNode v = node.get(field);
        return v != null && v.isObject() ? Optional.of((ObjectNode) v) : Optional.empty();
    }

    public Optional<JsonNode> array(final String... fields) {
        for (String f : fields) {
            JsonNode v = node.get(f);
            if (v != null && v.isArray() && !v.isEmpty()) {
                return Optional.of(v);
            }
        }
        return Optional.empty();
    }

    /**
     * Text of the first listed field of {@code source} that is a non-blank
     * string or a number.
     */
    public static Optional<String> firstText(final JsonNode source, final String... fields) {
        if (source == null || !source.isObject()) {
            return Optional.empty();
        }
        for (String f : fields) {
            JsonNode v = source.get(f);
            if (v != null && (v.isTextual() || v.isNumber())) {
                String s = v.asText().trim();
                if (!s.isEmpty()) {
                    return Optional.of(s);
                }
            }
        }
        return Optional.empty();
    }

    /**
     * First listed field of {@code source} that parses as a decimal amount,
     * whether the source stored it as a number or as text.
     */
    public static Optional<BigDecimal> firstAmount(final JsonNode source, final String... fields) {
        if (source == null || !source.isObject()) {
            return Optional.empty();
        }
        for (String f : fields) {
            JsonNode v = source.get(f);
            if (v == null) {
                continue;
            }
            if (v.isNumber()) {
                return Optional.of(v.decimalValue());
            }
            String text = v.isTextual() ? v.asText().trim() : "";
            if (NumberUtils.isParsable(text)) {
                return Optional.of(new BigDecimal(text));
            }
        }
        return Optional.empty();
    }

    /**
     * Text of a value given either directly or as an object carrying
     * {@code name}, {@code label} or {@code ratingValue}.
     */
    public static Optional<String> labelText(final JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return Optional.empty();
        }
        if (value.isObject()) {
            return firstText(value, "name", "label", "ratingValue");
        }
        if (!value.isValueNode()) {
            return Optional.empty();
        }
        String s = value.asText().trim();
        return s.isEmpty() ? Optional.empty() : Optional.of(s);
    }

    private static boolean isPresent(final JsonNode v) {
        if (v == null || v.isNull() || v.isMissingNode()) {
            return false;
        }
        if (v.isTextual()) {
            return !v.asText().isBlank();
        }
        return !v.isContainerNode() || !v.isEmpty();
    }

    @Override
    public String toString() {
        return node.toString();
    }
}
