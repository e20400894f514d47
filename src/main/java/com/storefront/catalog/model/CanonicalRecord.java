package com.storefront.catalog.model;

import com.storefront.catalog.exception.ValidationException;
import lombok.Builder;
import org.apache.commons.lang3.StringUtils;
import org.springframework.lang.Nullable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * <h2>CanonicalRecord</h2>
 *
 * <p>One normalized, store-tagged catalog entry. Every rule is applied by the
 * canonical constructor, so an instance that exists is valid:</p>
 * <ul>
 *   <li>{@code name} is non-blank;</li>
 *   <li>{@code price} is never empty, missing prices read {@value #UNAVAILABLE};</li>
 *   <li>{@code image} and {@code href} are absolute http(s) URLs;</li>
 *   <li>{@code platforms} holds no two entries equal ignoring case and keeps
 *       first-occurrence order.</li>
 * </ul>
 *
 * @param store     storefront the entry was read from
 * @param name      display title after cleanup
 * @param price     free-form display price
 * @param image     absolute image URL
 * @param href      absolute product page URL
 * @param uuid      store-native identifier, optional
 * @param platforms platforms the title runs on
 * @param rating    age rating, optional
 * @param kind      classification tag such as {@code game}, optional
 * @param extra     store-specific metadata not promoted to a field
 */
@Builder(toBuilder = true)
public record CanonicalRecord(Store store,
                              String name,
                              String price,
                              String image,
                              String href,
                              @Nullable String uuid,
                              List<String> platforms,
                              @Nullable Rating rating,
                              @Nullable String kind,
                              Map<String, Object> extra) {

    public static final String UNAVAILABLE = "Unavailable";

    private static final Pattern ABSOLUTE_HTTP_URL = Pattern.compile("(?i)^https?://[^\\s/?#]+\\S*$");

    public CanonicalRecord {
        Objects.requireNonNull(store, "store");
        if (StringUtils.isBlank(name)) {
            throw new ValidationException("name must not be blank");
        }
        name = name.trim();
        price = StringUtils.isBlank(price) ? UNAVAILABLE : price.trim();
        image = requireAbsoluteUrl("image", image);
        href = requireAbsoluteUrl("href", href);
        uuid = StringUtils.trimToNull(uuid);
        kind = StringUtils.trimToNull(kind);
        platforms = dedupePlatforms(platforms);
        extra = copyExtra(extra);
    }

    /**
     * @return the externally visible projection of this record
     */
    public OutputItem toOutputItem() {
        return new OutputItem(name, kind, price, image, href, uuid, platforms, rating);
    }

    /**
     * Case-insensitive de-duplication keeping the first spelling seen.
     *
     * @param raw platform values, any of which may be {@code null} or blank
     * @return immutable cleaned list
     */
    public static List<String> dedupePlatforms(@Nullable final Collection<?> raw) {
        if (raw == null || raw.isEmpty()) {
            return List.of();
        }
        Set<String> seen = new HashSet<>();
        List<String> out = new ArrayList<>(raw.size());
        for (Object p : raw) {
            String s = p == null ? "" : p.toString().trim();
            if (!s.isEmpty() && seen.add(s.toLowerCase(Locale.ROOT))) {
                out.add(s);
            }
        }
        return List.copyOf(out);
    }

    private static Map<String, Object> copyExtra(@Nullable final Map<String, Object> extra) {
        if (extra == null || extra.isEmpty()) {
            return Map.of();
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        extra.forEach((k, v) -> {
            if (k != null && v != null) {
                copy.put(k, v);
            }
        });
        return Collections.unmodifiableMap(copy);
    }

    /**
     * @return whether {@code value}, once trimmed, is an absolute http(s) URL
     *         without whitespace, the form {@code image} and {@code href} require
     */
    public static boolean isAbsoluteHttpUrl(@Nullable final String value) {
        return ABSOLUTE_HTTP_URL.matcher(StringUtils.trimToEmpty(value)).matches();
    }

    private static String requireAbsoluteUrl(final String field, final String value) {
        String v = StringUtils.trimToEmpty(value);
        if (!isAbsoluteHttpUrl(v)) {
            throw new ValidationException(field + " is not an absolute http(s) URL: '" + value + "'");
        }
        return v;
    }
}
