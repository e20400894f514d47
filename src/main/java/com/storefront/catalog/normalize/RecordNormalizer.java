package com.storefront.catalog.normalize;

import com.fasterxml.jackson.databind.JsonNode;
import com.storefront.catalog.exception.ValidationException;
import com.storefront.catalog.model.CanonicalRecord;
import com.storefront.catalog.model.ExtractedItem;
import com.storefront.catalog.model.Rating;
import com.storefront.catalog.model.RawItem;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

import java.math.BigDecimal;
import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * <h2>RecordNormalizer</h2>
 *
 * <p>Turns one item (API-shaped, or coerced into that shape) into a
 * {@link CanonicalRecord}, or decides the item is unusable.</p>
 *
 * <ul>
 *   <li><b>name</b>: cleaned and stripped of edition noise; empty rejects the item.</li>
 *   <li><b>image</b>: explicit image, else the box/pack/cover entry of an image
 *       list, else its first entry, else the store placeholder.</li>
 *   <li><b>href</b>: explicit link, else the product URL pattern filled with the
 *       slug or native id, else the page the item was found on, else the store root.</li>
 *   <li><b>price</b>: display string or formatted amount, {@code Unavailable} otherwise.</li>
 *   <li><b>platforms</b>: the item's own list, else the store default.</li>
 * </ul>
 */
@Slf4j
@Component
public class RecordNormalizer {

    private static final String KIND_GAME = "game";

    private static final String[] TITLE_FIELDS = {"title", "name", "productTitle"};
    private static final String[] IMAGE_FIELDS = {"image", "imageUrl", "boxArt", "heroBanner"};
    private static final String[] IMAGE_LIST_FIELDS = {"images", "keyImages"};
    private static final String[] IMAGE_TAG_FIELDS = {"type", "purpose", "tag"};
    private static final String[] LINK_FIELDS = {"productUrl", "url", "webUrl"};
    private static final String[] SLUG_FIELDS = {"slug", "seoName"};
    private static final String[] ID_FIELDS = {"nsuid", "id", "productId"};
    private static final String[] DISPLAY_PRICE_FIELDS = {"displayPrice", "priceDisplay"};
    private static final String[] AMOUNT_FIELDS = {"discounted", "current", "regular", "amount"};
    private static final String[] CURRENCY_FIELDS = {"currency", "currencyCode"};

    private static final List<String> BOX_ART_HINTS = List.of("box", "pack", "cover");

    /**
     * @param extracted item and its origin
     * @param defaults  store fallbacks
     * @return the record, or empty when the item fails a required-field rule
     */
    public Optional<CanonicalRecord> normalize(final ExtractedItem extracted, final StoreDefaults defaults) {
        try {
            return Optional.of(toRecord(extracted, defaults));
        } catch (ValidationException ex) {
            log.debug("Rejected {} item from {}: {}", defaults.store().id(), extracted.origin(), ex.getMessage());
            return Optional.empty();
        }
    }

    /**
     * @throws ValidationException when the item cannot become a record
     */
    CanonicalRecord toRecord(final ExtractedItem extracted, final StoreDefaults defaults) {
        RawItem it = extracted.item();
        URI origin = extracted.origin();

        String name = TitleNormalizer.stripEditionNoise(it.firstText(TITLE_FIELDS).orElse(""));
        if (name.isEmpty()) {
            throw new ValidationException("empty title");
        }

        String slug = it.firstText(SLUG_FIELDS).orElse(null);
        String nativeId = it.firstText(ID_FIELDS).orElse(null);

        Map<String, Object> extra = new LinkedHashMap<>();
        extra.put("source", extracted.source().label());
        if (origin != null) {
            extra.put("sourceUrl", origin.toString());
        }
        if (slug != null) {
            extra.put("slug", slug);
        }

        return CanonicalRecord.builder()
                .store(defaults.store())
                .name(name)
                .price(price(it, defaults.preferDisplayPrice()))
                .image(image(it, origin).orElse(defaults.placeholderImage()))
                .href(link(it, origin, slug, nativeId, defaults))
                .uuid(nativeId)
                .platforms(platforms(it, defaults.defaultPlatforms()))
                .rating(it.firstPresent("rating").flatMap(RawItem::labelText).flatMap(Rating::fromLabel).orElse(null))
                .kind(KIND_GAME)
                .extra(extra)
                .build();
    }

    /* ------------------------------------------------------------------ */
    /* image                                                              */
    /* ------------------------------------------------------------------ */

    private Optional<String> image(final RawItem it, final URI origin) {
        Optional<JsonNode> single = it.firstPresent(IMAGE_FIELDS);
        if (single.isPresent()) {
            JsonNode img = single.get();
            if (img.isArray()) {
                return fromImageList(img).flatMap(u -> absolute(u, origin));
            }
            Optional<String> url = imageUrl(img);
            if (url.isPresent()) {
                return absolute(url.get(), origin);
            }
        }
        return it.array(IMAGE_LIST_FIELDS)
                .flatMap(RecordNormalizer::fromImageList)
                .flatMap(u -> absolute(u, origin));
    }

    private static Optional<String> fromImageList(final JsonNode list) {
        for (JsonNode img : list) {
            if (!img.isObject()) {
                continue;
            }
            String tag = RawItem.firstText(img, IMAGE_TAG_FIELDS).orElse("").toLowerCase(Locale.ROOT);
            if (BOX_ART_HINTS.stream().anyMatch(tag::contains)) {
                Optional<String> url = imageUrl(img);
                if (url.isPresent()) {
                    return url;
                }
            }
        }
        return list.isEmpty() ? Optional.empty() : imageUrl(list.get(0));
    }

    private static Optional<String> imageUrl(final JsonNode img) {
        if (img.isObject()) {
            return RawItem.firstText(img, "url", "src", "contentUrl");
        }
        return img.isTextual() && !img.asText().isBlank() ? Optional.of(img.asText().trim()) : Optional.empty();
    }

    /* ------------------------------------------------------------------ */
    /* link                                                               */
    /* ------------------------------------------------------------------ */

    private String link(final RawItem it,
                        final URI origin,
                        @Nullable final String slug,
                        @Nullable final String nativeId,
                        final StoreDefaults defaults) {
        Optional<String> explicit = it.firstText(LINK_FIELDS).flatMap(u -> absolute(u, origin));
        if (explicit.isPresent()) {
            return explicit.get();
        }
        String key = slug != null ? slug : nativeId;
        if (key != null && StringUtils.isNotBlank(defaults.productUrlTemplate())) {
            return UriComponentsBuilder.fromUriString(defaults.productUrlTemplate())
                    .buildAndExpand(Map.of(
                            "slug", key,
                            "country", defaults.region().country(),
                            "locale", defaults.region().locale(),
                            "localePath", defaults.region().localePath()))
                    .encode()
                    .toUriString();
        }
        if (origin != null && origin.isAbsolute()) {
            return origin.toString();
        }
        return defaults.storeRootUrl();
    }

    /**
     * Resolves relative and protocol-relative URLs against the page they came
     * from. Anything that does not end up an absolute http(s) URL, such as
     * {@code data:} or {@code javascript:} values, is treated as absent.
     */
    private static Optional<String> absolute(final String url, @Nullable final URI origin) {
        String u = url.trim();
        String lower = u.toLowerCase(Locale.ROOT);
        String resolved;
        if (lower.startsWith("http://") || lower.startsWith("https://")) {
            resolved = u;
        } else if (origin == null || !origin.isAbsolute()) {
            return Optional.empty();
        } else {
            try {
                resolved = origin.resolve(u).toString();
            } catch (IllegalArgumentException ex) {
                log.debug("Unresolvable URL '{}' on {}", u, origin);
                return Optional.empty();
            }
        }
        if (!CanonicalRecord.isAbsoluteHttpUrl(resolved)) {
            log.debug("Ignoring non-http URL '{}'", u);
            return Optional.empty();
        }
        return Optional.of(resolved);
    }

    /* ------------------------------------------------------------------ */
    /* price                                                              */
    /* ------------------------------------------------------------------ */

    private static String price(final RawItem it, final boolean preferDisplay) {
        Optional<JsonNode> priceObj = it.object("price").map(JsonNode.class::cast);
        Optional<String> display = priceObj.flatMap(p -> RawItem.firstText(p, "display"))
                .or(() -> it.firstText(DISPLAY_PRICE_FIELDS));

        Optional<BigDecimal> amount = priceObj.flatMap(p -> RawItem.firstAmount(p, AMOUNT_FIELDS));
        Optional<String> currency = priceObj.flatMap(p -> RawItem.firstText(p, CURRENCY_FIELDS));
        boolean numeric = amount.isPresent() && currency.isPresent();

        if (display.isPresent() && (preferDisplay || !numeric)) {
            return PriceFormatter.format(null, null, display.get());
        }
        return PriceFormatter.format(amount.orElse(null), currency.orElse(null));
    }

    /* ------------------------------------------------------------------ */
    /* platforms                                                          */
    /* ------------------------------------------------------------------ */

    private static List<String> platforms(final RawItem it, final List<String> defaults) {
        List<String> out = new ArrayList<>();
        it.firstPresent("platforms").ifPresent(p -> {
            Iterable<JsonNode> values = p.isArray() ? p : List.of(p);
            for (JsonNode v : values) {
                if (v.isObject()) {
                    RawItem.firstText(v, "name", "label").ifPresent(out::add);
                } else if (v.isValueNode() && !v.isNull()) {
                    out.add(v.asText());
                }
            }
        });
        List<String> cleaned = CanonicalRecord.dedupePlatforms(out);
        return cleaned.isEmpty() ? defaults : cleaned;
    }
}
