package com.storefront.catalog.parser;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.storefront.catalog.model.RawItem;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * <h2>Item coercion</h2>
 *
 * <p>Scraped tiles and JSON-LD entities name the same facts in many ways.
 * The coercer maps them onto the field names search APIs use, so that one
 * normalization routine serves every extraction path:</p>
 *
 * <pre>
 * title        ← title | name | productTitle
 * imageUrl     ← imageUrl | image            (text, or object url / contentUrl)
 * keyImages    ← image (list) | images | keyImages
 * productUrl   ← url | href | productUrl
 * slug         ← slug | seoName
 * price        ← price (object) | offers (JSON-LD) → {amount, currency}
 * displayPrice ← price (text) | displayPrice | priceDisplay
 * nsuid        ← nsuid | id | productId | sku | productID | mpn
 * platforms    ← platforms | gamePlatform
 * rating       ← rating | contentRating | esrbRating
 * </pre>
 */
@Component
public class ItemCoercer {

    public static final String TITLE = "title";
    public static final String IMAGE_URL = "imageUrl";
    public static final String KEY_IMAGES = "keyImages";
    public static final String PRODUCT_URL = "productUrl";
    public static final String SLUG = "slug";
    public static final String PRICE = "price";
    public static final String DISPLAY_PRICE = "displayPrice";
    public static final String NSUID = "nsuid";
    public static final String PLATFORMS = "platforms";
    public static final String RATING = "rating";

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    /**
     * @param raw item as found in the page
     * @return the item under API field names; an empty item stays empty
     */
    public RawItem coerce(final RawItem raw) {
        if (raw.isEmpty()) {
            return raw;
        }
        ObjectNode out = NODES.objectNode();

        raw.firstText("title", "name", "productTitle").ifPresent(v -> out.put(TITLE, v));
        coerceImage(raw, out);
        raw.firstText("url", "href", "productUrl").ifPresent(v -> out.put(PRODUCT_URL, v));
        raw.firstText("slug", "seoName").ifPresent(v -> out.put(SLUG, v));
        coercePrice(raw, out);
        raw.firstText("nsuid", "id", "productId", "sku", "productID", "mpn").ifPresent(v -> out.put(NSUID, v));
        raw.firstPresent("platforms", "gamePlatform").ifPresent(v -> out.set(PLATFORMS, asArray(v)));
        raw.firstPresent("rating", "contentRating", "esrbRating")
                .flatMap(RawItem::labelText)
                .ifPresent(v -> out.put(RATING, v));

        return RawItem.of(out);
    }

    private static void coerceImage(final RawItem raw, final ObjectNode out) {
        Optional<JsonNode> single = raw.firstPresent("imageUrl", "image");
        if (single.isPresent()) {
            JsonNode img = single.get();
            if (img.isArray()) {
                out.set(KEY_IMAGES, img.deepCopy());
                return;
            }
            Optional<String> url = img.isObject()
                    ? RawItem.firstText(img, "url", "contentUrl")
                    : Optional.of(img.asText());
            if (url.isPresent()) {
                out.put(IMAGE_URL, url.get());
                return;
            }
        }
        raw.array("images", "keyImages").ifPresent(list -> out.set(KEY_IMAGES, list.deepCopy()));
    }

    private static void coercePrice(final RawItem raw, final ObjectNode out) {
        Optional<JsonNode> offers = raw.firstPresent("offers")
                .map(o -> o.isArray() ? o.get(0) : o)
                .filter(JsonNode::isObject);
        if (offers.isPresent()) {
            ObjectNode price = NODES.objectNode();
            RawItem.firstText(offers.get(), "price", "lowPrice").ifPresent(v -> price.put("amount", v));
            RawItem.firstText(offers.get(), "priceCurrency").ifPresent(v -> price.put("currency", v));
            if (!price.isEmpty()) {
                out.set(PRICE, price);
            }
        } else {
            raw.firstPresent("price").ifPresent(p -> {
                if (p.isObject()) {
                    out.set(PRICE, p.deepCopy());
                } else if (p.isNumber()) {
                    out.set(PRICE, NODES.objectNode().set("amount", p.deepCopy()));
                } else if (p.isTextual()) {
                    out.put(DISPLAY_PRICE, p.asText().trim());
                }
            });
        }
        if (!out.has(DISPLAY_PRICE)) {
            raw.firstText("displayPrice", "priceDisplay").ifPresent(v -> out.put(DISPLAY_PRICE, v));
        }
    }

    private static ArrayNode asArray(final JsonNode value) {
        if (value.isArray()) {
            return (ArrayNode) value.deepCopy();
        }
        ArrayNode one = NODES.arrayNode();
        one.add(value.deepCopy());
        return one;
    }

}
