package com.storefront.catalog.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.Setter;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Holds configuration properties for one storefront.
 * <p>
 * A profile tells the generic storefront adapter where the store exposes its
 * catalog (a JSON search API, listing pages, or both) and which fallbacks to
 * use when an item does not carry an image or a link of its own.
 * </p>
 */
@Getter
@Setter
public class StoreProfile {

    /**
     * Whether the store can be crawled at all.
     */
    private boolean enabled = true;

    /**
     * Templated JSON search endpoint.
     * <p>Placeholders: {@code {query}}, {@code {count}}, {@code {page}},
     * {@code {country}}, {@code {locale}}, {@code {localePath}}.
     * Leave empty when the store has no usable API.</p>
     */
    private String searchApi;

    /**
     * Listing pages scraped for embedded JSON and linked data.
     * <p>For example, "https://www.nintendo.com/{localePath}/store/games".</p>
     */
    private List<String> seedPages = new ArrayList<>();

    /**
     * {@code id} of the script element carrying the embedded page state.
     */
    private String embeddedScriptId = "__NEXT_DATA__";

    /**
     * Query tokens sent to the search API, one paginated query each.
     * The default covers APIs that reject an empty query.
     */
    private List<String> queryTokens = List.of(
            "a", "b", "c", "d", "e", "f", "g", "h", "i", "j", "k", "l", "m",
            "n", "o", "p", "q", "r", "s", "t", "u", "v", "w", "x", "y", "z");

    /**
     * API page size.
     */
    @Min(1)
    private int pageSize = 60;

    /**
     * Pause between two pages of the same query.
     */
    @NotNull
    private Duration pageDelay = Duration.ofMillis(50);

    /**
     * Pause between two queries.
     */
    @NotNull
    private Duration queryDelay = Duration.ofMillis(100);

    /**
     * Pause between two seed pages.
     */
    @NotNull
    private Duration seedPageDelay = Duration.ofMillis(200);

    /**
     * Image used when an item carries none.
     */
    private String placeholderImage;

    /**
     * Product page pattern used when an item carries no link; {@code {slug}}
     * receives the item's slug or native id.
     */
    private String productUrlTemplate;

    /**
     * Last-resort link for items that carry neither link, slug nor id.
     */
    private String storeRootUrl;

    /**
     * Platforms assumed when an item lists none.
     */
    private List<String> defaultPlatforms = new ArrayList<>();

    /**
     * The search API can be paged past the first page.
     */
    private boolean pagination = true;

    /**
     * Prices may come as display strings rather than amounts.
     */
    private boolean returnsPartialPrice = true;
}
