package com.storefront.catalog.model;

import org.springframework.lang.Nullable;
import org.springframework.web.util.UriComponentsBuilder;

import java.net.URI;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Where one adapter instance reads from, fixed for the lifetime of the adapter.
 * <p>
 * The search template may use {@code {query}}, {@code {count}}, {@code {page}},
 * {@code {country}}, {@code {locale}} and {@code {localePath}}; seed pages are
 * expanded eagerly with the region variables.
 * </p>
 *
 * @param searchApiTemplate templated JSON search endpoint, {@code null} when the store has none
 * @param seedPages         listing pages to scrape, in crawl order
 * @param region            region the templates are expanded for
 */
public record EndpointConfig(@Nullable String searchApiTemplate,
                             List<URI> seedPages,
                             AdapterConfig region) {

    public EndpointConfig {
        seedPages = List.copyOf(seedPages);
    }

    /**
     * Expands region placeholders in every seed template.
     *
     * @param searchApiTemplate search endpoint template, may be {@code null} or blank
     * @param seedTemplates     listing page templates
     * @param region            region of the run
     * @return immutable endpoint configuration
     */
    public static EndpointConfig of(@Nullable final String searchApiTemplate,
                                    final List<String> seedTemplates,
                                    final AdapterConfig region) {
        List<URI> seeds = seedTemplates.stream()
                .map(t -> expandRegion(t, region))
                .toList();
        String api = (searchApiTemplate == null || searchApiTemplate.isBlank()) ? null : searchApiTemplate;
        return new EndpointConfig(api, seeds, region);
    }

    /**
     * @param template URL template using only region placeholders
     * @param region   region to expand for
     * @return the expanded, encoded URI
     */
    public static URI expandRegion(final String template, final AdapterConfig region) {
        return expand(template, regionVariables(region));
    }

    public boolean hasSearchApi() {
        return searchApiTemplate != null;
    }

    /**
     * Builds the URI of one search page.
     *
     * @param query     query token
     * @param pageSize  requested items per page
     * @param pageIndex zero-based page index
     * @return the page URI, or empty when no search API is configured
     */
    public Optional<URI> searchUri(final String query, final int pageSize, final int pageIndex) {
        if (searchApiTemplate == null) {
            return Optional.empty();
        }
        Map<String, Object> vars = new HashMap<>(regionVariables(region));
        vars.put("query", query);
        vars.put("count", pageSize);
        vars.put("page", pageIndex);
        return Optional.of(expand(searchApiTemplate, vars));
    }

    private static Map<String, Object> regionVariables(final AdapterConfig region) {
        return Map.of(
                "country", region.country(),
                "locale", region.locale(),
                "localePath", region.localePath());
    }

    private static URI expand(final String template, final Map<String, ?> vars) {
        return UriComponentsBuilder.fromUriString(template)
                .buildAndExpand(vars)
                .encode()
                .toUri();
    }
}
