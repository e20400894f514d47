package com.storefront.catalog.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;

import java.util.List;

/**
 * Request payload of a crawl run.
 *
 * @param stores  store identifiers to crawl, e.g. {@code ["nintendo"]}; must not be empty
 * @param country region override, the configured country when omitted
 * @param locale  language-region override, the configured locale when omitted
 */
public record CrawlRequest(
        @NotEmpty List<@NotBlank String> stores,
        String country,
        String locale
) {}
