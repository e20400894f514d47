package com.storefront.catalog.model;

import jakarta.validation.constraints.NotBlank;

import java.util.Locale;

/**
 * Region settings of one crawl run, passed verbatim into every URL template.
 *
 * @param country region code, e.g. {@code US}
 * @param locale  language-region tag, e.g. {@code en-US}
 */
public record AdapterConfig(@NotBlank String country, @NotBlank String locale) {

    public static final AdapterConfig DEFAULT = new AdapterConfig("US", "en-US");

    /**
     * @return the locale as storefront paths spell it, {@code en_US} → {@code en-us}
     */
    public String localePath() {
        return locale.replace('_', '-').toLowerCase(Locale.ROOT);
    }
}
