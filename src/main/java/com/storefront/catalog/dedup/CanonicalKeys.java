package com.storefront.catalog.dedup;

import com.storefront.catalog.normalize.TitleNormalizer;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Lossy title key used to cluster the same game across stores:
 * edition noise stripped, lower-cased, everything but {@code [a-z0-9]} removed.
 * <pre>
 * "Halo: Infinite – Deluxe Edition" → "haloinfinite"
 * "HALO INFINITE"                   → "haloinfinite"
 * </pre>
 */
public final class CanonicalKeys {

    private static final Pattern NON_ALNUM = Pattern.compile("[^a-z0-9]+");

    private CanonicalKeys() {
    }

    public static String of(final String name) {
        String base = TitleNormalizer.stripEditionNoise(name).toLowerCase(Locale.ROOT);
        return NON_ALNUM.matcher(base).replaceAll("");
    }
}
