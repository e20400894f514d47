package com.storefront.catalog.normalize;

import org.apache.commons.lang3.StringUtils;

import java.util.regex.Pattern;

/**
 * Title cleanup shared by normalization and dedup clustering.
 * Both operations are idempotent.
 */
public final class TitleNormalizer {

    private static final Pattern MARKUP = Pattern.compile("<[^>]+>");

    private static final Pattern MARKS = Pattern.compile("[™®©℠℗]");

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final Pattern EDITION_NOISE = Pattern.compile(
            "\\b(deluxe|definitive|gold|ultimate|goty|complete|remastered|hd|bundle|collection"
                    + "|director['’]?s cut|edition)\\b",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE);

    /** Separators left dangling once a noise word is cut off a title's end. */
    private static final String EDGE_CHARS = " -–—:,;";

    private TitleNormalizer() {
    }

    /**
     * Removes markup tags and trademark/registration/copyright glyphs, then
     * collapses whitespace.
     *
     * @param name raw title, may be {@code null}
     * @return cleaned title, empty for {@code null}
     */
    public static String cleanTitle(final String name) {
        if (name == null) {
            return "";
        }
        String t = MARKUP.matcher(name).replaceAll(" ");
        t = MARKS.matcher(t).replaceAll("");
        return WHITESPACE.matcher(t).replaceAll(" ").trim();
    }

    /**
     * Cleans the title and drops edition and bundle words
     * ({@code Deluxe}, {@code GOTY}, {@code Director's Cut} …).
     * When nothing would be left, the cleaned title is returned instead.
     *
     * @param name raw title, may be {@code null}
     * @return the title without edition noise
     */
    public static String stripEditionNoise(final String name) {
        String clean = cleanTitle(name);
        String t = EDITION_NOISE.matcher(clean).replaceAll("");
        t = WHITESPACE.matcher(t).replaceAll(" ");
        t = StringUtils.strip(t, EDGE_CHARS);
        return t.isEmpty() ? clean : t;
    }
}
