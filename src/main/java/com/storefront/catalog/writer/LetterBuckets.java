package com.storefront.catalog.writer;

import java.util.ArrayList;
import java.util.List;

/**
 * Output partitions: {@code a} … {@code z}, plus {@code _} for titles
 * starting with anything else.
 */
public final class LetterBuckets {

    public static final String OTHER = "_";

    /** Every bucket key, catch-all first. */
    public static final List<String> ALL = buildAll();

    private LetterBuckets() {
    }

    /**
     * @param name record title
     * @return {@code "t"} for {@code "Tetris"}, {@code "_"} for {@code "2048"}
     */
    public static String bucketOf(final String name) {
        String t = name == null ? "" : name.trim();
        if (t.isEmpty()) {
            return OTHER;
        }
        // ASCII letters only: "Écho" belongs to the catch-all
        char first = t.charAt(0);
        return first < 128 && Character.isLetter(first) ? String.valueOf(Character.toLowerCase(first)) : OTHER;
    }

    private static List<String> buildAll() {
        List<String> keys = new ArrayList<>(27);
        keys.add(OTHER);
        for (char c = 'a'; c <= 'z'; c++) {
            keys.add(String.valueOf(c));
        }
        return List.copyOf(keys);
    }
}
