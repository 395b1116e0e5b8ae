package com.pagewright.core.util;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Slug and title helpers used for heading ids and automatic page titles.
 */
public final class Slugs {

    private static final Pattern DIACRITICS = Pattern.compile("\\p{M}+");
    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-z0-9]+");
    private static final Pattern WORD_SEPARATORS = Pattern.compile("[-_\\s]+");

    private Slugs() {
        // Utility class
    }

    /**
     * Converts text to a URL fragment: lowercase ASCII with runs of other characters collapsed to {@code -}.
     *
     * @param text input text
     * @return slug, never null
     */
    public static String slugify(String text) {
        String ascii = DIACRITICS.matcher(Normalizer.normalize(text, Normalizer.Form.NFKD)).replaceAll("");
        String slug = NON_ALPHANUMERIC.matcher(ascii.toLowerCase(Locale.ROOT)).replaceAll("-");
        int start = 0;
        int end = slug.length();
        while (start < end && slug.charAt(start) == '-') {
            start++;
        }
        while (end > start && slug.charAt(end - 1) == '-') {
            end--;
        }
        return slug.substring(start, end);
    }

    /**
     * Converts a file stem such as {@code getting-started} to {@code Getting Started}.
     *
     * @param stem file stem
     * @return title cased words
     */
    public static String titleCase(String stem) {
        StringBuilder title = new StringBuilder();
        for (String word : WORD_SEPARATORS.split(stem.trim())) {
            if (word.isEmpty()) {
                continue;
            }
            if (title.length() > 0) {
                title.append(' ');
            }
            title.append(Character.toUpperCase(word.charAt(0)))
                .append(word.substring(1).toLowerCase(Locale.ROOT));
        }
        return title.toString();
    }
}
