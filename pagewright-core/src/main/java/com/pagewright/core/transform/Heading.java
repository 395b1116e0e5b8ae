package com.pagewright.core.transform;

import java.util.Locale;

/**
 * Heading recorded for the table of contents.
 *
 * @param depth zero for {@code h1} through five for {@code h6}
 * @param id element id used as the link fragment
 * @param text plain heading text
 */
public record Heading(int depth, String id, String text) {

    /**
     * Parses a heading tag name.
     *
     * @param tagName {@code h1} to {@code h6}
     * @return zero based depth
     * @throws IllegalArgumentException for any other tag name
     */
    public static int depthOf(String tagName) {
        String tag = tagName.toLowerCase(Locale.ROOT);
        if (tag.length() == 2 && tag.charAt(0) == 'h' && tag.charAt(1) >= '1' && tag.charAt(1) <= '6') {
            return tag.charAt(1) - '1';
        }
        throw new IllegalArgumentException("Invalid heading tag name " + tagName);
    }

    public static Heading of(String tagName, String id, String text) {
        return new Heading(depthOf(tagName), id, text);
    }

    String open() {
        return "<li><a href=\"#" + HtmlEntities.escape(id) + "\">" + HtmlEntities.escape(text) + "</a>";
    }
}
