package com.pagewright.core.path;

import java.nio.file.Path;
import java.util.StringJoiner;

/**
 * String helpers shared by href computation and redirect handling.
 */
public final class Hrefs {

    private Hrefs() {
        // Utility class
    }

    /**
     * Joins the name elements of a relative path with forward slashes.
     *
     * @param relative relative path
     * @return slash separated form, empty for an empty path
     */
    public static String toHrefSeparator(Path relative) {
        StringJoiner joiner = new StringJoiner("/");
        for (Path name : relative) {
            String part = name.toString();
            if (!part.isEmpty()) {
                joiner.add(part);
            }
        }
        return joiner.toString();
    }

    /**
     * Converts a site-relative href into a relative path usable against a root directory.
     *
     * @param href href with or without leading slash
     * @return path string with the platform separator
     */
    public static String toPathSeparator(String href) {
        String trimmed = trimLeadingSlash(href);
        return trimmed.replace('/', java.io.File.separatorChar);
    }

    public static String trimLeadingSlash(String value) {
        int start = 0;
        while (start < value.length() && value.charAt(start) == '/') {
            start++;
        }
        return value.substring(start);
    }

    public static String trimTrailingSlash(String value) {
        int end = value.length();
        while (end > 0 && value.charAt(end - 1) == '/') {
            end--;
        }
        return value.substring(0, end);
    }

    /**
     * Returns true for absolute web URLs that must never be rewritten.
     *
     * @param href href to test
     * @return whether the href is an http or https URL
     */
    public static boolean isExternal(String href) {
        return href.startsWith("http:") || href.startsWith("https:");
    }

    /**
     * Returns true when the last segment of an href carries a file extension.
     *
     * @param href href to test
     * @return whether the href names a file
     */
    public static boolean hasExtension(String href) {
        String last = href.substring(href.lastIndexOf('/') + 1);
        int dot = last.lastIndexOf('.');
        return dot > 0 && dot < last.length() - 1;
    }
}
