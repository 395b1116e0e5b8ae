package com.pagewright.core.error;

import java.nio.file.Path;

/**
 * Href index failure: two sources claiming one href, a duplicate permalink,
 * or a verified link that does not resolve to a known page.
 */
public class LinkException extends BuildException {

    public LinkException(String message, Path path) {
        super(message, path);
    }

    public static LinkException collision(String href, Path existing, Path incoming) {
        return new LinkException(
            "Collision detected on " + href + " (" + existing + " <-> " + incoming + ")", incoming);
    }

    public static LinkException duplicatePermalink(String permalink, Path source) {
        return new LinkException(
            "Duplicate permalink for path '" + permalink + "', ensure permalinks are unique", source);
    }

    public static LinkException missing(String href, Path source) {
        return new LinkException("Missing link target " + href + " referenced from " + source, source);
    }
}
