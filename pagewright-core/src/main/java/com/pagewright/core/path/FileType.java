package com.pagewright.core.path;

/**
 * Classification of a source file by extension.
 */
public enum FileType {
    /** Page rendered through the markdown converter, then the template engine. */
    MARKDOWN,
    /** Page rendered directly by the template engine. */
    TEMPLATE,
    /** Anything else; copied verbatim. */
    UNKNOWN;

    public boolean isPage() {
        return this != UNKNOWN;
    }
}
