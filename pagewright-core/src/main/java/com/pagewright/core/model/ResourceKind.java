package com.pagewright.core.model;

/**
 * What a discovered filesystem entry is.
 */
public enum ResourceKind {
    /** A directory encountered whilst walking the tree. */
    DIRECTORY,
    /** Default kind when nothing more is known about a file. */
    FILE,
    /** A file that renders to an output page. */
    PAGE,
    /** Layout support file: images, fonts, styles, plugin assets. */
    ASSET,
    /** Translation resource from the locales directory. */
    LOCALE,
    /** Template fragment handled by the template engine. */
    PARTIAL,
    /** Document included by pages, typically code samples. */
    INCLUDE,
    /** Part of a data source directory. */
    DATA_SOURCE
}
