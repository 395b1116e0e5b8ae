package com.pagewright.core.model;

/**
 * Action the renderer performs with a source file.
 */
public enum ResourceOperation {
    /** Do nothing; used for directories. */
    NOOP,
    /** Render the file as a page template. */
    RENDER,
    /** Copy the file to the build target. */
    COPY,
    /** Create a symbolic link to the source file. */
    LINK
}
