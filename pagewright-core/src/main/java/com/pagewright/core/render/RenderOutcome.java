package com.pagewright.core.render;

/**
 * What the per-file pipeline did with one entry.
 */
public enum RenderOutcome {
    RENDERED,
    COPIED,
    LINKED,
    /** Draft page in a release build. */
    SKIPPED_DRAFT,
    /** Directory or other entry with nothing to write. */
    NOOP
}
