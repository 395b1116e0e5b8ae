package com.pagewright.core.render;

import com.pagewright.core.collation.Collation;
import com.pagewright.core.model.Resource;

import java.nio.file.Path;

/**
 * Per-file pipeline invoked by the scheduler.
 */
@FunctionalInterface
public interface ResourceRenderer {

    /**
     * Builds one entry.
     *
     * @param collation collation the entry belongs to, read only
     * @param source canonical source path
     * @param resource resource describing the destination and operation
     * @return what was done
     */
    RenderResult render(Collation collation, Path source, Resource resource);
}
