package com.pagewright.core.model;

import java.nio.file.Path;
import java.util.Objects;

/**
 * A discovered filesystem entry and what the build does with it.
 *
 * <p>Directories always carry {@link ResourceOperation#NOOP}; other kinds default to
 * {@link ResourceOperation#COPY} unless classified as a page, which renders.
 *
 * @param kind entry classification
 * @param operation action performed by the renderer
 * @param destination output-relative destination
 */
public record Resource(
    ResourceKind kind,
    ResourceOperation operation,
    Path destination
) {
    /**
     * Compact constructor enforcing the directory invariant.
     */
    public Resource {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(destination, "destination must not be null");
        if (kind == ResourceKind.DIRECTORY) {
            operation = ResourceOperation.NOOP;
        } else if (operation == null) {
            operation = kind == ResourceKind.PAGE ? ResourceOperation.RENDER : ResourceOperation.COPY;
        }
    }

    public static Resource directory(Path destination) {
        return new Resource(ResourceKind.DIRECTORY, ResourceOperation.NOOP, destination);
    }

    public static Resource file(ResourceKind kind, Path destination) {
        return new Resource(kind, ResourceOperation.COPY, destination);
    }

    public static Resource page(Path destination, boolean render) {
        return new Resource(ResourceKind.PAGE, render ? ResourceOperation.RENDER : ResourceOperation.COPY, destination);
    }

    /**
     * Resolves the destination against an output root.
     *
     * @param outputRoot build target for the collation
     * @return absolute output path
     */
    public Path output(Path outputRoot) {
        return outputRoot.resolve(destination);
    }
}
