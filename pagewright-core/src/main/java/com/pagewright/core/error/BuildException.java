package com.pagewright.core.error;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Base class for every failure raised by the build pipeline.
 *
 * <p>Carries the source (or destination) path the failure relates to when there is one,
 * so callers can report errors per file without parsing messages.
 */
public class BuildException extends RuntimeException {

    private final transient Path path;

    public BuildException(String message) {
        this(message, null, null);
    }

    public BuildException(String message, Path path) {
        this(message, path, null);
    }

    public BuildException(String message, Path path, Throwable cause) {
        super(message, cause);
        this.path = path;
    }

    /**
     * Returns the file this error is attached to.
     *
     * @return offending path, if known
     */
    public Optional<Path> path() {
        return Optional.ofNullable(path);
    }
}
