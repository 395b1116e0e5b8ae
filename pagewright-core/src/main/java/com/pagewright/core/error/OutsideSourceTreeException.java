package com.pagewright.core.error;

import java.nio.file.Path;

/**
 * Raised when a path handed to the resolver or the scheduler does not live under the source root.
 */
public class OutsideSourceTreeException extends BuildException {

    public OutsideSourceTreeException(Path path, Path sourceRoot) {
        super("Path " + path + " is outside the source directory " + sourceRoot, path);
    }
}
