package com.pagewright.core.error;

import java.nio.file.Path;

/**
 * Content error in a page header block.
 */
public class FrontMatterException extends BuildException {

    public FrontMatterException(String message, Path path) {
        super(message, path);
    }

    public FrontMatterException(String message, Path path, Throwable cause) {
        super(message, path, cause);
    }

    public static FrontMatterException notTerminated(Path path) {
        return new FrontMatterException("Front matter was not terminated in " + path, path);
    }
}
