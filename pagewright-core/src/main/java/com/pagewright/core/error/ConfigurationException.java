package com.pagewright.core.error;

import java.nio.file.Path;

/**
 * Configuration or invariant error. Always fatal and reported before output is written.
 */
public class ConfigurationException extends BuildException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Path path) {
        super(message, path);
    }

    public ConfigurationException(String message, Path path, Throwable cause) {
        super(message, path, cause);
    }
}
