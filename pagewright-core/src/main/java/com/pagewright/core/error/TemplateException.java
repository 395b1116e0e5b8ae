package com.pagewright.core.error;

import java.nio.file.Path;

/**
 * Rendering error reported by a template engine.
 */
public class TemplateException extends BuildException {

    public TemplateException(String message, Path template) {
        super(message, template);
    }

    public TemplateException(String message, Path template, Throwable cause) {
        super(message, template, cause);
    }
}
