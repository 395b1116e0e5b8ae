package com.pagewright.core.error;

import java.nio.file.Path;

/**
 * Redirect graph failure. Checked before any redirect file is written.
 */
public class RedirectException extends BuildException {

    /**
     * Why a redirect map was rejected.
     */
    public enum Reason {
        CYCLIC_REDIRECT,
        TOO_MANY_REDIRECTS,
        REDIRECT_FILE_EXISTS
    }

    private final Reason reason;

    public RedirectException(Reason reason, String message, Path path) {
        super(message, path);
        this.reason = reason;
    }

    public Reason reason() {
        return reason;
    }

    public static RedirectException cyclic(String stack, String key) {
        return new RedirectException(Reason.CYCLIC_REDIRECT,
            "Cyclic redirect: " + stack + " <-> " + key, null);
    }

    public static RedirectException tooMany(int limit) {
        return new RedirectException(Reason.TOO_MANY_REDIRECTS,
            "Too many redirects, limit is " + limit, null);
    }

    public static RedirectException fileExists(Path file) {
        return new RedirectException(Reason.REDIRECT_FILE_EXISTS,
            "Redirect file '" + file + "' exists", file);
    }
}
