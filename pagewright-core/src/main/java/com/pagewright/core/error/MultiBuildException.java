package com.pagewright.core.error;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Aggregate of per-file failures collected when a build runs without fail-fast.
 *
 * <p>Every individual error is kept, in the order the scheduler observed it.
 */
public class MultiBuildException extends BuildException {

    private final List<BuildException> errors;

    public MultiBuildException(List<BuildException> errors) {
        super(describe(errors));
        this.errors = List.copyOf(errors);
        this.errors.forEach(this::addSuppressed);
    }

    public List<BuildException> errors() {
        return errors;
    }

    private static String describe(List<BuildException> errors) {
        return errors.size() + " file(s) failed to build:" + errors.stream()
            .map(e -> System.lineSeparator() + "  - " + e.getMessage())
            .collect(Collectors.joining());
    }
}
