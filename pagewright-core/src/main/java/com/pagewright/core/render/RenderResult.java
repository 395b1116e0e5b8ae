package com.pagewright.core.render;

import com.pagewright.core.transform.TextExtraction;

import java.nio.file.Path;

/**
 * Result of running the per-file pipeline.
 *
 * @param source source path
 * @param output absolute output file, null when nothing was written
 * @param outcome what happened
 * @param text extracted text, empty unless extraction ran
 */
public record RenderResult(Path source, Path output, RenderOutcome outcome, TextExtraction text) {

    public RenderResult {
        text = text == null ? TextExtraction.empty() : text;
    }

    public static RenderResult of(Path source, Path output, RenderOutcome outcome) {
        return new RenderResult(source, output, outcome, TextExtraction.empty());
    }

    public boolean wroteOutput() {
        return outcome == RenderOutcome.RENDERED || outcome == RenderOutcome.COPIED
            || outcome == RenderOutcome.LINKED;
    }
}
