package com.pagewright.core.transform;

import java.util.List;

/**
 * Output of the HTML rewrite pipeline.
 *
 * @param html rewritten document
 * @param text extracted text, empty unless extraction was requested
 * @param headings headings recorded for the table of contents
 */
public record TransformResult(String html, TextExtraction text, List<Heading> headings) {

    public TransformResult {
        text = text == null ? TextExtraction.empty() : text;
        headings = headings == null ? List.of() : List.copyOf(headings);
    }
}
