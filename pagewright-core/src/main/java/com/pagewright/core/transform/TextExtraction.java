package com.pagewright.core.transform;

import java.util.List;

/**
 * Plain text pulled out of a rendered page for the search index.
 *
 * @param title text of the {@code <title>} element, may be empty
 * @param chunks paragraph texts in document order
 * @param words number of words across all chunks
 */
public record TextExtraction(String title, List<String> chunks, int words) {

    public TextExtraction {
        title = title == null ? "" : title;
        chunks = chunks == null ? List.of() : List.copyOf(chunks);
    }

    public static TextExtraction empty() {
        return new TextExtraction("", List.of(), 0);
    }
}
