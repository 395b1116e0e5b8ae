package com.pagewright.core.render;

import com.pagewright.core.transform.TextExtraction;

import java.nio.file.Path;
import java.util.Set;

/**
 * Receives text extracted from rendered pages and writes a search index.
 *
 * <p>{@link #add} is called concurrently by scheduler workers.
 */
public interface SearchIndexer {

    /**
     * Adds one page to the index.
     *
     * @param lang collation language
     * @param href page href
     * @param text extracted text
     */
    void add(String lang, String href, TextExtraction text);

    /**
     * Writes the index for a language.
     *
     * <p>An incremental pass only adds the pages it rebuilt, so the index must still cover pages
     * indexed by earlier passes and drop pages that no longer exist.
     *
     * @param lang collation language
     * @param outputRoot output root of the collation
     * @param hrefs hrefs of every page currently in the collation
     */
    void write(String lang, Path outputRoot, Set<String> hrefs);

    /**
     * Indexer that discards everything.
     *
     * @return no-op indexer
     */
    static SearchIndexer none() {
        return new SearchIndexer() {
            @Override
            public void add(String lang, String href, TextExtraction text) {
                // Search is disabled
            }

            @Override
            public void write(String lang, Path outputRoot, Set<String> hrefs) {
                // Search is disabled
            }
        };
    }
}
