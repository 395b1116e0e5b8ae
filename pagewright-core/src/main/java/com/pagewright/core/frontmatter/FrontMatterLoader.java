package com.pagewright.core.frontmatter;

import java.nio.file.Path;

/**
 * Splits page files into front matter and body.
 *
 * <p>Implementations must raise {@link com.pagewright.core.error.FrontMatterException} naming the
 * file when an opened block is never closed.
 */
public interface FrontMatterLoader {

    /**
     * Reads a file and splits it.
     *
     * @param file page source file
     * @param config delimiters
     * @return split content
     */
    FrontMatter load(Path file, FrontMatterConfig config);

    /**
     * Splits already loaded content.
     *
     * @param content file content
     * @param file file the content came from, used in error messages
     * @param config delimiters
     * @return split content
     */
    FrontMatter split(String content, Path file, FrontMatterConfig config);
}
