package com.pagewright.core.frontmatter;

import com.pagewright.core.path.FileType;

/**
 * Delimiters used to recognise a front matter block.
 *
 * @param start opening delimiter, must be the first line of the file
 * @param end closing delimiter
 */
public record FrontMatterConfig(String start, String end) {

    public static final FrontMatterConfig MARKDOWN = new FrontMatterConfig("+++", "+++");
    public static final FrontMatterConfig HTML = new FrontMatterConfig("<!--", "-->");

    /**
     * Picks the delimiters for a file type.
     *
     * @param type file type of the page
     * @return markdown delimiters for markdown pages, HTML comment delimiters otherwise
     */
    public static FrontMatterConfig forType(FileType type) {
        return type == FileType.MARKDOWN ? MARKDOWN : HTML;
    }
}
