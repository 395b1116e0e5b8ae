package com.pagewright.core.frontmatter;

/**
 * Result of splitting a file into front matter and body.
 *
 * <p>Front matter lines are replaced by blank lines in the body so that line numbers reported by
 * the template engine still match the source file.
 *
 * @param body file content without the front matter block
 * @param hasFrontMatter whether a front matter block was found
 * @param text raw front matter text, empty when absent
 */
public record FrontMatter(String body, boolean hasFrontMatter, String text) {

    public FrontMatter {
        if (body == null) {
            body = "";
        }
        if (text == null) {
            text = "";
        }
    }

    public static FrontMatter none(String body) {
        return new FrontMatter(body, false, "");
    }
}
