package com.pagewright.core.transform;

import com.pagewright.core.config.SiteConfig;

/**
 * HTML post-processing switches for one build.
 *
 * @param autoId assign ids to headings without one
 * @param syntaxHighlight replace code block content with highlighted markup
 * @param stripComments remove HTML comments
 * @param toc replace the table of contents placeholder
 * @param words replace the word count placeholder
 * @param extractText collect text for the search index
 */
public record TransformFlags(
    boolean autoId,
    boolean syntaxHighlight,
    boolean stripComments,
    boolean toc,
    boolean words,
    boolean extractText
) {
    public static final TransformFlags NONE = new TransformFlags(false, false, false, false, false, false);

    public static TransformFlags from(SiteConfig config) {
        SiteConfig.HtmlTransformConfig html = config.transform().html();
        return new TransformFlags(
            html.autoId(),
            html.syntaxHighlight() || config.syntax().enabled(),
            html.stripComments(),
            html.toc(),
            html.words(),
            config.search().enabled()
        );
    }

    /**
     * Returns true when the rewrite pipeline has anything to do.
     *
     * @return whether any flag is set
     */
    public boolean isActive() {
        return autoId || syntaxHighlight || stripComments || toc || words || extractText;
    }
}
