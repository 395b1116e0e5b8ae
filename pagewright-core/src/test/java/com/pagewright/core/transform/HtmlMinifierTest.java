package com.pagewright.core.transform;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link HtmlMinifier}.
 */
class HtmlMinifierTest {

    @Test
    void minify_plainText_isUnchanged() {
        assertThat(HtmlMinifier.minify("This is some plain text")).isEqualTo("This is some plain text");
    }

    @Test
    void minify_doctypeFollowedByText_isUnchanged() {
        assertThat(HtmlMinifier.minify("<!doctype html>")).isEqualTo("<!doctype html>");
        assertThat(HtmlMinifier.minify("<!doctype html> This is some text"))
            .isEqualTo("<!doctype html> This is some text");
    }

    @Test
    void minify_whitespaceBetweenTags_isDropped() {
        assertThat(HtmlMinifier.minify("<p>   <b>bold</b>    <i>italic</i></p>"))
            .isEqualTo("<p><b>bold</b><i>italic</i></p>");
    }

    @Test
    void minify_inlineText_isKept() {
        assertThat(HtmlMinifier.minify("<p>   <b>bold</b> with some inline text <i>italic</i>   \n</p>"))
            .isEqualTo("<p><b>bold</b> with some inline text <i>italic</i></p>");
    }

    @Test
    void minify_scriptWithSelector_isUnchanged() {
        String script = """
            <script>
                const el = document.querySelector('main > header > .title');
            </script>""";

        assertThat(HtmlMinifier.minify(script)).isEqualTo(script);
    }

    @Test
    void minify_document_collapsesIndentation() {
        String html = """
            <html>
              <head>
                <title>Page</title>
              </head>
              <body><p>Hello world</p></body>
            </html>
            """;

        assertThat(HtmlMinifier.minify(html))
            .isEqualTo("<html><head><title>Page</title></head><body><p>Hello world</p></body></html>");
    }
}
