package com.pagewright.core.transform;

import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.ServiceLoader;

import static org.assertj.core.api.Assertions.assertThat;

class KeywordHighlighterTest {

    private final KeywordHighlighter highlighter = new KeywordHighlighter();

    @Test
    void highlight_java_marksKeywordsStringsAndComments() {
        String html = highlighter.highlight("java", "return \"a<b\"; // done").orElseThrow();

        assertThat(html).isEqualTo("<span class=\"kw\">return</span> <span class=\"str\">&quot;a&lt;b&quot;</span>; "
            + "<span class=\"cm\">// done</span>");
    }

    @Test
    void highlight_python_usesHashComments() {
        String html = highlighter.highlight("python", "x = a // b  # floor").orElseThrow();

        assertThat(html).isEqualTo("x = a // b  <span class=\"cm\"># floor</span>");
    }

    @Test
    void highlight_unknownLanguage_returnsEmpty() {
        assertThat(highlighter.highlight("cobol", "MOVE A TO B")).isEmpty();
    }

    @Test
    void serviceLoader_findsBuiltInHighlighter() {
        assertThat(ServiceLoader.load(SyntaxHighlighter.class).findFirst())
            .containsInstanceOf(KeywordHighlighter.class);
    }

    @Test
    void languageAliases_overridesWinOverBuiltIns() {
        LanguageAliases aliases = new LanguageAliases(Map.of("JS", "typescript", "jsx", "javascript"));

        assertThat(aliases.resolve("js")).isEqualTo("typescript");
        assertThat(aliases.resolve("JSX")).isEqualTo("javascript");
        assertThat(aliases.resolve("py")).isEqualTo("python");
        assertThat(aliases.resolve("go")).isEqualTo("go");
    }
}
