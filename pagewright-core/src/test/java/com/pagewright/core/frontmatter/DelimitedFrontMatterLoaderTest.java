package com.pagewright.core.frontmatter;

import com.pagewright.core.error.FrontMatterException;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link DelimitedFrontMatterLoader} and {@link FrontMatterParser}.
 */
class DelimitedFrontMatterLoaderTest {

    private static final Path FILE = Path.of("site/page.md");

    private final DelimitedFrontMatterLoader loader = new DelimitedFrontMatterLoader();
    private final FrontMatterParser parser = new FrontMatterParser();

    @Test
    void split_markdownBlock_extractsTextAndPadsBody() {
        FrontMatter result = loader.split("+++\ntitle: Hello\ndraft: true\n+++\n# Heading", FILE,
            FrontMatterConfig.MARKDOWN);

        assertThat(result.hasFrontMatter()).isTrue();
        assertThat(result.text()).isEqualTo("title: Hello\ndraft: true\n");
        // Line numbers of the body stay aligned with the file
        assertThat(result.body()).isEqualTo("\n\n\n\n# Heading");
    }

    @Test
    void split_htmlComment_usesCommentDelimiters() {
        FrontMatter result = loader.split("<!--\ntitle: Home\n-->\n<p>Home</p>", FILE, FrontMatterConfig.HTML);

        assertThat(result.hasFrontMatter()).isTrue();
        assertThat(result.text()).isEqualTo("title: Home\n");
        assertThat(result.body()).endsWith("<p>Home</p>");
    }

    @Test
    void split_noDelimiterOnFirstLine_returnsContentUnchanged() {
        String content = "# Title\n+++\nnot front matter\n+++";

        FrontMatter result = loader.split(content, FILE, FrontMatterConfig.MARKDOWN);

        assertThat(result.hasFrontMatter()).isFalse();
        assertThat(result.body()).isEqualTo(content);
    }

    @Test
    void split_unterminatedBlock_throws() {
        assertThatThrownBy(() -> loader.split("+++\ntitle: Oops\n# Body", FILE, FrontMatterConfig.MARKDOWN))
            .isInstanceOf(FrontMatterException.class)
            .hasMessageContaining("not terminated");
    }

    @Test
    void parse_yamlText_returnsMap() {
        FrontMatter frontMatter = loader.split("+++\ntitle: Hello\nweight: 3\nmenu: [main]\n+++\nbody", FILE,
            FrontMatterConfig.MARKDOWN);

        Map<String, Object> data = parser.parse(frontMatter, FILE);

        assertThat(data).containsEntry("title", "Hello").containsEntry("weight", 3);
        assertThat(data.get("menu")).isEqualTo(List.of("main"));
    }

    @Test
    void parse_invalidYaml_throwsFrontMatterException() {
        FrontMatter frontMatter = new FrontMatter("", true, "title: [unclosed\n");

        assertThatThrownBy(() -> parser.parse(frontMatter, FILE)).isInstanceOf(FrontMatterException.class);
    }

    @Test
    void parse_noFrontMatter_returnsEmptyMap() {
        assertThat(parser.parse(FrontMatter.none("body"), FILE)).isEmpty();
    }
}
