package com.pagewright.core.render;

import com.pagewright.core.SiteTestBase;
import com.pagewright.core.collation.Collation;
import com.pagewright.core.collation.Collator;
import com.pagewright.core.config.RuntimeOptions;
import com.pagewright.core.error.LinkException;
import com.pagewright.core.error.TemplateException;
import com.pagewright.core.model.Page;
import com.pagewright.core.path.PathResolver;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link PageTemplateEngine} and the {@link LinkHelper} it calls.
 */
class PageTemplateEngineTest extends SiteTestBase {

    private final PageTemplateEngine engine = new PageTemplateEngine();

    private Path guide;

    @BeforeEach
    void createSite() throws IOException {
        writeConfig("""
            link:
              verify: true
              allow: ["/feed.xml"]
            menus:
              main: ["/", "/docs/guide.html"]
            """);
        createSource("index.md", "+++\ntitle: Home\n+++\n# Home");
        guide = createSource("docs/guide.md", "+++\ntitle: Guide\nauthor:\n"
            + "  name: Sam <sam@example.com>\n+++\n# Guide");
    }

    private TemplateContext context(Path pagePath) {
        RuntimeOptions options = options();
        Collation collation = new Collator(options).walk().values().iterator().next();
        Page page = collation.resolve(pagePath).orElseThrow();
        LinkHelper links = new LinkHelper(new PathResolver(options), collation, true);
        return new TemplateContext(page, page.templateData(), links);
    }

    @Test
    void render_values_areEscapedUnlessTripleBraced() {
        TemplateContext context = context(guide).withBody("<p>Body</p>");

        String result = engine.render(guide, "<h1>{{ title }}</h1>{{ author.name }}|{{{ template }}}|{{ missing }}",
            context);

        assertThat(result).isEqualTo("<h1>Guide</h1>Sam &lt;sam@example.com&gt;|<p>Body</p>|");
    }

    @Test
    void render_linkHelper_makesHrefRelative() {
        String result = engine.render(guide, "<a href=\"{{ link /feed.xml }}\">feed</a>", context(guide));

        assertThat(result).isEqualTo("<a href=\"../feed.xml\">feed</a>");
    }

    @Test
    void render_linkHelper_unknownHref_throws() {
        assertThatThrownBy(() -> engine.render(guide, "{{ link /nowhere/ }}", context(guide)))
            .isInstanceOf(LinkException.class)
            .hasMessageContaining("/nowhere/");
    }

    @Test
    void render_menuHelper_marksCurrentPage() {
        String result = engine.render(guide, "{{{ menu main }}}", context(guide));

        assertThat(result).isEqualTo("<ul class=\"menu\"><li><a href=\"../\">Home</a></li>"
            + "<li class=\"selected\"><a href=\"../docs/guide.html\">Guide</a></li></ul>");
    }

    @Test
    void render_unterminatedTag_throws() {
        assertThatThrownBy(() -> engine.render(guide, "<p>{{ title </p>", context(guide)))
            .isInstanceOf(TemplateException.class)
            .hasMessageContaining("Unterminated");
    }

    @Test
    void render_unknownHelper_throws() {
        assertThatThrownBy(() -> engine.render(guide, "{{ shout title }}", context(guide)))
            .isInstanceOf(TemplateException.class)
            .hasMessageContaining("Unknown helper 'shout'");
    }

    @Test
    void lookup_nestedPath_walksMaps() {
        Map<String, Object> data = Map.of("a", Map.of("b", Map.of("c", 42)));

        assertThat(PageTemplateEngine.lookup(data, "a.b.c")).isEqualTo(42);
        assertThat(PageTemplateEngine.lookup(data, "a.x.c")).isNull();
    }
}
