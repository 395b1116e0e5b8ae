package com.pagewright.core.transform;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link TableOfContents}.
 */
class TableOfContentsTest {

    private final TableOfContents toc = new TableOfContents();

    @Test
    void toHtml_empty_rendersNothing() {
        assertThat(toc.toHtml("ol", "toc", "h1", "h1")).isEmpty();
    }

    @Test
    void toHtml_singleItem() {
        toc.add("h1", "foo", "Foo");

        assertThat(toc.toHtml("ol", "toc", "h1", "h1"))
            .isEqualTo("<ol class=\"toc\"><li><a href=\"#foo\">Foo</a></li></ol>");
    }

    @Test
    void toHtml_flatList() {
        toc.add("h3", "foo", "Foo");
        toc.add("h3", "bar", "Bar");
        toc.add("h3", "qux", "Qux");

        assertThat(toc.toHtml("ol", "toc", "h3", "h3")).isEqualTo(
            "<ol class=\"toc\"><li><a href=\"#foo\">Foo</a></li><li><a href=\"#bar\">Bar</a></li>"
                + "<li><a href=\"#qux\">Qux</a></li></ol>");
    }

    @Test
    void toHtml_nestedList_closesBeforeSibling() {
        toc.add("h3", "foo", "Foo");
        toc.add("h4", "bar", "Bar");
        toc.add("h3", "qux", "Qux");

        assertThat(toc.toHtml("ol", "toc", "h3", "h4")).isEqualTo(
            "<ol class=\"toc\"><li><a href=\"#foo\">Foo</a><ol><li><a href=\"#bar\">Bar</a></li></ol></li>"
                + "<li><a href=\"#qux\">Qux</a></li></ol>");
    }

    @Test
    void toHtml_trailingNestedList_isClosed() {
        toc.add("h3", "foo", "Foo");
        toc.add("h4", "bar", "Bar");
        toc.add("h4", "qux", "Qux");

        assertThat(toc.toHtml("ol", "toc", "h3", "h4")).isEqualTo(
            "<ol class=\"toc\"><li><a href=\"#foo\">Foo</a><ol><li><a href=\"#bar\">Bar</a></li>"
                + "<li><a href=\"#qux\">Qux</a></li></ol></li></ol>");
    }

    @Test
    void toHtml_outOfRangeHeadings_areSkipped() {
        toc.add("h1", "title", "Title");
        toc.add("h2", "intro", "Intro & Scope");
        toc.add("h5", "deep", "Deep");

        assertThat(toc.toHtml("ul", "", "h2", "h3"))
            .isEqualTo("<ul><li><a href=\"#intro\">Intro &amp; Scope</a></li></ul>");
    }

    @Test
    void add_invalidTag_throws() {
        assertThatThrownBy(() -> toc.add("p", "x", "X")).isInstanceOf(IllegalArgumentException.class);
    }
}
