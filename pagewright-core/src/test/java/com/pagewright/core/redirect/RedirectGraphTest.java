package com.pagewright.core.redirect;

import com.pagewright.core.error.LinkException;
import com.pagewright.core.error.RedirectException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link RedirectGraph}.
 */
class RedirectGraphTest {

    @TempDir
    Path outputRoot;

    private static Map<String, String> map(String... pairs) {
        Map<String, String> map = new LinkedHashMap<>();
        for (int i = 0; i < pairs.length; i += 2) {
            map.put(pairs[i], pairs[i + 1]);
        }
        return map;
    }

    @Test
    void validate_cycle_throwsCyclicRedirect() {
        RedirectGraph graph = new RedirectGraph(map("/a", "/b", "/b", "/a"));

        assertThatThrownBy(graph::validate)
            .isInstanceOf(RedirectException.class)
            .extracting(e -> ((RedirectException) e).reason())
            .isEqualTo(RedirectException.Reason.CYCLIC_REDIRECT);
    }

    @Test
    void validate_cycleThroughTrailingSlash_throwsCyclicRedirect() {
        RedirectGraph graph = new RedirectGraph(map("/a", "/b/", "/b", "/a"));

        assertThatThrownBy(graph::validate)
            .isInstanceOfSatisfying(RedirectException.class,
                e -> assertThat(e.reason()).isEqualTo(RedirectException.Reason.CYCLIC_REDIRECT));
    }

    @Test
    void validate_fiveHops_throwsTooManyRedirects() {
        RedirectGraph graph = new RedirectGraph(map(
            "/a", "/b", "/b", "/c", "/c", "/d", "/d", "/e", "/e", "/f"));

        assertThatThrownBy(graph::validate)
            .isInstanceOfSatisfying(RedirectException.class,
                e -> assertThat(e.reason()).isEqualTo(RedirectException.Reason.TOO_MANY_REDIRECTS));
    }

    @Test
    void validate_twoHops_succeeds() {
        RedirectGraph graph = new RedirectGraph(map("/a", "/b", "/b", "/c"));

        assertThatCode(graph::validate).doesNotThrowAnyException();
    }

    @Test
    void write_createsStubsAndManifest() throws IOException {
        RedirectGraph graph = new RedirectGraph(map("/docs", "/docs/intro/", "/old/", "/new/"));

        var written = graph.write(outputRoot);

        assertThat(written).containsExactly(outputRoot.resolve("docs"), outputRoot.resolve("old/index.html"));
        assertThat(Files.readString(outputRoot.resolve("docs"))).isEqualTo(RedirectGraph.stub("/docs/intro/"));
        assertThat(Files.readString(outputRoot.resolve(RedirectGraph.MANIFEST_FILE)))
            .contains("\"/docs\" : \"/docs/intro/\"");
    }

    @Test
    void stub_containsCanonicalRefreshAndScript() {
        String stub = RedirectGraph.stub("/target/");

        assertThat(stub)
            .contains("<link rel=\"canonical\" href=\"/target/\">")
            .contains("<meta http-equiv=\"refresh\" content=\"0; /target/\">")
            .contains("document.location.replace('/target/')");
    }

    @Test
    void write_existingForeignFile_throwsBeforeWritingAnything() throws IOException {
        Files.writeString(outputRoot.resolve("b"), "<p>real page</p>");
        RedirectGraph graph = new RedirectGraph(map("/a", "/x", "/b", "/y"));

        assertThatThrownBy(() -> graph.write(outputRoot))
            .isInstanceOfSatisfying(RedirectException.class,
                e -> assertThat(e.reason()).isEqualTo(RedirectException.Reason.REDIRECT_FILE_EXISTS));
        assertThat(outputRoot.resolve("a")).doesNotExist();
    }

    @Test
    void write_twice_keepsExistingStubs() {
        RedirectGraph graph = new RedirectGraph(map("/a", "/b"));
        graph.write(outputRoot);

        var written = graph.write(outputRoot);

        assertThat(written).isEmpty();
    }

    @Test
    void of_permalinkClashingWithConfiguredKey_throws() {
        assertThatThrownBy(() -> RedirectGraph.of(map("/p", "/x"), map("/p", "/page/")))
            .isInstanceOf(LinkException.class)
            .hasMessageContaining("Duplicate permalink");
    }

    @Test
    void of_mergesPermalinks() {
        RedirectGraph graph = RedirectGraph.of(map("/a", "/b"), map("/p", "/page/"));

        assertThat(graph.redirects()).containsEntry("/a", "/b").containsEntry("/p", "/page/");
    }
}
