package com.pagewright.core.build;

import com.pagewright.core.SiteTestBase;
import com.pagewright.core.error.TemplateException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link SiteWatcher}. Polls are driven directly; modification times are set explicitly
 * so changes are seen regardless of timestamp granularity.
 */
class SiteWatcherTest extends SiteTestBase {

    private Path about;
    private SiteWatcher watcher;
    private int touches;

    @BeforeEach
    void startWatching() throws IOException {
        writeConfig("project:\n  name: test\n");
        createSource("layouts/main.html", "<main>{{{ template }}}</main>");
        createSource("index.md", "# Home");
        about = createSource("about.md", "# About");

        watcher = new SiteWatcher(new SiteBuilder(options(), BuildServices.defaults()), Duration.ofMillis(10));
        BuildReport initial = watcher.start();
        assertThat(initial.rendered()).isEqualTo(2);
    }

    private void touch(Path file, String content) throws IOException {
        Files.writeString(file, content);
        touches++;
        Files.setLastModifiedTime(file, FileTime.from(Instant.now().plusSeconds(60L * touches)));
    }

    @Test
    void poll_nothingChanged_returnsEmpty() {
        assertThat(watcher.poll()).isEmpty();
    }

    @Test
    void poll_modifiedPage_rebuildsOnlyThatPage() throws IOException {
        touch(about, "# About us");

        Optional<BuildReport> report = watcher.poll();

        assertThat(report).isPresent();
        assertThat(report.get().rendered()).isEqualTo(1);
        assertThat(readTarget("about.html")).contains("<h1>About us</h1>");
    }

    @Test
    void poll_newPage_isCollatedAndBuilt() throws IOException {
        createSource("news.md", "# News");

        Optional<BuildReport> report = watcher.poll();

        assertThat(report).isPresent();
        assertThat(readTarget("news.html")).contains("<h1>News</h1>");
    }

    @Test
    void poll_deletedPage_removesArtifact() throws IOException {
        Files.delete(about);

        watcher.poll();

        assertThat(targetRoot().resolve("about.html")).doesNotExist();
        assertThat(targetRoot().resolve("index.html")).exists();
    }

    @Test
    void poll_layoutChanged_rebuildsEverything() throws IOException {
        touch(sourceRoot().resolve("layouts/main.html"), "<article>{{{ template }}}</article>");

        Optional<BuildReport> report = watcher.poll();

        assertThat(report).isPresent();
        assertThat(report.get().rendered()).isEqualTo(2);
        assertThat(readTarget("index.html")).startsWith("<article>");
        assertThat(readTarget("about.html")).startsWith("<article>");
    }

    @Test
    void poll_afterFailure_recoversOnNextChange() throws IOException {
        touch(about, "# About {{ broken");
        assertThatThrownBy(() -> watcher.poll()).isInstanceOf(TemplateException.class);

        touch(about, "# Fixed");
        Optional<BuildReport> report = watcher.poll();

        assertThat(report).isPresent();
        assertThat(readTarget("about.html")).contains("<h1>Fixed</h1>");
    }

    @Test
    void constructor_invalidInterval_usesDefault() {
        SiteWatcher defaulted = new SiteWatcher(new SiteBuilder(options(), BuildServices.defaults()), Duration.ZERO);

        assertThat(defaulted.interval()).isEqualTo(SiteWatcher.DEFAULT_INTERVAL);
    }
}
