package com.pagewright.core.manifest;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link BuildManifest}.
 */
class BuildManifestTest {

    @TempDir
    Path tempDir;

    private Path source;
    private Path dest;
    private Path target;

    @BeforeEach
    void setUp() throws IOException {
        source = tempDir.resolve("site/page.md");
        target = tempDir.resolve("build");
        dest = target.resolve("page.html");
        Files.createDirectories(source.getParent());
        Files.createDirectories(target);
        Files.writeString(source, "# Page");
        Files.writeString(dest, "<h1>Page</h1>");
        Files.setLastModifiedTime(source, FileTime.from(Instant.parse("2024-01-01T00:00:00Z")));
    }

    @Test
    @DisplayName("Fresh manifest reports dirty, touch makes clean, modification makes dirty again")
    void isDirty_touchThenModify_cyclesDirtyCleanDirty() throws IOException {
        // Given: a fresh manifest
        BuildManifest manifest = BuildManifest.empty(target, true);

        // Then: an unknown file is dirty
        assertThat(manifest.isDirty(source, dest, false)).isTrue();

        // When: the build records the file
        manifest.touch(source, dest);

        // Then: it is clean until modified
        assertThat(manifest.isDirty(source, dest, false)).isFalse();

        // When: the source is modified
        Files.writeString(source, "# Changed");
        Files.setLastModifiedTime(source, FileTime.from(Instant.parse("2024-01-02T00:00:00Z")));

        // Then: it is dirty again
        assertThat(manifest.isDirty(source, dest, false)).isTrue();
    }

    @Test
    void isDirty_force_alwaysDirty() {
        BuildManifest manifest = BuildManifest.empty(target, true);
        manifest.touch(source, dest);

        assertThat(manifest.isDirty(source, dest, true)).isTrue();
    }

    @Test
    void isDirty_missingOutput_isDirty() throws IOException {
        BuildManifest manifest = BuildManifest.empty(target, true);
        manifest.touch(source, dest);

        Files.delete(dest);

        assertThat(manifest.isDirty(source, dest, false)).isTrue();
    }

    @Test
    void isDirty_notIncremental_alwaysDirty() {
        BuildManifest manifest = BuildManifest.empty(target, false);
        manifest.touch(source, dest);

        assertThat(manifest.isDirty(source, dest, false)).isTrue();
    }

    @Test
    void touch_deletedSource_removesEntry() throws IOException {
        BuildManifest manifest = BuildManifest.empty(target, true);
        manifest.touch(source, dest);

        Files.delete(source);
        manifest.touch(source, dest);

        assertThat(manifest.get(source)).isEmpty();
        assertThat(manifest.size()).isZero();
    }

    @Test
    void save_thenLoad_restoresEntries() {
        BuildManifest manifest = BuildManifest.empty(target, true);
        manifest.touch(source, dest);
        manifest.save();

        BuildManifest loaded = BuildManifest.load(target, true);

        assertThat(loaded.file()).isEqualTo(tempDir.resolve("build.json").toAbsolutePath().normalize());
        assertThat(loaded.get(source)).contains(manifest.get(source).orElseThrow());
        assertThat(loaded.isDirty(source, dest, false)).isFalse();
    }

    @Test
    void save_writesSecondsAndNanos() throws IOException {
        BuildManifest manifest = BuildManifest.empty(target, true);
        manifest.touch(source, dest);
        manifest.save();

        String json = Files.readString(BuildManifest.manifestFile(target));

        assertThat(json).contains("\"secs_since_epoch\" : 1704067200").contains("\"nanos_since_epoch\" : 0");
    }

    @Test
    void load_corruptFile_yieldsEmptyManifest() throws IOException {
        Files.writeString(BuildManifest.manifestFile(target), "{ not json");

        BuildManifest manifest = BuildManifest.load(target, true);

        assertThat(manifest.size()).isZero();
        assertThat(manifest.isDirty(source, dest, false)).isTrue();
    }

    @Test
    void save_notIncremental_writesNothing() {
        BuildManifest manifest = BuildManifest.empty(target, false);
        manifest.touch(source, dest);

        manifest.save();

        assertThat(BuildManifest.manifestFile(target)).doesNotExist();
    }
}
