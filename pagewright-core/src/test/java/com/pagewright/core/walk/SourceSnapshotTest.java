package com.pagewright.core.walk;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SourceSnapshotTest {

    @TempDir
    Path root;

    private final DirectoryWalker walker = new FileTreeWalker(true);

    private Path write(String relative, String content) throws IOException {
        Path file = root.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
        return file;
    }

    @Test
    void take_recordsVisibleFilesIncludingReservedDirectories() throws IOException {
        write("index.md", "# Home");
        write("layouts/main.html", "<main></main>");
        write(".git/config", "[core]");

        SourceSnapshot snapshot = SourceSnapshot.take(walker, root);

        assertThat(snapshot.files().keySet())
            .containsExactlyInAnyOrder(root.resolve("index.md"), root.resolve("layouts/main.html"));
    }

    @Test
    void since_reportsModifiedCreatedAndRemovedFiles() throws IOException {
        Path kept = write("kept.md", "a");
        Path changed = write("changed.md", "b");
        Path removed = write("removed.md", "c");
        SourceSnapshot before = SourceSnapshot.take(walker, root);

        Files.setLastModifiedTime(changed, FileTime.from(Instant.now().plusSeconds(60)));
        Files.delete(removed);
        Path created = write("created.md", "d");
        SourceSnapshot.Changes changes = SourceSnapshot.take(walker, root).since(before);

        assertThat(changes.modified()).containsExactlyInAnyOrder(changed, created);
        assertThat(changes.removed()).containsExactly(removed);
        assertThat(changes.all()).doesNotContain(kept).hasSize(3);
    }

    @Test
    void since_emptySnapshot_reportsEverythingAsModified() throws IOException {
        Path file = write("index.md", "# Home");

        SourceSnapshot.Changes changes = SourceSnapshot.take(walker, root).since(SourceSnapshot.empty());

        assertThat(changes.modified()).containsExactly(file);
        assertThat(changes.removed()).isEmpty();
        assertThat(SourceSnapshot.empty().since(SourceSnapshot.empty()).isEmpty()).isTrue();
    }

    @Test
    void walk_exclusions_skipSubtrees() throws IOException {
        write("index.md", "# Home");
        write("partials/nav.html", "<nav></nav>");

        List<WalkEntry> entries = walker.walk(root, List.of(root.resolve("partials")));

        assertThat(entries).extracting(WalkEntry::path).containsExactly(root.resolve("index.md"));
    }
}
