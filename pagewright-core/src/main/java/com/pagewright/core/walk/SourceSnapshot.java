package com.pagewright.core.walk;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Modification times of every visible file under a directory at one point in time.
 *
 * <p>The watch loop compares successive snapshots instead of subscribing to file system events.
 */
public final class SourceSnapshot {

    private static final Logger log = LoggerFactory.getLogger(SourceSnapshot.class);

    private final Map<Path, FileTime> files;

    private SourceSnapshot(Map<Path, FileTime> files) {
        this.files = Collections.unmodifiableMap(files);
    }

    public static SourceSnapshot empty() {
        return new SourceSnapshot(new TreeMap<>());
    }

    /**
     * Records every file the walker yields under the root. Nothing is excluded so that changes to
     * layouts and partials are seen too.
     *
     * @param walker walker to enumerate the tree
     * @param root directory to snapshot
     * @return snapshot keyed by absolute path
     */
    public static SourceSnapshot take(DirectoryWalker walker, Path root) {
        Map<Path, FileTime> files = new TreeMap<>();
        for (WalkEntry entry : walker.walk(root, List.of())) {
            if (!entry.isFile()) {
                continue;
            }
            try {
                files.put(entry.path(), Files.getLastModifiedTime(entry.path()));
            } catch (NoSuchFileException e) {
                // Deleted between walk and stat; the next probe sees it as removed
                log.debug("File vanished while probing: {}", entry.path());
            } catch (IOException e) {
                log.warn("Cannot read modification time of {}: {}", entry.path(), e.getMessage());
            }
        }
        return new SourceSnapshot(files);
    }

    public Map<Path, FileTime> files() {
        return files;
    }

    public int size() {
        return files.size();
    }

    /**
     * Compares this snapshot against an earlier one.
     *
     * @param previous earlier snapshot
     * @return files created or modified since, and files removed since
     */
    public Changes since(SourceSnapshot previous) {
        List<Path> modified = new ArrayList<>();
        List<Path> removed = new ArrayList<>();
        files.forEach((path, time) -> {
            if (!time.equals(previous.files.get(path))) {
                modified.add(path);
            }
        });
        previous.files.keySet().stream().filter(path -> !files.containsKey(path)).forEach(removed::add);
        return new Changes(modified, removed);
    }

    /**
     * Difference between two snapshots.
     *
     * @param modified files created or modified
     * @param removed files deleted
     */
    public record Changes(List<Path> modified, List<Path> removed) {

        public Changes {
            modified = List.copyOf(modified);
            removed = List.copyOf(removed);
        }

        public boolean isEmpty() {
            return modified.isEmpty() && removed.isEmpty();
        }

        public List<Path> all() {
            List<Path> all = new ArrayList<>(modified);
            all.addAll(removed);
            return all;
        }
    }
}
