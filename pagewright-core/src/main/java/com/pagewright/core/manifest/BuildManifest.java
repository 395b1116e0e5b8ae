package com.pagewright.core.manifest;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.pagewright.core.error.BuildException;
import com.pagewright.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Incremental rebuild cache mapping source paths to their last built modification time.
 *
 * <p>Persisted as JSON in a file named after the build target directory and placed next to it,
 * for example {@code build.json} for {@code build/}. A missing or unreadable file yields an empty
 * manifest, which simply means every file is rebuilt.
 *
 * <p>Workers call {@link #touch(Path, Path)} concurrently; every method synchronizes on the
 * manifest so the single in-memory map has one owner.
 */
public class BuildManifest {

    private static final Logger log = LoggerFactory.getLogger(BuildManifest.class);

    private static final TypeReference<TreeMap<String, ManifestEntry>> ENTRIES_TYPE = new TypeReference<>() {};

    private static final ObjectMapper mapper = new ObjectMapper()
        .enable(SerializationFeature.INDENT_OUTPUT);

    private final Path file;
    private final boolean incremental;
    private final Map<String, ManifestEntry> entries;

    BuildManifest(Path file, boolean incremental, Map<String, ManifestEntry> entries) {
        this.file = file;
        this.incremental = incremental;
        this.entries = new TreeMap<>(entries);
    }

    /**
     * Computes the manifest file for a build target.
     *
     * @param target build target directory
     * @return sibling file {@code <target name>.json}
     */
    public static Path manifestFile(Path target) {
        Path normalized = target.toAbsolutePath().normalize();
        return normalized.resolveSibling(normalized.getFileName() + ".json");
    }

    /**
     * Creates an empty manifest that has never been persisted.
     *
     * @param target build target directory
     * @param incremental whether the cache is consulted at all
     * @return empty manifest
     */
    public static BuildManifest empty(Path target, boolean incremental) {
        return new BuildManifest(manifestFile(target), incremental, Map.of());
    }

    /**
     * Loads the manifest for a build target.
     *
     * <p>Never fails: a missing file or a corrupt one yields an empty manifest.
     *
     * @param target build target directory
     * @param incremental whether the cache is consulted at all
     * @return loaded manifest
     */
    public static BuildManifest load(Path target, boolean incremental) {
        Path file = manifestFile(target);
        if (!incremental || !Files.isRegularFile(file)) {
            return new BuildManifest(file, incremental, Map.of());
        }
        try {
            Map<String, ManifestEntry> entries = mapper.readValue(file.toFile(), ENTRIES_TYPE);
            log.debug("Loaded build manifest {} with {} entries", file, entries == null ? 0 : entries.size());
            return new BuildManifest(file, incremental, entries == null ? Map.of() : entries);
        } catch (IOException e) {
            log.warn("Ignoring unreadable build manifest {}: {}", file, e.getMessage());
            return new BuildManifest(file, incremental, Map.of());
        }
    }

    public Path file() {
        return file;
    }

    public boolean incremental() {
        return incremental;
    }

    /**
     * Decides whether a file must be built.
     *
     * @param source source file
     * @param dest absolute output file
     * @param force rebuild regardless of the cache
     * @return true unless the cached entry is at least as new as the source
     */
    public synchronized boolean isDirty(Path source, Path dest, boolean force) {
        if (!incremental || force || !Files.exists(dest)) {
            return true;
        }
        ManifestEntry entry = entries.get(key(source));
        if (entry == null) {
            return true;
        }
        Optional<FileTime> current = FileUtils.lastModified(source);
        return current.isEmpty() || FileTimestamp.of(current.get()).isAfter(entry.modified());
    }

    /**
     * Records a successful build. Removes the entry when the source no longer exists.
     *
     * @param source source file
     * @param dest absolute output file
     */
    public synchronized void touch(Path source, Path dest) {
        String key = key(source);
        Optional<FileTime> modified = FileUtils.lastModified(source);
        if (modified.isEmpty()) {
            entries.remove(key);
            return;
        }
        entries.put(key, new ManifestEntry(FileTimestamp.of(modified.get())));
    }

    public synchronized Optional<ManifestEntry> get(Path source) {
        return Optional.ofNullable(entries.get(key(source)));
    }

    public synchronized int size() {
        return entries.size();
    }

    /**
     * Persists the manifest. Does nothing when incremental mode is off.
     *
     * @throws BuildException if the file cannot be written
     */
    public synchronized void save() {
        if (!incremental) {
            return;
        }
        try {
            FileUtils.writeString(file, mapper.writeValueAsString(entries));
            log.debug("Saved build manifest {} with {} entries", file, entries.size());
        } catch (IOException e) {
            throw new BuildException("Failed to write build manifest: " + file, file, e);
        }
    }

    private static String key(Path source) {
        return source.toString();
    }
}
