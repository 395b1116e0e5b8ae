package com.pagewright.core.collation;

import com.pagewright.core.config.RuntimeOptions;
import com.pagewright.core.error.ConfigurationException;
import com.pagewright.core.path.Hrefs;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Page data overrides declared under {@code pages} in {@code site.yaml}, keyed by absolute source path.
 *
 * <p>Owned by the collation walk and passed to the page loader; there is no shared global table.
 */
public final class PageTable {

    private final Map<Path, Map<String, Object>> entries;

    private PageTable(Map<Path, Map<String, Object>> entries) {
        this.entries = Collections.unmodifiableMap(entries);
    }

    /**
     * Builds the table from configuration.
     *
     * @param options runtime options supplying the source root and the {@code pages} section
     * @return table keyed by absolute source path
     */
    public static PageTable from(RuntimeOptions options) {
        Map<Path, Map<String, Object>> entries = new LinkedHashMap<>();
        options.config().pages().forEach((key, data) -> {
            Path file = options.source().resolve(Hrefs.toPathSeparator(Hrefs.trimLeadingSlash(key))).normalize();
            entries.put(file, data == null ? Map.of() : data);
        });
        return new PageTable(entries);
    }

    public static PageTable empty() {
        return new PageTable(Map.of());
    }

    /**
     * Returns the overrides for a file.
     *
     * @param file absolute source path
     * @return override data, empty when the file has no entry
     */
    public Map<String, Object> get(Path file) {
        return entries.getOrDefault(file, Map.of());
    }

    public Map<Path, Map<String, Object>> entries() {
        return entries;
    }

    /**
     * Checks that every entry names an existing file.
     *
     * @throws ConfigurationException naming the first missing file
     */
    public void verify() {
        for (Path file : entries.keySet()) {
            if (!Files.isRegularFile(file)) {
                throw new ConfigurationException("No page exists for page table entry " + file, file);
            }
        }
    }
}
