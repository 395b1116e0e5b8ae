package com.pagewright.core.build;

import com.pagewright.core.error.OutsideSourceTreeException;

import java.nio.file.Path;
import java.util.List;

/**
 * Selects which collation entries a scheduler pass builds.
 *
 * <p>An empty path list selects everything. Otherwise an entry is selected when its source path
 * equals a listed file or lies under a listed directory.
 *
 * @param paths absolute files or directory prefixes
 */
public record BuildScope(List<Path> paths) {

    public BuildScope {
        paths = paths == null ? List.of() : paths.stream().map(p -> p.toAbsolutePath().normalize()).toList();
    }

    public static BuildScope all() {
        return new BuildScope(List.of());
    }

    public static BuildScope of(List<Path> paths) {
        return new BuildScope(paths);
    }

    public boolean isAll() {
        return paths.isEmpty();
    }

    public boolean contains(Path source) {
        return paths.isEmpty() || paths.stream().anyMatch(source::startsWith);
    }

    /**
     * Checks that every path lies inside the source root.
     *
     * @param sourceRoot absolute source root
     * @throws OutsideSourceTreeException for the first path outside the root
     */
    public void validate(Path sourceRoot) {
        for (Path path : paths) {
            if (!path.startsWith(sourceRoot)) {
                throw new OutsideSourceTreeException(path, sourceRoot);
            }
        }
    }
}
