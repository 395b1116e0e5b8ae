package com.pagewright.core.walk;

import java.nio.file.Path;
import java.util.Collection;
import java.util.List;

/**
 * Enumerates a source tree for the collation walk.
 */
public interface DirectoryWalker {

    /**
     * Walks a directory tree.
     *
     * <p>The root itself is not yielded. Nothing at or below an exclusion root is yielded.
     *
     * @param root directory to walk
     * @param exclusions absolute directories that are never entered
     * @return entries in walk order, parents before children
     */
    List<WalkEntry> walk(Path root, Collection<Path> exclusions);
}
