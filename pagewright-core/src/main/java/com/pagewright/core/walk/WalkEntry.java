package com.pagewright.core.walk;

import java.nio.file.Path;

/**
 * One entry yielded by a {@link DirectoryWalker}.
 *
 * @param path absolute path
 * @param isFile false for directories
 */
public record WalkEntry(Path path, boolean isFile) {
}
