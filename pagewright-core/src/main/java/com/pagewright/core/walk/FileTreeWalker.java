package com.pagewright.core.walk;

import com.pagewright.core.error.BuildException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.FileVisitOption;
import java.nio.file.FileSystemLoopException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * {@link DirectoryWalker} backed by {@link Files#walkFileTree}.
 *
 * <p>Hidden entries (names starting with a dot) are skipped. Symbolic links are followed when
 * configured; link cycles are reported and skipped.
 */
public class FileTreeWalker implements DirectoryWalker {

    private static final Logger log = LoggerFactory.getLogger(FileTreeWalker.class);

    private final boolean followLinks;

    public FileTreeWalker(boolean followLinks) {
        this.followLinks = followLinks;
    }

    @Override
    public List<WalkEntry> walk(Path root, Collection<Path> exclusions) {
        Path start = root.toAbsolutePath().normalize();
        List<Path> excluded = exclusions.stream().map(p -> p.toAbsolutePath().normalize()).toList();
        List<WalkEntry> entries = new ArrayList<>();
        Set<FileVisitOption> options = followLinks
            ? EnumSet.of(FileVisitOption.FOLLOW_LINKS)
            : EnumSet.noneOf(FileVisitOption.class);

        try {
            Files.walkFileTree(start, options, Integer.MAX_VALUE, new SimpleFileVisitor<>() {
                @Override
                public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                    if (dir.equals(start)) {
                        return FileVisitResult.CONTINUE;
                    }
                    if (isHidden(dir) || excluded.contains(dir)) {
                        return FileVisitResult.SKIP_SUBTREE;
                    }
                    entries.add(new WalkEntry(dir, false));
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                    if (!isHidden(file) && excluded.stream().noneMatch(file::startsWith)) {
                        entries.add(new WalkEntry(file, true));
                    }
                    return FileVisitResult.CONTINUE;
                }

                @Override
                public FileVisitResult visitFileFailed(Path file, IOException exc) throws IOException {
                    if (exc instanceof FileSystemLoopException) {
                        log.warn("Skipping symbolic link cycle at {}", file);
                        return FileVisitResult.CONTINUE;
                    }
                    throw exc;
                }
            });
        } catch (IOException e) {
            throw new BuildException("Failed to walk source tree: " + start, start, e);
        }

        log.debug("Walked {} entries under {}", entries.size(), start);
        return entries;
    }

    private static boolean isHidden(Path path) {
        Path name = path.getFileName();
        return name != null && name.toString().startsWith(".");
    }
}
