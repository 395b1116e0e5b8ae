package com.pagewright.core.render;

import com.pagewright.core.error.BuildException;
import com.pagewright.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * Writes build output to the filesystem.
 *
 * <p>Parent directories are created as needed and existing files are overwritten. Every
 * I/O failure is rethrown as a {@link BuildException} carrying the path it failed on.
 */
public class OutputWriter {

    private static final Logger log = LoggerFactory.getLogger(OutputWriter.class);

    public void write(Path target, String content) {
        try {
            FileUtils.writeString(target, content);
            log.debug("Wrote file: {} ({} chars)", target, content.length());
        } catch (IOException e) {
            throw new BuildException("Failed to write file: " + target, target, e);
        }
    }

    public void copy(Path source, Path target) {
        try {
            FileUtils.copy(source, target);
            log.debug("Copied file: {} -> {}", source, target);
        } catch (IOException e) {
            throw new BuildException("Failed to copy file: " + source, source, e);
        }
    }

    /**
     * Creates a symbolic link to the source file. An existing destination is left in place.
     *
     * @param source absolute source file
     * @param target output file
     * @return true when a link was created
     */
    public boolean link(Path source, Path target) {
        if (Files.exists(target, LinkOption.NOFOLLOW_LINKS)) {
            return false;
        }
        try {
            Path parent = target.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.createSymbolicLink(target, source.toAbsolutePath());
            log.debug("Linked file: {} -> {}", target, source);
            return true;
        } catch (IOException e) {
            throw new BuildException("Failed to link file: " + source, source, e);
        }
    }
}
