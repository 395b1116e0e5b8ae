package com.pagewright.core.util;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.FileTime;
import java.util.Optional;

/**
 * Utility class for file operations.
 */
public final class FileUtils {

    private FileUtils() {
        // Utility class
    }

    /**
     * Gets the file extension.
     *
     * @param path file path
     * @return file extension without dot, or empty string if no extension
     */
    public static String getExtension(Path path) {
        Path name = path.getFileName();
        if (name == null) {
            return "";
        }
        String fileName = name.toString();
        int lastDot = fileName.lastIndexOf('.');
        return lastDot > 0 ? fileName.substring(lastDot + 1) : "";
    }

    /**
     * Gets the file name without its extension.
     *
     * @param path file path
     * @return file stem
     */
    public static String getStem(Path path) {
        Path name = path.getFileName();
        if (name == null) {
            return "";
        }
        String fileName = name.toString();
        int lastDot = fileName.lastIndexOf('.');
        return lastDot > 0 ? fileName.substring(0, lastDot) : fileName;
    }

    /**
     * Writes a string, creating parent directories as needed.
     *
     * @param target file to write
     * @param content content
     * @throws IOException if writing fails
     */
    public static void writeString(Path target, String content) throws IOException {
        createParentDirectories(target);
        Files.writeString(target, content);
    }

    /**
     * Copies a file, creating parent directories and replacing an existing destination.
     *
     * @param source file to copy
     * @param target destination
     * @throws IOException if copying fails
     */
    public static void copy(Path source, Path target) throws IOException {
        createParentDirectories(target);
        Files.copy(source, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
    }

    /**
     * Copies a directory tree into a destination directory.
     *
     * @param source directory to copy
     * @param target destination directory
     * @throws IOException if walking or copying fails
     */
    public static void copyTree(Path source, Path target) throws IOException {
        try (var paths = Files.walk(source)) {
            for (Path path : (Iterable<Path>) paths::iterator) {
                Path dest = target.resolve(source.relativize(path).toString());
                if (Files.isDirectory(path)) {
                    Files.createDirectories(dest);
                } else {
                    copy(path, dest);
                }
            }
        }
    }

    /**
     * Reads the last modification time of a file.
     *
     * @param path file
     * @return modification time, or empty if the file is missing or unreadable
     */
    public static Optional<FileTime> lastModified(Path path) {
        try {
            return Optional.of(Files.getLastModifiedTime(path));
        } catch (IOException e) {
            return Optional.empty();
        }
    }

    private static void createParentDirectories(Path target) throws IOException {
        Path parent = target.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }
}
