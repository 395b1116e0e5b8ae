package com.pagewright.core;

import com.pagewright.core.config.BuildProfile;
import com.pagewright.core.config.ConfigLoader;
import com.pagewright.core.config.RuntimeOptions;
import com.pagewright.core.config.SiteConfig;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Base class for tests that need a site project on disk.
 *
 * <p>The project lives in a temporary directory with the default layout: sources under
 * {@code site/}, output under {@code build/} and configuration in {@code site.yaml}.
 */
public abstract class SiteTestBase {

    @TempDir
    protected Path projectDir;

    /**
     * Writes {@code site.yaml}.
     *
     * @param yaml configuration text
     * @throws IOException if the file cannot be written
     */
    protected void writeConfig(String yaml) throws IOException {
        Files.writeString(projectDir.resolve(ConfigLoader.CONFIG_FILE), yaml);
    }

    /**
     * Creates a file under the source root.
     *
     * @param relativePath path relative to {@code site/}
     * @param content file content
     * @return absolute path of the created file
     * @throws IOException if the file cannot be created
     */
    protected Path createSource(String relativePath, String content) throws IOException {
        Path file = sourceRoot().resolve(relativePath);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
        return file;
    }

    protected Path sourceRoot() {
        return projectDir.resolve("site").toAbsolutePath().normalize();
    }

    protected Path targetRoot() {
        return projectDir.resolve("build").toAbsolutePath().normalize();
    }

    protected SiteConfig loadConfig() {
        return ConfigLoader.loadFromProject(projectDir);
    }

    /**
     * Options for a sequential debug build, loaded from the project directory.
     *
     * @return runtime options
     */
    protected RuntimeOptions options() {
        return options(BuildProfile.DEBUG);
    }

    protected RuntimeOptions options(BuildProfile profile) {
        return RuntimeOptions.from(projectDir, loadConfig(), profile).withParallel(false);
    }

    protected String readTarget(String relativePath) throws IOException {
        return Files.readString(targetRoot().resolve(relativePath));
    }
}
