package com.pagewright.core.config;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Effective options for one build invocation: configuration plus command-line overrides.
 *
 * <p>All paths are absolute and normalized so that prefix checks against the source root are exact.
 *
 * @param source source root
 * @param target build target base directory
 * @param config site configuration
 * @param profile active build profile
 * @param force rebuild every file regardless of the manifest
 * @param cleanUrls clean URL rewriting
 * @param includeIndex keep {@code index.html} in hrefs
 * @param incremental consult the build manifest
 * @param parallel dispatch files across a worker pool
 * @param failFast abort on first error
 * @param workers worker pool size
 */
public record RuntimeOptions(
    Path source,
    Path target,
    SiteConfig config,
    BuildProfile profile,
    boolean force,
    boolean cleanUrls,
    boolean includeIndex,
    boolean incremental,
    boolean parallel,
    boolean failFast,
    int workers
) {
    public static final String INDEX_STEM = "index";
    public static final String INDEX_HTML = "index.html";
    public static final String HTML = "html";

    public RuntimeOptions {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(config, "config must not be null");
        Objects.requireNonNull(profile, "profile must not be null");
        source = source.toAbsolutePath().normalize();
        target = target.toAbsolutePath().normalize();
        if (workers < 1) {
            workers = 1;
        }
    }

    /**
     * Derives options from a project directory and its configuration.
     *
     * @param projectDir directory containing {@code site.yaml}
     * @param config loaded configuration
     * @param profile active profile
     * @return options with configuration defaults
     */
    public static RuntimeOptions from(Path projectDir, SiteConfig config, BuildProfile profile) {
        SiteConfig.BuildConfig build = config.build();
        return new RuntimeOptions(
            projectDir.resolve(build.source()),
            projectDir.resolve(build.target()),
            config,
            profile,
            false,
            build.cleanUrls(),
            build.includeIndex(),
            build.incremental(),
            build.parallel(),
            build.failFast(),
            build.workers()
        );
    }

    public RuntimeOptions withForce(boolean value) {
        return new RuntimeOptions(source, target, config, profile, value, cleanUrls, includeIndex,
            incremental, parallel, failFast, workers);
    }

    public RuntimeOptions withCleanUrls(boolean value) {
        return new RuntimeOptions(source, target, config, profile, force, value, includeIndex,
            incremental, parallel, failFast, workers);
    }

    public RuntimeOptions withIncludeIndex(boolean value) {
        return new RuntimeOptions(source, target, config, profile, force, cleanUrls, value,
            incremental, parallel, failFast, workers);
    }

    public RuntimeOptions withIncremental(boolean value) {
        return new RuntimeOptions(source, target, config, profile, force, cleanUrls, includeIndex,
            value, parallel, failFast, workers);
    }

    public RuntimeOptions withParallel(boolean value) {
        return new RuntimeOptions(source, target, config, profile, force, cleanUrls, includeIndex,
            incremental, value, failFast, workers);
    }

    public RuntimeOptions withFailFast(boolean value) {
        return new RuntimeOptions(source, target, config, profile, force, cleanUrls, includeIndex,
            incremental, parallel, value, workers);
    }

    public RuntimeOptions withWorkers(int value) {
        return new RuntimeOptions(source, target, config, profile, force, cleanUrls, includeIndex,
            incremental, parallel, failFast, value);
    }

    public boolean isRelease() {
        return profile.release();
    }

    public String baseHref() {
        return config.build().baseHref();
    }

    public Map<String, String> extensionMap() {
        return config.build().extensions();
    }

    public List<String> renderExtensions() {
        return config.build().render();
    }

    public List<String> markdownExtensions() {
        return config.build().markdown();
    }

    private Path sourceDir(String name) {
        return source.resolve(name).normalize();
    }

    public Path partialsPath() {
        return sourceDir(config.directories().partials());
    }

    public Path includesPath() {
        return sourceDir(config.directories().includes());
    }

    public Path dataSourcesPath() {
        return sourceDir(config.directories().datasources());
    }

    public Path localesPath() {
        return sourceDir(config.directories().locales());
    }

    public Path themesPath() {
        return sourceDir(config.directories().themes());
    }

    public Path hooksPath() {
        return sourceDir(config.directories().hooks());
    }

    public Path layoutsPath() {
        return sourceDir(config.directories().layouts());
    }

    public Path booksPath() {
        return sourceDir(config.directories().books());
    }

    /**
     * Directories the collation walk never enters.
     *
     * @return absolute exclusion roots
     */
    public List<Path> exclusionRoots() {
        return List.of(partialsPath(), includesPath(), dataSourcesPath(), themesPath(),
            localesPath(), hooksPath(), layoutsPath(), booksPath());
    }

    /**
     * Output root for a language. Multi-lingual sites write each language into its own subdirectory.
     *
     * @param lang language identifier
     * @return output root for the language
     */
    public Path buildTarget(String lang) {
        SiteConfig.LocaleConfig locales = config.locales();
        if (locales.isMulti()) {
            return target.resolve(lang);
        }
        return target;
    }
}
