package com.pagewright.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Root configuration for a site.
 *
 * <p>Loaded from {@code site.yaml} in the project directory. Every section is optional;
 * absent sections fall back to the defaults documented on each record.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * project:
 *   name: "Docs"
 *
 * build:
 *   source: site
 *   target: build
 *   cleanUrls: true
 *   parallel: true
 *   failFast: false
 *
 * link:
 *   relative: true
 *   verify: true
 *
 * pages:
 *   "about.md":
 *     title: "About us"
 *
 * redirect:
 *   "/docs": "/docs/getting-started/"
 *
 * transform:
 *   html:
 *     autoId: true
 *     toc: true
 * }</pre>
 *
 * @param project project metadata
 * @param build build settings
 * @param layout path of the default layout, relative to the source root
 * @param link link handling
 * @param page global page defaults
 * @param pages page data keyed by source-relative path
 * @param menus named menus declared in configuration, each a list of hrefs
 * @param redirect short URL to target map
 * @param transform HTML post-processing flags
 * @param minify minification settings
 * @param syntax syntax highlighting settings
 * @param search search index settings
 * @param hooks commands run before and after a build
 * @param locales locale settings
 * @param directories reserved directory names
 * @param profiles custom build profiles keyed by name
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SiteConfig(
    @JsonProperty("project") ProjectInfo project,
    @JsonProperty("build") BuildConfig build,
    @JsonProperty("layout") String layout,
    @JsonProperty("link") LinkConfig link,
    @JsonProperty("page") Map<String, Object> page,
    @JsonProperty("pages") Map<String, Map<String, Object>> pages,
    @JsonProperty("menus") Map<String, List<String>> menus,
    @JsonProperty("redirect") Map<String, String> redirect,
    @JsonProperty("transform") TransformConfig transform,
    @JsonProperty("minify") MinifyConfig minify,
    @JsonProperty("syntax") SyntaxConfig syntax,
    @JsonProperty("search") SearchConfig search,
    @JsonProperty("hooks") List<HookConfig> hooks,
    @JsonProperty("locales") LocaleConfig locales,
    @JsonProperty("directories") DirectoryConfig directories,
    @JsonProperty("profiles") Map<String, ProfileConfig> profiles
) {
    /**
     * Compact constructor replacing absent sections with defaults.
     */
    public SiteConfig {
        if (project == null) {
            project = new ProjectInfo("site", null);
        }
        if (build == null) {
            build = BuildConfig.defaults();
        }
        if (link == null) {
            link = new LinkConfig(null, null, null);
        }
        if (page == null) {
            page = Map.of();
        }
        if (pages == null) {
            pages = Map.of();
        }
        if (menus == null) {
            menus = Map.of();
        }
        redirect = redirect == null ? Map.of() : new LinkedHashMap<>(redirect);
        if (transform == null) {
            transform = new TransformConfig(null);
        }
        if (minify == null) {
            minify = new MinifyConfig(null);
        }
        if (syntax == null) {
            syntax = new SyntaxConfig(null, null);
        }
        if (search == null) {
            search = new SearchConfig(null);
        }
        if (hooks == null) {
            hooks = List.of();
        }
        if (locales == null) {
            locales = new LocaleConfig(null, null);
        }
        if (directories == null) {
            directories = DirectoryConfig.defaults();
        }
        if (profiles == null) {
            profiles = Map.of();
        }
    }

    /**
     * Creates a configuration with every section defaulted.
     *
     * @return default configuration
     */
    public static SiteConfig defaults() {
        return new SiteConfig(null, null, null, null, null, null, null, null,
            null, null, null, null, null, null, null, null);
    }

    /**
     * Project metadata.
     *
     * @param name site name
     * @param description optional description
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ProjectInfo(
        @JsonProperty("name") String name,
        @JsonProperty("description") String description
    ) {}

    /**
     * Build settings.
     *
     * @param source source directory relative to the project
     * @param target build target directory relative to the project
     * @param cleanUrls rewrite {@code name.ext} to {@code name/index.html}
     * @param includeIndex keep {@code index.html} in generated hrefs
     * @param baseHref optional prefix stripped from source paths
     * @param extensions source to output extension map
     * @param render extensions of page-shaped files
     * @param markdown extensions treated as markdown
     * @param incremental consult the build manifest
     * @param parallel dispatch files across a worker pool
     * @param failFast abort on the first failed file
     * @param workers pool size, defaults to available processors
     * @param followLinks follow symbolic links while walking
     * @param linkAssets symlink non-page files into the target instead of copying them
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record BuildConfig(
        @JsonProperty("source") String source,
        @JsonProperty("target") String target,
        @JsonProperty("cleanUrls") Boolean cleanUrls,
        @JsonProperty("includeIndex") Boolean includeIndex,
        @JsonProperty("baseHref") String baseHref,
        @JsonProperty("extensions") Map<String, String> extensions,
        @JsonProperty("render") List<String> render,
        @JsonProperty("markdown") List<String> markdown,
        @JsonProperty("incremental") Boolean incremental,
        @JsonProperty("parallel") Boolean parallel,
        @JsonProperty("failFast") Boolean failFast,
        @JsonProperty("workers") Integer workers,
        @JsonProperty("followLinks") Boolean followLinks,
        @JsonProperty("linkAssets") Boolean linkAssets
    ) {
        public BuildConfig {
            if (source == null) {
                source = "site";
            }
            if (target == null) {
                target = "build";
            }
            if (cleanUrls == null) {
                cleanUrls = false;
            }
            if (includeIndex == null) {
                includeIndex = false;
            }
            if (extensions == null) {
                extensions = Map.of("md", "html");
            }
            if (render == null) {
                render = List.of("md", "html");
            }
            if (markdown == null) {
                markdown = List.of("md");
            }
            if (incremental == null) {
                incremental = false;
            }
            if (parallel == null) {
                parallel = true;
            }
            if (failFast == null) {
                failFast = true;
            }
            if (workers == null || workers < 1) {
                workers = Runtime.getRuntime().availableProcessors();
            }
            if (followLinks == null) {
                followLinks = true;
            }
            if (linkAssets == null) {
                linkAssets = false;
            }
        }

        public static BuildConfig defaults() {
            return new BuildConfig(null, null, null, null, null, null, null, null,
                null, null, null, null, null, null);
        }
    }

    /**
     * Link handling.
     *
     * @param relative convert leading-slash hrefs to relative links
     * @param verify fail when a link does not resolve to a known page
     * @param allow hrefs accepted by verification even without a source page
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record LinkConfig(
        @JsonProperty("relative") Boolean relative,
        @JsonProperty("verify") Boolean verify,
        @JsonProperty("allow") List<String> allow
    ) {
        public LinkConfig {
            if (relative == null) {
                relative = true;
            }
            if (verify == null) {
                verify = false;
            }
            if (allow == null) {
                allow = List.of();
            }
        }
    }

    /**
     * HTML transform section.
     *
     * @param html HTML rewrite flags
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TransformConfig(
        @JsonProperty("html") HtmlTransformConfig html
    ) {
        public TransformConfig {
            if (html == null) {
                html = new HtmlTransformConfig(null, null, null, null, null);
            }
        }
    }

    /**
     * HTML rewrite flags.
     *
     * @param autoId assign ids to headings
     * @param syntaxHighlight highlight fenced code blocks
     * @param stripComments remove HTML comments
     * @param toc replace the table of contents placeholder
     * @param words replace word count placeholders
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record HtmlTransformConfig(
        @JsonProperty("autoId") Boolean autoId,
        @JsonProperty("syntaxHighlight") Boolean syntaxHighlight,
        @JsonProperty("stripComments") Boolean stripComments,
        @JsonProperty("toc") Boolean toc,
        @JsonProperty("words") Boolean words
    ) {
        public HtmlTransformConfig {
            autoId = Boolean.TRUE.equals(autoId);
            syntaxHighlight = Boolean.TRUE.equals(syntaxHighlight);
            stripComments = Boolean.TRUE.equals(stripComments);
            toc = Boolean.TRUE.equals(toc);
            words = Boolean.TRUE.equals(words);
        }
    }

    /**
     * Minification settings.
     *
     * @param html profiles for which HTML output is minified; empty means release builds only
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record MinifyConfig(
        @JsonProperty("html") List<String> html
    ) {
        public MinifyConfig {
            if (html == null) {
                html = List.of();
            }
        }
    }

    /**
     * Syntax highlighting settings.
     *
     * @param enabled whether code blocks are highlighted
     * @param aliases language alias to canonical language name
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SyntaxConfig(
        @JsonProperty("enabled") Boolean enabled,
        @JsonProperty("aliases") Map<String, String> aliases
    ) {
        public SyntaxConfig {
            enabled = Boolean.TRUE.equals(enabled);
            if (aliases == null) {
                aliases = Map.of();
            }
        }
    }

    /**
     * Search index settings.
     *
     * @param enabled whether text is extracted for the search index
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SearchConfig(
        @JsonProperty("enabled") Boolean enabled
    ) {
        public SearchConfig {
            enabled = Boolean.TRUE.equals(enabled);
        }
    }

    /**
     * External command run around a build.
     *
     * @param command program and arguments
     * @param phase {@code before} or {@code after}
     * @param profiles profiles the hook runs for; empty means all
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record HookConfig(
        @JsonProperty("command") List<String> command,
        @JsonProperty("phase") String phase,
        @JsonProperty("profiles") List<String> profiles
    ) {
        public HookConfig {
            if (command == null) {
                command = List.of();
            }
            if (phase == null) {
                phase = "before";
            }
            if (profiles == null) {
                profiles = List.of();
            }
        }
    }

    /**
     * Locale settings.
     *
     * @param fallback primary language
     * @param languages every language the site is published in
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record LocaleConfig(
        @JsonProperty("fallback") String fallback,
        @JsonProperty("languages") List<String> languages
    ) {
        public LocaleConfig {
            if (fallback == null) {
                fallback = "en";
            }
            if (languages == null) {
                languages = List.of(fallback);
            }
        }

        /**
         * Returns true when more than one language is published.
         *
         * @return whether output is split per language
         */
        public boolean isMulti() {
            return languages.stream().anyMatch(lang -> !lang.equals(fallback));
        }

        /**
         * Languages other than the fallback.
         *
         * @return alternate languages
         */
        public List<String> alternates() {
            return languages.stream().filter(lang -> !lang.equals(fallback)).toList();
        }
    }

    /**
     * Reserved directory names, relative to the source root.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record DirectoryConfig(
        @JsonProperty("partials") String partials,
        @JsonProperty("includes") String includes,
        @JsonProperty("datasources") String datasources,
        @JsonProperty("locales") String locales,
        @JsonProperty("themes") String themes,
        @JsonProperty("hooks") String hooks,
        @JsonProperty("layouts") String layouts,
        @JsonProperty("books") String books
    ) {
        public DirectoryConfig {
            if (partials == null) {
                partials = "partials";
            }
            if (includes == null) {
                includes = "includes";
            }
            if (datasources == null) {
                datasources = "data";
            }
            if (locales == null) {
                locales = "locales";
            }
            if (themes == null) {
                themes = "themes";
            }
            if (hooks == null) {
                hooks = "hooks";
            }
            if (layouts == null) {
                layouts = "layouts";
            }
            if (books == null) {
                books = "books";
            }
        }

        public static DirectoryConfig defaults() {
            return new DirectoryConfig(null, null, null, null, null, null, null, null);
        }
    }

    /**
     * Custom profile declaration.
     *
     * @param release whether the profile behaves as a release build
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ProfileConfig(
        @JsonProperty("release") Boolean release
    ) {
        public ProfileConfig {
            release = Boolean.TRUE.equals(release);
        }
    }
}
