package com.pagewright.core.collation;

import com.pagewright.core.config.RuntimeOptions;
import com.pagewright.core.config.SiteConfig;
import com.pagewright.core.error.BuildException;
import com.pagewright.core.error.ConfigurationException;
import com.pagewright.core.frontmatter.DelimitedFrontMatterLoader;
import com.pagewright.core.frontmatter.FrontMatterLoader;
import com.pagewright.core.frontmatter.FrontMatterParser;
import com.pagewright.core.model.Page;
import com.pagewright.core.model.Resource;
import com.pagewright.core.model.ResourceKind;
import com.pagewright.core.model.ResourceOperation;
import com.pagewright.core.path.Hrefs;
import com.pagewright.core.path.PathResolver;
import com.pagewright.core.util.FileUtils;
import com.pagewright.core.walk.DirectoryWalker;
import com.pagewright.core.walk.FileTreeWalker;
import com.pagewright.core.walk.WalkEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Builds {@link Collation}s by walking the source tree, and keeps them current in the watch loop.
 *
 * <p>One collation is produced per published language. The fallback language is walked once;
 * every other language inherits the fallback entries and overlays pages from translated files
 * named {@code name.<lang>.<ext>}.
 */
public class Collator {

    private static final Logger log = LoggerFactory.getLogger(Collator.class);

    private final RuntimeOptions options;
    private final PathResolver resolver;
    private final DirectoryWalker walker;
    private final PageTable table;
    private final PageLoader loader;
    private final List<PluginAssets> plugins;

    public Collator(RuntimeOptions options) {
        this(options, new FileTreeWalker(options.config().build().followLinks()),
            new DelimitedFrontMatterLoader(), List.of());
    }

    public Collator(RuntimeOptions options, DirectoryWalker walker, FrontMatterLoader frontMatterLoader,
                    List<PluginAssets> plugins) {
        this.options = options;
        this.resolver = new PathResolver(options);
        this.walker = walker;
        this.table = PageTable.from(options);
        this.loader = new PageLoader(resolver, table, frontMatterLoader, new FrontMatterParser());
        this.plugins = List.copyOf(plugins);
    }

    public PathResolver resolver() {
        return resolver;
    }

    /**
     * Walks the source tree and builds one collation per language.
     *
     * @return collations keyed by language, fallback first
     * @throws ConfigurationException if the page table names a missing file or a layout is missing
     */
    public Map<String, Collation> walk() {
        table.verify();

        SiteConfig.LocaleConfig locales = options.config().locales();
        String fallbackLang = locales.fallback();
        Collation fallback = new Collation(fallbackLang, options.buildTarget(fallbackLang), true);
        registerLayouts(fallback);
        injectPlugins(fallback);

        Map<String, List<Path>> translations = new LinkedHashMap<>();
        locales.alternates().forEach(lang -> translations.put(lang, new ArrayList<>()));

        for (WalkEntry entry : walker.walk(options.source(), options.exclusionRoots())) {
            Path path = entry.path();
            if (!entry.isFile()) {
                fallback.addDirectory(path, Resource.directory(resolver.computeDestination(path)));
                continue;
            }
            Optional<String> lang = translationLanguage(path);
            if (lang.isPresent() && resolver.isPage(path)) {
                translations.get(lang.get()).add(path);
                continue;
            }
            add(fallback, path);
        }

        options.config().link().allow().forEach(fallback::allow);
        fallback.rebuildMenus(options.config().menus());
        log.info("Collated {} pages and {} files for '{}'", fallback.pages().size(),
            fallback.targets().size(), fallbackLang);

        Map<String, Collation> collations = new LinkedHashMap<>();
        collations.put(fallbackLang, fallback);
        translations.forEach((lang, files) -> {
            Collation translated = Collation.inherit(fallback, lang, options.buildTarget(lang));
            for (Path file : files) {
                overlay(translated, file, lang);
            }
            translated.rebuildMenus(options.config().menus());
            log.info("Collated {} translated pages for '{}'", files.size(), lang);
            collations.put(lang, translated);
        });
        return collations;
    }

    /**
     * Adds or refreshes a single file. Used between passes by the watch loop.
     *
     * @param collation collation to update
     * @param file absolute source file
     */
    public void upsert(Collation collation, Path file) {
        Path path = resolver.normalize(file);
        if (!Files.exists(path)) {
            remove(collation, path);
            return;
        }
        if (Files.isDirectory(path)) {
            collation.addDirectory(path, Resource.directory(resolver.computeDestination(path)));
            return;
        }
        Optional<String> lang = translationLanguage(path);
        if (lang.isPresent() && resolver.isPage(path)) {
            if (lang.get().equals(collation.lang())) {
                overlay(collation, path, lang.get());
                collation.rebuildMenus(options.config().menus());
            }
            return;
        }
        Optional<Path> translatedFrom = collation.resolve(path).map(Page::template).filter(t -> !t.equals(path));
        add(collation, path);
        translatedFrom.filter(Files::isRegularFile).ifPresent(t -> overlay(collation, t, collation.lang()));
        collation.rebuildMenus(options.config().menus());
    }

    /**
     * Removes a file from the collation and deletes its stale build artifact.
     *
     * @param collation collation to update
     * @param file absolute source file
     */
    public void remove(Collation collation, Path file) {
        Path path = resolver.normalize(file);
        Optional<String> lang = translationLanguage(path);
        if (lang.isPresent() && resolver.isPage(path)) {
            if (!lang.get().equals(collation.lang())) {
                return;
            }
            // The fallback page takes over again when it exists
            Path key = translationKey(path, lang.get());
            if (Files.isRegularFile(key)) {
                add(collation, key);
                collation.rebuildMenus(options.config().menus());
                return;
            }
            path = key;
        }
        Optional<Path> destination = collation.remove(path);
        collation.rebuildMenus(options.config().menus());
        if (destination.isEmpty()) {
            return;
        }
        Path artifact = collation.outputRoot().resolve(destination.get());
        try {
            if (Files.deleteIfExists(artifact)) {
                log.info("Removed stale artifact {}", artifact);
            }
        } catch (IOException e) {
            throw new BuildException("Failed to delete stale artifact: " + artifact, artifact, e);
        }
    }

    private void add(Collation collation, Path file) {
        if (resolver.isPage(file)) {
            collation.addPage(loader.load(file, collation.lang(), collation));
            return;
        }
        ResourceOperation operation = options.config().build().linkAssets()
            ? ResourceOperation.LINK
            : ResourceOperation.COPY;
        collation.addTarget(file,
            new Resource(ResourceKind.FILE, operation, resolver.computeDestination(file)),
            resolver.computeAbsoluteHref(file));
    }

    private void overlay(Collation collation, Path file, String lang) {
        Path key = translationKey(file, lang);
        Page translated = loader.load(file, key, lang, collation);
        Page page = collation.resolve(key).map(existing -> existing.overlay(translated)).orElse(translated);
        collation.addPage(page);
    }

    private void registerLayouts(Collation collation) {
        Path layouts = options.layoutsPath();
        if (Files.isDirectory(layouts)) {
            try (Stream<Path> files = Files.walk(layouts)) {
                files.filter(Files::isRegularFile).sorted().forEach(file -> {
                    Path relative = layouts.relativize(file);
                    String name = Hrefs.toHrefSeparator(relative);
                    String ext = FileUtils.getExtension(file);
                    if (!ext.isEmpty()) {
                        name = name.substring(0, name.length() - ext.length() - 1);
                    }
                    collation.addLayout(name, file);
                });
            } catch (IOException e) {
                throw new BuildException("Failed to read layouts: " + layouts, layouts, e);
            }
        }

        String configured = options.config().layout();
        if (configured != null) {
            Path file = options.source().resolve(configured).normalize();
            if (!Files.isRegularFile(file)) {
                throw new ConfigurationException("Default layout " + configured + " does not exist", file);
            }
            collation.setDefaultLayout(file);
        } else {
            collation.namedLayout(Collation.DEFAULT_LAYOUT).ifPresent(collation::setDefaultLayout);
        }
    }

    private void injectPlugins(Collation collation) {
        for (PluginAssets plugin : plugins) {
            for (Path asset : plugin.assets()) {
                Path source = plugin.base().resolve(asset).toAbsolutePath().normalize();
                Path destination = plugin.destination(asset);
                collation.addTarget(source, new Resource(ResourceKind.ASSET, ResourceOperation.COPY, destination),
                    "/" + Hrefs.toHrefSeparator(destination));
            }
            plugin.layouts().forEach((name, file) -> collation.addLayout(
                Collation.pluginLayoutName(plugin.name(), name),
                plugin.base().resolve(file).toAbsolutePath().normalize()));
            log.debug("Injected {} assets from plugin {}", plugin.assets().size(), plugin.name());
        }
    }

    /**
     * Collation key a source file is stored under. Translated pages share the key of the page they
     * translate.
     *
     * @param file absolute source file
     * @return collation key
     */
    public Path entryKey(Path file) {
        Path path = resolver.normalize(file);
        return translationLanguage(path)
            .filter(lang -> resolver.isPage(path))
            .map(lang -> translationKey(path, lang))
            .orElse(path);
    }

    /**
     * Detects a translated file named {@code name.<lang>.<ext>}.
     *
     * @param file absolute source file
     * @return language when the file is a translation for a configured alternate language
     */
    Optional<String> translationLanguage(Path file) {
        SiteConfig.LocaleConfig locales = options.config().locales();
        if (!locales.isMulti()) {
            return Optional.empty();
        }
        String stem = FileUtils.getStem(file.getFileName());
        int dot = stem.lastIndexOf('.');
        if (dot < 0) {
            return Optional.empty();
        }
        String lang = stem.substring(dot + 1);
        return locales.alternates().contains(lang) ? Optional.of(lang) : Optional.empty();
    }

    static Path translationKey(Path file, String lang) {
        String ext = FileUtils.getExtension(file);
        String stem = FileUtils.getStem(file.getFileName());
        String base = stem.substring(0, stem.length() - lang.length() - 1);
        return file.resolveSibling(ext.isEmpty() ? base : base + "." + ext);
    }
}
