package com.pagewright.core.collation;

import com.pagewright.core.error.LinkException;
import com.pagewright.core.manifest.BuildManifest;
import com.pagewright.core.model.Page;
import com.pagewright.core.model.Resource;
import com.pagewright.core.path.Hrefs;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * In-memory graph of every resource in one build target.
 *
 * <p>Invariants maintained by every mutator:
 * <ul>
 *   <li>a source path is in exactly one of {@link #pages()} and {@link #targets()}</li>
 *   <li>every href in the link index names a source present in one of those maps</li>
 *   <li>no two sources share an href</li>
 * </ul>
 *
 * <p>A collation is populated by {@link Collator} and must not be mutated while a scheduler pass
 * reads it. Incremental updates in the watch loop happen strictly between passes.
 */
public class Collation {

    public static final String DEFAULT_LAYOUT = "main";
    static final String PLUGIN_SEPARATOR = "::";

    private final String lang;
    private final Path outputRoot;
    private final boolean fallback;

    private final Map<Path, Page> pages = new LinkedHashMap<>();
    private final Map<Path, Resource> targets = new LinkedHashMap<>();
    private final Map<Path, Resource> resources = new LinkedHashMap<>();
    private final Map<String, Path> links = new LinkedHashMap<>();
    private final Set<String> allowedLinks = new LinkedHashSet<>();
    private final Map<String, String> permalinks = new LinkedHashMap<>();
    private final Map<String, List<String>> menus = new LinkedHashMap<>();
    private final Map<Path, Path> layouts = new LinkedHashMap<>();
    private final Map<String, Path> namedLayouts = new LinkedHashMap<>();
    private Path defaultLayout;
    private BuildManifest manifest;

    public Collation(String lang, Path outputRoot, boolean fallback) {
        this.lang = lang;
        this.outputRoot = outputRoot;
        this.fallback = fallback;
    }

    /**
     * Creates a translation collation that inherits every entry of a fallback collation.
     *
     * @param base fallback collation
     * @param lang translation language
     * @param outputRoot output root for the language
     * @return independent copy rooted at {@code outputRoot}
     */
    public static Collation inherit(Collation base, String lang, Path outputRoot) {
        Collation copy = new Collation(lang, outputRoot, false);
        copy.pages.putAll(base.pages);
        copy.targets.putAll(base.targets);
        copy.resources.putAll(base.resources);
        copy.links.putAll(base.links);
        copy.allowedLinks.addAll(base.allowedLinks);
        copy.permalinks.putAll(base.permalinks);
        base.menus.forEach((name, hrefs) -> copy.menus.put(name, new ArrayList<>(hrefs)));
        copy.layouts.putAll(base.layouts);
        copy.namedLayouts.putAll(base.namedLayouts);
        copy.defaultLayout = base.defaultLayout;
        return copy;
    }

    public String lang() {
        return lang;
    }

    public Path outputRoot() {
        return outputRoot;
    }

    public boolean isFallback() {
        return fallback;
    }

    public Optional<BuildManifest> manifest() {
        return Optional.ofNullable(manifest);
    }

    public void setManifest(BuildManifest manifest) {
        this.manifest = manifest;
    }

    // Lookups

    public Optional<Page> resolve(Path source) {
        return Optional.ofNullable(pages.get(source));
    }

    public Optional<Resource> target(Path source) {
        return Optional.ofNullable(targets.get(source));
    }

    public Optional<Path> getLink(String href) {
        return Optional.ofNullable(links.get(href));
    }

    /**
     * Finds the source for an href written the way authors tend to write it.
     *
     * <p>Tries the href as given, with a leading slash, with a trailing slash, with
     * {@code index.html} appended and finally with a trailing {@code .html} dropped.
     *
     * @param partial href fragment
     * @return source path, if one matches
     */
    public Optional<Path> findLink(String partial) {
        for (String candidate : linkCandidates(partial)) {
            Path source = links.get(candidate);
            if (source != null) {
                return Optional.of(source);
            }
        }
        return Optional.empty();
    }

    private static List<String> linkCandidates(String partial) {
        String leading = partial.startsWith("/") ? partial : "/" + partial;
        String trailing = leading.endsWith("/") ? leading : leading + "/";
        List<String> candidates = new ArrayList<>();
        candidates.add(partial);
        candidates.add(leading);
        candidates.add(trailing);
        candidates.add(trailing + "index.html");
        if (leading.endsWith(".html")) {
            candidates.add(leading.substring(0, leading.length() - ".html".length()) + "/");
        }
        return candidates;
    }

    /**
     * Returns true when link verification should accept the href.
     *
     * @param href site-root-relative href
     * @return whether the href names a known source or an allow listed file
     */
    public boolean isKnownLink(String href) {
        String path = stripQuery(href);
        return findLink(path).isPresent() || allowedLinks.contains(path)
            || allowedLinks.contains(Hrefs.trimTrailingSlash(path));
    }

    private static String stripQuery(String href) {
        int end = href.length();
        int hash = href.indexOf('#');
        if (hash >= 0) {
            end = hash;
        }
        int query = href.indexOf('?');
        if (query >= 0 && query < end) {
            end = query;
        }
        String path = href.substring(0, end);
        return path.isEmpty() ? "/" : path;
    }

    public Map<Path, Page> pages() {
        return Collections.unmodifiableMap(pages);
    }

    public Map<Path, Resource> targets() {
        return Collections.unmodifiableMap(targets);
    }

    public Map<String, Path> links() {
        return Collections.unmodifiableMap(links);
    }

    public Set<String> allowedLinks() {
        return Collections.unmodifiableSet(allowedLinks);
    }

    public Map<String, String> permalinks() {
        return Collections.unmodifiableMap(permalinks);
    }

    public Map<String, List<String>> menus() {
        return Collections.unmodifiableMap(menus);
    }

    /**
     * Every discovered entry, directories included. Directories carry the no-op operation and
     * are never scheduled.
     *
     * @return source path to resource, in walk order
     */
    public Map<Path, Resource> entries() {
        return Collections.unmodifiableMap(resources);
    }

    // Layouts

    /**
     * Registers a named layout. Plugins register theirs as {@code <plugin>::<name>}.
     *
     * @param name layout name
     * @param file absolute layout file
     */
    public void addLayout(String name, Path file) {
        namedLayouts.put(name, file);
    }

    public static String pluginLayoutName(String plugin, String name) {
        return plugin + PLUGIN_SEPARATOR + name;
    }

    public Optional<Path> namedLayout(String name) {
        return Optional.ofNullable(namedLayouts.get(name));
    }

    public Map<String, Path> namedLayouts() {
        return Collections.unmodifiableMap(namedLayouts);
    }

    public Optional<Path> defaultLayout() {
        return Optional.ofNullable(defaultLayout);
    }

    public void setDefaultLayout(Path defaultLayout) {
        this.defaultLayout = defaultLayout;
    }

    /**
     * Resolves the layout for a page: its own layout first, then the default layout.
     *
     * @param source page source path
     * @return layout file, empty to render standalone
     */
    public Optional<Path> findLayout(Path source) {
        Path layout = layouts.get(source);
        return layout != null ? Optional.of(layout) : defaultLayout();
    }

    // Mutators

    void addDirectory(Path source, Resource resource) {
        resources.put(source, resource);
    }

    /**
     * Adds or replaces a page.
     *
     * @param page page to add
     * @throws LinkException if another source already owns the href or the permalink
     */
    void addPage(Page page) {
        Path source = page.source();
        checkLink(page.href(), source);
        if (page.permalink() != null) {
            String permalink = Hrefs.trimTrailingSlash(page.permalink());
            String existing = permalinks.get(permalink);
            if (existing != null && !existing.equals(page.href()) && !source.equals(links.get(existing))) {
                throw LinkException.duplicatePermalink(permalink, source);
            }
        }

        detach(source);
        pages.put(source, page);
        resources.put(source, page.toResource());
        links.put(page.href(), source);
        page.layoutPath().ifPresent(layout -> layouts.put(source, layout));
        if (page.permalink() != null) {
            permalinks.put(Hrefs.trimTrailingSlash(page.permalink()), page.href());
        }
    }

    /**
     * Adds or replaces a plain copy target.
     *
     * @param source absolute source file
     * @param resource resource describing the destination
     * @param href href the destination is served at
     * @throws LinkException if another source already owns the href
     */
    void addTarget(Path source, Resource resource, String href) {
        checkLink(href, source);
        detach(source);
        targets.put(source, resource);
        resources.put(source, resource);
        links.put(href, source);
    }

    void allow(String href) {
        allowedLinks.add(href);
    }

    /**
     * Removes every trace of a source path.
     *
     * @param source absolute source path
     * @return destination the source was written to, if it was a page or target
     */
    Optional<Path> remove(Path source) {
        Optional<Path> destination = detach(source);
        resources.remove(source);
        return destination;
    }

    private Optional<Path> detach(Path source) {
        Page page = pages.remove(source);
        Resource target = targets.remove(source);
        links.values().removeIf(source::equals);
        layouts.remove(source);
        if (page != null) {
            permalinks.values().removeIf(page.href()::equals);
            menus.values().forEach(hrefs -> hrefs.remove(page.href()));
            return Optional.of(page.destination());
        }
        if (target != null) {
            return Optional.of(target.destination());
        }
        return Optional.empty();
    }

    private void checkLink(String href, Path source) {
        Path existing = links.get(href);
        if (existing != null && !existing.equals(source)) {
            throw LinkException.collision(href, existing, source);
        }
    }

    /**
     * Rebuilds menus: declared menus first in declared order, then pages listing the menu in
     * their {@code menu} key ordered by weight and href.
     *
     * @param declared menus from configuration
     */
    void rebuildMenus(Map<String, List<String>> declared) {
        menus.clear();
        declared.forEach((name, hrefs) -> menus.put(name, new ArrayList<>(hrefs)));

        List<Page> listed = new ArrayList<>(pages.values());
        listed.sort(Comparator.comparingInt(Page::weight).thenComparing(Page::href));
        for (Page page : listed) {
            for (String name : page.menus()) {
                List<String> hrefs = menus.computeIfAbsent(name, key -> new ArrayList<>());
                if (!hrefs.contains(page.href())) {
                    hrefs.add(page.href());
                }
            }
        }
    }

    /**
     * Checks the structural invariants.
     *
     * @return true when pages and targets are disjoint and every link resolves
     */
    public boolean isConsistent() {
        Set<Path> shared = new HashSet<>(pages.keySet());
        shared.retainAll(targets.keySet());
        if (!shared.isEmpty()) {
            return false;
        }
        return links.values().stream().allMatch(source -> pages.containsKey(source) ^ targets.containsKey(source));
    }
}
