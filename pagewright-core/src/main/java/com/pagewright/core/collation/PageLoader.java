package com.pagewright.core.collation;

import com.pagewright.core.config.RuntimeOptions;
import com.pagewright.core.error.ConfigurationException;
import com.pagewright.core.frontmatter.FrontMatter;
import com.pagewright.core.frontmatter.FrontMatterConfig;
import com.pagewright.core.frontmatter.FrontMatterLoader;
import com.pagewright.core.frontmatter.FrontMatterParser;
import com.pagewright.core.model.Page;
import com.pagewright.core.path.PathResolver;
import com.pagewright.core.util.FileUtils;
import com.pagewright.core.util.Slugs;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Creates {@link Page} instances for page-shaped files.
 *
 * <p>Page data is merged in three layers, later layers winning:
 * <ol>
 *   <li>global page defaults ({@code page} in {@code site.yaml})</li>
 *   <li>the path keyed {@link PageTable}</li>
 *   <li>front matter in the file itself</li>
 * </ol>
 */
public class PageLoader {

    private final PathResolver resolver;
    private final PageTable table;
    private final FrontMatterLoader frontMatterLoader;
    private final FrontMatterParser frontMatterParser;

    public PageLoader(PathResolver resolver, PageTable table, FrontMatterLoader frontMatterLoader,
                      FrontMatterParser frontMatterParser) {
        this.resolver = resolver;
        this.table = table;
        this.frontMatterLoader = frontMatterLoader;
        this.frontMatterParser = frontMatterParser;
    }

    /**
     * Loads a page whose template is the source file itself.
     *
     * @param file absolute source file
     * @param lang language of the collation
     * @param collation collation supplying named and default layouts
     * @return merged page
     */
    public Page load(Path file, String lang, Collation collation) {
        return load(file, file, lang, collation);
    }

    /**
     * Loads a page.
     *
     * @param template file to read front matter and content from
     * @param key canonical source path used for the page table, destination and href
     * @param lang language of the collation
     * @param collation collation supplying named and default layouts
     * @return merged page
     */
    public Page load(Path template, Path key, String lang, Collation collation) {
        RuntimeOptions options = resolver.options();
        Map<String, Object> data = new LinkedHashMap<>(options.config().page());
        data.putAll(table.get(key));

        FrontMatter frontMatter = frontMatterLoader.load(template,
            FrontMatterConfig.forType(resolver.fileType(template)));
        data.putAll(frontMatterParser.parse(frontMatter, template));

        boolean cleanUrls = booleanValue(data, Page.REWRITE_INDEX, options.cleanUrls());
        Path destination = resolver.computeDestination(key, cleanUrls);
        String href = resolver.computeAbsoluteHref(key, cleanUrls);

        Object title = data.get(Page.TITLE);
        Object permalink = data.get(Page.PERMALINK);

        return new Page(
            key,
            destination,
            href,
            template,
            title != null ? title.toString() : autoTitle(key),
            resolveLayout(data.get(Page.LAYOUT), key, collation).orElse(null),
            booleanValue(data, Page.STANDALONE, false),
            booleanValue(data, Page.DRAFT, false),
            booleanValue(data, Page.RENDER, true),
            cleanUrls,
            permalink != null ? permalink.toString() : null,
            lang,
            data
        );
    }

    /**
     * Derives a title from the file name: the stem for ordinary pages, the parent directory for index pages.
     *
     * @param file absolute source file
     * @return title cased name
     */
    public String autoTitle(Path file) {
        RuntimeOptions options = resolver.options();
        if (PathResolver.isIndex(file)) {
            Path parent = file.getParent();
            if (parent == null || parent.equals(options.source())) {
                return options.config().project().name();
            }
            return Slugs.titleCase(parent.getFileName().toString());
        }
        return Slugs.titleCase(FileUtils.getStem(file.getFileName()));
    }

    private Optional<Path> resolveLayout(Object value, Path page, Collation collation) {
        if (value == null) {
            return Optional.empty();
        }
        String name = value.toString();
        Optional<Path> named = collation.namedLayout(name);
        if (named.isPresent()) {
            return named;
        }
        Path file = resolver.options().source().resolve(name).normalize();
        if (!Files.isRegularFile(file)) {
            throw new ConfigurationException("Layout " + name + " for page " + page + " does not exist", page);
        }
        return Optional.of(file);
    }

    private static boolean booleanValue(Map<String, Object> data, String key, boolean fallback) {
        Object value = data.get(key);
        if (value instanceof Boolean flag) {
            return flag;
        }
        if (value instanceof String text) {
            return Boolean.parseBoolean(text);
        }
        return fallback;
    }
}
