package com.pagewright.core.model;

import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Page data for one page-shaped source file.
 *
 * <p>Created during the collation walk by merging global page defaults, the path-keyed page
 * table and in-file front matter, in that order of precedence (front matter wins).
 * Instances are immutable; locale passes derive new instances with {@link #overlay(Page)}.
 *
 * @param source absolute source path
 * @param destination output-relative destination
 * @param href site-root-relative href
 * @param template file holding the page template (normally the source itself)
 * @param title page title
 * @param layout absolute layout path, or null to use the collation default
 * @param standalone render without any layout
 * @param draft excluded from release builds
 * @param render false to copy the file verbatim
 * @param cleanUrls effective clean URL setting for this page
 * @param permalink optional short link redirected to the page href
 * @param lang language the page belongs to
 * @param data merged page data, including unknown keys
 */
public record Page(
    Path source,
    Path destination,
    String href,
    Path template,
    String title,
    Path layout,
    boolean standalone,
    boolean draft,
    boolean render,
    boolean cleanUrls,
    String permalink,
    String lang,
    Map<String, Object> data
) {
    public static final String TITLE = "title";
    public static final String LAYOUT = "layout";
    public static final String STANDALONE = "standalone";
    public static final String DRAFT = "draft";
    public static final String RENDER = "render";
    public static final String REWRITE_INDEX = "rewriteIndex";
    public static final String PERMALINK = "permalink";
    public static final String MENU = "menu";
    public static final String WEIGHT = "weight";

    public Page {
        Objects.requireNonNull(source, "source must not be null");
        Objects.requireNonNull(destination, "destination must not be null");
        Objects.requireNonNull(href, "href must not be null");
        if (template == null) {
            template = source;
        }
        data = data == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }

    /**
     * Returns the resource the scheduler dispatches for this page.
     *
     * @return page resource; copy when rendering is disabled
     */
    public Resource toResource() {
        return Resource.page(destination, render);
    }

    public Optional<Path> layoutPath() {
        return Optional.ofNullable(layout);
    }

    /**
     * Names of menus this page is listed in.
     *
     * @return menu names from the {@code menu} key
     */
    public List<String> menus() {
        Object value = data.get(MENU);
        if (value instanceof String name) {
            return List.of(name);
        }
        if (value instanceof List<?> names) {
            return names.stream().map(String::valueOf).toList();
        }
        return List.of();
    }

    /**
     * Menu ordering weight.
     *
     * @return weight from the {@code weight} key, zero when absent
     */
    public int weight() {
        Object value = data.get(WEIGHT);
        if (value instanceof Number number) {
            return number.intValue();
        }
        return 0;
    }

    /**
     * Template data handed to the template engine.
     *
     * @return merged data plus the computed fields
     */
    public Map<String, Object> templateData() {
        Map<String, Object> values = new LinkedHashMap<>(data);
        values.put(TITLE, title);
        values.put("href", href);
        values.put("lang", lang);
        values.put("source", source.toString());
        values.put("destination", destination.toString());
        return values;
    }

    /**
     * Derives a locale variant: this page's data overlaid with the translated page.
     *
     * <p>The fallback source path and destination are kept so the variant is written to the
     * same output-relative location inside the language's output root; the template switches
     * to the translated file.
     *
     * @param translated page loaded from the locale specific file
     * @return merged page for the translation collation
     */
    public Page overlay(Page translated) {
        Map<String, Object> own = translated.data();
        Map<String, Object> merged = new LinkedHashMap<>(data);
        merged.putAll(own);
        return new Page(
            source,
            destination,
            href,
            translated.template(),
            own.containsKey(TITLE) ? translated.title() : title,
            own.containsKey(LAYOUT) ? translated.layout() : layout,
            own.containsKey(STANDALONE) ? translated.standalone() : standalone,
            own.containsKey(DRAFT) ? translated.draft() : draft,
            own.containsKey(RENDER) ? translated.render() : render,
            cleanUrls,
            permalink,
            translated.lang(),
            merged
        );
    }
}
