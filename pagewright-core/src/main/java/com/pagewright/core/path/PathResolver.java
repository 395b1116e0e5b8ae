package com.pagewright.core.path;

import com.pagewright.core.config.RuntimeOptions;
import com.pagewright.core.error.OutsideSourceTreeException;
import com.pagewright.core.util.FileUtils;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;

/**
 * Computes destination paths and public hrefs for source files.
 *
 * <p>Both directions share one rewriting rule set so that a page's href always names the
 * file its destination writes:
 * <ul>
 *   <li>the source root and an optional base-href prefix are stripped</li>
 *   <li>page-shaped files have their extension mapped (for example {@code md -> html})</li>
 *   <li>with clean URLs, {@code name.ext} becomes {@code name/index.html} unless the file is
 *       already an index file or a {@code name/index.*} page exists next to it</li>
 * </ul>
 *
 * <p>Apart from the sibling-index probe the resolver is pure: the same input always yields the
 * same output.
 */
public class PathResolver {

    private final RuntimeOptions options;

    public PathResolver(RuntimeOptions options) {
        this.options = Objects.requireNonNull(options, "options must not be null");
    }

    public RuntimeOptions options() {
        return options;
    }

    /**
     * Classifies a file by its extension.
     *
     * @param file source file
     * @return file type
     */
    public FileType fileType(Path file) {
        String ext = FileUtils.getExtension(file);
        if (options.renderExtensions().contains(ext)) {
            return options.markdownExtensions().contains(ext) ? FileType.MARKDOWN : FileType.TEMPLATE;
        }
        return FileType.UNKNOWN;
    }

    public boolean isPage(Path file) {
        return fileType(file).isPage();
    }

    /**
     * Returns true when the file stem is {@code index}.
     *
     * @param file file to test
     * @return whether the file is an index file
     */
    public static boolean isIndex(Path file) {
        Path name = file.getFileName();
        return name != null && RuntimeOptions.INDEX_STEM.equals(FileUtils.getStem(name));
    }

    /**
     * Returns true when clean URL rewriting would move this page one directory deeper.
     *
     * @param file absolute source file
     * @return whether the page is written as {@code name/index.html}
     */
    public boolean isClean(Path file) {
        Path normalized = normalize(file);
        if (!isPage(normalized) || isIndex(normalized)) {
            return false;
        }
        return !hasSiblingIndex(normalized);
    }

    private boolean hasSiblingIndex(Path file) {
        Path parent = file.getParent();
        if (parent == null) {
            return false;
        }
        Path dir = parent.resolve(FileUtils.getStem(file.getFileName()));
        for (String ext : options.renderExtensions()) {
            if (Files.exists(dir.resolve(RuntimeOptions.INDEX_STEM + "." + ext))) {
                return true;
            }
        }
        return false;
    }

    /**
     * Computes the output-relative destination using the global clean URL setting.
     *
     * @param file absolute source file
     * @return destination relative to the build target
     * @throws OutsideSourceTreeException if the file is not under the source root
     */
    public Path computeDestination(Path file) {
        return computeDestination(file, options.cleanUrls());
    }

    /**
     * Computes the output-relative destination.
     *
     * @param file absolute source file
     * @param cleanUrls clean URL rewriting for this file (pages may override the global flag)
     * @return destination relative to the build target
     * @throws OutsideSourceTreeException if the file is not under the source root
     */
    public Path computeDestination(Path file, boolean cleanUrls) {
        Path normalized = normalize(file);
        Path relative = relativize(normalized);

        if (!isPage(normalized)) {
            return relative;
        }

        Path result = withMappedExtension(relative);
        if (cleanUrls && !isIndex(normalized) && !hasSiblingIndex(normalized)) {
            String stem = FileUtils.getStem(result.getFileName());
            Path parent = result.getParent();
            Path dir = parent == null ? Path.of(stem) : parent.resolve(stem);
            result = dir.resolve(RuntimeOptions.INDEX_HTML);
        }
        return result;
    }

    /**
     * Computes the site-root-relative href for a file using the global clean URL setting.
     *
     * @param file absolute source file
     * @return href beginning with {@code /}
     */
    public String computeAbsoluteHref(Path file) {
        return computeAbsoluteHref(file, options.cleanUrls());
    }

    /**
     * Computes the site-root-relative href for a file.
     *
     * <p>The home index collapses to {@code /}; paths without an extension get a trailing slash;
     * with clean URLs on and include-index off a trailing {@code index.html} is dropped.
     *
     * @param file absolute source file
     * @param cleanUrls clean URL rewriting for this file
     * @return href beginning with {@code /}
     */
    public String computeAbsoluteHref(Path file, boolean cleanUrls) {
        String dest = Hrefs.toHrefSeparator(computeDestination(file, cleanUrls));
        if (dest.isEmpty() || dest.equals(RuntimeOptions.INDEX_HTML)) {
            return "/";
        }

        if (cleanUrls && !options.includeIndex() && isPage(normalize(file))
            && dest.endsWith("/" + RuntimeOptions.INDEX_HTML)) {
            dest = dest.substring(0, dest.length() - RuntimeOptions.INDEX_HTML.length());
        }

        StringBuilder href = new StringBuilder("/").append(dest);
        if (!dest.endsWith("/") && !Hrefs.hasExtension(dest)) {
            href.append('/');
        }
        return href.toString();
    }

    /**
     * Rewrites a site-root-relative href so it is relative to the page being rendered.
     *
     * <p>External URLs, hrefs without a leading slash and all hrefs when relative links are
     * disabled pass through unchanged.
     *
     * @param href target href
     * @param current absolute source path of the page containing the link
     * @return relative href
     * @throws OutsideSourceTreeException if the current page is not under the source root
     */
    public String computeRelativeHref(String href, Path current) {
        return computeRelativeHref(href, current, options.cleanUrls());
    }

    /**
     * Rewrites a site-root-relative href for a page whose clean URL setting may differ from the
     * global one.
     *
     * @param href target href
     * @param current absolute source path of the page containing the link
     * @param cleanUrls clean URL rewriting in effect for the current page
     * @return relative href
     * @throws OutsideSourceTreeException if the current page is not under the source root
     */
    public String computeRelativeHref(String href, Path current, boolean cleanUrls) {
        boolean relativeLinks = options.config().link().relative();
        if (!relativeLinks || isPassthrough(href)) {
            if (options.includeIndex() && (href.equals(".") || href.equals(".."))) {
                return href + "/" + RuntimeOptions.INDEX_HTML;
            }
            return href;
        }

        String input = Hrefs.trimLeadingSlash(href);
        String baseHref = options.baseHref();
        if (baseHref != null && !baseHref.isEmpty() && input.startsWith(baseHref)) {
            input = Hrefs.trimLeadingSlash(input.substring(baseHref.length()));
        }

        Path normalized = normalize(current);
        Path relative = relativize(normalized);

        StringBuilder value = new StringBuilder();
        if (cleanUrls && isClean(normalized)) {
            value.append("../");
        }
        Path parent = relative.getParent();
        if (parent != null) {
            for (int i = 0; i < parent.getNameCount(); i++) {
                value.append("../");
            }
        }
        value.append(input);

        String result = value.toString();
        if (options.includeIndex() && (result.isEmpty() || result.endsWith("/"))) {
            return result + RuntimeOptions.INDEX_HTML;
        }
        if (result.isEmpty()) {
            return "../";
        }
        return result;
    }

    /**
     * Returns true for hrefs that are never rewritten.
     *
     * @param href href to test
     * @return whether the href is external or not site-root-relative
     */
    public static boolean isPassthrough(String href) {
        return !href.startsWith("/") || Hrefs.isExternal(href);
    }

    /**
     * Makes a path absolute and normalized so prefix checks against the source root are exact.
     *
     * @param file path to normalize
     * @return absolute normalized path
     */
    public Path normalize(Path file) {
        return file.toAbsolutePath().normalize();
    }

    private Path relativize(Path normalized) {
        Path source = options.source();
        if (!normalized.startsWith(source)) {
            throw new OutsideSourceTreeException(normalized, source);
        }
        Path relative = source.relativize(normalized);
        String baseHref = options.baseHref();
        if (baseHref != null && !baseHref.isEmpty()) {
            Path base = Path.of(Hrefs.toPathSeparator(baseHref));
            if (relative.startsWith(base) && !relative.equals(base)) {
                relative = base.relativize(relative);
            }
        }
        return relative;
    }

    private Path withMappedExtension(Path relative) {
        Path name = relative.getFileName();
        if (name == null) {
            return relative;
        }
        String ext = FileUtils.getExtension(name);
        Map<String, String> map = options.extensionMap();
        String mapped = map.get(ext);
        if (mapped == null) {
            return relative;
        }
        return relative.resolveSibling(FileUtils.getStem(name) + "." + mapped);
    }
}
