package com.pagewright.core.build;

import com.pagewright.core.collation.Collation;
import com.pagewright.core.collation.Collator;
import com.pagewright.core.config.RuntimeOptions;
import com.pagewright.core.error.BuildException;
import com.pagewright.core.frontmatter.DelimitedFrontMatterLoader;
import com.pagewright.core.frontmatter.FrontMatterLoader;
import com.pagewright.core.manifest.BuildManifest;
import com.pagewright.core.model.Page;
import com.pagewright.core.redirect.RedirectGraph;
import com.pagewright.core.render.BookCompiler;
import com.pagewright.core.render.OutputWriter;
import com.pagewright.core.render.PageRenderer;
import com.pagewright.core.transform.HtmlTransformer;
import com.pagewright.core.transform.LanguageAliases;
import com.pagewright.core.transform.TransformFlags;
import com.pagewright.core.util.FileUtils;
import com.pagewright.core.walk.FileTreeWalker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Runs a complete build.
 *
 * <p>Order of work:
 * <ol>
 *   <li>collate every language (page table and layouts are verified here)</li>
 *   <li>validate redirects, so graph errors surface before anything is written</li>
 *   <li>run {@code before} hooks</li>
 *   <li>per language: load the manifest, run the scheduler, copy compiled books, write the
 *       search index, write redirect stubs, save the manifest</li>
 *   <li>run {@code after} hooks</li>
 * </ol>
 * A failure anywhere aborts the build with files already written left in place.
 */
public class SiteBuilder {

    private static final Logger log = LoggerFactory.getLogger(SiteBuilder.class);

    private final RuntimeOptions options;
    private final BuildServices services;
    private final Collator collator;
    private final BuildScheduler scheduler;
    private final HookRunner hooks;

    public SiteBuilder(RuntimeOptions options) {
        this(options, BuildServices.discover(options));
    }

    public SiteBuilder(RuntimeOptions options, BuildServices services) {
        this(options, services, new HookRunner(options));
    }

    public SiteBuilder(RuntimeOptions options, BuildServices services, HookRunner hooks) {
        this.options = options;
        this.services = services;
        FrontMatterLoader frontMatterLoader = new DelimitedFrontMatterLoader();
        this.collator = new Collator(options, new FileTreeWalker(options.config().build().followLinks()),
            frontMatterLoader, services.plugins());
        HtmlTransformer transformer = new HtmlTransformer(
            TransformFlags.from(options.config()),
            services.highlighter(),
            new LanguageAliases(options.config().syntax().aliases()));
        PageRenderer renderer = new PageRenderer(options, services.templateEngine(), frontMatterLoader,
            transformer, services.searchIndexer(), new OutputWriter());
        this.scheduler = new BuildScheduler(options, renderer);
        this.hooks = hooks;
    }

    public RuntimeOptions options() {
        return options;
    }

    public Collator collator() {
        return collator;
    }

    /**
     * Returns a builder with the same services that ignores the build manifest.
     *
     * @return forcing builder
     */
    public SiteBuilder forced() {
        return new SiteBuilder(options.withForce(true), services, hooks);
    }

    /**
     * Builds every collation entry.
     *
     * @return combined report
     */
    public BuildReport build() {
        return build(BuildScope.all());
    }

    /**
     * Collates the site and builds the entries in scope.
     *
     * @param scope entries to build
     * @return combined report
     */
    public BuildReport build(BuildScope scope) {
        scope.validate(options.source());
        return build(collate(), scope);
    }

    /**
     * Builds already collated languages. The watch loop keeps collations between builds.
     *
     * @param collations collations keyed by language
     * @param scope entries to build
     * @return combined report
     */
    public BuildReport build(Map<String, Collation> collations, BuildScope scope) {
        Instant start = Instant.now();
        validateRedirects(collations);

        hooks.run(HookRunner.BEFORE);

        BuildReport report = BuildReport.empty();
        for (Collation collation : collations.values()) {
            report = report.merge(buildCollation(collation, scope));
        }

        hooks.run(HookRunner.AFTER);

        report = report.withElapsed(Duration.between(start, Instant.now()));
        log.info("Build complete: {}", report.getSummary());
        return report;
    }

    /**
     * Collates every language.
     *
     * @return collations keyed by language, fallback first
     */
    public Map<String, Collation> collate() {
        return collator.walk();
    }

    /**
     * Runs every check a build would run without writing anything.
     *
     * @return collations that were validated
     */
    public Map<String, Collation> validate() {
        Map<String, Collation> collations = collate();
        validateRedirects(collations);
        for (Collation collation : collations.values()) {
            if (!collation.isConsistent()) {
                throw new BuildException("Collation for '" + collation.lang() + "' is inconsistent");
            }
        }
        return collations;
    }

    private void validateRedirects(Map<String, Collation> collations) {
        for (Collation collation : collations.values()) {
            redirects(collation).validate();
        }
    }

    private RedirectGraph redirects(Collation collation) {
        return RedirectGraph.of(options.config().redirect(), collation.permalinks());
    }

    private BuildReport buildCollation(Collation collation, BuildScope scope) {
        log.info("Building '{}' into {}", collation.lang(), collation.outputRoot());
        BuildManifest manifest = BuildManifest.load(collation.outputRoot(), options.incremental());
        collation.setManifest(manifest);

        BuildReport report = scheduler.run(collation, scope);

        if (scope.isAll()) {
            compileBooks(collation);
        }
        services.searchIndexer().write(collation.lang(), collation.outputRoot(), publishedHrefs(collation));
        redirects(collation).write(collation.outputRoot());
        manifest.save();
        return report;
    }

    private Set<String> publishedHrefs(Collation collation) {
        return collation.pages().values().stream()
            .filter(page -> !(options.isRelease() && page.draft()))
            .map(Page::href)
            .collect(Collectors.toSet());
    }

    /**
     * Compiles each directory under the books directory and copies the output under
     * {@code <output root>/<book name>}.
     *
     * @param collation collation whose output root receives the books
     */
    void compileBooks(Collation collation) {
        Path books = options.booksPath();
        if (!Files.isDirectory(books)) {
            return;
        }
        List<Path> bookDirs = listDirectories(books);
        if (bookDirs.isEmpty()) {
            return;
        }
        if (services.bookCompiler().isEmpty()) {
            log.warn("Skipping {} book(s): no book compiler installed", bookDirs.size());
            return;
        }
        BookCompiler compiler = services.bookCompiler().get();
        for (Path bookDir : bookDirs) {
            Path work = null;
            try {
                work = Files.createTempDirectory("pagewright-book-");
                compiler.compile(bookDir, work, options.isRelease());
                Path destination = collation.outputRoot().resolve(bookDir.getFileName().toString());
                FileUtils.copyTree(work, destination);
                log.info("Book {} -> {}", bookDir, destination);
            } catch (IOException e) {
                throw new BuildException("Failed to compile book: " + bookDir, bookDir, e);
            } finally {
                deleteQuietly(work);
            }
        }
    }

    private static List<Path> listDirectories(Path dir) {
        try (Stream<Path> children = Files.list(dir)) {
            return children.filter(Files::isDirectory).sorted().toList();
        } catch (IOException e) {
            throw new BuildException("Failed to list books: " + dir, dir, e);
        }
    }

    private static void deleteQuietly(Path dir) {
        if (dir == null) {
            return;
        }
        try (Stream<Path> paths = Files.walk(dir)) {
            for (Path path : paths.sorted((a, b) -> b.getNameCount() - a.getNameCount()).toList()) {
                Files.deleteIfExists(path);
            }
        } catch (IOException e) {
            log.warn("Failed to delete temporary directory {}: {}", dir, e.getMessage());
        }
    }
}
