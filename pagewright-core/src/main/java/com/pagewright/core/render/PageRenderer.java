package com.pagewright.core.render;

import com.pagewright.core.collation.Collation;
import com.pagewright.core.config.RuntimeOptions;
import com.pagewright.core.error.BuildException;
import com.pagewright.core.frontmatter.FrontMatterConfig;
import com.pagewright.core.frontmatter.FrontMatterLoader;
import com.pagewright.core.model.Page;
import com.pagewright.core.model.Resource;
import com.pagewright.core.path.FileType;
import com.pagewright.core.path.PathResolver;
import com.pagewright.core.transform.HtmlMinifier;
import com.pagewright.core.transform.HtmlTransformer;
import com.pagewright.core.transform.TextExtraction;
import com.pagewright.core.transform.TransformResult;
import com.pagewright.core.util.FileUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Per-file build pipeline.
 *
 * <p>For a page:
 * <ol>
 *   <li>{@code render: false} pages are copied verbatim</li>
 *   <li>drafts are skipped in release builds</li>
 *   <li>the layout is resolved: none for standalone pages, else the page layout, else the
 *       collation default, else none</li>
 *   <li>the template engine renders the page body, markdown is converted, and the layout wraps it</li>
 *   <li>HTML output is minified when configured, then rewritten when a transform flag is set</li>
 *   <li>the result is written to the destination</li>
 * </ol>
 * Other entries are copied or linked. Directories produce nothing.
 *
 * <p>The renderer only reads the collation and is safe to call from several workers at once.
 * Errors propagate to the caller unchanged.
 */
public class PageRenderer implements ResourceRenderer {

    private static final Logger log = LoggerFactory.getLogger(PageRenderer.class);

    private final RuntimeOptions options;
    private final PathResolver resolver;
    private final TemplateEngine engine;
    private final MarkdownConverter markdown;
    private final FrontMatterLoader frontMatterLoader;
    private final HtmlTransformer transformer;
    private final SearchIndexer indexer;
    private final OutputWriter writer;

    public PageRenderer(RuntimeOptions options, TemplateEngine engine, FrontMatterLoader frontMatterLoader,
                        HtmlTransformer transformer, SearchIndexer indexer, OutputWriter writer) {
        this.options = options;
        this.resolver = new PathResolver(options);
        this.engine = engine;
        this.markdown = new MarkdownConverter();
        this.frontMatterLoader = frontMatterLoader;
        this.transformer = transformer;
        this.indexer = indexer;
        this.writer = writer;
    }

    /**
     * Runs the pipeline for one collation entry.
     *
     * @param collation collation the entry belongs to, read only
     * @param source canonical source path
     * @param resource resource describing the destination and operation
     * @return what was done
     */
    @Override
    public RenderResult render(Collation collation, Path source, Resource resource) {
        Path output = resource.output(collation.outputRoot());
        Optional<Page> page = collation.resolve(source);
        if (page.isPresent()) {
            return renderPage(collation, page.get(), output);
        }

        switch (resource.operation()) {
            case COPY -> {
                log.info("{} -> {}", source, output);
                writer.copy(source, output);
                return RenderResult.of(source, output, RenderOutcome.COPIED);
            }
            case LINK -> {
                if (writer.link(source, output)) {
                    log.info("{} -> {} (link)", source, output);
                }
                return RenderResult.of(source, output, RenderOutcome.LINKED);
            }
            default -> {
                log.debug("noop {}", source);
                return RenderResult.of(source, null, RenderOutcome.NOOP);
            }
        }
    }

    private RenderResult renderPage(Collation collation, Page page, Path output) {
        Path source = page.source();
        if (!page.render()) {
            log.info("{} -> {}", page.template(), output);
            writer.copy(page.template(), output);
            return RenderResult.of(source, output, RenderOutcome.COPIED);
        }

        if (options.isRelease() && page.draft()) {
            log.debug("Skipping draft {}", source);
            return RenderResult.of(source, null, RenderOutcome.SKIPPED_DRAFT);
        }

        Optional<Path> layout = page.standalone() ? Optional.empty() : collation.findLayout(source);

        LinkHelper links = new LinkHelper(resolver, collation, options.config().link().verify());
        TemplateContext context = new TemplateContext(page, templateData(collation, page), links);

        FileType type = resolver.fileType(page.template());
        String body = frontMatterLoader.load(page.template(), FrontMatterConfig.forType(type)).body();
        String content = engine.render(page.template(), body, context);
        if (type == FileType.MARKDOWN) {
            content = markdown.toHtml(content);
        }
        if (layout.isPresent()) {
            content = engine.render(layout.get(), readLayout(layout.get()), context.withBody(content));
        }

        TextExtraction text = TextExtraction.empty();
        if (isHtml(output)) {
            if (shouldMinify()) {
                content = HtmlMinifier.minify(content);
            }
            if (transformer.flags().isActive()) {
                TransformResult result = transformer.transform(content);
                content = result.html();
                text = result.text();
                if (transformer.flags().extractText()) {
                    indexer.add(collation.lang(), page.href(), text);
                }
            }
        }

        log.info("{} -> {}", page.template(), output);
        writer.write(output, content);
        return new RenderResult(source, output, RenderOutcome.RENDERED, text);
    }

    private static Map<String, Object> templateData(Collation collation, Page page) {
        Map<String, Object> data = page.templateData();
        data.put("menus", collation.menus());
        return data;
    }

    /**
     * Returns true when HTML output is minified for the active profile.
     *
     * <p>Profiles listed in {@code minify.html} minify; with no list, release builds do.
     *
     * @return whether to minify
     */
    boolean shouldMinify() {
        List<String> profiles = options.config().minify().html();
        if (profiles.isEmpty()) {
            return options.isRelease();
        }
        return profiles.contains(options.profile().name());
    }

    private static boolean isHtml(Path output) {
        return RuntimeOptions.HTML.equals(FileUtils.getExtension(output));
    }

    private static String readLayout(Path layout) {
        try {
            return Files.readString(layout, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new BuildException("Failed to read layout: " + layout, layout, e);
        }
    }
}
