package com.pagewright.core.build;

import com.pagewright.core.collation.PluginAssets;
import com.pagewright.core.config.RuntimeOptions;
import com.pagewright.core.render.BookCompiler;
import com.pagewright.core.render.JsonSearchIndexer;
import com.pagewright.core.render.PageTemplateEngine;
import com.pagewright.core.render.SearchIndexer;
import com.pagewright.core.render.TemplateEngine;
import com.pagewright.core.transform.SyntaxHighlighter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Pluggable collaborators of a build.
 *
 * @param templateEngine renders page and layout templates
 * @param highlighter highlights code blocks
 * @param searchIndexer receives extracted page text
 * @param bookCompiler compiles book directories, when one is installed
 * @param plugins resolved plugin assets to inject
 */
public record BuildServices(
    TemplateEngine templateEngine,
    SyntaxHighlighter highlighter,
    SearchIndexer searchIndexer,
    Optional<BookCompiler> bookCompiler,
    List<PluginAssets> plugins
) {
    private static final Logger log = LoggerFactory.getLogger(BuildServices.class);

    public BuildServices {
        Objects.requireNonNull(templateEngine, "templateEngine must not be null");
        if (highlighter == null) {
            highlighter = SyntaxHighlighter.none();
        }
        if (searchIndexer == null) {
            searchIndexer = SearchIndexer.none();
        }
        if (bookCompiler == null) {
            bookCompiler = Optional.empty();
        }
        plugins = plugins == null ? List.of() : List.copyOf(plugins);
    }

    /**
     * Discovers collaborators through {@link ServiceLoader}, falling back to the built-in ones.
     *
     * @param options runtime options deciding whether search and highlighting are on
     * @return discovered services
     */
    public static BuildServices discover(RuntimeOptions options) {
        log.debug("Discovering build services via ServiceLoader");
        TemplateEngine engine = ServiceLoader.load(TemplateEngine.class).findFirst()
            .orElseGet(PageTemplateEngine::new);
        SyntaxHighlighter highlighter = ServiceLoader.load(SyntaxHighlighter.class).findFirst()
            .orElseGet(SyntaxHighlighter::none);
        SearchIndexer indexer = options.config().search().enabled()
            ? ServiceLoader.load(SearchIndexer.class).findFirst().orElseGet(JsonSearchIndexer::new)
            : SearchIndexer.none();
        Optional<BookCompiler> books = ServiceLoader.load(BookCompiler.class).findFirst();

        log.debug("Using template engine '{}'", engine.getId());
        return new BuildServices(engine, highlighter, indexer, books, List.of());
    }

    /**
     * Built-in services only, without any service lookup.
     *
     * @return default services
     */
    public static BuildServices defaults() {
        return new BuildServices(new PageTemplateEngine(), SyntaxHighlighter.none(), SearchIndexer.none(),
            Optional.empty(), List.of());
    }

    public BuildServices withPlugins(List<PluginAssets> value) {
        return new BuildServices(templateEngine, highlighter, searchIndexer, bookCompiler, value);
    }

    public BuildServices withSearchIndexer(SearchIndexer value) {
        return new BuildServices(templateEngine, highlighter, value, bookCompiler, plugins);
    }

    public BuildServices withBookCompiler(BookCompiler value) {
        return new BuildServices(templateEngine, highlighter, searchIndexer, Optional.ofNullable(value), plugins);
    }

    public BuildServices withHighlighter(SyntaxHighlighter value) {
        return new BuildServices(templateEngine, value, searchIndexer, bookCompiler, plugins);
    }
}
