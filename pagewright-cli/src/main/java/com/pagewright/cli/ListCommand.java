package com.pagewright.cli;

import com.pagewright.core.build.SiteBuilder;
import com.pagewright.core.collation.Collation;
import com.pagewright.core.config.RuntimeOptions;
import com.pagewright.core.model.Resource;
import com.pagewright.core.model.ResourceOperation;
import com.pagewright.core.render.BookCompiler;
import com.pagewright.core.render.SearchIndexer;
import com.pagewright.core.render.TemplateEngine;
import com.pagewright.core.transform.SyntaxHighlighter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.Map;
import java.util.ServiceLoader;

/**
 * Command to list what a build would produce, or the installed services.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Source to destination mapping of every entry
 * pagewright list
 *
 * # Layouts known to the site
 * pagewright list --type layouts
 *
 * # Services found on the class path
 * pagewright list --type services
 * }</pre>
 */
@Command(
    name = "list",
    description = "List entries, links, layouts or installed services",
    mixinStandardHelpOptions = true
)
public class ListCommand extends ProjectCommand {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Option(
        names = {"-t", "--type"},
        description = "Type to list: entries, links, layouts or services (default: ${DEFAULT-VALUE})",
        defaultValue = "entries"
    )
    String type;

    @Override
    protected int execute(RuntimeOptions options) {
        return switch (type.toLowerCase()) {
            case "entries", "entry" -> listEntries(options);
            case "links", "link" -> listLinks(options);
            case "layouts", "layout" -> listLayouts(options);
            case "services", "service" -> listServices();
            default -> {
                log.error("Unknown type: {}. Use: entries, links, layouts or services", type);
                yield 1;
            }
        };
    }

    private int listEntries(RuntimeOptions options) {
        for (Collation collation : new SiteBuilder(options).collate().values()) {
            String suffix = collation.isFallback() ? " (fallback)" : "";
            System.out.println("Entries for '" + collation.lang() + "'" + suffix + ":");
            System.out.println();
            collation.entries().entrySet().stream()
                .filter(entry -> entry.getValue().operation() != ResourceOperation.NOOP)
                .forEach(entry -> printEntry(options, collation, entry.getKey(), entry.getValue()));
            System.out.println();
        }
        return 0;
    }

    private static void printEntry(RuntimeOptions options, Collation collation, Path source, Resource resource) {
        System.out.printf("  • %s -> %s (%s)%n",
            options.source().relativize(source), collation.outputRoot().resolve(resource.destination()),
            resource.operation().name().toLowerCase());
    }

    private int listLinks(RuntimeOptions options) {
        for (Collation collation : new SiteBuilder(options).collate().values()) {
            System.out.println("Links for '" + collation.lang() + "':");
            System.out.println();
            collation.links().forEach((href, source) ->
                System.out.printf("  • %s (%s)%n", href, options.source().relativize(source)));
            collation.allowedLinks().forEach(href -> System.out.printf("  • %s (allowed)%n", href));
            System.out.println();
        }
        return 0;
    }

    private int listLayouts(RuntimeOptions options) {
        Collation fallback = new SiteBuilder(options).collate().values().iterator().next();
        System.out.println("Available Layouts:");
        System.out.println();
        Map<String, Path> layouts = fallback.namedLayouts();
        if (layouts.isEmpty()) {
            System.out.println("  No layouts found in " + options.layoutsPath());
        }
        layouts.forEach((name, file) -> System.out.printf("  • %s (%s)%n", name, file));
        fallback.defaultLayout().ifPresent(file -> {
            System.out.println();
            System.out.println("  Default: " + file);
        });
        return 0;
    }

    private int listServices() {
        System.out.println("Template Engines:");
        ServiceLoader.load(TemplateEngine.class)
            .forEach(engine -> System.out.printf("  • %s (%s)%n", engine.getId(), engine.getClass().getName()));
        System.out.println("  • page (built-in)");
        System.out.println();

        System.out.println("Syntax Highlighters:");
        printProviders(ServiceLoader.load(SyntaxHighlighter.class));
        System.out.println("Search Indexers:");
        printProviders(ServiceLoader.load(SearchIndexer.class));
        System.out.println("Book Compilers:");
        printProviders(ServiceLoader.load(BookCompiler.class));
        return 0;
    }

    private static void printProviders(ServiceLoader<?> loader) {
        boolean found = false;
        for (Object provider : loader) {
            found = true;
            System.out.printf("  • %s%n", provider.getClass().getName());
        }
        if (!found) {
            System.out.println("  None installed.");
        }
        System.out.println();
    }

    @Override
    protected String commandName() {
        return "List";
    }
}
