package com.pagewright.cli;

import com.pagewright.core.build.BuildReport;
import com.pagewright.core.build.BuildScope;
import com.pagewright.core.build.SiteBuilder;
import com.pagewright.core.config.RuntimeOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Command to build a site.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Build the site in the current directory
 * pagewright build
 *
 * # Release build of another project, ignoring the manifest
 * pagewright build ../blog --release --force
 *
 * # Rebuild only the posts directory
 * pagewright build --path site/posts
 * }</pre>
 */
@Command(
    name = "build",
    description = "Build the site into the target directory",
    mixinStandardHelpOptions = true
)
public class BuildCommand extends ProjectCommand {

    private static final Logger log = LoggerFactory.getLogger(BuildCommand.class);

    @Option(names = {"-f", "--force"}, description = "Rebuild every file regardless of the build manifest")
    boolean force;

    @Option(names = {"--incremental"}, negatable = true,
        description = "Consult the build manifest (default: from site.yaml)")
    Boolean incremental;

    @Option(names = {"--sequential"}, description = "Build files one at a time")
    boolean sequential;

    @Option(names = {"-j", "--workers"}, description = "Worker thread count")
    Integer workers;

    @Option(names = {"--no-fail-fast"}, description = "Keep building after an error and report every failure")
    boolean noFailFast;

    @Option(names = {"--path"}, description = "Limit the build to files or directories (repeatable)")
    List<Path> paths = new ArrayList<>();

    @Override
    protected RuntimeOptions customize(RuntimeOptions options) {
        RuntimeOptions result = options.withForce(force);
        if (incremental != null) {
            result = result.withIncremental(incremental);
        }
        if (sequential) {
            result = result.withParallel(false);
        }
        if (workers != null) {
            result = result.withWorkers(workers);
        }
        if (noFailFast) {
            result = result.withFailFast(false);
        }
        return result;
    }

    @Override
    protected int execute(RuntimeOptions options) {
        log.info("Building {} ({})", options.source(), options.profile().name());
        System.out.println("Building site: " + options.source());
        System.out.println();

        BuildScope scope = BuildScope.of(paths.stream().map(p -> p.toAbsolutePath().normalize()).toList());
        BuildReport report = new SiteBuilder(options).build(scope);

        System.out.println("✓ " + report.getSummary());
        System.out.println("✓ Output written to: " + options.target());
        return 0;
    }

    @Override
    protected String commandName() {
        return "Build";
    }
}
