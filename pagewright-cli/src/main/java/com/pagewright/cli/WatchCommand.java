package com.pagewright.cli;

import com.pagewright.core.build.BuildReport;
import com.pagewright.core.build.SiteBuilder;
import com.pagewright.core.build.SiteWatcher;
import com.pagewright.core.config.RuntimeOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.time.Duration;

/**
 * Command to build a site and rebuild it whenever a source file changes.
 */
@Command(
    name = "watch",
    description = "Build the site, then rebuild on every change",
    mixinStandardHelpOptions = true
)
public class WatchCommand extends ProjectCommand {

    private static final Logger log = LoggerFactory.getLogger(WatchCommand.class);

    @Option(names = {"-i", "--interval"}, description = "Probe interval in milliseconds (default: ${DEFAULT-VALUE})",
        defaultValue = "500")
    long intervalMillis;

    @Override
    protected RuntimeOptions customize(RuntimeOptions options) {
        // Between probes only changed files are rebuilt, so the manifest is always consulted
        return options.withIncremental(true);
    }

    @Override
    protected int execute(RuntimeOptions options) {
        SiteWatcher watcher = new SiteWatcher(new SiteBuilder(options), Duration.ofMillis(intervalMillis));
        BuildReport initial = watcher.start();
        System.out.println("✓ " + initial.getSummary());
        System.out.println("Watching " + options.source() + " (Ctrl+C to stop)");
        try {
            watcher.run();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.info("Watch stopped");
        }
        return 0;
    }

    @Override
    protected String commandName() {
        return "Watch";
    }
}
