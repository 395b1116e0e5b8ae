package com.pagewright;

import ch.qos.logback.classic.Level;
import com.pagewright.cli.BuildCommand;
import com.pagewright.cli.ListCommand;
import com.pagewright.cli.ValidateCommand;
import com.pagewright.cli.WatchCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Main CLI entry point for Pagewright.
 *
 * <p>Pagewright turns a tree of markdown, HTML and asset files into a static site.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code build} - Build the site</li>
 *   <li>{@code watch} - Build, then rebuild on every change</li>
 *   <li>{@code validate} - Check configuration, links and redirects</li>
 *   <li>{@code list} - List entries, links, layouts or installed services</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 *   <li>{@code --help} - Show help information</li>
 *   <li>{@code --version} - Show version information</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Build the site in the current directory
 * pagewright build
 *
 * # Release build with verbose output
 * pagewright -v build --release
 *
 * # Rebuild on change
 * pagewright watch
 * }</pre>
 */
@Command(
    name = "pagewright",
    mixinStandardHelpOptions = true,
    version = "Pagewright 1.0.0-SNAPSHOT",
    description = "Static site build engine",
    subcommands = {
        BuildCommand.class,
        WatchCommand.class,
        ValidateCommand.class,
        ListCommand.class
    }
)
public class PagewrightCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(PagewrightCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return;
        }

        System.out.println("Pagewright - Static site build engine");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'pagewright --help' to see available commands");
        System.out.println("Use 'pagewright <command> --help' for command-specific help");
    }

    /**
     * Configures logging level based on global options.
     */
    void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
        log.debug("Verbose logging enabled");
    }

    public boolean isVerbose() {
        return verbose;
    }

    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Creates the command line with logging configured before any subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        PagewrightCLI cli = new PagewrightCLI();
        CommandLine commandLine = new CommandLine(cli);
        commandLine.setExecutionStrategy(parseResult -> {
            cli.configureLogging();
            return new CommandLine.RunLast().execute(parseResult);
        });
        return commandLine;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
