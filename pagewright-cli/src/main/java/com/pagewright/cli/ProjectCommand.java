package com.pagewright.cli;

import com.pagewright.core.config.BuildProfile;
import com.pagewright.core.config.ConfigLoader;
import com.pagewright.core.config.RuntimeOptions;
import com.pagewright.core.config.SiteConfig;
import com.pagewright.core.error.BuildException;
import com.pagewright.core.error.MultiBuildException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Options shared by every command that works on a site project.
 */
abstract class ProjectCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ProjectCommand.class);

    @Parameters(
        index = "0",
        arity = "0..1",
        description = "Project directory (default: current directory)",
        defaultValue = "."
    )
    Path projectPath;

    @Option(
        names = {"-c", "--config"},
        description = "Configuration file (default: <project>/site.yaml)"
    )
    Path configPath;

    @Option(
        names = {"-p", "--profile"},
        description = "Build profile: debug, release or one declared in site.yaml"
    )
    String profile;

    @Option(
        names = {"--release"},
        description = "Shorthand for --profile release"
    )
    boolean release;

    @Override
    public Integer call() {
        try {
            return execute(loadOptions());
        } catch (MultiBuildException e) {
            log.error("Build failed", e);
            System.err.println("✗ " + e.errors().size() + " file(s) failed:");
            e.errors().forEach(error -> System.err.println("  • " + error.getMessage()));
            return 1;
        } catch (BuildException e) {
            log.error("{} failed", commandName(), e);
            System.err.println("✗ " + commandName() + " failed: " + e.getMessage());
            return 1;
        }
    }

    /**
     * Runs the command with resolved options.
     *
     * @param options effective options
     * @return process exit code
     */
    protected abstract int execute(RuntimeOptions options);

    protected abstract String commandName();

    /**
     * Loads the configuration and applies the command-line profile.
     *
     * @return effective options
     */
    RuntimeOptions loadOptions() {
        Path projectDir = projectPath.toAbsolutePath().normalize();
        Path config = configPath != null ? configPath : projectDir.resolve(ConfigLoader.CONFIG_FILE);
        SiteConfig siteConfig = ConfigLoader.load(config);
        String profileName = release ? BuildProfile.RELEASE.name() : profile;
        BuildProfile buildProfile = BuildProfile.resolve(profileName, siteConfig);
        log.debug("Project {} with profile {}", projectDir, buildProfile.name());
        return customize(RuntimeOptions.from(projectDir, siteConfig, buildProfile));
    }

    /**
     * Applies command specific overrides.
     *
     * @param options options derived from configuration
     * @return options to run with
     */
    protected RuntimeOptions customize(RuntimeOptions options) {
        return options;
    }
}
