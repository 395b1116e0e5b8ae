package com.pagewright.core.build;

import com.pagewright.core.config.RuntimeOptions;
import com.pagewright.core.config.SiteConfig;
import com.pagewright.core.error.BuildException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Runs configured hook commands before or after a build.
 *
 * <p>Hooks run one at a time, outside the worker pool, with the project directory as working
 * directory and inherited standard streams. A command whose first element names a file in the
 * hooks directory runs that file. There is no timeout: a hook that never exits stalls the build.
 */
public class HookRunner {

    private static final Logger log = LoggerFactory.getLogger(HookRunner.class);

    public static final String BEFORE = "before";
    public static final String AFTER = "after";

    private final RuntimeOptions options;

    public HookRunner(RuntimeOptions options) {
        this.options = options;
    }

    /**
     * Runs every hook registered for a phase and the active profile.
     *
     * @param phase {@value #BEFORE} or {@value #AFTER}
     * @return number of hooks run
     * @throws BuildException if a hook cannot start or exits with a non-zero status
     */
    public int run(String phase) {
        int count = 0;
        for (SiteConfig.HookConfig hook : options.config().hooks()) {
            if (!phase.equals(hook.phase()) || hook.command().isEmpty()) {
                continue;
            }
            if (!hook.profiles().isEmpty() && !hook.profiles().contains(options.profile().name())) {
                log.debug("Skipping hook {} for profile {}", hook.command(), options.profile().name());
                continue;
            }
            execute(command(hook.command()));
            count++;
        }
        return count;
    }

    List<String> command(List<String> configured) {
        List<String> command = new ArrayList<>(configured);
        Path script = options.hooksPath().resolve(command.get(0));
        if (Files.isRegularFile(script)) {
            command.set(0, script.toString());
        }
        return command;
    }

    private void execute(List<String> command) {
        Path workingDir = options.source().getParent() != null ? options.source().getParent() : options.source();
        log.info("Running hook {}", String.join(" ", command));

        ProcessBuilder builder = new ProcessBuilder(command)
            .directory(workingDir.toFile())
            .inheritIO();
        Map<String, String> env = builder.environment();
        env.put("PAGEWRIGHT_SOURCE", options.source().toString());
        env.put("PAGEWRIGHT_TARGET", options.target().toString());
        env.put("PAGEWRIGHT_PROFILE", options.profile().name());

        try {
            int status = builder.start().waitFor();
            if (status != 0) {
                throw new BuildException("Hook " + command.get(0) + " exited with status " + status);
            }
        } catch (IOException e) {
            throw new BuildException("Failed to run hook: " + command.get(0), null, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BuildException("Interrupted while running hook: " + command.get(0), null, e);
        }
    }
}
