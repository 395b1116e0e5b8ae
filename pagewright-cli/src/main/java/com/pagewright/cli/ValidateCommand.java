package com.pagewright.cli;

import com.pagewright.core.build.SiteBuilder;
import com.pagewright.core.collation.Collation;
import com.pagewright.core.config.RuntimeOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;

import java.util.Map;

/**
 * Command to check configuration, page table, layouts, links and redirects without writing output.
 */
@Command(
    name = "validate",
    description = "Validate configuration and source tree without building",
    mixinStandardHelpOptions = true
)
public class ValidateCommand extends ProjectCommand {

    private static final Logger log = LoggerFactory.getLogger(ValidateCommand.class);

    @Override
    protected int execute(RuntimeOptions options) {
        log.info("Validating project: {}", options.source());
        Map<String, Collation> collations = new SiteBuilder(options).validate();
        for (Collation collation : collations.values()) {
            System.out.printf("✓ %s: %d pages, %d files%n", collation.lang(),
                collation.pages().size(), collation.targets().size());
        }
        System.out.println("✓ Site is valid");
        return 0;
    }

    @Override
    protected String commandName() {
        return "Validation";
    }
}
