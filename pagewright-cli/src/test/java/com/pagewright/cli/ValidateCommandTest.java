package com.pagewright.cli;

import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;

class ValidateCommandTest extends CommandTestBase {

    @Test
    void validate_validSite_printsCounts() throws IOException {
        writeConfig("locales:\n  fallback: en\n  languages: [en, de]\n");
        createSource("index.md", "# Home");
        createSource("index.de.md", "# Start");

        int exitCode = run("validate", project());

        assertThat(exitCode).isZero();
        assertThat(output()).contains("✓ en: 1 pages").contains("✓ de: 1 pages").contains("Site is valid");
    }

    @Test
    void validate_redirectCycle_exitsOne() throws IOException {
        writeConfig("redirect:\n  /a: /b\n  /b: /a\n");
        createSource("index.md", "# Home");

        int exitCode = run("validate", project());

        assertThat(exitCode).isEqualTo(1);
        assertThat(errors()).contains("Validation failed");
    }

    @Test
    void validate_missingPageTableEntry_exitsOne() throws IOException {
        writeConfig("pages:\n  missing.md:\n    title: Gone\n");
        createSource("index.md", "# Home");

        assertThat(run("validate", project())).isEqualTo(1);
    }
}
