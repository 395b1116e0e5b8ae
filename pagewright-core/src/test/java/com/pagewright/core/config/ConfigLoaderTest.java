package com.pagewright.core.config;

import com.pagewright.core.error.ConfigurationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ConfigLoader}.
 */
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_validYaml_returnsConfig() throws IOException {
        Path configFile = tempDir.resolve("site.yaml");
        Files.writeString(configFile, """
            project:
              name: "Docs"
              description: "Product documentation"

            build:
              source: content
              target: public
              cleanUrls: true
              workers: 3

            link:
              verify: true
              allow: ["/feed.xml"]

            pages:
              index.md:
                title: Welcome

            menus:
              main: ["/", "/guide/"]

            redirect:
              /old/: /guide/

            transform:
              html:
                autoId: true
                toc: true

            minify:
              html: [release, staging]

            hooks:
              - command: ["npm", "run", "css"]
                phase: before
                profiles: [release]

            locales:
              fallback: en
              languages: [en, fr]

            profiles:
              staging:
                release: true
            """);

        SiteConfig config = ConfigLoader.load(configFile);

        assertThat(config.project().name()).isEqualTo("Docs");
        assertThat(config.project().description()).isEqualTo("Product documentation");
        assertThat(config.build().source()).isEqualTo("content");
        assertThat(config.build().target()).isEqualTo("public");
        assertThat(config.build().cleanUrls()).isTrue();
        assertThat(config.build().workers()).isEqualTo(3);
        assertThat(config.link().verify()).isTrue();
        assertThat(config.link().allow()).containsExactly("/feed.xml");
        assertThat(config.pages().get("index.md")).containsEntry("title", "Welcome");
        assertThat(config.menus().get("main")).containsExactly("/", "/guide/");
        assertThat(config.redirect()).containsEntry("/old/", "/guide/");
        assertThat(config.transform().html().autoId()).isTrue();
        assertThat(config.transform().html().stripComments()).isFalse();
        assertThat(config.minify().html()).containsExactly("release", "staging");
        assertThat(config.hooks()).hasSize(1);
        assertThat(config.hooks().get(0).command()).containsExactly("npm", "run", "css");
        assertThat(config.locales().alternates()).containsExactly("fr");
        assertThat(config.profiles().get("staging").release()).isTrue();
    }

    @Test
    void load_minimalYaml_fillsDefaults() throws IOException {
        Path configFile = tempDir.resolve("site.yaml");
        Files.writeString(configFile, """
            project:
              name: "Minimal"
            """);

        SiteConfig config = ConfigLoader.load(configFile);

        assertThat(config.project().name()).isEqualTo("Minimal");
        assertThat(config.project().description()).isNull();
        assertThat(config.build().source()).isEqualTo("site");
        assertThat(config.build().target()).isEqualTo("build");
        assertThat(config.build().parallel()).isTrue();
        assertThat(config.build().failFast()).isTrue();
        assertThat(config.build().incremental()).isFalse();
        assertThat(config.build().extensions()).containsEntry("md", "html");
        assertThat(config.link().relative()).isTrue();
        assertThat(config.link().verify()).isFalse();
        assertThat(config.locales().isMulti()).isFalse();
        assertThat(config.directories().layouts()).isEqualTo("layouts");
        assertThat(config.redirect()).isEmpty();
    }

    @Test
    void load_unknownKeys_areIgnored() throws IOException {
        Path configFile = tempDir.resolve("site.yaml");
        Files.writeString(configFile, """
            theme: dark
            build:
              compress: true
            """);

        SiteConfig config = ConfigLoader.load(configFile);

        assertThat(config.build().target()).isEqualTo("build");
    }

    @Test
    void load_fileDoesNotExist_returnsDefaults() {
        SiteConfig config = ConfigLoader.load(tempDir.resolve("nonexistent.yaml"));

        assertThat(config).isEqualTo(SiteConfig.defaults());
    }

    @Test
    void load_emptyFile_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("site.yaml");
        Files.writeString(configFile, "");

        assertThat(ConfigLoader.load(configFile).build().source()).isEqualTo("site");
    }

    @Test
    void load_invalidYaml_throwsConfigurationException() throws IOException {
        Path configFile = tempDir.resolve("site.yaml");
        Files.writeString(configFile, """
            build:
              source: [unclosed
            """);

        assertThatThrownBy(() -> ConfigLoader.load(configFile))
            .isInstanceOf(ConfigurationException.class)
            .hasMessageContaining("Failed to parse");
    }

    @Test
    void loadFromProject_readsSiteYaml() throws IOException {
        Files.writeString(tempDir.resolve(ConfigLoader.CONFIG_FILE), "project:\n  name: FromProject\n");

        assertThat(ConfigLoader.loadFromProject(tempDir).project().name()).isEqualTo("FromProject");
    }
}
