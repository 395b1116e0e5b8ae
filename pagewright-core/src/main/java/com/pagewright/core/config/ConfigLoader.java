package com.pagewright.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.pagewright.core.error.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads site configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code site.yaml} into {@link SiteConfig} records.
 * A missing file yields {@link SiteConfig#defaults()}; a file that exists but cannot be
 * parsed is a fatal {@link ConfigurationException}, since building with silently
 * ignored settings would write the wrong output tree.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * SiteConfig config = ConfigLoader.load(Paths.get("site.yaml"));
 * RuntimeOptions options = RuntimeOptions.from(projectDir, config, BuildProfile.DEBUG);
 * }</pre>
 */
public class ConfigLoader {

    public static final String CONFIG_FILE = "site.yaml";

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
    }

    /**
     * Loads configuration from a YAML file.
     *
     * @param configPath path to {@code site.yaml}
     * @return loaded configuration or defaults if the file does not exist
     * @throws ConfigurationException if the file exists but is unreadable or invalid
     */
    public static SiteConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.warn("Configuration file not found: {}. Using defaults.", configPath);
            return SiteConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            throw new ConfigurationException("Configuration file is not readable: " + configPath, configPath);
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            SiteConfig config = YAML_MAPPER.readValue(configPath.toFile(), SiteConfig.class);
            if (config == null) {
                log.info("Configuration file {} is empty. Using defaults.", configPath);
                return SiteConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            throw new ConfigurationException(
                "Failed to parse configuration file " + configPath + ": " + e.getMessage(), configPath, e);
        }
    }

    /**
     * Loads configuration from the conventional location inside a project directory.
     *
     * @param projectDir project directory
     * @return loaded configuration or defaults
     */
    public static SiteConfig loadFromProject(Path projectDir) {
        return load(projectDir.resolve(CONFIG_FILE));
    }
}
