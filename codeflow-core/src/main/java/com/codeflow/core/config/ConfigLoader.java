package com.codeflow.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for loading CodeFlow configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code codeflow.yaml} into {@link CodeflowConfig} records.
 * If the config file is missing or invalid, returns {@link CodeflowConfig#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * CodeflowConfig config = ConfigLoader.load(Path.of("codeflow.yaml"));
 * GeneratorConfig generatorConfig = config.toGeneratorConfig();
 * }</pre>
 */
public final class ConfigLoader {

    public static final String DEFAULT_FILE_NAME = "codeflow.yaml";

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Loads configuration from a YAML file.
     *
     * <p>If the file doesn't exist or can't be parsed, logs and returns
     * {@link CodeflowConfig#defaults()}.
     *
     * @param configPath path to {@code codeflow.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static CodeflowConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.debug("Configuration file not found: {}. Using defaults.", configPath);
            return CodeflowConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return CodeflowConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            CodeflowConfig config = YAML_MAPPER.readValue(configPath.toFile(), CodeflowConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return CodeflowConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return CodeflowConfig.defaults();
        }
    }
}
