package com.codeflow.core.config;

import com.codeflow.core.generator.GeneratorConfig;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Locale;

/**
 * Root configuration for CodeFlow.
 *
 * <p>Loaded from {@code codeflow.yaml}. Every section and every key is optional; missing
 * values take the defaults shown below.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * generator:
 *   direction: TD          # or LR
 *   maxLabelLength: 50
 *   format: mermaid        # mermaid, markdown or json
 *
 * frontend:
 *   default: python        # used when autoDetect is off
 *   autoDetect: true
 *
 * output:
 *   directory: docs/flows  # write files here instead of printing them
 * }</pre>
 *
 * @param generator generator settings
 * @param frontend front-end selection settings
 * @param output output settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CodeflowConfig(
    @JsonProperty("generator") GeneratorSettings generator,
    @JsonProperty("frontend") FrontendSettings frontend,
    @JsonProperty("output") OutputSettings output
) {
    public CodeflowConfig {
        if (generator == null) {
            generator = GeneratorSettings.defaults();
        }
        if (frontend == null) {
            frontend = FrontendSettings.defaults();
        }
        if (output == null) {
            output = OutputSettings.defaults();
        }
    }

    /**
     * Creates the default configuration.
     *
     * @return default configuration
     */
    public static CodeflowConfig defaults() {
        return new CodeflowConfig(null, null, null);
    }

    /**
     * Converts the generator section into run-time generator settings.
     *
     * @return generator configuration
     */
    public GeneratorConfig toGeneratorConfig() {
        return new GeneratorConfig(
            generator.direction(),
            generator.maxLabelLength(),
            GeneratorSettings.FORMAT_MARKDOWN.equals(generator.format())
        );
    }

    /**
     * Generator settings.
     *
     * @param direction flow direction
     * @param maxLabelLength label length limit
     * @param format default output format
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record GeneratorSettings(
        @JsonProperty("direction") String direction,
        @JsonProperty("maxLabelLength") Integer maxLabelLength,
        @JsonProperty("format") String format
    ) {
        public static final String FORMAT_MERMAID = "mermaid";
        public static final String FORMAT_MARKDOWN = "markdown";
        public static final String FORMAT_JSON = "json";

        public GeneratorSettings {
            if (direction == null || direction.isBlank()) {
                direction = GeneratorConfig.DEFAULT_DIRECTION;
            }
            if (maxLabelLength == null) {
                maxLabelLength = GeneratorConfig.DEFAULT_MAX_LABEL_LENGTH;
            }
            format = format == null || format.isBlank() ? FORMAT_MERMAID : format.strip().toLowerCase(Locale.ROOT);
        }

        public static GeneratorSettings defaults() {
            return new GeneratorSettings(null, null, null);
        }
    }

    /**
     * Front-end selection settings.
     *
     * @param defaultLanguage language used when detection is off or no language is given
     * @param autoDetect whether to guess the language from the snippet
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record FrontendSettings(
        @JsonProperty("default") String defaultLanguage,
        @JsonProperty("autoDetect") Boolean autoDetect
    ) {
        public FrontendSettings {
            if (defaultLanguage == null || defaultLanguage.isBlank()) {
                defaultLanguage = "python";
            }
            if (autoDetect == null) {
                autoDetect = Boolean.TRUE;
            }
        }

        public static FrontendSettings defaults() {
            return new FrontendSettings(null, null);
        }
    }

    /**
     * Output settings.
     *
     * @param directory directory generated files are written to; {@code null} prints them
     *                  to standard output
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputSettings(
        @JsonProperty("directory") String directory
    ) {
        public OutputSettings {
            if (directory != null && directory.isBlank()) {
                directory = null;
            }
        }

        public static OutputSettings defaults() {
            return new OutputSettings(null);
        }

        /**
         * Returns whether output goes to files rather than the console.
         *
         * @return true if a directory is configured
         */
        public boolean writesFiles() {
            return directory != null;
        }
    }
}
