package com.codeflow.core.renderer;

import java.util.Map;
import java.util.Objects;

/**
 * Context passed to {@link OutputRenderer}s.
 *
 * @param outputDirectory directory relative file paths are resolved against
 * @param settings renderer-specific settings
 */
public record RenderContext(
    String outputDirectory,
    Map<String, String> settings
) {
    public RenderContext {
        Objects.requireNonNull(outputDirectory, "outputDirectory must not be null");
        if (settings == null) {
            settings = Map.of();
        }
    }

    public String getSettingOrDefault(String key, String defaultValue) {
        return settings.getOrDefault(key, defaultValue);
    }
}
