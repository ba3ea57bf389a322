package com.codeflow.core.generator;

import java.util.Locale;

/**
 * Configuration for diagram generation.
 *
 * @param direction Mermaid flow direction ({@code TD}, {@code LR}, ...)
 * @param maxLabelLength longest node label written before it is shortened with {@code ...}
 * @param embedInMarkdown whether to wrap the diagram in a {@code ```mermaid} code block
 */
public record GeneratorConfig(
    String direction,
    int maxLabelLength,
    boolean embedInMarkdown
) {
    public static final String DEFAULT_DIRECTION = "TD";
    public static final int DEFAULT_MAX_LABEL_LENGTH = 50;

    /**
     * Compact constructor with validation.
     */
    public GeneratorConfig {
        if (direction == null || direction.isBlank()) {
            direction = DEFAULT_DIRECTION;
        }
        direction = direction.strip().toUpperCase(Locale.ROOT);
        if (maxLabelLength <= 0) {
            maxLabelLength = Integer.MAX_VALUE;
        }
    }

    /**
     * Creates a default configuration.
     *
     * @return top-down, 50-character labels, raw Mermaid
     */
    public static GeneratorConfig defaults() {
        return new GeneratorConfig(DEFAULT_DIRECTION, DEFAULT_MAX_LABEL_LENGTH, false);
    }

    /**
     * Returns a copy with a different direction.
     *
     * @param newDirection flow direction
     * @return updated config
     */
    public GeneratorConfig withDirection(String newDirection) {
        return new GeneratorConfig(newDirection, maxLabelLength, embedInMarkdown);
    }

    /**
     * Returns a copy with Markdown embedding switched on or off.
     *
     * @param embed whether to embed in Markdown
     * @return updated config
     */
    public GeneratorConfig withEmbedInMarkdown(boolean embed) {
        return new GeneratorConfig(direction, maxLabelLength, embed);
    }
}
