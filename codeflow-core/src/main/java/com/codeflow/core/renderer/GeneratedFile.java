package com.codeflow.core.renderer;

import com.codeflow.core.generator.GeneratedDiagram;

import java.util.Objects;

/**
 * A generated artifact ready to be written by an {@link OutputRenderer}.
 *
 * @param relativePath path relative to the output directory
 * @param content file content
 * @param contentType content description such as {@code mermaid} or {@code json} (may be null)
 */
public record GeneratedFile(
    String relativePath,
    String content,
    String contentType
) {
    public GeneratedFile {
        Objects.requireNonNull(relativePath, "relativePath must not be null");
        Objects.requireNonNull(content, "content must not be null");
    }

    /**
     * Wraps a generated diagram, naming the file {@code <baseName>.<extension>}.
     *
     * @param baseName file name without extension
     * @param diagram generated diagram
     * @return generated file
     */
    public static GeneratedFile of(String baseName, GeneratedDiagram diagram) {
        return new GeneratedFile(baseName + "." + diagram.fileExtension(), diagram.content(), diagram.name());
    }
}
