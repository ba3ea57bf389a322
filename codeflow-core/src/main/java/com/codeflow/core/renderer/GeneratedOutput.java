package com.codeflow.core.renderer;

import java.util.List;
import java.util.Objects;

/**
 * The set of files produced by one command.
 *
 * @param files generated files in output order
 */
public record GeneratedOutput(
    List<GeneratedFile> files
) {
    public GeneratedOutput {
        Objects.requireNonNull(files, "files must not be null");
        files = List.copyOf(files);
    }

    public static GeneratedOutput of(GeneratedFile file) {
        return new GeneratedOutput(List.of(file));
    }
}
