package com.codeflow.core.renderer.impl;

import com.codeflow.core.generator.GeneratedDiagram;
import com.codeflow.core.renderer.GeneratedFile;
import com.codeflow.core.renderer.GeneratedOutput;
import com.codeflow.core.renderer.RenderContext;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link FileSystemRenderer}.
 */
class FileSystemRendererTest {

    @TempDir
    Path tempDir;

    private final FileSystemRenderer renderer = new FileSystemRenderer();

    @Test
    void getId_returnsFilesystem() {
        assertThat(renderer.getId()).isEqualTo("filesystem");
    }

    @Test
    void render_createsMissingDirectoriesAndWritesUtf8() throws IOException {
        Path outputDir = tempDir.resolve("docs/flows");
        GeneratedFile file = GeneratedFile.of("grade", new GeneratedDiagram("flowchart", "N1[\"Noté\"]", "mmd"));

        renderer.render(GeneratedOutput.of(file), new RenderContext(outputDir.toString(), Map.of()));

        Path written = outputDir.resolve("grade.mmd");
        assertThat(written).exists();
        assertThat(Files.readString(written, StandardCharsets.UTF_8)).isEqualTo("N1[\"Noté\"]");
    }

    @Test
    void render_nestedRelativePath_createsParentDirectories() {
        GeneratedOutput output = new GeneratedOutput(List.of(
            new GeneratedFile("c/loop.mmd", "graph TD", null),
            new GeneratedFile("python/loop.json", "{}", null)));

        renderer.render(output, new RenderContext(tempDir.toString(), Map.of()));

        assertThat(tempDir.resolve("c/loop.mmd")).hasContent("graph TD");
        assertThat(tempDir.resolve("python/loop.json")).hasContent("{}");
    }

    @Test
    void render_outputDirectoryIsFile_throwsIllegalState() throws IOException {
        Path blocker = Files.writeString(tempDir.resolve("blocker"), "x");

        assertThatThrownBy(() -> renderer.render(
            GeneratedOutput.of(new GeneratedFile("a.mmd", "graph TD", null)),
            new RenderContext(blocker.toString(), Map.of())))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("Failed to create output directory");
    }
}
