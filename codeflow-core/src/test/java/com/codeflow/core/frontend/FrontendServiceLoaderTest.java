package com.codeflow.core.frontend;

import com.codeflow.core.generator.DiagramGenerator;
import com.codeflow.core.renderer.OutputRenderer;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.ServiceLoader;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Integration test validating SPI registration for front ends, generators and renderers.
 *
 * <p>Catches typos in the {@code META-INF/services} files and constructor failures
 * before they surface as missing languages at run time.
 */
class FrontendServiceLoaderTest {

    @Test
    void serviceLoader_discoversAllFrontends() {
        List<String> ids = ServiceLoader.load(LanguageFrontend.class).stream()
            .map(ServiceLoader.Provider::get)
            .map(LanguageFrontend::getId)
            .toList();

        assertThat(ids)
            .as("ServiceLoader should discover the C, Java and Python front ends")
            .containsExactlyInAnyOrder("c", "java", "python");
    }

    @Test
    void serviceLoader_discoversAllGenerators() {
        List<String> ids = ServiceLoader.load(DiagramGenerator.class).stream()
            .map(ServiceLoader.Provider::get)
            .map(DiagramGenerator::getId)
            .toList();

        assertThat(ids).containsExactlyInAnyOrder("mermaid", "explanation", "json");
    }

    @Test
    void serviceLoader_discoversAllRenderers() {
        List<String> ids = ServiceLoader.load(OutputRenderer.class).stream()
            .map(ServiceLoader.Provider::get)
            .map(OutputRenderer::getId)
            .toList();

        assertThat(ids).containsExactlyInAnyOrder("console", "filesystem");
    }

    @Test
    void frontends_haveNonOverlappingExtensions() {
        List<String> extensions = ServiceLoader.load(LanguageFrontend.class).stream()
            .map(ServiceLoader.Provider::get)
            .flatMap(frontend -> frontend.getFileExtensions().stream())
            .toList();

        assertThat(extensions).doesNotHaveDuplicates();
    }
}
