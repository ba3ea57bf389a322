package com.codeflow.core.renderer;

/**
 * Writes generated output somewhere: the console, the file system, ...
 *
 * <p>Renderers are discovered via Java Service Provider Interface (SPI).
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.codeflow.core.renderer.OutputRenderer}
 */
public interface OutputRenderer {

    /**
     * Returns unique identifier for this renderer (e.g. "console", "filesystem").
     *
     * @return renderer identifier
     */
    String getId();

    /**
     * Renders the output.
     *
     * @param output files to render
     * @param context output directory and renderer settings
     * @throws IllegalStateException if the output cannot be written
     */
    void render(GeneratedOutput output, RenderContext context);
}
