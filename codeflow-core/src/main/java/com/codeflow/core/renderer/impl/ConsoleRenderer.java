package com.codeflow.core.renderer.impl;

import com.codeflow.core.renderer.GeneratedFile;
import com.codeflow.core.renderer.GeneratedOutput;
import com.codeflow.core.renderer.OutputRenderer;
import com.codeflow.core.renderer.RenderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.Objects;

/**
 * Prints generated content to a stream, standard output by default.
 *
 * <p>By default only the content is printed, so the output can be piped into the Mermaid
 * CLI or a file. With {@value #SHOW_HEADERS} set to {@code true} each file is preceded by
 * its name, content type and size.
 */
public class ConsoleRenderer implements OutputRenderer {

    private static final Logger logger = LoggerFactory.getLogger(ConsoleRenderer.class);

    public static final String SHOW_HEADERS = "console.showHeaders";

    private final PrintStream out;

    public ConsoleRenderer() {
        this(System.out);
    }

    public ConsoleRenderer(PrintStream out) {
        this.out = Objects.requireNonNull(out, "out must not be null");
    }

    @Override
    public String getId() {
        return "console";
    }

    @Override
    public void render(GeneratedOutput output, RenderContext context) {
        boolean showHeaders = Boolean.parseBoolean(context.getSettingOrDefault(SHOW_HEADERS, "false"));

        logger.debug("Rendering {} file(s) to console (headers: {})", output.files().size(), showHeaders);

        for (int i = 0; i < output.files().size(); i++) {
            GeneratedFile file = output.files().get(i);
            if (showHeaders) {
                printFileHeader(file, i + 1, output.files().size());
            }
            out.println(file.content());
        }
        out.flush();
    }

    private void printFileHeader(GeneratedFile file, int index, int total) {
        out.println("File " + index + "/" + total + ": " + file.relativePath());
        if (file.contentType() != null && !file.contentType().isEmpty()) {
            out.println("Type: " + file.contentType());
        }
        out.println("Size: " + file.content().length() + " chars");
        out.println();
    }
}
