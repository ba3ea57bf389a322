package com.codeflow.cli;

import com.codeflow.core.frontend.LanguageFrontend;
import com.codeflow.core.generator.DiagramGenerator;
import com.codeflow.core.renderer.OutputRenderer;
import picocli.CommandLine.Command;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;
import java.util.ServiceLoader;
import java.util.concurrent.Callable;

/**
 * Command to list available languages, generators, or renderers.
 *
 * <p>Discovers plugins via Java Service Provider Interface (SPI) and displays
 * their capabilities. Without an argument every category is listed.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * codeflow list
 * codeflow list languages
 * codeflow list generators
 * codeflow list renderers
 * }</pre>
 */
@Command(
    name = "list",
    description = "List available languages, generators, or renderers",
    mixinStandardHelpOptions = true
)
public class ListCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ListCommand.class);

    @Parameters(
        index = "0",
        arity = "0..1",
        description = "Type to list: languages, generators, or renderers (default: all)"
    )
    private String type;

    @Override
    public Integer call() {
        if (type == null) {
            listLanguages();
            listGenerators();
            listRenderers();
            return 0;
        }
        return switch (type.toLowerCase(Locale.ROOT)) {
            case "languages", "language" -> listLanguages();
            case "generators", "generator" -> listGenerators();
            case "renderers", "renderer" -> listRenderers();
            default -> {
                log.error("Unknown type: {}. Use: languages, generators, or renderers", type);
                yield 1;
            }
        };
    }

    private int listLanguages() {
        System.out.println("Available Languages:");
        System.out.println();

        boolean found = false;
        for (LanguageFrontend frontend : ServiceLoader.load(LanguageFrontend.class)) {
            found = true;
            System.out.printf("  • %s (ID: %s)%n", frontend.getDisplayName(), frontend.getId());
            System.out.printf("    File Extensions: %s%n", frontend.getFileExtensions());
            System.out.println();
        }

        if (!found) {
            System.out.println("  No languages found.");
        }
        return 0;
    }

    private int listGenerators() {
        System.out.println("Available Generators:");
        System.out.println();

        boolean found = false;
        for (DiagramGenerator generator : ServiceLoader.load(DiagramGenerator.class)) {
            found = true;
            System.out.printf("  • %s (ID: %s)%n", generator.getDisplayName(), generator.getId());
            System.out.printf("    File Extension: .%s%n", generator.getFileExtension());
            System.out.printf("    Diagram Types: %s%n", generator.getSupportedDiagramTypes());
            System.out.println();
        }

        if (!found) {
            System.out.println("  No generators found.");
        }
        return 0;
    }

    private int listRenderers() {
        System.out.println("Available Renderers:");
        System.out.println();

        boolean found = false;
        for (OutputRenderer renderer : ServiceLoader.load(OutputRenderer.class)) {
            found = true;
            System.out.printf("  • %s%n", renderer.getId());
            System.out.println();
        }

        if (!found) {
            System.out.println("  No renderers found.");
        }
        return 0;
    }
}
