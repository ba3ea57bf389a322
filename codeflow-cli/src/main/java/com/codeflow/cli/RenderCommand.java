package com.codeflow.cli;

import com.codeflow.core.config.CodeflowConfig;
import com.codeflow.core.config.CodeflowConfig.GeneratorSettings;
import com.codeflow.core.frontend.LanguageFrontend;
import com.codeflow.core.generator.DiagramType;
import com.codeflow.core.generator.GeneratedDiagram;
import com.codeflow.core.generator.GeneratorConfig;
import com.codeflow.core.model.ProgramModel;
import com.codeflow.core.model.Sequence;
import com.codeflow.core.renderer.GeneratedFile;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Locale;
import java.util.concurrent.Callable;

/**
 * Command to render a snippet as a Mermaid flowchart or a JSON flow graph.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * # Mermaid text to the console
 * codeflow render loop.c
 *
 * # Markdown-embedded diagram written to docs/loop.md
 * codeflow render loop.c -f markdown -o docs
 *
 * # Flow graph as JSON from stdin
 * codeflow render -l java -f json < Main.java
 *
 * # Console output preceded by file name, type and size
 * codeflow render loop.c --headers
 * }</pre>
 *
 * <p>Unparseable snippets still produce a diagram ({@code Start -> Error -> End}).
 * Unreadable input and unwritable output end the command with exit code 1.
 */
@Command(
    name = "render",
    description = "Render a snippet as a flowchart (mermaid, markdown) or flow graph (json)",
    mixinStandardHelpOptions = true
)
public class RenderCommand extends AbstractSourceCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(RenderCommand.class);

    @Option(names = {"-f", "--format"}, description = "Output format: mermaid, markdown, or json (default: from config)")
    private String format;

    @Option(names = {"-d", "--direction"}, description = "Flowchart direction: TD or LR (default: from config)")
    private String direction;

    @Override
    public Integer call() {
        CodeflowConfig config = loadConfig();

        String source;
        try {
            source = readSource();
        } catch (IOException e) {
            log.error("Failed to read input: {}", e.getMessage());
            return 1;
        }

        LanguageFrontend frontend;
        try {
            frontend = resolveFrontend(source, config);
        } catch (IllegalArgumentException e) {
            log.error(e.getMessage());
            return 1;
        }

        String outputFormat = format != null ? format.strip().toLowerCase(Locale.ROOT) : config.generator().format();
        GeneratorConfig generatorConfig = config.toGeneratorConfig()
            .withEmbedInMarkdown(GeneratorSettings.FORMAT_MARKDOWN.equals(outputFormat));
        if (direction != null) {
            generatorConfig = generatorConfig.withDirection(direction);
        }

        DiagramType type = switch (outputFormat) {
            case GeneratorSettings.FORMAT_MERMAID, GeneratorSettings.FORMAT_MARKDOWN -> DiagramType.FLOWCHART;
            case GeneratorSettings.FORMAT_JSON -> DiagramType.GRAPH_JSON;
            default -> null;
        };
        if (type == null) {
            log.error("Unknown format: {}. Use: mermaid, markdown, or json", outputFormat);
            return 1;
        }

        ProgramModel model = analyze(frontend, source);
        GeneratedDiagram diagram = findGenerator(type).generate(model, type, generatorConfig);
        try {
            writeOutput(GeneratedFile.of(baseName(diagram.name()), diagram), config);
        } catch (IllegalStateException e) {
            log.error("Failed to write output: {}", e.getMessage());
            return 1;
        }
        return 0;
    }

    private ProgramModel analyze(LanguageFrontend frontend, String source) {
        try {
            return frontend.analyze(source);
        } catch (RuntimeException e) {
            // buildGraph degrades to the error diagram and logs the failure
            return new ProgramModel(frontend.getId(), Sequence.empty(), frontend.buildGraph(source));
        }
    }
}
