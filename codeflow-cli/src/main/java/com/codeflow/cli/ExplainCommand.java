package com.codeflow.cli;

import com.codeflow.core.config.CodeflowConfig;
import com.codeflow.core.frontend.LanguageFrontend;
import com.codeflow.core.generator.DiagramGenerator;
import com.codeflow.core.generator.DiagramType;
import com.codeflow.core.generator.GeneratedDiagram;
import com.codeflow.core.renderer.GeneratedFile;
import picocli.CommandLine.Command;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.Callable;

/**
 * Command to print a nested-bullet explanation of a snippet.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * codeflow explain grade.py
 * echo 'if x > 0: print("pos")' | codeflow explain -l python
 *
 * # Written to docs/grade-explanation.md
 * codeflow explain grade.py -o docs
 * }</pre>
 */
@Command(
    name = "explain",
    description = "Explain a snippet as nested bullets",
    mixinStandardHelpOptions = true
)
public class ExplainCommand extends AbstractSourceCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ExplainCommand.class);

    private static final String FILE_SUFFIX = "-explanation";

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

        DiagramGenerator generator = findGenerator(DiagramType.EXPLANATION);
        GeneratedDiagram explanation = explain(generator, frontend, source, config);
        String name = readsStdin() ? explanation.name() : baseName(explanation.name()) + FILE_SUFFIX;

        try {
            writeOutput(GeneratedFile.of(name, explanation), config);
        } catch (IllegalStateException e) {
            log.error("Failed to write output: {}", e.getMessage());
            return 1;
        }
        return 0;
    }

    private GeneratedDiagram explain(DiagramGenerator generator, LanguageFrontend frontend,
                                     String source, CodeflowConfig config) {
        try {
            return generator.generate(frontend.analyze(source), DiagramType.EXPLANATION, config.toGeneratorConfig());
        } catch (RuntimeException e) {
            // explain degrades to an error bullet and logs the failure
            return new GeneratedDiagram(generator.getId(), frontend.explain(source), generator.getFileExtension());
        }
    }
}
