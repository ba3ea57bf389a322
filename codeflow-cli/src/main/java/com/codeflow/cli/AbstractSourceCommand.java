package com.codeflow.cli;

import com.codeflow.core.config.CodeflowConfig;
import com.codeflow.core.config.ConfigLoader;
import com.codeflow.core.frontend.FrontendRegistry;
import com.codeflow.core.frontend.LanguageDetector;
import com.codeflow.core.frontend.LanguageFrontend;
import com.codeflow.core.generator.DiagramGenerator;
import com.codeflow.core.generator.DiagramType;
import com.codeflow.core.renderer.GeneratedFile;
import com.codeflow.core.renderer.GeneratedOutput;
import com.codeflow.core.renderer.OutputRenderer;
import com.codeflow.core.renderer.RenderContext;
import com.codeflow.core.renderer.impl.ConsoleRenderer;
import com.codeflow.core.renderer.impl.FileSystemRenderer;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Shared options and input handling for commands that read a program snippet.
 *
 * <p>The snippet comes from {@code FILE}, or from standard input when the argument is
 * omitted or is {@code -}. The front end is chosen in this order:
 * <ol>
 *   <li>the {@code --language} option</li>
 *   <li>the file extension</li>
 *   <li>{@link LanguageDetector}, when {@code frontend.autoDetect} is enabled</li>
 *   <li>{@code frontend.default} from the configuration</li>
 * </ol>
 *
 * <p>Results go to the {@code --output} directory, else to {@code output.directory} from
 * the configuration, else to standard output.
 */
abstract class AbstractSourceCommand {

    private static final Logger log = LoggerFactory.getLogger(AbstractSourceCommand.class);

    static final String STDIN_MARKER = "-";

    @Parameters(
        index = "0",
        arity = "0..1",
        description = "Source file to read (default: standard input)"
    )
    private String file;

    @Option(names = {"-l", "--language"}, description = "Syntax family: c, java, or python (default: detected)")
    private String language;

    @Option(names = {"-c", "--config"}, description = "Configuration file (default: ${DEFAULT-VALUE})")
    private Path configPath = Paths.get(ConfigLoader.DEFAULT_FILE_NAME);

    @Option(names = {"-o", "--output"}, description = "Output directory (default: output.directory, else console)")
    private Path outputDir;

    @Option(names = "--headers", description = "Print file name, type and size before console output")
    private boolean headers;

    private final FrontendRegistry registry = FrontendRegistry.load();

    protected CodeflowConfig loadConfig() {
        return ConfigLoader.load(configPath);
    }

    /**
     * Reads the snippet from the file argument or standard input.
     *
     * @return snippet text
     * @throws IOException if the input cannot be read
     */
    protected String readSource() throws IOException {
        if (readsStdin()) {
            log.debug("Reading snippet from standard input");
            InputStream in = System.in;
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
        Path path = Paths.get(file);
        log.debug("Reading snippet from {}", path);
        return Files.readString(path, StandardCharsets.UTF_8);
    }

    /**
     * Picks the front end for a snippet.
     *
     * @param source snippet text
     * @param config loaded configuration
     * @return front end to use
     * @throws IllegalArgumentException if {@code --language} names an unknown front end
     */
    protected LanguageFrontend resolveFrontend(String source, CodeflowConfig config) {
        if (language != null) {
            return registry.require(language);
        }
        if (!readsStdin()) {
            Optional<LanguageFrontend> byExtension = registry.forFile(Paths.get(file));
            if (byExtension.isPresent()) {
                log.debug("Selected {} front end from file extension", byExtension.get().getId());
                return byExtension.get();
            }
        }
        String id = Boolean.TRUE.equals(config.frontend().autoDetect())
            ? LanguageDetector.detect(source)
            : config.frontend().defaultLanguage();
        log.debug("Selected {} front end", id);
        return registry.require(id);
    }

    /**
     * Finds the generator registered for a diagram type.
     *
     * @param type diagram type
     * @return first generator supporting the type
     * @throws IllegalStateException if no generator supports the type
     */
    protected DiagramGenerator findGenerator(DiagramType type) {
        for (DiagramGenerator generator : ServiceLoader.load(DiagramGenerator.class)) {
            if (generator.getSupportedDiagramTypes().contains(type)) {
                log.debug("Using {} for {}", generator.getDisplayName(), type);
                return generator;
            }
        }
        throw new IllegalStateException("No generator registered for " + type);
    }

    /**
     * Writes a generated file to the output directory or prints it.
     *
     * @param generated generated file
     * @param config loaded configuration
     * @throws IllegalStateException if the file cannot be written
     */
    protected void writeOutput(GeneratedFile generated, CodeflowConfig config) {
        String directory = outputDir != null ? outputDir.toString() : config.output().directory();
        OutputRenderer renderer = directory != null ? new FileSystemRenderer() : new ConsoleRenderer();
        Map<String, String> settings = Map.of(ConsoleRenderer.SHOW_HEADERS, String.valueOf(headers));
        renderer.render(GeneratedOutput.of(generated), new RenderContext(directory != null ? directory : ".", settings));
    }

    /**
     * Base name for written files: the input file name without extension, or the fallback.
     *
     * @param fallback name used for standard input
     * @return output base name
     */
    protected String baseName(String fallback) {
        if (readsStdin()) {
            return fallback;
        }
        String name = Paths.get(file).getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    protected boolean readsStdin() {
        return file == null || STDIN_MARKER.equals(file);
    }
}
