package com.codeflow;

import com.codeflow.cli.ExplainCommand;
import com.codeflow.cli.ListCommand;
import com.codeflow.cli.RenderCommand;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import ch.qos.logback.classic.Level;

/**
 * Main CLI entry point for CodeFlow.
 *
 * <p>CodeFlow turns a short C, Java or Python snippet into a Mermaid flowchart, a JSON
 * flow graph or a plain-language explanation.
 *
 * <p><b>Commands:</b>
 * <ul>
 *   <li>{@code render} - Render a snippet as a flowchart or flow graph</li>
 *   <li>{@code explain} - Describe a snippet as nested bullets</li>
 *   <li>{@code list} - List available languages, generators, or renderers</li>
 * </ul>
 *
 * <p><b>Global Options:</b>
 * <ul>
 *   <li>{@code -v, --verbose} - Enable verbose output</li>
 *   <li>{@code -q, --quiet} - Suppress all output except errors</li>
 *   <li>{@code --help} - Show help information</li>
 *   <li>{@code --version} - Show version information</li>
 * </ul>
 *
 * <p><b>Example Usage:</b>
 * <pre>{@code
 * # Render a C file to the console
 * codeflow render loop.c
 *
 * # Render stdin as Python, left to right
 * cat snippet.py | codeflow render -l python -d LR
 *
 * # Explain a Java class
 * codeflow explain Main.java
 * }</pre>
 */
@Command(
    name = "codeflow",
    mixinStandardHelpOptions = true,
    version = "CodeFlow 1.0.0-SNAPSHOT",
    description = "Flowchart and explanation generator for short program snippets",
    subcommands = {
        RenderCommand.class,
        ExplainCommand.class,
        ListCommand.class
    }
)
public class CodeflowCLI implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(CodeflowCLI.class);

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose output (DEBUG level)")
    private boolean verbose;

    @Option(names = {"-q", "--quiet"}, description = "Suppress all output except errors")
    private boolean quiet;

    @Override
    public void run() {
        if (quiet) {
            return; // Suppress banner in quiet mode
        }

        System.out.println("CodeFlow - Flowcharts from program snippets");
        System.out.println("Version: 1.0.0-SNAPSHOT");
        System.out.println();
        System.out.println("Use 'codeflow --help' to see available commands");
        System.out.println("Use 'codeflow <command> --help' for command-specific help");
    }

    /**
     * Configures logging level based on global options.
     */
    void configureLogging() {
        ch.qos.logback.classic.Logger root =
            (ch.qos.logback.classic.Logger) LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);

        if (quiet) {
            root.setLevel(Level.ERROR);
        } else if (verbose) {
            root.setLevel(Level.DEBUG);
        } else {
            root.setLevel(Level.INFO);
        }
        log.debug("Root log level set to {}", root.getLevel());
    }

    /**
     * Returns whether verbose mode is enabled.
     *
     * @return true if verbose mode is enabled
     */
    public boolean isVerbose() {
        return verbose;
    }

    /**
     * Returns whether quiet mode is enabled.
     *
     * @return true if quiet mode is enabled
     */
    public boolean isQuiet() {
        return quiet;
    }

    /**
     * Builds the command line with logging configured before any subcommand runs.
     *
     * @return configured command line
     */
    public static CommandLine commandLine() {
        CodeflowCLI cli = new CodeflowCLI();
        CommandLine commandLine = new CommandLine(cli);
        // global options are parsed before the subcommand executes
        commandLine.setExecutionStrategy(parseResult -> {
            cli.configureLogging();
            return new CommandLine.RunLast().execute(parseResult);
        });
        return commandLine;
    }

    /**
     * Main entry point.
     *
     * @param args command-line arguments
     */
    public static void main(String[] args) {
        int exitCode = commandLine().execute(args);
        System.exit(exitCode);
    }
}
