package com.codeflow.core.frontend;

import com.codeflow.core.classifier.StatementClassifier;
import com.codeflow.core.generator.GeneratorConfig;
import com.codeflow.core.model.FlowGraph;
import com.codeflow.core.model.ProgramModel;
import com.codeflow.core.model.Sequence;

import java.util.Set;

/**
 * Adapter between one syntax family and the shared control-tree builder and renderer.
 *
 * <p>A front end knows three things about its family: how comments look, where the
 * program's entry block starts, and how single statements are labelled. Everything else
 * (block scanning, tree building, graph rendering) is shared.
 *
 * <p>Front ends are discovered via Java Service Provider Interface (SPI) and looked up
 * by id in {@link FrontendRegistry}. Implementations must be stateless; every call owns
 * its own parser and renderer state.
 *
 * <p><b>Example Implementation:</b>
 * <pre>{@code
 * public class CFrontend extends AbstractBraceFrontend {
 *     @Override
 *     public String getId() {
 *         return "c";
 *     }
 *
 *     @Override
 *     protected Pattern entryPattern() {
 *         return Pattern.compile("\\b(?:int|void)\\s+main\\s*\\([^)]*\\)\\s*\\{");
 *     }
 *     // ...
 * }
 * }</pre>
 *
 * <p><b>Registration:</b> Register implementations in
 * {@code META-INF/services/com.codeflow.core.frontend.LanguageFrontend}
 *
 * @see FrontendRegistry
 * @see AbstractFrontend
 */
public interface LanguageFrontend {

    /**
     * Returns unique identifier for this front end.
     *
     * <p>Lowercase language name, e.g. "c", "java", "python".
     *
     * @return unique front-end identifier
     */
    String getId();

    /**
     * Returns human-readable display name.
     *
     * @return display name
     */
    String getDisplayName();

    /**
     * Returns source file extensions handled by this front end, without leading dot.
     *
     * @return file extensions
     */
    Set<String> getFileExtensions();

    /**
     * Returns the classifier that labels this family's statements.
     *
     * @return statement classifier
     */
    StatementClassifier getClassifier();

    /**
     * Parses a snippet into its control tree.
     *
     * @param source snippet text (null is treated as empty)
     * @return control tree of the entry block
     * @throws com.codeflow.core.parser.FlowParseException if the snippet cannot be parsed
     */
    Sequence parse(String source);

    /**
     * Parses and renders a snippet.
     *
     * @param source snippet text (null is treated as empty)
     * @return control tree and flow graph
     * @throws com.codeflow.core.parser.FlowParseException if the snippet cannot be parsed
     */
    ProgramModel analyze(String source);

    /**
     * Builds the flow graph of a snippet. Never throws for malformed input; the result is
     * then a {@code Start -> error -> End} graph.
     *
     * @param source snippet text
     * @return flow graph
     */
    FlowGraph buildGraph(String source);

    /**
     * Renders a snippet as a Mermaid flowchart with default settings.
     *
     * @param source snippet text
     * @return diagram text, deterministic for identical input
     */
    default String renderFlowchart(String source) {
        return renderFlowchart(source, GeneratorConfig.defaults());
    }

    /**
     * Renders a snippet as a Mermaid flowchart. Never throws for malformed input.
     *
     * @param source snippet text
     * @param config generator settings
     * @return diagram text
     */
    String renderFlowchart(String source, GeneratorConfig config);

    /**
     * Explains a snippet as an indented bullet list. Never throws for malformed input.
     *
     * @param source snippet text
     * @return explanation text starting with {@code Program Explanation:}
     */
    String explain(String source);
}
