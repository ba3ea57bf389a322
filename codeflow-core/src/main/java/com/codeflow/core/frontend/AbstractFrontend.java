package com.codeflow.core.frontend;

import com.codeflow.core.generator.FlowGraphRenderer;
import com.codeflow.core.generator.GeneratorConfig;
import com.codeflow.core.generator.impl.ExplanationGenerator;
import com.codeflow.core.generator.impl.MermaidGenerator;
import com.codeflow.core.model.FlowGraph;
import com.codeflow.core.model.ProgramModel;
import com.codeflow.core.model.Sequence;
import com.codeflow.core.parser.ControlTreeBuilder;
import com.codeflow.core.parser.FlowParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Base class for front ends providing the shared pipeline.
 *
 * <p>{@link #parse(String)} runs three steps, the first two supplied by subclasses:
 * <ol>
 *   <li>{@link #stripComments(String)} removes comments and directives</li>
 *   <li>{@link #extractEntryBlock(String)} isolates the body of the entry point</li>
 *   <li>{@link #toBraceForm(String)} (identity unless overridden) rewrites the block into
 *       the brace-delimited form the {@link ControlTreeBuilder} reads</li>
 * </ol>
 *
 * <h2>Error Handling</h2>
 * <p>{@link #parse(String)} and {@link #analyze(String)} propagate
 * {@link FlowParseException}. The rendering entry points catch every runtime failure,
 * log it at WARN and return the error diagram instead, so no failure crosses the public
 * boundary of {@link #renderFlowchart(String, GeneratorConfig)}, {@link #buildGraph(String)}
 * and {@link #explain(String)}.
 *
 * @since 1.0.0
 */
public abstract class AbstractFrontend implements LanguageFrontend {

    /**
     * Logger instance for this front end.
     * Automatically initialized with the concrete class name.
     */
    protected final Logger log;

    private final MermaidGenerator mermaid = new MermaidGenerator();
    private final ExplanationGenerator explanation = new ExplanationGenerator();

    protected AbstractFrontend() {
        this.log = LoggerFactory.getLogger(getClass());
    }

    // ==================== Family Hooks ====================

    /**
     * Removes comments (and directives, where the family has them).
     *
     * @param source raw snippet
     * @return snippet without comments
     */
    protected abstract String stripComments(String source);

    /**
     * Returns the statements of the program's entry point, or the whole text when the
     * snippet has no recognizable entry point.
     *
     * @param source snippet without comments
     * @return entry block content
     */
    protected abstract String extractEntryBlock(String source);

    /**
     * Rewrites the entry block into brace form. Brace-delimited families return it as is.
     *
     * @param block entry block
     * @return brace-delimited block
     */
    protected String toBraceForm(String block) {
        return block;
    }

    // ==================== Pipeline ====================

    @Override
    public Sequence parse(String source) {
        String text = source == null ? "" : source;
        String block = extractEntryBlock(stripComments(text));
        return new ControlTreeBuilder(getClassifier()).build(toBraceForm(block));
    }

    @Override
    public ProgramModel analyze(String source) {
        Sequence tree = parse(source);
        FlowGraph graph = new FlowGraphRenderer(getClassifier()).render(tree);
        return new ProgramModel(getId(), tree, graph);
    }

    @Override
    public FlowGraph buildGraph(String source) {
        try {
            return analyze(source).graph();
        } catch (RuntimeException e) {
            return errorGraph(e);
        }
    }

    @Override
    public String renderFlowchart(String source, GeneratorConfig config) {
        Objects.requireNonNull(config, "config must not be null");
        return mermaid.generateFlowchart(buildGraph(source), config);
    }

    @Override
    public String explain(String source) {
        try {
            return explanation.explain(parse(source));
        } catch (RuntimeException e) {
            log.warn("Failed to explain {} snippet: {}", getId(), e.getMessage());
            return ExplanationGenerator.HEADER + "\n- " + FlowGraphRenderer.ERROR_PREFIX + describe(e);
        }
    }

    private FlowGraph errorGraph(RuntimeException e) {
        if (e instanceof FlowParseException) {
            log.warn("Failed to parse {} snippet: {}", getId(), e.getMessage());
        } else {
            log.warn("Unexpected failure while rendering {} snippet", getId(), e);
        }
        return FlowGraphRenderer.errorGraph(describe(e));
    }

    private static String describe(RuntimeException e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
