package com.codeflow.core.generator.impl;

import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.codeflow.core.generator.DiagramGenerator;
import com.codeflow.core.generator.DiagramType;
import com.codeflow.core.generator.GeneratedDiagram;
import com.codeflow.core.generator.GeneratorConfig;
import com.codeflow.core.model.DirectedEdge;
import com.codeflow.core.model.FlowGraph;
import com.codeflow.core.model.GraphNode;
import com.codeflow.core.model.ProgramModel;

/**
 * Generates Mermaid flowchart definitions from flow graphs.
 *
 * <p>The output is line oriented: one header line, one line per node, then one line per
 * edge, in the order the renderer produced them.
 *
 * <h2>Node Shapes</h2>
 * <ul>
 *   <li><b>Process:</b> {@code N1["x = 1"]}</li>
 *   <li><b>Input/Output:</b> {@code N2[/"Display Hello"/]}</li>
 *   <li><b>Decision:</b> {@code N3{"x > 0"}}</li>
 *   <li><b>Terminal:</b> {@code Start(("Start"))}</li>
 * </ul>
 * Edges read {@code N1 --> N2} or {@code N3 -- Yes --> N4}.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * MermaidGenerator generator = new MermaidGenerator();
 * GeneratedDiagram diagram = generator.generate(model, DiagramType.FLOWCHART, GeneratorConfig.defaults());
 * // diagram.content() starts with "graph TD"
 * }</pre>
 *
 * <p>With {@link GeneratorConfig#embedInMarkdown()} set the diagram is wrapped in a
 * {@code ```mermaid} code block suitable for GitHub, GitLab and the Mermaid Live Editor.
 *
 * @see <a href="https://mermaid.js.org/syntax/flowchart.html">Mermaid Flowchart Syntax</a>
 */
public class MermaidGenerator implements DiagramGenerator {

    private static final Logger log = LoggerFactory.getLogger(MermaidGenerator.class);

    // Generator identification
    private static final String GENERATOR_ID = "mermaid";
    private static final String GENERATOR_DISPLAY_NAME = "Mermaid Flowchart Generator";
    private static final String FILE_EXTENSION = "mmd";
    private static final String MARKDOWN_EXTENSION = "md";

    // Markdown formatting
    private static final String NEWLINE = "\n";
    private static final String CODE_BLOCK_START = "```mermaid\n";
    private static final String CODE_BLOCK_END = "```\n";

    private static final String GRAPH_KEYWORD = "graph ";
    private static final String INDENT = "    ";
    private static final String ARROW = " --> ";
    private static final String ELLIPSIS = "...";

    @Override
    public String getId() {
        return GENERATOR_ID;
    }

    @Override
    public String getDisplayName() {
        return GENERATOR_DISPLAY_NAME;
    }

    @Override
    public String getFileExtension() {
        return FILE_EXTENSION;
    }

    @Override
    public Set<DiagramType> getSupportedDiagramTypes() {
        return Set.of(DiagramType.FLOWCHART);
    }

    @Override
    public GeneratedDiagram generate(ProgramModel model, DiagramType type, GeneratorConfig config) {
        Objects.requireNonNull(model, "model must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(config, "config must not be null");

        if (!getSupportedDiagramTypes().contains(type)) {
            throw new IllegalArgumentException("Unsupported diagram type: " + type);
        }

        log.debug("Generating Mermaid flowchart for {} program", model.language());

        String flowchart = generateFlowchart(model.graph(), config);
        if (config.embedInMarkdown()) {
            return new GeneratedDiagram("flowchart", CODE_BLOCK_START + flowchart + NEWLINE + CODE_BLOCK_END,
                MARKDOWN_EXTENSION);
        }
        return new GeneratedDiagram("flowchart", flowchart, getFileExtension());
    }

    /**
     * Writes the flowchart text for a graph, without a trailing newline.
     *
     * @param graph graph to write
     * @param config generator configuration (direction, label length)
     * @return Mermaid flowchart definition
     */
    public String generateFlowchart(FlowGraph graph, GeneratorConfig config) {
        StringBuilder sb = new StringBuilder();
        sb.append(GRAPH_KEYWORD).append(config.direction());
        for (GraphNode node : graph.nodes()) {
            sb.append(NEWLINE).append(INDENT);
            appendNode(sb, node, config.maxLabelLength());
        }
        for (DirectedEdge edge : graph.edges()) {
            sb.append(NEWLINE).append(INDENT);
            appendEdge(sb, edge);
        }
        return sb.toString();
    }

    private void appendNode(StringBuilder sb, GraphNode node, int maxLabelLength) {
        String label = escape(shorten(node.label(), maxLabelLength));
        sb.append(node.id());
        switch (node.shape()) {
            case IO -> sb.append("[/\"").append(label).append("\"/]");
            case DECISION -> sb.append("{\"").append(label).append("\"}");
            case TERMINAL -> sb.append("((\"").append(label).append("\"))");
            default -> sb.append("[\"").append(label).append("\"]");
        }
    }

    private void appendEdge(StringBuilder sb, DirectedEdge edge) {
        sb.append(edge.from());
        if (edge.hasLabel()) {
            sb.append(" -- ").append(escapeEdgeLabel(edge.label())).append(ARROW);
        } else {
            sb.append(ARROW);
        }
        sb.append(edge.to());
    }

    private String shorten(String label, int maxLabelLength) {
        if (label.length() <= maxLabelLength || maxLabelLength <= ELLIPSIS.length()) {
            return label;
        }
        return label.substring(0, maxLabelLength - ELLIPSIS.length()) + ELLIPSIS;
    }

    /**
     * Escapes special characters for Mermaid labels.
     *
     * <ul>
     *   <li>Replaces double quotes with single quotes (quotes delimit the label)</li>
     *   <li>Replaces newlines with spaces (labels stay on one line)</li>
     * </ul>
     *
     * @param text the text to escape (may be null)
     * @return escaped text, or empty string if input is null
     */
    private String escape(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("\"", "'").replace("\r", "").replace("\n", " ");
    }

    // Unquoted edge text ends at the next "-"; "--" inside it would close the label.
    private String escapeEdgeLabel(String text) {
        return escape(text).replace("--", "- -").replace("|", "/");
    }
}
