package com.codeflow.core.generator.impl;

import java.util.Locale;
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
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Serializes the flow graph as JSON with Jackson.
 *
 * <pre>{@code
 * {
 *   "language" : "c",
 *   "start" : "Start",
 *   "end" : "End",
 *   "nodes" : [ { "id" : "Start", "label" : "Start", "shape" : "terminal" }, ... ],
 *   "edges" : [ { "from" : "Start", "to" : "N1" }, { "from" : "N1", "to" : "N2", "label" : "Yes" }, ... ]
 * }
 * }</pre>
 */
public class JsonGenerator implements DiagramGenerator {

    private static final Logger log = LoggerFactory.getLogger(JsonGenerator.class);

    private static final String GENERATOR_ID = "json";
    private static final String GENERATOR_DISPLAY_NAME = "Flow Graph JSON Generator";
    private static final String FILE_EXTENSION = "json";

    private final ObjectMapper objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

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
        return Set.of(DiagramType.GRAPH_JSON);
    }

    @Override
    public GeneratedDiagram generate(ProgramModel model, DiagramType type, GeneratorConfig config) {
        Objects.requireNonNull(model, "model must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(config, "config must not be null");

        if (!getSupportedDiagramTypes().contains(type)) {
            throw new IllegalArgumentException("Unsupported diagram type: " + type);
        }

        ObjectNode root = toTree(model.language(), model.graph());
        try {
            String content = objectMapper.writeValueAsString(root);
            log.debug("Serialized flow graph with {} nodes", model.graph().nodes().size());
            return new GeneratedDiagram("flowgraph", content, getFileExtension());
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize flow graph: " + e.getMessage(), e);
        }
    }

    ObjectNode toTree(String language, FlowGraph graph) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("language", language);
        root.put("start", graph.startId());
        root.put("end", graph.endId());

        ArrayNode nodes = root.putArray("nodes");
        for (GraphNode node : graph.nodes()) {
            nodes.addObject()
                .put("id", node.id())
                .put("label", node.label())
                .put("shape", node.shape().name().toLowerCase(Locale.ROOT));
        }

        ArrayNode edges = root.putArray("edges");
        for (DirectedEdge edge : graph.edges()) {
            ObjectNode json = edges.addObject()
                .put("from", edge.from())
                .put("to", edge.to());
            if (edge.hasLabel()) {
                json.put("label", edge.label());
            }
        }
        return root;
    }
}
