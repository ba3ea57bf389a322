package com.codeflow.core.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link FlowGraph} structural validation.
 */
class FlowGraphTest {

    private static GraphNode terminal(String id) {
        return new GraphNode(id, id, ShapeKind.TERMINAL);
    }

    @Test
    void validate_chain_hasNoViolations() {
        FlowGraph graph = new FlowGraph("Start", "End",
            List.of(terminal("Start"), new GraphNode("N1", "x = 1", ShapeKind.PROCESS), terminal("End")),
            List.of(new DirectedEdge("Start", "N1", null), new DirectedEdge("N1", "End", null)));

        assertThat(graph.validate()).isEmpty();
        assertThat(graph.isWellFormed()).isTrue();
    }

    @Test
    void validate_decisionWithSingleBranch_isReported() {
        FlowGraph graph = new FlowGraph("Start", "End",
            List.of(terminal("Start"), new GraphNode("N1", "x", ShapeKind.DECISION), terminal("End")),
            List.of(new DirectedEdge("Start", "N1", null), new DirectedEdge("N1", "End", "Yes")));

        assertThat(graph.validate()).containsExactly("Decision has fewer than two outgoing edges: N1");
    }

    @Test
    void validate_repeatedDecisionLabel_isReported() {
        FlowGraph graph = new FlowGraph("Start", "End",
            List.of(terminal("Start"), new GraphNode("N1", "x", ShapeKind.DECISION),
                new GraphNode("N2", "a", ShapeKind.PROCESS), terminal("End")),
            List.of(new DirectedEdge("Start", "N1", null), new DirectedEdge("N1", "N2", "Yes"),
                new DirectedEdge("N1", "End", "Yes"), new DirectedEdge("N2", "End", null)));

        assertThat(graph.validate()).containsExactly("Decision N1 repeats edge label: Yes");
    }

    @Test
    void validate_danglingNodeAndUnknownTarget_areReported() {
        FlowGraph graph = new FlowGraph("Start", "End",
            List.of(terminal("Start"), new GraphNode("N1", "orphan", ShapeKind.PROCESS), terminal("End")),
            List.of(new DirectedEdge("Start", "End", null), new DirectedEdge("End", "N9", null)));

        assertThat(graph.validate()).contains(
            "Edge references unknown node: End -> N9",
            "Node has no incoming edge: N1",
            "Node has no outgoing edge: N1");
    }

    @Test
    void directedEdge_blankLabel_becomesNull() {
        assertThat(new DirectedEdge("a", "b", "  ").hasLabel()).isFalse();
    }

    @Test
    void accessors_filterByNode() {
        FlowGraph graph = new FlowGraph("Start", "End",
            List.of(terminal("Start"), terminal("End")),
            List.of(new DirectedEdge("Start", "End", null)));

        assertThat(graph.outgoing("Start")).hasSize(1);
        assertThat(graph.incoming("Start")).isEmpty();
        assertThat(graph.node("End")).isPresent();
        assertThat(graph.node("N1")).isEmpty();
    }
}
