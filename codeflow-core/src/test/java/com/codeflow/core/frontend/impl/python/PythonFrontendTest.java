package com.codeflow.core.frontend.impl.python;

import com.codeflow.core.model.DirectedEdge;
import com.codeflow.core.model.FlowGraph;
import com.codeflow.core.model.GraphNode;
import com.codeflow.core.model.ShapeKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link PythonFrontend}.
 */
class PythonFrontendTest {

    private PythonFrontend frontend;

    @BeforeEach
    void setUp() {
        frontend = new PythonFrontend();
    }

    @Test
    void metadata_describesPython() {
        assertThat(frontend.getId()).isEqualTo("python");
        assertThat(frontend.getFileExtensions()).containsExactly("py");
    }

    @Test
    void buildGraph_inputAndIfElse_matchesExpectedShape() {
        FlowGraph graph = frontend.buildGraph("""
            # classify a number
            x = int(input("Number?"))
            if x > 0:
                print("pos")
            else:
                print("neg")
            """);

        assertThat(graph.nodes()).extracting(GraphNode::label, GraphNode::shape).containsExactly(
            tuple("Start", ShapeKind.TERMINAL),
            tuple("Input x: Number? (as int)", ShapeKind.IO),
            tuple("x > 0", ShapeKind.DECISION),
            tuple("Output: pos", ShapeKind.IO),
            tuple("Output: neg", ShapeKind.IO),
            tuple("End", ShapeKind.TERMINAL));
        assertThat(graph.incoming("End")).extracting(DirectedEdge::from).containsExactly("N3", "N4");
    }

    @Test
    void buildGraph_withMainFunction_usesItsBody() {
        FlowGraph graph = frontend.buildGraph("""
            \"\"\"Counts to three.\"\"\"

            def main():
                n = 0
                while n < 3:
                    n += 1
                print("done")

            main()
            """);

        assertThat(graph.nodes()).extracting(GraphNode::label)
            .containsExactly("Start", "n = 0", "n < 3", "n += 1", "Output: done", "End");
        assertThat(graph.edges()).contains(
            new DirectedEdge("N3", "N2", null),
            new DirectedEdge("N2", "N4", "No"));
    }

    @Test
    void buildGraph_forLoop_usesForLabel() {
        FlowGraph graph = frontend.buildGraph("for item in items:\n    print(item)\n");

        assertThat(graph.nodesWithShape(ShapeKind.DECISION)).extracting(GraphNode::label)
            .containsExactly("For item in items");
    }

    @Test
    void buildGraph_matchStatement_drawsCaseEdges() {
        FlowGraph graph = frontend.buildGraph("""
            match cmd:
                case "go":
                    print("going")
                case _:
                    print("stop")
            """);

        GraphNode decision = graph.nodesWithShape(ShapeKind.DECISION).get(0);
        assertThat(decision.label()).isEqualTo("Match cmd");
        assertThat(graph.outgoing(decision.id())).extracting(DirectedEdge::label)
            .containsExactly("case \"go\"", "case (default)");
        assertThat(graph.isWellFormed()).isTrue();
    }

    @Test
    void buildGraph_badIndentation_returnsErrorDiagram() {
        FlowGraph graph = frontend.buildGraph("if x:\n        a = 1\n    b = 2\n");

        assertThat(graph.nodes()).extracting(GraphNode::label).containsExactly(
            "Start", "Error: Unindent does not match any outer indentation level at line 3", "End");
    }

    @Test
    void explain_nestedLoopAndCondition_indentsBullets() {
        String explanation = frontend.explain("""
            while n > 0:
                if n % 2 == 0:
                    print("even")
                n -= 1
            """);

        assertThat(explanation).isEqualTo(String.join("\n",
            "Program Explanation:",
            "- While **(n > 0)**, repeat:",
            "  - If condition **(n % 2 == 0)** is true:",
            "    - Output: even.",
            "  - n -= 1."));
    }
}
