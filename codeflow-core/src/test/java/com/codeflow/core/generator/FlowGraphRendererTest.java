package com.codeflow.core.generator;

import com.codeflow.core.classifier.StatementClassifier;
import com.codeflow.core.frontend.impl.c.CStatementClassifier;
import com.codeflow.core.model.DirectedEdge;
import com.codeflow.core.model.FlowGraph;
import com.codeflow.core.model.GraphNode;
import com.codeflow.core.model.Sequence;
import com.codeflow.core.model.ShapeKind;
import com.codeflow.core.parser.ControlTreeBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link FlowGraphRenderer}.
 *
 * <p>Snippets are parsed with the C statement classifier so labels read like the C
 * front end's output.
 */
class FlowGraphRendererTest {

    private StatementClassifier classifier;
    private FlowGraphRenderer renderer;

    @BeforeEach
    void setUp() {
        classifier = new CStatementClassifier();
        renderer = new FlowGraphRenderer(classifier);
    }

    private FlowGraph render(String block) {
        return renderer.render(new ControlTreeBuilder(classifier).build(block));
    }

    private static DirectedEdge edge(String from, String to) {
        return new DirectedEdge(from, to, null);
    }

    private static DirectedEdge edge(String from, String to, String label) {
        return new DirectedEdge(from, to, label);
    }

    // ==================== Worked Examples ====================

    @Test
    void render_ifElseAsOnlyStatement_connectsBothBranchesToEnd() {
        FlowGraph graph = render("if (x > 0) { printf(\"pos\"); } else { printf(\"neg\"); }");

        assertThat(graph.nodes()).containsExactly(
            new GraphNode("Start", "Start", ShapeKind.TERMINAL),
            new GraphNode("N1", "x > 0", ShapeKind.DECISION),
            new GraphNode("N2", "Display pos", ShapeKind.IO),
            new GraphNode("N3", "Display neg", ShapeKind.IO),
            new GraphNode("End", "End", ShapeKind.TERMINAL)
        );
        assertThat(graph.edges()).containsExactly(
            edge("Start", "N1"),
            edge("N1", "N2", "Yes"),
            edge("N1", "N3", "No"),
            edge("N2", "End"),
            edge("N3", "End")
        );
        assertThat(graph.nodes()).noneMatch(node -> node.label().equals(FlowGraphRenderer.MERGE_LABEL));
    }

    @Test
    void render_repeatedDeclaration_collapsesIntoOneNode() {
        FlowGraph graph = render("int x; int x;");

        assertThat(graph.nodes()).extracting(GraphNode::label)
            .containsExactly("Start", "Declare variable x", "End");
        assertThat(graph.edges()).containsExactly(edge("Start", "N1"), edge("N1", "End"));
    }

    @Test
    void render_whileFollowedByReturn_drawsBackEdgeAndExit() {
        FlowGraph graph = render("while (n < 5) { n = n + 1; } return n;");

        assertThat(graph.nodes()).extracting(GraphNode::id, GraphNode::label)
            .containsExactly(
                tuple("Start", "Start"),
                tuple("N1", "n < 5"),
                tuple("N2", "n = n + 1"),
                tuple("N3", "Return"),
                tuple("End", "End"));
        assertThat(graph.edges()).containsExactly(
            edge("Start", "N1"),
            edge("N1", "N2", "Yes"),
            edge("N2", "N1"),
            edge("N1", "N3", "No"),
            edge("N3", "End")
        );
    }

    // ==================== Structural Properties ====================

    @Test
    void render_emptyBlock_connectsStartToEnd() {
        FlowGraph graph = renderer.render(Sequence.empty());

        assertThat(graph.nodes()).hasSize(2);
        assertThat(graph.edges()).containsExactly(edge("Start", "End"));
        assertThat(graph.isWellFormed()).isTrue();
    }

    @Test
    void render_statements_formChainInSourceOrder() {
        FlowGraph graph = render("int a; a = 1; printf(\"%d\", a);");

        assertThat(graph.edges()).containsExactly(
            edge("Start", "N1"),
            edge("N1", "N2"),
            edge("N2", "N3"),
            edge("N3", "End")
        );
        assertThat(graph.node("N3")).get().extracting(GraphNode::shape).isEqualTo(ShapeKind.IO);
    }

    @Test
    void render_ifWithoutElseFollowedByStatement_mergesBranches() {
        FlowGraph graph = render("if (x) { a = 1; } b = 2;");

        assertThat(graph.nodes()).extracting(GraphNode::label)
            .containsExactly("Start", "x", "a = 1", "Merge", "b = 2", "End");
        assertThat(graph.edges()).containsExactly(
            edge("Start", "N1"),
            edge("N1", "N2", "Yes"),
            edge("N2", "N3"),
            edge("N1", "N3", "No"),
            edge("N3", "N4"),
            edge("N4", "End")
        );
    }

    @Test
    void render_ifWithoutElseAsLastStatement_sendsNoEdgeToEnd() {
        FlowGraph graph = render("if (x) { a = 1; }");

        assertThat(graph.edges()).contains(edge("N1", "End", "No"), edge("N2", "End"));
        assertThat(graph.isWellFormed()).isTrue();
    }

    @Test
    void render_elseIfChain_hangsEachDecisionOffPreviousNo() {
        FlowGraph graph = render("if (a) { x = 1; } else if (b) { x = 2; } else { x = 3; }");

        assertThat(graph.nodesWithShape(ShapeKind.DECISION)).extracting(GraphNode::id).containsExactly("N1", "N3");
        assertThat(graph.edges()).contains(
            edge("N1", "N2", "Yes"),
            edge("N1", "N3", "No"),
            edge("N3", "N4", "Yes"),
            edge("N3", "N5", "No")
        );
        assertThat(graph.incoming("End")).hasSize(3);
    }

    @Test
    void render_returnInsideBranch_closesOnlyThatBranch() {
        FlowGraph graph = render("if (x) { return 1; } y = 2;");

        assertThat(graph.edges()).containsExactly(
            edge("Start", "N1"),
            edge("N1", "N2", "Yes"),
            edge("N2", "End"),
            edge("N1", "N3", "No"),
            edge("N3", "End")
        );
    }

    @Test
    void render_statementsAfterReturn_areNotDrawn() {
        FlowGraph graph = render("a = 1; return a; b = 2; printf(\"never\");");

        assertThat(graph.nodes()).extracting(GraphNode::label)
            .containsExactly("Start", "a = 1", "Return", "End");
        assertThat(graph.outgoing("N2")).containsExactly(edge("N2", "End"));
    }

    @Test
    void render_bothBranchesReturn_drawsNothingAfterConditional() {
        FlowGraph graph = render("if (x) { return 1; } else { return 2; } y = 3;");

        assertThat(graph.nodes()).extracting(GraphNode::label).doesNotContain("y = 3");
        assertThat(graph.incoming("End")).hasSize(2);
        assertThat(graph.isWellFormed()).isTrue();
    }

    @Test
    void render_forLoop_hasExactlyOneBackEdge() {
        FlowGraph graph = render("for (i = 0; i < 3; i++) { printf(\"%d\", i); sum += i; }");

        GraphNode decision = graph.nodesWithShape(ShapeKind.DECISION).get(0);
        assertThat(decision.label()).isEqualTo("i = 0; i < 3; i++");
        assertThat(graph.incoming(decision.id())).containsExactly(edge("Start", "N1"), edge("N3", "N1"));
        assertThat(graph.outgoing(decision.id())).extracting(DirectedEdge::label).containsExactly("Yes", "No");
    }

    @Test
    void render_emptyLoopBody_drawsNoActionNode() {
        FlowGraph graph = render("while (busy()) ;");

        assertThat(graph.nodes()).extracting(GraphNode::label)
            .containsExactly("Start", "busy()", "No action", "End");
        assertThat(graph.edges()).contains(edge("N2", "N1"), edge("N1", "End", "No"));
    }

    @Test
    void render_loopBodyEndingInReturn_hasNoBackEdge() {
        FlowGraph graph = render("while (x) { return 0; } y = 1;");

        assertThat(graph.incoming("N1")).containsExactly(edge("Start", "N1"));
        assertThat(graph.edges()).contains(edge("N1", "N3", "No"));
    }

    @Test
    void render_doWhile_drawsBodyBeforeDecision() {
        FlowGraph graph = render("do { i = i + 1; } while (i < 3);");

        assertThat(graph.nodes()).extracting(GraphNode::label)
            .containsExactly("Start", "i = i + 1", "i < 3", "End");
        assertThat(graph.edges()).containsExactly(
            edge("Start", "N1"),
            edge("N1", "N2"),
            edge("N2", "N1", "Yes"),
            edge("N2", "End", "No")
        );
    }

    @Test
    void render_doWhileWithEmptyBody_loopsBackToNoActionNode() {
        FlowGraph graph = render("do ; while (c);");

        assertThat(graph.nodes()).extracting(GraphNode::label)
            .containsExactly("Start", "No action", "c", "End");
        assertThat(graph.edges()).containsExactly(
            edge("Start", "N1"),
            edge("N1", "N2"),
            edge("N2", "N1", "Yes"),
            edge("N2", "End", "No")
        );
    }

    @Test
    void render_bracedCaseEndingInBreak_drawsNoBreakNode() {
        FlowGraph graph = render("switch (c) { case 1: { a = 1; break; } default: a = 0; }");

        assertThat(graph.nodes()).extracting(GraphNode::label)
            .containsExactly("Start", "c", "a = 1", "a = 0", "Merge", "End");
    }

    @Test
    void render_switchWithoutDefault_addsImplicitDefaultAndMerges() {
        FlowGraph graph = render("switch (c) { case 1: a = 1; break; case 2: a = 2; break; }");

        assertThat(graph.nodes()).extracting(GraphNode::label)
            .containsExactly("Start", "c", "a = 1", "a = 2", "Merge", "End");
        assertThat(graph.outgoing("N1")).extracting(DirectedEdge::label)
            .containsExactly("case 1", "case 2", "default");
        assertThat(graph.incoming("N4")).extracting(DirectedEdge::from).containsExactly("N2", "N3", "N1");
        assertThat(graph.edges()).contains(edge("N4", "End"));
    }

    @Test
    void render_switchWithEmptyCase_drawsNoActionNode() {
        FlowGraph graph = render("switch (c) { case 1: break; default: a = 0; }");

        assertThat(graph.nodes()).extracting(GraphNode::label).contains("No action");
        assertThat(graph.outgoing("N1")).extracting(DirectedEdge::label).containsExactly("case 1", "default");
        assertThat(graph.isWellFormed()).isTrue();
    }

    @Test
    void render_switchWithOnlyDefault_drawsProcessNode() {
        FlowGraph graph = render("switch (c) { default: a = 0; }");

        assertThat(graph.nodesWithShape(ShapeKind.DECISION)).isEmpty();
        assertThat(graph.nodes()).extracting(GraphNode::label).containsExactly("Start", "c", "a = 0", "End");
    }

    @Test
    void render_nestedConstructs_produceWellFormedGraph() {
        FlowGraph graph = render("""
            int i;
            for (i = 0; i < 10; i++) {
                if (i % 2 == 0) {
                    printf("even");
                } else if (i % 3 == 0) {
                    continue;
                }
                switch (i) { case 5: printf("five"); break; }
            }
            do { i--; } while (i > 0);
            return 0;
            """);

        assertThat(graph.validate()).isEmpty();
        for (GraphNode decision : graph.nodesWithShape(ShapeKind.DECISION)) {
            List<String> labels = graph.outgoing(decision.id()).stream().map(DirectedEdge::label).toList();
            assertThat(labels).hasSizeGreaterThanOrEqualTo(2).doesNotHaveDuplicates();
        }
    }

    @Test
    void render_sameTreeTwice_producesEqualGraphs() {
        Sequence tree = new ControlTreeBuilder(classifier)
            .build("if (a) { b = 1; } while (b < 3) { b++; } return b;");

        assertThat(renderer.render(tree)).isEqualTo(renderer.render(tree));
    }

    @Test
    void errorGraph_containsSingleErrorNode() {
        FlowGraph graph = FlowGraphRenderer.errorGraph("bad input");

        assertThat(graph.nodes()).extracting(GraphNode::label).containsExactly("Start", "Error: bad input", "End");
        assertThat(graph.edges()).containsExactly(edge("Start", "N1"), edge("N1", "End"));
        assertThat(graph.isWellFormed()).isTrue();
    }
}
