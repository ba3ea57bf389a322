package com.codeflow.core.generator;

import com.codeflow.core.classifier.StatementClassifier;
import com.codeflow.core.model.Conditional;
import com.codeflow.core.model.DirectedEdge;
import com.codeflow.core.model.FlowElement;
import com.codeflow.core.model.FlowGraph;
import com.codeflow.core.model.GraphNode;
import com.codeflow.core.model.Loop;
import com.codeflow.core.model.Sequence;
import com.codeflow.core.model.ShapeKind;
import com.codeflow.core.model.Statement;
import com.codeflow.core.model.Switch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Linearizes a control tree into a single connected {@link FlowGraph}.
 *
 * <p>The renderer walks the tree keeping the id of the most recently emitted node (the
 * tail) and the label of the edge that will leave it. Each construct maps to a fixed
 * shape:
 * <ul>
 *   <li><b>Statement</b> - one process or I/O node chained from the tail. A return
 *       statement is connected straight to {@code End} and nothing after it at the same
 *       or a deeper level is drawn.</li>
 *   <li><b>Conditional</b> - one decision per clause; {@code Yes} enters the clause body,
 *       {@code No} leads to the next clause or the else body. Branch ends reconverge in a
 *       merge node, or connect straight to {@code End} when the conditional is the last
 *       construct of a sequence that itself exits to {@code End}.</li>
 *   <li><b>Pre-test loop</b> - decision, {@code Yes} into the body, back-edge from the
 *       body end to the decision, {@code No} out to whatever is drawn next.</li>
 *   <li><b>Post-test loop</b> - body first, then the decision with a {@code Yes}
 *       back-edge to the first body node.</li>
 *   <li><b>Switch</b> - one decision with an edge per case (plus {@code default} when
 *       the source has none); all case ends converge in a merge node.</li>
 * </ul>
 * Empty loop bodies and empty cases get a {@value #NO_ACTION_LABEL} placeholder node.
 * A statement whose label repeats the label of the statement drawn just before it is
 * skipped.
 *
 * <p>All traversal state, including the node id counter, lives in a per-call object, so
 * one renderer may be shared by concurrent callers. Ids are {@code N1, N2, ...} in
 * emission order; the terminals are {@value #START_ID} and {@value #END_ID}.
 *
 * @see FlowGraph#validate()
 * @since 1.0.0
 */
public final class FlowGraphRenderer {

    private static final Logger log = LoggerFactory.getLogger(FlowGraphRenderer.class);

    public static final String START_ID = "Start";
    public static final String END_ID = "End";
    public static final String YES = "Yes";
    public static final String NO = "No";
    public static final String MERGE_LABEL = "Merge";
    public static final String NO_ACTION_LABEL = "No action";
    public static final String ERROR_PREFIX = "Error: ";

    private static final String ID_PREFIX = "N";

    private final StatementClassifier classifier;

    public FlowGraphRenderer(StatementClassifier classifier) {
        this.classifier = Objects.requireNonNull(classifier, "classifier must not be null");
    }

    /**
     * Renders a control tree.
     *
     * @param tree root sequence of the program
     * @return flow graph from {@code Start} to {@code End}
     */
    public FlowGraph render(Sequence tree) {
        Objects.requireNonNull(tree, "tree must not be null");
        Trace trace = new Trace();
        trace.renderSequence(tree, true);
        FlowGraph graph = trace.finish();

        List<String> violations = graph.validate();
        if (!violations.isEmpty()) {
            log.debug("Rendered graph has {} structural issue(s): {}", violations.size(), violations);
        }
        log.debug("Rendered {} nodes and {} edges", graph.nodes().size(), graph.edges().size());
        return graph;
    }

    /**
     * Builds the fallback diagram shown when a snippet cannot be parsed.
     *
     * @param message error description
     * @return {@code Start -> error -> End}
     */
    public static FlowGraph errorGraph(String message) {
        String errorId = ID_PREFIX + 1;
        List<GraphNode> nodes = List.of(
            new GraphNode(START_ID, START_ID, ShapeKind.TERMINAL),
            new GraphNode(errorId, ERROR_PREFIX + (message == null ? "unknown" : message), ShapeKind.PROCESS),
            new GraphNode(END_ID, END_ID, ShapeKind.TERMINAL)
        );
        List<DirectedEdge> edges = List.of(
            new DirectedEdge(START_ID, errorId, null),
            new DirectedEdge(errorId, END_ID, null)
        );
        return new FlowGraph(START_ID, END_ID, nodes, edges);
    }

    /** An open branch end: the node it leaves and the label of its outgoing edge. */
    private record Exit(String node, String label) {
    }

    private final class Trace implements FlowElement.Visitor<Void> {

        private final List<GraphNode> nodes = new ArrayList<>();
        private final List<DirectedEdge> edges = new ArrayList<>();
        private int counter;

        private String tail = START_ID;
        private String pendingLabel;
        private boolean closed;
        private String lastStatementLabel;

        // Set while visiting the last element of a sequence that exits to End.
        private boolean exitsToEnd;

        Trace() {
            nodes.add(new GraphNode(START_ID, START_ID, ShapeKind.TERMINAL));
        }

        void renderSequence(Sequence sequence, boolean sequenceExitsToEnd) {
            List<FlowElement> elements = sequence.elements();
            for (int i = 0; i < elements.size() && !closed; i++) {
                boolean saved = exitsToEnd;
                exitsToEnd = sequenceExitsToEnd && i == elements.size() - 1;
                elements.get(i).accept(this);
                exitsToEnd = saved;
            }
        }

        FlowGraph finish() {
            if (!closed) {
                connect(END_ID);
            }
            nodes.add(new GraphNode(END_ID, END_ID, ShapeKind.TERMINAL));
            return new FlowGraph(START_ID, END_ID, nodes, edges);
        }

        // ==================== Visitor ====================

        @Override
        public Void visitStatement(Statement statement) {
            String label = statement.label();
            if (label.isEmpty()) {
                return null;
            }
            if (!statement.classification().isReturn() && label.equals(lastStatementLabel)) {
                log.trace("Suppressing repeated statement '{}'", label);
                return null;
            }
            emit(label, statement.classification().shape());
            lastStatementLabel = label;
            if (statement.classification().isReturn()) {
                connect(END_ID);
                closed = true;
            }
            return null;
        }

        @Override
        public Void visitSequence(Sequence sequence) {
            renderSequence(sequence, exitsToEnd);
            return null;
        }

        @Override
        public Void visitConditional(Conditional conditional) {
            boolean toEnd = exitsToEnd;
            List<Exit> ends = new ArrayList<>();
            String decision = null;
            for (Conditional.Clause clause : conditional.clauses()) {
                if (decision != null) {
                    resume(decision, NO);
                }
                decision = emit(classifier.conditionLabel(clause.condition()), ShapeKind.DECISION);
                renderBranch(decision, YES, clause.body(), toEnd, ends);
            }
            Optional<Sequence> elseBody = conditional.elseBody();
            if (elseBody.isPresent()) {
                renderBranch(decision, NO, elseBody.get(), toEnd, ends);
            } else {
                ends.add(new Exit(decision, NO));
            }
            converge(ends, toEnd, false);
            return null;
        }

        @Override
        public Void visitLoop(Loop loop) {
            if (loop.isPostTest()) {
                renderPostTest(loop);
            } else {
                renderPreTest(loop);
            }
            return null;
        }

        @Override
        public Void visitSwitch(Switch switchNode) {
            String label = classifier.switchLabel(switchNode);
            if (switchNode.cases().stream().allMatch(Switch.SwitchCase::isDefault)) {
                emit(label, ShapeKind.PROCESS);
                for (Switch.SwitchCase switchCase : switchNode.cases()) {
                    renderSequence(switchCase.body(), false);
                }
                lastStatementLabel = null;
                return null;
            }

            String decision = emit(label, ShapeKind.DECISION);
            Set<String> usedLabels = new HashSet<>();
            List<Exit> ends = new ArrayList<>();
            for (Switch.SwitchCase switchCase : switchNode.cases()) {
                resume(decision, distinct(classifier.caseLabel(switchCase), usedLabels));
                int before = nodes.size();
                renderSequence(switchCase.body(), false);
                if (!closed && nodes.size() == before) {
                    emit(NO_ACTION_LABEL, ShapeKind.PROCESS);
                }
                if (!closed) {
                    ends.add(new Exit(tail, pendingLabel));
                }
            }
            if (!switchNode.hasDefault()) {
                Switch.SwitchCase implicit = new Switch.SwitchCase(Switch.SwitchCase.DEFAULT_LABEL, Sequence.empty());
                ends.add(new Exit(decision, distinct(classifier.caseLabel(implicit), usedLabels)));
            }
            converge(ends, false, true);
            return null;
        }

        // ==================== Loops ====================

        private void renderPreTest(Loop loop) {
            String decision = emit(classifier.loopLabel(loop), ShapeKind.DECISION);
            resume(decision, YES);
            int before = nodes.size();
            renderSequence(loop.body(), false);
            if (!closed && nodes.size() == before) {
                emit(NO_ACTION_LABEL, ShapeKind.PROCESS);
            }
            if (!closed) {
                connect(decision);
            }
            // The loop exit is whatever gets drawn next.
            resume(decision, NO);
        }

        private void renderPostTest(Loop loop) {
            lastStatementLabel = null;
            int first = nodes.size();
            renderSequence(loop.body(), false);
            if (!closed && nodes.size() == first) {
                emit(NO_ACTION_LABEL, ShapeKind.PROCESS);
            }
            if (closed) {
                return;
            }
            String entry = nodes.get(first).id();
            String decision = emit(classifier.loopLabel(loop), ShapeKind.DECISION);
            edges.add(new DirectedEdge(decision, entry, YES));
            resume(decision, NO);
        }

        // ==================== Branches ====================

        private void renderBranch(String from, String label, Sequence body, boolean toEnd, List<Exit> ends) {
            resume(from, label);
            renderSequence(body, toEnd);
            if (!closed) {
                ends.add(new Exit(tail, pendingLabel));
            }
        }

        private void converge(List<Exit> ends, boolean toEnd, boolean alwaysMerge) {
            lastStatementLabel = null;
            if (ends.isEmpty()) {
                closed = true;
                return;
            }
            if (toEnd) {
                for (Exit end : ends) {
                    edges.add(new DirectedEdge(end.node(), END_ID, end.label()));
                }
                closed = true;
                return;
            }
            closed = false;
            if (ends.size() == 1 && !alwaysMerge) {
                tail = ends.get(0).node();
                pendingLabel = ends.get(0).label();
                return;
            }
            String merge = newNode(MERGE_LABEL, ShapeKind.PROCESS);
            for (Exit end : ends) {
                edges.add(new DirectedEdge(end.node(), merge, end.label()));
            }
            tail = merge;
            pendingLabel = null;
        }

        // ==================== Graph Building ====================

        private String emit(String label, ShapeKind shape) {
            String id = newNode(label, shape);
            connect(id);
            tail = id;
            lastStatementLabel = null;
            return id;
        }

        private String newNode(String label, ShapeKind shape) {
            String id = ID_PREFIX + (++counter);
            nodes.add(new GraphNode(id, label, shape));
            return id;
        }

        private void connect(String target) {
            edges.add(new DirectedEdge(tail, target, pendingLabel));
            pendingLabel = null;
        }

        private void resume(String from, String label) {
            tail = from;
            pendingLabel = label;
            closed = false;
            lastStatementLabel = null;
        }

        private String distinct(String label, Set<String> used) {
            String candidate = label;
            int suffix = 2;
            while (!used.add(candidate)) {
                candidate = label + " (" + suffix++ + ")";
            }
            return candidate;
        }
    }
}
