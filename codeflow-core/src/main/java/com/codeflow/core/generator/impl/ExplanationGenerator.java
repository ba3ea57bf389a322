package com.codeflow.core.generator.impl;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.codeflow.core.generator.DiagramGenerator;
import com.codeflow.core.generator.DiagramType;
import com.codeflow.core.generator.GeneratedDiagram;
import com.codeflow.core.generator.GeneratorConfig;
import com.codeflow.core.model.Conditional;
import com.codeflow.core.model.FlowElement;
import com.codeflow.core.model.Loop;
import com.codeflow.core.model.ProgramModel;
import com.codeflow.core.model.Sequence;
import com.codeflow.core.model.Statement;
import com.codeflow.core.model.Switch;

/**
 * Renders the control tree as an indented Markdown bullet list.
 *
 * <p>One bullet per statement, branch, loop and case, indented two spaces per nesting
 * level:
 * <pre>
 * Program Explanation:
 * - Declare variable n.
 * - While **(n &lt; 5)**, repeat:
 *   - n++.
 * - Return.
 * </pre>
 *
 * <p>The explanation works on the control tree, not on the flow graph, so repeated
 * statements and code after a {@code return} still appear.
 */
public class ExplanationGenerator implements DiagramGenerator {

    private static final Logger log = LoggerFactory.getLogger(ExplanationGenerator.class);

    private static final String GENERATOR_ID = "explanation";
    private static final String GENERATOR_DISPLAY_NAME = "Program Explanation Generator";
    private static final String FILE_EXTENSION = "md";

    public static final String HEADER = "Program Explanation:";
    private static final String INDENT = "  ";

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
        return Set.of(DiagramType.EXPLANATION);
    }

    @Override
    public GeneratedDiagram generate(ProgramModel model, DiagramType type, GeneratorConfig config) {
        Objects.requireNonNull(model, "model must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(config, "config must not be null");

        if (!getSupportedDiagramTypes().contains(type)) {
            throw new IllegalArgumentException("Unsupported diagram type: " + type);
        }

        String content = explain(model.tree());
        log.debug("Generated explanation with {} lines", content.lines().count());
        return new GeneratedDiagram("explanation", content, getFileExtension());
    }

    /**
     * Explains a control tree.
     *
     * @param tree root sequence
     * @return explanation text without trailing newline
     */
    public String explain(Sequence tree) {
        Bullets bullets = new Bullets();
        bullets.lines.add(HEADER);
        bullets.walk(tree, 0);
        return String.join("\n", bullets.lines);
    }

    private static final class Bullets implements FlowElement.Visitor<Void> {

        private final List<String> lines = new ArrayList<>();
        private int depth;

        void walk(Sequence sequence, int level) {
            int saved = depth;
            depth = level;
            for (FlowElement element : sequence.elements()) {
                element.accept(this);
            }
            depth = saved;
        }

        private void bullet(String text) {
            lines.add(INDENT.repeat(depth) + "- " + text);
        }

        @Override
        public Void visitStatement(Statement statement) {
            if (!statement.label().isEmpty()) {
                bullet(statement.label() + ".");
            }
            return null;
        }

        @Override
        public Void visitSequence(Sequence sequence) {
            walk(sequence, depth);
            return null;
        }

        @Override
        public Void visitConditional(Conditional conditional) {
            boolean first = true;
            for (Conditional.Clause clause : conditional.clauses()) {
                String prefix = first ? "If" : "Otherwise, if";
                bullet(prefix + " condition **(" + clause.condition() + ")** is true:");
                walk(clause.body(), depth + 1);
                first = false;
            }
            conditional.elseBody().ifPresent(elseBody -> {
                bullet("Otherwise:");
                walk(elseBody, depth + 1);
            });
            return null;
        }

        @Override
        public Void visitLoop(Loop loop) {
            if (loop.isPostTest()) {
                bullet("Do the following at least once:");
                walk(loop.body(), depth + 1);
                bullet("Then repeat while **(" + loop.condition() + ")**.");
            } else if ("for".equals(loop.keyword())) {
                bullet("For loop **(" + loop.condition() + ")**, repeat:");
                walk(loop.body(), depth + 1);
            } else {
                bullet("While **(" + loop.condition() + ")**, repeat:");
                walk(loop.body(), depth + 1);
            }
            return null;
        }

        @Override
        public Void visitSwitch(Switch switchNode) {
            bullet("Switch on **(" + switchNode.selector() + ")**:");
            for (Switch.SwitchCase switchCase : switchNode.cases()) {
                lines.add(INDENT.repeat(depth + 1) + "- **" + switchCase.label() + "**:");
                walk(switchCase.body(), depth + 2);
            }
            return null;
        }
    }
}
