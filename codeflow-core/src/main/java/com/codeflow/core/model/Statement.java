package com.codeflow.core.model;

import java.util.Objects;

/**
 * A single statement of the analyzed snippet.
 *
 * <p>The control-tree builder classifies each statement with the front end's classifier
 * as it reads it, so the tree carries both the raw text and the family-specific label.
 *
 * @param text raw statement text, including its terminator when the source had one
 * @param classification kind, label and shape of the statement
 */
public record Statement(String text, ClassifiedStatement classification) implements FlowElement {

    public Statement {
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(classification, "classification must not be null");
    }

    /**
     * Creates a generic statement labelled with its own text.
     *
     * @param text statement text
     * @return generic statement
     */
    public static Statement generic(String text) {
        return new Statement(text, ClassifiedStatement.of(StatementKind.GENERIC, text.strip(), ShapeKind.PROCESS));
    }

    public StatementKind kind() {
        return classification.kind();
    }

    public String label() {
        return classification.label();
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitStatement(this);
    }
}
