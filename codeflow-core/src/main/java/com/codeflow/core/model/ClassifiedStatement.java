package com.codeflow.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Result of classifying a {@link Statement}: what kind of step it is and how to draw it.
 *
 * @param kind statement classification
 * @param label display label
 * @param shape node shape used in the flow graph
 * @param variables variable names the statement declares or reads into (may be empty)
 * @param detail extracted payload such as a prompt or printed literal, or null
 */
public record ClassifiedStatement(
    StatementKind kind,
    String label,
    ShapeKind shape,
    List<String> variables,
    String detail
) {
    public ClassifiedStatement {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(label, "label must not be null");
        Objects.requireNonNull(shape, "shape must not be null");
        variables = variables == null ? List.of() : List.copyOf(variables);
    }

    /**
     * Creates a classification with no extracted detail.
     *
     * @param kind statement kind
     * @param label display label
     * @param shape node shape
     * @return classified statement
     */
    public static ClassifiedStatement of(StatementKind kind, String label, ShapeKind shape) {
        return new ClassifiedStatement(kind, label, shape, List.of(), null);
    }

    public boolean isReturn() {
        return kind == StatementKind.RETURN;
    }
}
