package com.codeflow.core.model;

import java.util.Objects;

/**
 * Node of a rendered flow graph.
 *
 * @param id unique node id within one graph
 * @param label display label
 * @param shape node shape
 */
public record GraphNode(String id, String label, ShapeKind shape) {

    public GraphNode {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(label, "label must not be null");
        Objects.requireNonNull(shape, "shape must not be null");
    }

    public boolean isDecision() {
        return shape == ShapeKind.DECISION;
    }
}
