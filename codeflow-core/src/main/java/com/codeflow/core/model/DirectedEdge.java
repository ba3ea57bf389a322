package com.codeflow.core.model;

import java.util.Objects;

/**
 * Directed edge of a flow graph.
 *
 * @param from source node id
 * @param to target node id
 * @param label edge label such as {@code Yes}, {@code No} or a case label; null when unlabelled
 */
public record DirectedEdge(String from, String to, String label) {

    public DirectedEdge {
        Objects.requireNonNull(from, "from must not be null");
        Objects.requireNonNull(to, "to must not be null");
        if (label != null && label.isBlank()) {
            label = null;
        }
    }

    public boolean hasLabel() {
        return label != null;
    }
}
