package com.codeflow.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Ordered list of control-tree elements executed one after another.
 *
 * @param elements the elements, in source order
 */
public record Sequence(List<FlowElement> elements) implements ControlNode {

    public Sequence {
        Objects.requireNonNull(elements, "elements must not be null");
        elements = List.copyOf(elements);
    }

    /**
     * Creates an empty sequence.
     *
     * @return empty sequence
     */
    public static Sequence empty() {
        return new Sequence(List.of());
    }

    /**
     * Wraps a single element, as used for brace-less bodies.
     *
     * @param element the element
     * @return one-element sequence
     */
    public static Sequence of(FlowElement element) {
        return new Sequence(List.of(element));
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    public int size() {
        return elements.size();
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitSequence(this);
    }
}
