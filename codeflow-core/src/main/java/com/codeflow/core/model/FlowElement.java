package com.codeflow.core.model;

/**
 * One element of a control-tree: either a plain {@link Statement} or a structured
 * {@link ControlNode}.
 *
 * <p>The hierarchy is sealed; consumers walk it through a {@link Visitor} so that adding
 * a new variant breaks every traversal at compile time instead of silently falling
 * through an {@code instanceof} chain.
 *
 * @see ControlNode
 * @see Statement
 */
public sealed interface FlowElement permits Statement, ControlNode {

    /**
     * Dispatches to the visitor method matching this element's variant.
     *
     * @param visitor the visitor
     * @param <R> result type
     * @return the visitor's result
     */
    <R> R accept(Visitor<R> visitor);

    /**
     * Exhaustive visitor over all control-tree variants.
     *
     * @param <R> result type
     */
    interface Visitor<R> {

        R visitStatement(Statement statement);

        R visitSequence(Sequence sequence);

        R visitConditional(Conditional conditional);

        R visitLoop(Loop loop);

        R visitSwitch(Switch switchNode);
    }
}
