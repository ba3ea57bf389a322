package com.codeflow.core.model;

/**
 * Structured node of the control-tree.
 *
 * <p>Variants:
 * <ul>
 *   <li>{@link Sequence} - ordered list of statements and nested nodes</li>
 *   <li>{@link Conditional} - if / else-if chain with optional else body</li>
 *   <li>{@link Loop} - pre-test ({@code for}, {@code while}) or post-test ({@code do-while}) loop</li>
 *   <li>{@link Switch} - multi-way branch over a selector expression</li>
 * </ul>
 */
public sealed interface ControlNode extends FlowElement permits Sequence, Conditional, Loop, Switch {
}
