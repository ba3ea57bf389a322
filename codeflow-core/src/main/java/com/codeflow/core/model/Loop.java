package com.codeflow.core.model;

import java.util.Objects;

/**
 * A loop construct.
 *
 * <p>For {@code for} loops the condition is the whole header ({@code init; cond; step}),
 * kept as one opaque string.
 *
 * @param kind pre-test or post-test
 * @param keyword source keyword that introduced the loop ({@code for}, {@code while}, {@code do})
 * @param condition loop condition or header text
 * @param body loop body
 */
public record Loop(LoopKind kind, String keyword, String condition, Sequence body) implements ControlNode {

    public Loop {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(keyword, "keyword must not be null");
        Objects.requireNonNull(condition, "condition must not be null");
        Objects.requireNonNull(body, "body must not be null");
    }

    public boolean isPostTest() {
        return kind == LoopKind.POST_TEST;
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitLoop(this);
    }
}
