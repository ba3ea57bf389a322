package com.codeflow.core.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * An {@code if} statement with its chained {@code else if} clauses and optional
 * {@code else} body.
 *
 * @param clauses condition/body pairs in source order; never empty
 * @param elseBody body of the trailing {@code else}, empty when the source has none
 */
public record Conditional(List<Clause> clauses, Optional<Sequence> elseBody) implements ControlNode {

    public Conditional {
        Objects.requireNonNull(clauses, "clauses must not be null");
        Objects.requireNonNull(elseBody, "elseBody must not be null");
        if (clauses.isEmpty()) {
            throw new IllegalArgumentException("A conditional needs at least one clause");
        }
        clauses = List.copyOf(clauses);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitConditional(this);
    }

    /**
     * One {@code if}/{@code else if} arm.
     *
     * @param condition condition text without the surrounding parentheses
     * @param body statements executed when the condition holds
     */
    public record Clause(String condition, Sequence body) {

        public Clause {
            Objects.requireNonNull(condition, "condition must not be null");
            Objects.requireNonNull(body, "body must not be null");
        }
    }
}
