package com.codeflow.core.model;

import java.util.List;
import java.util.Objects;

/**
 * A multi-way branch ({@code switch} in C and Java, {@code match} in Python).
 *
 * <p>Each case body holds only the statements up to the first {@code break}; fallthrough
 * into the next case is not modeled.
 *
 * @param selector selector expression text
 * @param cases case arms in source order, {@code default} included
 */
public record Switch(String selector, List<SwitchCase> cases) implements ControlNode {

    public Switch {
        Objects.requireNonNull(selector, "selector must not be null");
        Objects.requireNonNull(cases, "cases must not be null");
        cases = List.copyOf(cases);
    }

    public boolean hasDefault() {
        return cases.stream().anyMatch(SwitchCase::isDefault);
    }

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitSwitch(this);
    }

    /**
     * One case arm.
     *
     * @param label case label as written, e.g. {@code case 1} or {@code default}
     * @param body statements of the arm
     */
    public record SwitchCase(String label, Sequence body) {

        public static final String DEFAULT_LABEL = "default";

        public SwitchCase {
            Objects.requireNonNull(label, "label must not be null");
            Objects.requireNonNull(body, "body must not be null");
        }

        public boolean isDefault() {
            return DEFAULT_LABEL.equals(label);
        }
    }
}
