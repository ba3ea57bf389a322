package com.codeflow.core.model;

/**
 * Whether a loop tests its condition before or after the body.
 */
public enum LoopKind {
    /** {@code for} and {@code while}: the body may run zero times */
    PRE_TEST,

    /** {@code do ... while}: the body runs at least once */
    POST_TEST
}
