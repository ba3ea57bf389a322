package com.codeflow.core.model;

/**
 * Visual shape of a flow-graph node.
 */
public enum ShapeKind {
    /** Rectangle: computation step */
    PROCESS,

    /** Parallelogram: input or output */
    IO,

    /** Diamond: condition with labelled outgoing edges */
    DECISION,

    /** Circle: Start and End */
    TERMINAL
}
