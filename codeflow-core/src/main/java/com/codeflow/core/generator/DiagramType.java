package com.codeflow.core.generator;

/**
 * Types of output that can be generated from a program model.
 */
public enum DiagramType {
    /** Flowchart of the program's control flow */
    FLOWCHART,

    /** Indented bullet explanation of the control tree */
    EXPLANATION,

    /** Machine-readable dump of the flow graph */
    GRAPH_JSON
}
