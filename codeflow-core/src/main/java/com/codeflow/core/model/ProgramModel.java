package com.codeflow.core.model;

import java.util.Objects;

/**
 * Everything known about one converted snippet: the syntax family it was read as, its
 * control-tree and the flow graph rendered from that tree.
 *
 * <p>This is the input of every {@code DiagramGenerator}. It lives only for the duration
 * of one conversion call.
 *
 * @param language front-end id the snippet was parsed with (e.g. {@code c}, {@code java}, {@code python})
 * @param tree the control-tree
 * @param graph the flow graph
 */
public record ProgramModel(String language, Sequence tree, FlowGraph graph) {

    public ProgramModel {
        Objects.requireNonNull(language, "language must not be null");
        Objects.requireNonNull(tree, "tree must not be null");
        Objects.requireNonNull(graph, "graph must not be null");
    }
}
