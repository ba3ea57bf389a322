package com.codeflow.core.model;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Directed flow graph produced from a control-tree.
 *
 * <p>A well-formed graph satisfies:
 * <ul>
 *   <li>exactly one start terminal and one end terminal</li>
 *   <li>every node except the start has at least one incoming edge</li>
 *   <li>only the end terminal has no outgoing edge</li>
 *   <li>every decision has at least two outgoing edges with pairwise-distinct labels</li>
 *   <li>no edge references a missing node</li>
 * </ul>
 * {@link #validate()} reports every violated rule.
 *
 * @param startId id of the start terminal
 * @param endId id of the end terminal
 * @param nodes nodes in creation order
 * @param edges edges in creation order
 */
public record FlowGraph(String startId, String endId, List<GraphNode> nodes, List<DirectedEdge> edges) {

    public FlowGraph {
        Objects.requireNonNull(startId, "startId must not be null");
        Objects.requireNonNull(endId, "endId must not be null");
        Objects.requireNonNull(nodes, "nodes must not be null");
        Objects.requireNonNull(edges, "edges must not be null");
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
    }

    public Optional<GraphNode> node(String id) {
        return nodes.stream().filter(n -> n.id().equals(id)).findFirst();
    }

    public List<DirectedEdge> outgoing(String id) {
        return edges.stream().filter(e -> e.from().equals(id)).toList();
    }

    public List<DirectedEdge> incoming(String id) {
        return edges.stream().filter(e -> e.to().equals(id)).toList();
    }

    public List<GraphNode> nodesWithShape(ShapeKind shape) {
        return nodes.stream().filter(n -> n.shape() == shape).toList();
    }

    /**
     * Checks the structural invariants of the graph.
     *
     * @return human-readable violations; empty when the graph is well formed
     */
    public List<String> validate() {
        List<String> violations = new ArrayList<>();
        Map<String, GraphNode> byId = new HashMap<>();
        for (GraphNode node : nodes) {
            if (byId.put(node.id(), node) != null) {
                violations.add("Duplicate node id: " + node.id());
            }
        }

        long terminals = nodesWithShape(ShapeKind.TERMINAL).size();
        if (terminals != 2 || !byId.containsKey(startId) || !byId.containsKey(endId)) {
            violations.add("Expected exactly one start and one end terminal, found " + terminals + " terminals");
        }

        Map<String, Integer> inDegree = new HashMap<>();
        Map<String, List<DirectedEdge>> outEdges = new HashMap<>();
        for (DirectedEdge edge : edges) {
            if (!byId.containsKey(edge.from()) || !byId.containsKey(edge.to())) {
                violations.add("Edge references unknown node: " + edge.from() + " -> " + edge.to());
                continue;
            }
            inDegree.merge(edge.to(), 1, Integer::sum);
            outEdges.computeIfAbsent(edge.from(), k -> new ArrayList<>()).add(edge);
        }

        for (GraphNode node : nodes) {
            String id = node.id();
            if (!id.equals(startId) && inDegree.getOrDefault(id, 0) == 0) {
                violations.add("Node has no incoming edge: " + id);
            }
            List<DirectedEdge> out = outEdges.getOrDefault(id, List.of());
            if (!id.equals(endId) && out.isEmpty()) {
                violations.add("Node has no outgoing edge: " + id);
            }
            if (node.isDecision()) {
                if (out.size() < 2) {
                    violations.add("Decision has fewer than two outgoing edges: " + id);
                }
                Set<String> labels = new HashSet<>();
                for (DirectedEdge edge : out) {
                    if (!labels.add(String.valueOf(edge.label()))) {
                        violations.add("Decision " + id + " repeats edge label: " + edge.label());
                    }
                }
            }
        }
        return violations;
    }

    public boolean isWellFormed() {
        return validate().isEmpty();
    }
}
