package com.funcplan.flatten;

import com.funcplan.plan.NodeKind;

import java.util.List;
import java.util.stream.Collectors;

/**
 * The flattened view of a plan: one node list and one edge list, entered at {@code entryId}.
 */
public record FlatGraph(int entryId, List<FlatNode> nodes, List<FlatEdge> edges) {
    public FlatGraph {
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
    }

    /** The node with {@code id}, or {@code null}. */
    public FlatNode node(int id) {
        for (FlatNode node : nodes) {
            if (node.id() == id) {
                return node;
            }
        }
        return null;
    }

    public List<FlatEdge> outgoing(int id) {
        return edges.stream().filter(e -> e.from() == id).collect(Collectors.toList());
    }

    public List<FlatEdge> incoming(int id) {
        return edges.stream().filter(e -> e.to() == id).collect(Collectors.toList());
    }

    public List<FlatNode> nodesOfKind(NodeKind kind) {
        return nodes.stream().filter(n -> n.kind() == kind).collect(Collectors.toList());
    }

    public List<FlatEdge> edgesTagged(EdgeTag tag) {
        return edges.stream().filter(e -> e.tag() == tag).collect(Collectors.toList());
    }
}
