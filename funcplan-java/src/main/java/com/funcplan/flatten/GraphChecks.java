package com.funcplan.flatten;

import com.funcplan.plan.NodeKind;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Checks the result contract of {@link Flattener} on a {@link FlatGraph}.
 */
public final class GraphChecks {

    private GraphChecks() {}

    /**
     * @return human-readable violations, empty when the graph is well formed
     */
    public static List<String> check(FlatGraph graph) {
        List<String> violations = new ArrayList<>();

        List<FlatNode> starts = graph.nodesOfKind(NodeKind.START);
        if (starts.size() != 1) {
            violations.add("expected exactly one Start, found " + starts.size());
        } else if (starts.get(0).id() != graph.entryId()) {
            violations.add("entry " + graph.entryId() + " is not the Start node " + starts.get(0).id());
        }

        Set<Integer> ids = new HashSet<>();
        for (FlatNode node : graph.nodes()) {
            if (!ids.add(node.id())) {
                violations.add("duplicate node id " + node.id());
            }
        }
        for (FlatEdge edge : graph.edges()) {
            if (!ids.contains(edge.from()) || !ids.contains(edge.to())) {
                violations.add("edge " + edge.from() + " -> " + edge.to() + " references an unknown node");
            }
        }

        Set<Integer> reachable = reachableFrom(graph);
        boolean terminalReached = false;
        Map<Integer, Integer> loopBacks = new HashMap<>();
        for (FlatEdge edge : graph.edgesTagged(EdgeTag.LOOP_BACK)) {
            loopBacks.merge(edge.to(), 1, Integer::sum);
        }

        for (FlatNode node : graph.nodes()) {
            if (!reachable.contains(node.id())) {
                violations.add("node " + node.id() + " (" + node.kind().displayName() + ") is unreachable from Start");
            }
            if (node.kind() != NodeKind.START && graph.incoming(node.id()).isEmpty()) {
                violations.add("node " + node.id() + " (" + node.kind().displayName() + ") has no incoming edge");
            }
            if (node.kind().isTerminal() && reachable.contains(node.id())) {
                terminalReached = true;
            }
        }
        if (!terminalReached) {
            violations.add("no terminal node is reachable");
        }

        loopBacks.forEach((target, count) -> {
            FlatNode node = graph.node(target);
            if (node != null && !node.kind().isLoop()) {
                violations.add("loop_back edge targets " + node.kind().displayName() + " node " + target);
            }
            if (count > 1) {
                violations.add("loop node " + target + " has " + count + " loop_back edges");
            }
        });
        return violations;
    }

    /**
     * @throws IllegalStateException listing every violation
     */
    public static void requireValid(FlatGraph graph) {
        List<String> violations = check(graph);
        if (!violations.isEmpty()) {
            throw new IllegalStateException("Malformed graph: " + String.join("; ", violations));
        }
    }

    static Set<Integer> reachableFrom(FlatGraph graph) {
        Map<Integer, List<Integer>> successors = new HashMap<>();
        for (FlatEdge edge : graph.edges()) {
            successors.computeIfAbsent(edge.from(), k -> new ArrayList<>()).add(edge.to());
        }
        Set<Integer> seen = new HashSet<>();
        Deque<Integer> queue = new ArrayDeque<>();
        seen.add(graph.entryId());
        queue.add(graph.entryId());
        while (!queue.isEmpty()) {
            for (int next : successors.getOrDefault(queue.poll(), List.of())) {
                if (seen.add(next)) {
                    queue.add(next);
                }
            }
        }
        return seen;
    }
}
