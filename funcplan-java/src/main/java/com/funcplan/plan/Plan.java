package com.funcplan.plan;

import java.util.ArrayList;
import java.util.List;

/**
 * An ordered, single-entry/single-exit sequence of plan nodes.
 */
public record Plan(List<PlanNode> nodes) {
    public Plan {
        nodes = List.copyOf(nodes);
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    public PlanNode entry() {
        return nodes.isEmpty() ? null : nodes.get(0);
    }

    /** Every node of this plan and its sub-plans, in pre-order. */
    public List<PlanNode> preOrder() {
        List<PlanNode> result = new ArrayList<>();
        collect(this, result);
        return result;
    }

    private static void collect(Plan plan, List<PlanNode> out) {
        for (PlanNode node : plan.nodes) {
            out.add(node);
            for (SubPlan child : node.children()) {
                collect(child.plan(), out);
            }
        }
    }
}
