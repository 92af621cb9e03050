package com.funcplan.plan;

import java.util.List;

/**
 * The top-level plan of one function: {@code Start}, the body nodes, {@code End}.
 */
public record FunctionPlan(
        String name,
        String signature,
        int lineStart,
        int lineEnd,
        Plan plan,
        List<PlanWarning> warnings
) {
    public FunctionPlan {
        warnings = List.copyOf(warnings);
    }

    public PlanNode start() {
        return plan.nodes().get(0);
    }

    public PlanNode end() {
        return plan.nodes().get(plan.nodes().size() - 1);
    }

    /** Top-level nodes between Start and End. */
    public List<PlanNode> body() {
        List<PlanNode> nodes = plan.nodes();
        return nodes.size() <= 2 ? List.of() : nodes.subList(1, nodes.size() - 1);
    }

    public int maxId() {
        return plan.preOrder().stream().mapToInt(PlanNode::id).max().orElse(-1);
    }
}
