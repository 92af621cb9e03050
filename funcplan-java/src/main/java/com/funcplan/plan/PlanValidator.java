package com.funcplan.plan;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Checks the structural invariants of a built {@link FunctionPlan}.
 */
public class PlanValidator {

    /**
     * @return human-readable violations, empty when the plan is well formed
     */
    public List<String> validate(FunctionPlan functionPlan) {
        List<String> violations = new ArrayList<>();
        List<PlanNode> top = functionPlan.plan().nodes();

        if (top.size() < 2) {
            violations.add("top-level plan must hold at least Start and End");
            return violations;
        }
        if (top.get(0).kind() != NodeKind.START) {
            violations.add("first top-level node is " + top.get(0).kind().displayName() + ", expected Start");
        }
        if (top.get(top.size() - 1).kind() != NodeKind.END) {
            violations.add("last top-level node is " + top.get(top.size() - 1).kind().displayName() + ", expected End");
        }

        List<PlanNode> all = functionPlan.plan().preOrder();
        long starts = all.stream().filter(n -> n.kind() == NodeKind.START).count();
        long ends = all.stream().filter(n -> n.kind() == NodeKind.END).count();
        if (starts != 1) violations.add("expected exactly one Start, found " + starts);
        if (ends != 1)   violations.add("expected exactly one End, found " + ends);
        if (all.stream().noneMatch(n -> n.kind().isTerminal())) {
            violations.add("plan has no terminal node");
        }

        Set<Integer> seen = new HashSet<>();
        int previous = Integer.MIN_VALUE;
        for (PlanNode node : all) {
            if (!seen.add(node.id())) {
                violations.add("duplicate id " + node.id());
            }
            if (node.id() <= previous) {
                violations.add("id " + node.id() + " does not increase in pre-order (after " + previous + ")");
            }
            previous = node.id();
            checkShape(node, violations);
        }
        return violations;
    }

    /**
     * @throws IllegalStateException listing every violation
     */
    public void requireValid(FunctionPlan functionPlan) {
        List<String> violations = validate(functionPlan);
        if (!violations.isEmpty()) {
            throw new IllegalStateException("Malformed plan for " + functionPlan.name() + ": "
                    + String.join("; ", violations));
        }
    }

    private void checkShape(PlanNode node, List<String> violations) {
        NodeKind kind = node.kind();
        if (kind == NodeKind.ANCHOR) {
            violations.add("node " + node.id() + " is an Anchor, which only exists in flattened graphs");
        }
        if (!kind.isCompound()) {
            if (!node.children().isEmpty()) {
                violations.add("leaf node " + node.id() + " (" + kind.displayName() + ") owns sub-plans");
            }
            return;
        }

        for (SubPlan sub : node.children()) {
            if (sub.plan().isEmpty()) {
                violations.add("sub-plan '" + sub.name() + "' of node " + node.id() + " is empty");
            }
            for (PlanNode inner : sub.plan().nodes()) {
                if (inner.kind() == NodeKind.START || inner.kind() == NodeKind.END) {
                    violations.add(inner.kind().displayName() + " node " + inner.id()
                            + " nested in sub-plan '" + sub.name() + "'");
                }
            }
        }

        switch (kind) {
            case IF -> {
                requireChild(node, SubPlan.THEN, violations);
                requireChild(node, SubPlan.ELSE, violations);
            }
            case FOR, WHILE -> requireChild(node, SubPlan.BODY, violations);
            case TRY_EXCEPT -> requireChild(node, SubPlan.TRY, violations);
            default -> { }
        }
    }

    private void requireChild(PlanNode node, String name, List<String> violations) {
        if (node.child(name) == null) {
            violations.add(node.kind().displayName() + " node " + node.id() + " has no '" + name + "' sub-plan");
        }
    }
}
