package com.funcplan.plan;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-build state threaded through the recursive descent: the id counter and the warnings.
 */
final class BuildContext {

    private final UnsupportedPolicy policy;
    private final List<PlanWarning> warnings = new ArrayList<>();
    private int nextId = 0;

    BuildContext(UnsupportedPolicy policy) {
        this.policy = policy;
    }

    int nextId() {
        return nextId++;
    }

    UnsupportedPolicy policy() {
        return policy;
    }

    void warn(int nodeId, int line, String message) {
        warnings.add(new PlanWarning(nodeId, line, message));
        System.err.println("[funcplan] Warning: line " + line + ": " + message);
    }

    List<PlanWarning> warnings() {
        return warnings;
    }
}
