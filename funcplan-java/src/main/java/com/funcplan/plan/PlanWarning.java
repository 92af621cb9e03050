package com.funcplan.plan;

/**
 * Non-fatal finding recorded while building a plan.
 */
public record PlanWarning(int nodeId, int line, String message) {}
