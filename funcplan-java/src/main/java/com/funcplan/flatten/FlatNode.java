package com.funcplan.flatten;

import com.funcplan.plan.NodeKind;

import java.util.Objects;

public record FlatNode(int id, NodeKind kind, String label, int line, boolean synthetic) {
    public FlatNode {
        Objects.requireNonNull(kind, "kind");
        label = label == null ? "" : label;
    }
}
