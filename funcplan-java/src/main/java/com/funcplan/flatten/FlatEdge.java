package com.funcplan.flatten;

import java.util.Objects;

public record FlatEdge(int from, int to, EdgeTag tag) {
    public FlatEdge {
        Objects.requireNonNull(tag, "tag");
    }
}
