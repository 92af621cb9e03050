package com.funcplan.plan;

import java.util.Objects;

/**
 * A named region owned by a compound node: {@code then}, {@code else}, {@code body},
 * {@code try}, {@code handler[i]} or {@code finally}.
 *
 * @param header extra text for the region, e.g. the caught declaration of a handler; empty otherwise
 */
public record SubPlan(String name, String header, Plan plan) {
    public static final String THEN = "then";
    public static final String ELSE = "else";
    public static final String BODY = "body";
    public static final String TRY = "try";
    public static final String FINALLY = "finally";

    public SubPlan {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(plan, "plan");
        header = header == null ? "" : header;
    }

    public static String handlerName(int index) {
        return "handler[" + index + "]";
    }

    public boolean isHandler() {
        return name.startsWith("handler[");
    }
}
