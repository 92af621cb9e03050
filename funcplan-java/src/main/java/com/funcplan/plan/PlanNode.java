package com.funcplan.plan;

import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One unit of plan structure. Compound kinds own their sub-plans; leaves have none.
 *
 * @param text      normalized source text, empty for synthesized nodes
 * @param synthetic true for nodes invented by the builder (Start, End, pass-through)
 */
public record PlanNode(
        int id,
        NodeKind kind,
        String label,
        String text,
        int line,
        boolean synthetic,
        List<SubPlan> children
) {
    public static final String PASS_LABEL = "pass";

    private static final Pattern STATEMENT_LABEL =
            Pattern.compile("^(\\p{javaJavaIdentifierStart}\\p{javaJavaIdentifierPart}*)\\s*:(?!:)");

    public PlanNode {
        Objects.requireNonNull(kind, "kind");
        label = label == null ? "" : label;
        text = text == null ? "" : text;
        children = children == null ? List.of() : List.copyOf(children);
    }

    public static PlanNode leaf(int id, NodeKind kind, String label, String text, int line) {
        return new PlanNode(id, kind, label, text, line, false, List.of());
    }

    public static PlanNode passThrough(int id, int line) {
        return new PlanNode(id, NodeKind.STATEMENT, PASS_LABEL, "", line, true, List.of());
    }

    public boolean isPassThrough() {
        return synthetic && kind == NodeKind.STATEMENT;
    }

    /**
     * The Java statement label of a labelled loop, {@code outer} for {@code outer: for (...)},
     * or {@code null}.
     */
    public String loopName() {
        if (kind != NodeKind.FOR && kind != NodeKind.WHILE) {
            return null;
        }
        Matcher m = STATEMENT_LABEL.matcher(text);
        return m.find() ? m.group(1) : null;
    }

    /** The sub-plan called {@code name}, or {@code null}. */
    public Plan child(String name) {
        for (SubPlan sub : children) {
            if (sub.name().equals(name)) {
                return sub.plan();
            }
        }
        return null;
    }

    public List<SubPlan> handlers() {
        return children.stream().filter(SubPlan::isHandler).toList();
    }
}
