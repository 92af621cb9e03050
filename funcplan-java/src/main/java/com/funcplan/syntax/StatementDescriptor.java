package com.funcplan.syntax;

import java.util.List;
import java.util.Objects;

/**
 * Typed, source-independent view of one statement of a function body.
 *
 * <p>Compound kinds carry their nested statement lists:
 * <ul>
 *   <li>{@code IF}: {@code body} is the then-branch, {@code elseBody} the else-branch or {@code null}</li>
 *   <li>{@code FOR} / {@code WHILE}: {@code body} is the loop body</li>
 *   <li>{@code TRY}: {@code body} is the try block, {@code handlers} the catch clauses,
 *       {@code finallyBody} the finally block or {@code null}</li>
 * </ul>
 * For {@code UNSUPPORTED} the label holds the syntax node type name.
 */
public record StatementDescriptor(
        StatementKind kind,
        int line,
        String label,
        String text,
        List<StatementDescriptor> body,
        List<StatementDescriptor> elseBody,
        List<HandlerDescriptor> handlers,
        List<StatementDescriptor> finallyBody
) {
    public StatementDescriptor {
        Objects.requireNonNull(kind, "kind");
        label = label == null ? "" : label;
        text = text == null ? "" : text;
        body = body == null ? List.of() : List.copyOf(body);
        elseBody = elseBody == null ? null : List.copyOf(elseBody);
        handlers = handlers == null ? List.of() : List.copyOf(handlers);
        finallyBody = finallyBody == null ? null : List.copyOf(finallyBody);
    }

    public static StatementDescriptor simple(StatementKind kind, int line, String label, String text) {
        return new StatementDescriptor(kind, line, label, text, null, null, null, null);
    }

    public static StatementDescriptor ifStatement(int line, String condition, String text,
                                                  List<StatementDescriptor> thenBody,
                                                  List<StatementDescriptor> elseBody) {
        return new StatementDescriptor(StatementKind.IF, line, condition, text, thenBody, elseBody, null, null);
    }

    public static StatementDescriptor loop(StatementKind kind, int line, String header, String text,
                                           List<StatementDescriptor> body) {
        if (kind != StatementKind.FOR && kind != StatementKind.WHILE) {
            throw new IllegalArgumentException("Not a loop kind: " + kind);
        }
        return new StatementDescriptor(kind, line, header, text, body, null, null, null);
    }

    public static StatementDescriptor tryStatement(int line, String label, String text,
                                                   List<StatementDescriptor> tryBody,
                                                   List<HandlerDescriptor> handlers,
                                                   List<StatementDescriptor> finallyBody) {
        return new StatementDescriptor(StatementKind.TRY, line, label, text, tryBody, null, handlers, finallyBody);
    }

    public static StatementDescriptor unsupported(String nodeType, int line, String text) {
        return new StatementDescriptor(StatementKind.UNSUPPORTED, line, nodeType, text, null, null, null, null);
    }

    public boolean hasElse() {
        return elseBody != null;
    }
}
