package com.funcplan.plan;

import com.funcplan.syntax.FunctionCandidate;
import com.funcplan.syntax.HandlerDescriptor;
import com.funcplan.syntax.StatementDescriptor;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds the nested {@link FunctionPlan} of one function from its statement descriptors.
 *
 * <p>Ids come from a single counter per build, handed out in pre-order: a compound node gets its
 * id before any node of its sub-plans, sub-plans are numbered in child order, and {@code End}
 * is numbered last. Empty regions are filled with one pass-through node so every sub-plan has
 * an entry.
 */
public class PlanBuilder {

    public static final String UNSUPPORTED_PREFIX = "<unsupported: ";

    private final UnsupportedPolicy policy;

    public PlanBuilder() {
        this(UnsupportedPolicy.PLACEHOLDER);
    }

    public PlanBuilder(UnsupportedPolicy policy) {
        this.policy = policy;
    }

    public FunctionPlan build(FunctionCandidate function, List<StatementDescriptor> statements) {
        return build(function.name(), function.signature(), function.lineStart(), function.lineEnd(), statements);
    }

    /**
     * @throws UnsupportedConstructException under {@link UnsupportedPolicy#ABORT} only
     */
    public FunctionPlan build(String name, String signature, int lineStart, int lineEnd,
                              List<StatementDescriptor> statements) {
        BuildContext ctx = new BuildContext(policy);

        List<PlanNode> nodes = new ArrayList<>();
        nodes.add(new PlanNode(ctx.nextId(), NodeKind.START, name, "", lineStart, true, List.of()));
        nodes.addAll(buildSequence(statements, ctx));
        nodes.add(new PlanNode(ctx.nextId(), NodeKind.END, name, "", lineEnd, true, List.of()));

        return new FunctionPlan(name, signature, lineStart, lineEnd, new Plan(nodes), ctx.warnings());
    }

    private List<PlanNode> buildSequence(List<StatementDescriptor> statements, BuildContext ctx) {
        List<PlanNode> nodes = new ArrayList<>(statements.size());
        for (StatementDescriptor statement : statements) {
            nodes.add(buildNode(statement, ctx));
        }
        return nodes;
    }

    private Plan buildRegion(List<StatementDescriptor> statements, int line, BuildContext ctx) {
        if (statements.isEmpty()) {
            return new Plan(List.of(PlanNode.passThrough(ctx.nextId(), line)));
        }
        return new Plan(buildSequence(statements, ctx));
    }

    private PlanNode buildNode(StatementDescriptor s, BuildContext ctx) {
        return switch (s.kind()) {
            case PLAIN    -> leaf(NodeKind.STATEMENT, s, ctx);
            case CALL     -> leaf(NodeKind.CALL, s, ctx);
            case ASSIGN   -> leaf(NodeKind.ASSIGN, s, ctx);
            case RETURN   -> leaf(NodeKind.RETURN, s, ctx);
            case BREAK    -> leaf(NodeKind.BREAK, s, ctx);
            case CONTINUE -> leaf(NodeKind.CONTINUE, s, ctx);
            case RAISE    -> leaf(NodeKind.RAISE, s, ctx);
            case IF       -> buildIf(s, ctx);
            case FOR      -> buildLoop(NodeKind.FOR, s, ctx);
            case WHILE    -> buildLoop(NodeKind.WHILE, s, ctx);
            case TRY      -> buildTry(s, ctx);
            case UNSUPPORTED -> buildPlaceholder(s, ctx);
        };
    }

    private PlanNode leaf(NodeKind kind, StatementDescriptor s, BuildContext ctx) {
        return PlanNode.leaf(ctx.nextId(), kind, s.label(), s.text(), s.line());
    }

    private PlanNode buildIf(StatementDescriptor s, BuildContext ctx) {
        int id = ctx.nextId();
        Plan thenPlan = buildRegion(s.body(), s.line(), ctx);
        // a missing else still gets a region so both branches have the same shape
        Plan elsePlan = s.hasElse()
                ? buildRegion(s.elseBody(), s.line(), ctx)
                : buildRegion(List.of(), s.line(), ctx);
        return new PlanNode(id, NodeKind.IF, s.label(), s.text(), s.line(), false, List.of(
                new SubPlan(SubPlan.THEN, "", thenPlan),
                new SubPlan(SubPlan.ELSE, "", elsePlan)));
    }

    private PlanNode buildLoop(NodeKind kind, StatementDescriptor s, BuildContext ctx) {
        int id = ctx.nextId();
        Plan body = buildRegion(s.body(), s.line(), ctx);
        return new PlanNode(id, kind, s.label(), s.text(), s.line(), false,
                List.of(new SubPlan(SubPlan.BODY, "", body)));
    }

    private PlanNode buildTry(StatementDescriptor s, BuildContext ctx) {
        int id = ctx.nextId();
        List<SubPlan> children = new ArrayList<>();
        children.add(new SubPlan(SubPlan.TRY, "", buildRegion(s.body(), s.line(), ctx)));
        List<HandlerDescriptor> handlers = s.handlers();
        for (int i = 0; i < handlers.size(); i++) {
            HandlerDescriptor handler = handlers.get(i);
            children.add(new SubPlan(SubPlan.handlerName(i), handler.header(),
                    buildRegion(handler.body(), handler.line(), ctx)));
        }
        if (s.finallyBody() != null) {
            children.add(new SubPlan(SubPlan.FINALLY, "", buildRegion(s.finallyBody(), s.line(), ctx)));
        }
        return new PlanNode(id, NodeKind.TRY_EXCEPT, s.label(), s.text(), s.line(), false, children);
    }

    private PlanNode buildPlaceholder(StatementDescriptor s, BuildContext ctx) {
        if (ctx.policy() == UnsupportedPolicy.ABORT) {
            throw new UnsupportedConstructException(s.label(), s.line());
        }
        int id = ctx.nextId();
        String label = UNSUPPORTED_PREFIX + s.label() + ">";
        ctx.warn(id, s.line(), "unsupported construct " + s.label() + " replaced by a placeholder");
        return PlanNode.leaf(id, NodeKind.STATEMENT, label, s.text(), s.line());
    }
}
