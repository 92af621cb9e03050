package com.funcplan.render;

import com.funcplan.plan.FunctionPlan;
import com.funcplan.plan.Plan;
import com.funcplan.plan.PlanBuilder;
import com.funcplan.plan.PlanNode;
import com.funcplan.plan.SubPlan;

/**
 * Renders a {@link FunctionPlan} as indented pseudocode, two spaces per nesting level.
 */
public class PseudocodeRenderer {

    private static final String INDENT = "  ";

    public String render(FunctionPlan functionPlan) {
        StringBuilder out = new StringBuilder();
        line(out, 0, "FUNCTION " + functionPlan.signature());
        for (PlanNode node : functionPlan.body()) {
            renderNode(out, node, 1);
        }
        line(out, 0, "END FUNCTION");
        return out.toString();
    }

    private void renderPlan(StringBuilder out, Plan plan, int depth) {
        for (PlanNode node : plan.nodes()) {
            renderNode(out, node, depth);
        }
    }

    private void renderNode(StringBuilder out, PlanNode node, int depth) {
        switch (node.kind()) {
            case STATEMENT -> line(out, depth, statementLine(node));
            case CALL      -> line(out, depth, "CALL " + textOf(node));
            case ASSIGN    -> line(out, depth, "SET " + textOf(node));
            case RETURN    -> line(out, depth, "return".equals(node.label()) ? "RETURN" : "RETURN " + node.label());
            case BREAK     -> line(out, depth, "BREAK" + jumpTarget(node.label(), "break"));
            case CONTINUE  -> line(out, depth, "CONTINUE" + jumpTarget(node.label(), "continue"));
            case RAISE     -> line(out, depth, "RAISE " + node.label());
            case IF        -> renderIf(out, node, depth);
            case FOR       -> renderLoop(out, node, depth, "FOR", "END FOR");
            case WHILE     -> renderLoop(out, node, depth, "WHILE", "END WHILE");
            case TRY_EXCEPT -> renderTry(out, node, depth);
            case START, END, ANCHOR -> { }
        }
    }

    private void renderIf(StringBuilder out, PlanNode node, int depth) {
        line(out, depth, "IF " + node.label());
        renderPlan(out, node.child(SubPlan.THEN), depth + 1);
        Plan elsePlan = node.child(SubPlan.ELSE);
        if (!isSynthesizedElse(elsePlan)) {
            line(out, depth, "ELSE");
            renderPlan(out, elsePlan, depth + 1);
        }
        line(out, depth, "END IF");
    }

    private void renderLoop(StringBuilder out, PlanNode node, int depth, String open, String close) {
        String name = node.loopName();
        line(out, depth, (name == null ? "" : name + ": ") + open + " " + node.label());
        renderPlan(out, node.child(SubPlan.BODY), depth + 1);
        line(out, depth, close);
    }

    private void renderTry(StringBuilder out, PlanNode node, int depth) {
        String label = node.label();
        line(out, depth, label.startsWith("try") ? "TRY" + label.substring(3) : "TRY");
        renderPlan(out, node.child(SubPlan.TRY), depth + 1);
        for (SubPlan handler : node.handlers()) {
            line(out, depth, handler.header().isEmpty() ? "EXCEPT" : "EXCEPT " + handler.header());
            renderPlan(out, handler.plan(), depth + 1);
        }
        Plan finallyPlan = node.child(SubPlan.FINALLY);
        if (finallyPlan != null) {
            line(out, depth, "FINALLY");
            renderPlan(out, finallyPlan, depth + 1);
        }
        line(out, depth, "END TRY");
    }

    private String statementLine(PlanNode node) {
        if (node.isPassThrough()) {
            return "PASS";
        }
        if (node.label().startsWith(PlanBuilder.UNSUPPORTED_PREFIX)) {
            return "# " + node.label();
        }
        return textOf(node);
    }

    private static boolean isSynthesizedElse(Plan elsePlan) {
        return elsePlan == null
                || (elsePlan.nodes().size() == 1 && elsePlan.nodes().get(0).isPassThrough());
    }

    /** {@code "break outer"} becomes {@code " outer"}; a bare keyword has no target. */
    private static String jumpTarget(String label, String keyword) {
        String target = label.startsWith(keyword) ? label.substring(keyword.length()).trim() : "";
        return target.isEmpty() ? "" : " " + target;
    }

    private static String textOf(PlanNode node) {
        return node.text().isEmpty() ? node.label() : node.text();
    }

    private static void line(StringBuilder out, int depth, String content) {
        out.append(INDENT.repeat(depth)).append(content).append('\n');
    }
}
