package com.funcplan;

import com.funcplan.flatten.FlatGraph;
import com.funcplan.flatten.FlatNode;
import com.funcplan.flatten.Flattener;
import com.funcplan.plan.FunctionPlan;
import com.funcplan.plan.NodeKind;
import com.funcplan.plan.PlanBuilder;
import com.funcplan.syntax.ParsedFunction;
import com.funcplan.syntax.SourceAnalyzer;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Shared sources and shortcuts for tests that need a plan or a graph.
 */
final class PlanFixtures {

    static final Path FIXTURE_ROOT = Paths.get(
            System.getProperty("user.dir"),
            "..", "test-fixtures", "sample-functions").normalize();

    static final Path ORDER_WORKFLOW = FIXTURE_ROOT.resolve("src/main/java/com/funcplan/fixture/OrderWorkflow.java");
    static final Path SELECTION = FIXTURE_ROOT.resolve("src/main/java/com/funcplan/fixture/Selection.java");
    static final Path BROKEN = FIXTURE_ROOT.resolve("invalid/Broken.java");

    private PlanFixtures() {}

    /** Wraps {@code body} in {@code void target(int x, int n, List<String> items)} of class Sample. */
    static String methodSource(String body) {
        return "import java.util.List;\n"
                + "class Sample {\n"
                + "    void target(int x, int n, List<String> items) {\n"
                + body + "\n"
                + "    }\n"
                + "}\n";
    }

    static ParsedFunction analyze(String body) {
        return new SourceAnalyzer().analyze(methodSource(body), "Sample.java", "target");
    }

    static FunctionPlan planOf(String body) {
        ParsedFunction parsed = analyze(body);
        return new PlanBuilder().build(parsed.function(), parsed.statements());
    }

    static FlatGraph graphOf(String body) {
        return new Flattener().flatten(planOf(body));
    }

    static List<FlatNode> nodesLabelled(FlatGraph graph, NodeKind kind, String label) {
        return graph.nodesOfKind(kind).stream()
                .filter(n -> n.label().equals(label))
                .collect(Collectors.toList());
    }

    static FlatNode single(FlatGraph graph, NodeKind kind, String label) {
        List<FlatNode> matches = nodesLabelled(graph, kind, label);
        if (matches.size() != 1) {
            throw new AssertionError("expected one " + kind.displayName() + " '" + label + "', found " + matches.size());
        }
        return matches.get(0);
    }
}
