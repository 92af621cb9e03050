package com.funcplan;

import com.funcplan.flatten.EdgeTag;
import com.funcplan.flatten.FlatEdge;
import com.funcplan.flatten.FlatGraph;
import com.funcplan.flatten.FlatNode;
import com.funcplan.flatten.Flattener;
import com.funcplan.flatten.GraphChecks;
import com.funcplan.plan.FunctionPlan;
import com.funcplan.plan.NodeKind;
import com.funcplan.plan.PlanBuilder;
import com.funcplan.syntax.StatementDescriptor;
import com.funcplan.syntax.StatementKind;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static com.funcplan.PlanFixtures.graphOf;
import static com.funcplan.PlanFixtures.planOf;
import static com.funcplan.PlanFixtures.single;
import static org.junit.jupiter.api.Assertions.*;

class FlattenerTest {

    private static FlatEdge edge(int from, int to, EdgeTag tag) {
        return new FlatEdge(from, to, tag);
    }

    @Test
    void ifElseWithReturnsInBothBranchesNeedsNoMergeAnchor() {
        FlatGraph graph = graphOf("if (x > 0) { return 1; } else { return 2; }");

        assertEquals(Set.of(
                edge(0, 1, EdgeTag.SEQ),
                edge(1, 2, EdgeTag.TRUE),
                edge(1, 3, EdgeTag.FALSE),
                edge(2, 4, EdgeTag.SEQ),
                edge(3, 4, EdgeTag.SEQ)), Set.copyOf(graph.edges()));
        assertEquals(2, graph.nodesOfKind(NodeKind.RETURN).size());
        assertEquals(1, graph.nodesOfKind(NodeKind.END).size());
        assertTrue(graph.nodesOfKind(NodeKind.ANCHOR).isEmpty());
    }

    @Test
    void countedLoopHasOneBackEdgeAndExitsToEnd() {
        FlatGraph graph = graphOf("for (int i = 0; i < n; i++) { doSomething(i); }");

        FlatNode loop = graph.nodesOfKind(NodeKind.FOR).get(0);
        FlatNode call = single(graph, NodeKind.CALL, "doSomething");
        FlatNode end = graph.nodesOfKind(NodeKind.END).get(0);
        assertEquals(Set.of(
                edge(0, loop.id(), EdgeTag.SEQ),
                edge(loop.id(), call.id(), EdgeTag.LOOP_BODY),
                edge(call.id(), loop.id(), EdgeTag.LOOP_BACK),
                edge(loop.id(), end.id(), EdgeTag.LOOP_EXIT)), Set.copyOf(graph.edges()));
        assertEquals(1, graph.edgesTagged(EdgeTag.LOOP_BACK).size());
    }

    @Test
    void ifWithoutElseRoutesFalseBranchThroughPassNode() {
        FlatGraph graph = graphOf("if (x > 0) { log(x); }\ndone();");

        FlatNode ifNode = graph.nodesOfKind(NodeKind.IF).get(0);
        List<FlatEdge> falseEdges = graph.outgoing(ifNode.id()).stream()
                .filter(e -> e.tag() == EdgeTag.FALSE).toList();
        assertEquals(1, falseEdges.size());

        FlatNode pass = graph.node(falseEdges.get(0).to());
        assertEquals(NodeKind.STATEMENT, pass.kind());
        assertTrue(pass.synthetic());

        List<FlatEdge> fromPass = graph.outgoing(pass.id());
        assertEquals(1, fromPass.size());
        assertEquals(EdgeTag.SEQ, fromPass.get(0).tag());
        FlatNode merge = graph.node(fromPass.get(0).to());
        assertEquals(NodeKind.ANCHOR, merge.kind());
        assertEquals(Flattener.MERGE_LABEL, merge.label());

        FlatNode log = single(graph, NodeKind.CALL, "log");
        FlatNode done = single(graph, NodeKind.CALL, "done");
        assertTrue(graph.edges().contains(edge(log.id(), merge.id(), EdgeTag.SEQ)));
        assertTrue(graph.edges().contains(edge(merge.id(), done.id(), EdgeTag.SEQ)));
    }

    @Test
    void breakAndContinueMeetOnLoopAnchors() {
        FlatGraph graph = graphOf(
                "for (String s : items) {\n"
                + "  if (s.isEmpty()) { continue; }\n"
                + "  if (s.equals(\"end\")) { break; }\n"
                + "  handle(s);\n"
                + "}\n"
                + "finish();");
        GraphChecks.requireValid(graph);

        FlatNode loop = graph.nodesOfKind(NodeKind.FOR).get(0);
        FlatNode latch = single(graph, NodeKind.ANCHOR, Flattener.CONTINUE_LABEL);
        FlatNode after = single(graph, NodeKind.ANCHOR, Flattener.LOOP_EXIT_LABEL);
        FlatNode jumpBack = graph.nodesOfKind(NodeKind.CONTINUE).get(0);
        FlatNode jumpOut = graph.nodesOfKind(NodeKind.BREAK).get(0);
        FlatNode handle = single(graph, NodeKind.CALL, "handle");
        FlatNode finish = single(graph, NodeKind.CALL, "finish");

        assertEquals(List.of(edge(latch.id(), loop.id(), EdgeTag.LOOP_BACK)), graph.edgesTagged(EdgeTag.LOOP_BACK));
        assertTrue(graph.edges().contains(edge(jumpBack.id(), latch.id(), EdgeTag.SEQ)));
        assertTrue(graph.edges().contains(edge(handle.id(), latch.id(), EdgeTag.SEQ)));
        assertTrue(graph.edges().contains(edge(loop.id(), after.id(), EdgeTag.LOOP_EXIT)));
        assertTrue(graph.edges().contains(edge(jumpOut.id(), after.id(), EdgeTag.SEQ)));
        assertTrue(graph.edges().contains(edge(after.id(), finish.id(), EdgeTag.SEQ)));
        assertEquals(1, graph.outgoing(jumpOut.id()).size());
        assertEquals(1, graph.outgoing(jumpBack.id()).size());
    }

    @Test
    void tryBodyNodesRaiseIntoEveryHandler() {
        FlatGraph graph = graphOf(
                "try {\n"
                + "  risky();\n"
                + "  more();\n"
                + "} catch (IOException e) {\n"
                + "  recover(e);\n"
                + "} catch (RuntimeException e) {\n"
                + "  log(e);\n"
                + "} finally {\n"
                + "  close();\n"
                + "}");
        GraphChecks.requireValid(graph);

        FlatNode tryNode = graph.nodesOfKind(NodeKind.TRY_EXCEPT).get(0);
        FlatNode risky = single(graph, NodeKind.CALL, "risky");
        FlatNode more = single(graph, NodeKind.CALL, "more");
        FlatNode recover = single(graph, NodeKind.CALL, "recover");
        FlatNode log = single(graph, NodeKind.CALL, "log");
        FlatNode close = single(graph, NodeKind.CALL, "close");
        FlatNode merge = single(graph, NodeKind.ANCHOR, Flattener.MERGE_LABEL);
        FlatNode end = graph.nodesOfKind(NodeKind.END).get(0);

        assertEquals(Set.of(
                edge(risky.id(), recover.id(), EdgeTag.EXCEPTION),
                edge(more.id(), recover.id(), EdgeTag.EXCEPTION),
                edge(risky.id(), log.id(), EdgeTag.EXCEPTION),
                edge(more.id(), log.id(), EdgeTag.EXCEPTION)),
                Set.copyOf(graph.edgesTagged(EdgeTag.EXCEPTION)));
        assertTrue(graph.edges().contains(edge(tryNode.id(), risky.id(), EdgeTag.SEQ)));
        assertTrue(graph.edges().contains(edge(more.id(), merge.id(), EdgeTag.SEQ)));
        assertTrue(graph.edges().contains(edge(recover.id(), merge.id(), EdgeTag.SEQ)));
        assertTrue(graph.edges().contains(edge(log.id(), merge.id(), EdgeTag.SEQ)));
        assertTrue(graph.edges().contains(edge(merge.id(), close.id(), EdgeTag.SEQ)));
        assertTrue(graph.edges().contains(edge(close.id(), end.id(), EdgeTag.SEQ)));
    }

    @Test
    void loopEndingInNestedLoopStillHasSingleBackEdge() {
        FlatGraph graph = graphOf(
                "while (x > 0) {\n"
                + "  x--;\n"
                + "  for (int i = 0; i < n; i++) { step(i); }\n"
                + "}");
        GraphChecks.requireValid(graph);

        FlatNode outer = graph.nodesOfKind(NodeKind.WHILE).get(0);
        FlatNode inner = graph.nodesOfKind(NodeKind.FOR).get(0);
        FlatNode next = single(graph, NodeKind.ANCHOR, Flattener.NEXT_ITERATION_LABEL);

        assertTrue(graph.edges().contains(edge(inner.id(), next.id(), EdgeTag.LOOP_EXIT)));
        assertEquals(List.of(edge(next.id(), outer.id(), EdgeTag.LOOP_BACK)),
                graph.incoming(outer.id()).stream().filter(e -> e.tag() == EdgeTag.LOOP_BACK).toList());
        assertEquals(1, graph.incoming(inner.id()).stream().filter(e -> e.tag() == EdgeTag.LOOP_BACK).count());
    }

    @Test
    void raiseHasNoSuccessor() {
        FlatGraph graph = graphOf("if (x < 0) { throw new IllegalArgumentException(\"neg\"); }\ngo();");
        GraphChecks.requireValid(graph);

        FlatNode raise = graph.nodesOfKind(NodeKind.RAISE).get(0);
        assertTrue(graph.outgoing(raise.id()).isEmpty());
        FlatNode merge = single(graph, NodeKind.ANCHOR, Flattener.MERGE_LABEL);
        assertEquals(1, graph.incoming(merge.id()).size());
    }

    @Test
    void emptyBodyConnectsStartToEnd() {
        FlatGraph graph = graphOf("");
        assertEquals(List.of(edge(0, 1, EdgeTag.SEQ)), graph.edges());
        assertEquals(2, graph.nodes().size());
    }

    @Test
    void codeAfterReturnIsPruned() {
        FunctionPlan plan = new PlanBuilder().build("dead", "dead()", 1, 4, List.of(
                StatementDescriptor.simple(StatementKind.RETURN, 2, "1", "return 1"),
                StatementDescriptor.simple(StatementKind.CALL, 3, "never", "never()")));
        FlatGraph graph = new Flattener().flatten(plan);

        assertTrue(graph.nodesOfKind(NodeKind.CALL).isEmpty());
        assertEquals(Set.of(edge(0, 1, EdgeTag.SEQ), edge(1, 3, EdgeTag.SEQ)), Set.copyOf(graph.edges()));
        GraphChecks.requireValid(graph);
    }

    @Test
    void labelledJumpsTargetTheNamedLoop() {
        FlatGraph graph = graphOf(
                "outer:\n"
                + "for (String s : items) {\n"
                + "  for (int i = 0; i < n; i++) {\n"
                + "    if (s.isEmpty()) { continue outer; }\n"
                + "    if (i > x) { break outer; }\n"
                + "    step(i);\n"
                + "  }\n"
                + "}\n"
                + "finish();");
        GraphChecks.requireValid(graph);

        FlatNode outer = single(graph, NodeKind.FOR, "s : items");
        FlatNode inner = single(graph, NodeKind.FOR, "int i = 0; i < n; i++");
        FlatNode latch = single(graph, NodeKind.ANCHOR, Flattener.CONTINUE_LABEL);
        FlatNode after = single(graph, NodeKind.ANCHOR, Flattener.LOOP_EXIT_LABEL);
        FlatNode jumpBack = single(graph, NodeKind.CONTINUE, "continue outer");
        FlatNode jumpOut = single(graph, NodeKind.BREAK, "break outer");
        FlatNode step = single(graph, NodeKind.CALL, "step");
        FlatNode finish = single(graph, NodeKind.CALL, "finish");

        assertEquals(List.of(edge(jumpBack.id(), latch.id(), EdgeTag.SEQ)), graph.outgoing(jumpBack.id()));
        assertEquals(List.of(edge(jumpOut.id(), after.id(), EdgeTag.SEQ)), graph.outgoing(jumpOut.id()));
        assertTrue(graph.edges().contains(edge(latch.id(), outer.id(), EdgeTag.LOOP_BACK)));
        assertTrue(graph.edges().contains(edge(inner.id(), latch.id(), EdgeTag.LOOP_EXIT)));
        assertTrue(graph.edges().contains(edge(outer.id(), after.id(), EdgeTag.LOOP_EXIT)));
        assertTrue(graph.edges().contains(edge(after.id(), finish.id(), EdgeTag.SEQ)));
        assertEquals(List.of(edge(step.id(), inner.id(), EdgeTag.LOOP_BACK)),
                graph.incoming(inner.id()).stream().filter(e -> e.tag() == EdgeTag.LOOP_BACK).toList());
    }

    @Test
    void jumpToUnknownLabelIsSequential() {
        FunctionPlan plan = new PlanBuilder().build("stray", "stray()", 1, 4, List.of(
                StatementDescriptor.loop(StatementKind.WHILE, 2, "busy()", "outer: while (busy())", List.of(
                        StatementDescriptor.simple(StatementKind.BREAK, 3, "break missing", "break missing")))));
        FlatGraph graph = new Flattener().flatten(plan);

        assertEquals(Set.of(
                edge(0, 1, EdgeTag.SEQ),
                edge(1, 2, EdgeTag.LOOP_BODY),
                edge(2, 1, EdgeTag.LOOP_BACK),
                edge(1, 3, EdgeTag.LOOP_EXIT)), Set.copyOf(graph.edges()));
    }

    @Test
    void jumpOutOfTryLeavesFinallyBehind() {
        FunctionPlan plan = planOf("while (x > 0) { try { continue; } finally { a(); } }");
        FlatGraph graph = new Flattener().flatten(plan);
        GraphChecks.requireValid(graph);

        FlatNode jump = graph.nodesOfKind(NodeKind.CONTINUE).get(0);
        FlatNode latch = single(graph, NodeKind.ANCHOR, Flattener.CONTINUE_LABEL);
        assertEquals(List.of(edge(jump.id(), latch.id(), EdgeTag.SEQ)), graph.outgoing(jump.id()));
        assertTrue(graph.nodesOfKind(NodeKind.CALL).isEmpty());
        assertEquals(1, plan.plan().preOrder().stream().filter(n -> n.kind() == NodeKind.CALL).count());
    }

    @Test
    void breakOutsideLoopIsSequential() {
        FunctionPlan plan = new PlanBuilder().build("stray", "stray()", 1, 4, List.of(
                StatementDescriptor.simple(StatementKind.BREAK, 2, "break", "break"),
                StatementDescriptor.simple(StatementKind.CALL, 3, "after", "after()")));
        FlatGraph graph = new Flattener().flatten(plan);

        assertEquals(Set.of(
                edge(0, 1, EdgeTag.SEQ),
                edge(1, 2, EdgeTag.SEQ),
                edge(2, 3, EdgeTag.SEQ)), Set.copyOf(graph.edges()));
    }

    @Test
    void anchorIdsContinueAfterPlanIds() {
        FunctionPlan plan = planOf("if (x > 0) { a(); } else { b(); }\nwhile (n > 0) { if (x > n) break; n--; }");
        FlatGraph graph = new Flattener().flatten(plan);

        int maxPlanId = plan.maxId();
        List<FlatNode> anchors = graph.nodesOfKind(NodeKind.ANCHOR);
        assertFalse(anchors.isEmpty());
        for (FlatNode anchor : anchors) {
            assertTrue(anchor.id() > maxPlanId, "anchor " + anchor.id() + " collides with plan ids");
            assertTrue(anchor.synthetic());
        }
        List<Integer> ids = graph.nodes().stream().map(FlatNode::id).toList();
        assertEquals(ids.stream().sorted().toList(), ids, "nodes sorted by id");
    }

    @Test
    void everyShapeHasOneStartAndReachableTerminal() {
        List<String> bodies = List.of(
                "",
                "a();",
                "return;",
                "throw new IllegalStateException();",
                "if (x > 0) { a(); }",
                "if (x > 0) { return 1; } else if (x < 0) { return -1; } else { b(); }",
                "for (int i = 0; i < n; i++) { }",
                "while (true) { if (x > n) { break; } x++; }",
                "do { x--; } while (x > 0);",
                "for (String s : items) { for (char c : s.toCharArray()) { if (c == 'x') continue; use(c); } }",
                "try { a(); } catch (Exception e) { }",
                "try { return 1; } catch (Exception e) { throw new RuntimeException(e); }",
                "try { a(); } finally { b(); }",
                "while (x > 0) { try { if (x == 3) break; step(); } catch (RuntimeException e) { continue; } x--; }",
                "synchronized (this) { a(); }\nreturn;",
                "for (;;) { if (x > 0) return 1; }");
        for (String body : bodies) {
            FlatGraph graph = graphOf(body);
            assertEquals(List.of(), GraphChecks.check(graph), "violations for: " + body);
            assertEquals(1, graph.nodesOfKind(NodeKind.START).size(), body);
            assertTrue(graph.nodes().stream().anyMatch(n -> n.kind().isTerminal()), body);
        }
    }
}
