package com.funcplan.flatten;

import com.funcplan.plan.FunctionPlan;
import com.funcplan.plan.NodeKind;
import com.funcplan.plan.Plan;
import com.funcplan.plan.PlanNode;
import com.funcplan.plan.SubPlan;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Turns a nested {@link FunctionPlan} into a {@link FlatGraph}.
 *
 * <p>Each region is flattened bottom-up into an entry node and at most one dangling exit, which
 * the enclosing sequence wires to whatever follows. Anchors are synthesized only where paths
 * actually merge; their ids continue after the highest plan id. Nodes that end up unreachable
 * from {@code Start} are dropped at the end.
 */
public class Flattener {

    public static final String MERGE_LABEL = "merge";
    public static final String LOOP_EXIT_LABEL = "loop exit";
    public static final String CONTINUE_LABEL = "continue";
    public static final String NEXT_ITERATION_LABEL = "next iteration";

    public FlatGraph flatten(FunctionPlan functionPlan) {
        Wiring wiring = new Wiring(functionPlan.maxId() + 1);
        PlanNode start = functionPlan.start();
        PlanNode end = functionPlan.end();

        wiring.add(start);
        Region body = flattenSequence(functionPlan.body(), new Scope(end.id(), null), wiring);
        wiring.add(end);

        if (body == null) {
            wiring.edge(start.id(), end.id(), EdgeTag.SEQ);
        } else {
            wiring.edge(start.id(), body.entry(), EdgeTag.SEQ);
            if (body.exit() != null) {
                wiring.connect(body.exit(), end.id());
            }
        }
        return prune(start.id(), wiring);
    }

    /** A flattened region: where control enters, and the dangling way out ({@code null} if none). */
    private record Region(int entry, Exit exit) {}

    /** An edge waiting for its target. */
    private record Exit(int from, EdgeTag tag) {}

    /** Targets threaded down the recursion. */
    private record Scope(int endId, LoopFrame loop) {}

    private static final class LoopFrame {
        final int loopId;
        final String name;
        final LoopFrame outer;
        final List<Integer> breaks = new ArrayList<>();
        final List<Integer> continues = new ArrayList<>();

        LoopFrame(int loopId, String name, LoopFrame outer) {
            this.loopId = loopId;
            this.name = name;
            this.outer = outer;
        }

        /** The innermost frame for a bare jump, else the frame whose loop carries {@code target}. */
        LoopFrame resolve(String target) {
            if (target.isEmpty()) {
                return this;
            }
            for (LoopFrame frame = this; frame != null; frame = frame.outer) {
                if (target.equals(frame.name)) {
                    return frame;
                }
            }
            return null;
        }
    }

    private Region flattenSequence(List<PlanNode> nodes, Scope scope, Wiring wiring) {
        Integer entry = null;
        Exit pending = null;
        for (PlanNode node : nodes) {
            Region region = flattenNode(node, scope, wiring);
            if (entry == null) {
                entry = region.entry();
            } else if (pending != null) {
                wiring.connect(pending, region.entry());
            }
            // a null pending exit leaves the next region without predecessors; prune() removes it
            pending = region.exit();
        }
        return entry == null ? null : new Region(entry, pending);
    }

    private Region flattenNode(PlanNode node, Scope scope, Wiring wiring) {
        return switch (node.kind()) {
            case STATEMENT, CALL, ASSIGN -> {
                wiring.add(node);
                yield new Region(node.id(), new Exit(node.id(), EdgeTag.SEQ));
            }
            case RETURN -> {
                wiring.add(node);
                wiring.edge(node.id(), scope.endId(), EdgeTag.SEQ);
                yield new Region(node.id(), null);
            }
            case RAISE -> {
                wiring.add(node);
                yield new Region(node.id(), null);
            }
            case BREAK, CONTINUE -> flattenJump(node, scope, wiring);
            case IF -> flattenIf(node, scope, wiring);
            case FOR, WHILE -> flattenLoop(node, scope, wiring);
            case TRY_EXCEPT -> flattenTry(node, scope, wiring);
            case START, END, ANCHOR -> throw new IllegalStateException(
                    node.kind().displayName() + " node " + node.id() + " inside a function body");
        };
    }

    private Region flattenJump(PlanNode node, Scope scope, Wiring wiring) {
        wiring.add(node);
        LoopFrame loop = scope.loop() == null ? null : scope.loop().resolve(jumpTarget(node));
        if (loop == null) {
            System.err.println("[funcplan] Warning: line " + node.line() + ": "
                    + node.label() + " outside a matching loop, treated as a plain statement");
            return new Region(node.id(), new Exit(node.id(), EdgeTag.SEQ));
        }
        if (node.kind() == NodeKind.BREAK) {
            loop.breaks.add(node.id());
        } else {
            loop.continues.add(node.id());
        }
        return new Region(node.id(), null);
    }

    /** {@code "break outer"} targets {@code outer}; a bare keyword targets the innermost loop. */
    private static String jumpTarget(PlanNode node) {
        String label = node.label().trim();
        int space = label.indexOf(' ');
        return space < 0 ? "" : label.substring(space + 1).trim();
    }

    private Region flattenIf(PlanNode node, Scope scope, Wiring wiring) {
        wiring.add(node);
        Region thenRegion = flattenSequence(regionOf(node, SubPlan.THEN), scope, wiring);
        Region elseRegion = flattenSequence(regionOf(node, SubPlan.ELSE), scope, wiring);
        wiring.edge(node.id(), thenRegion.entry(), EdgeTag.TRUE);
        wiring.edge(node.id(), elseRegion.entry(), EdgeTag.FALSE);

        List<Exit> exits = new ArrayList<>();
        exits.add(thenRegion.exit());
        exits.add(elseRegion.exit());
        return new Region(node.id(), merge(exits, node.line(), wiring));
    }

    private Region flattenLoop(PlanNode node, Scope scope, Wiring wiring) {
        wiring.add(node);
        LoopFrame frame = new LoopFrame(node.id(), node.loopName(), scope.loop());
        Region body = flattenSequence(regionOf(node, SubPlan.BODY), new Scope(scope.endId(), frame), wiring);
        wiring.edge(node.id(), body.entry(), EdgeTag.LOOP_BODY);

        if (!frame.continues.isEmpty()) {
            int latch = wiring.anchor(CONTINUE_LABEL, node.line());
            if (body.exit() != null) {
                wiring.connect(body.exit(), latch);
            }
            for (int jump : frame.continues) {
                wiring.edge(jump, latch, EdgeTag.SEQ);
            }
            wiring.edge(latch, frame.loopId, EdgeTag.LOOP_BACK);
        } else if (body.exit() != null) {
            Exit exit = body.exit();
            if (exit.tag() == EdgeTag.SEQ) {
                wiring.edge(exit.from(), frame.loopId, EdgeTag.LOOP_BACK);
            } else {
                // body ends in a nested loop: keep its loop_exit and add one back edge after it
                int next = wiring.anchor(NEXT_ITERATION_LABEL, node.line());
                wiring.connect(exit, next);
                wiring.edge(next, frame.loopId, EdgeTag.LOOP_BACK);
            }
        }

        if (frame.breaks.isEmpty()) {
            return new Region(node.id(), new Exit(node.id(), EdgeTag.LOOP_EXIT));
        }
        int after = wiring.anchor(LOOP_EXIT_LABEL, node.line());
        wiring.edge(node.id(), after, EdgeTag.LOOP_EXIT);
        for (int jump : frame.breaks) {
            wiring.edge(jump, after, EdgeTag.SEQ);
        }
        return new Region(node.id(), new Exit(after, EdgeTag.SEQ));
    }

    private Region flattenTry(PlanNode node, Scope scope, Wiring wiring) {
        wiring.add(node);
        int mark = wiring.nodes.size();
        Region tryRegion = flattenSequence(regionOf(node, SubPlan.TRY), scope, wiring);
        wiring.edge(node.id(), tryRegion.entry(), EdgeTag.SEQ);

        List<Integer> raisers = wiring.nodes.subList(mark, wiring.nodes.size()).stream()
                .filter(n -> n.kind() != NodeKind.ANCHOR)
                .map(FlatNode::id)
                .collect(Collectors.toList());

        List<Exit> exits = new ArrayList<>();
        exits.add(tryRegion.exit());
        for (SubPlan handler : node.handlers()) {
            Region handlerRegion = flattenSequence(handler.plan().nodes(), scope, wiring);
            for (int raiser : raisers) {
                wiring.edge(raiser, handlerRegion.entry(), EdgeTag.EXCEPTION);
            }
            exits.add(handlerRegion.exit());
        }
        Exit merged = merge(exits, node.line(), wiring);

        Plan finallyPlan = node.child(SubPlan.FINALLY);
        if (finallyPlan == null) {
            return new Region(node.id(), merged);
        }
        Region finallyRegion = flattenSequence(finallyPlan.nodes(), scope, wiring);
        if (merged == null) {
            return new Region(node.id(), null);
        }
        wiring.connect(merged, finallyRegion.entry());
        return new Region(node.id(), finallyRegion.exit());
    }

    private Exit merge(List<Exit> exits, int line, Wiring wiring) {
        List<Exit> live = exits.stream().filter(e -> e != null).collect(Collectors.toList());
        if (live.isEmpty()) {
            return null;
        }
        int anchor = wiring.anchor(MERGE_LABEL, line);
        for (Exit exit : live) {
            wiring.connect(exit, anchor);
        }
        return new Exit(anchor, EdgeTag.SEQ);
    }

    private List<PlanNode> regionOf(PlanNode node, String name) {
        Plan plan = node.child(name);
        if (plan == null || plan.isEmpty()) {
            throw new IllegalStateException(node.kind().displayName() + " node " + node.id()
                    + " has no '" + name + "' sub-plan");
        }
        return plan.nodes();
    }

    private FlatGraph prune(int startId, Wiring wiring) {
        Set<Integer> reachable = GraphChecks.reachableFrom(new FlatGraph(startId, wiring.nodes, wiring.edges));

        List<FlatNode> kept = new ArrayList<>();
        for (FlatNode node : wiring.nodes) {
            if (reachable.contains(node.id())) {
                kept.add(node);
            } else if (node.kind() != NodeKind.ANCHOR) {
                System.err.println("[funcplan] Unreachable " + node.kind().displayName() + " node " + node.id()
                        + " (line " + node.line() + ") dropped from the graph");
            }
        }
        kept.sort(Comparator.comparingInt(FlatNode::id));

        List<FlatEdge> keptEdges = wiring.edges.stream()
                .filter(e -> reachable.contains(e.from()) && reachable.contains(e.to()))
                .collect(Collectors.toList());
        return new FlatGraph(startId, kept, keptEdges);
    }

    private static final class Wiring {
        final List<FlatNode> nodes = new ArrayList<>();
        final List<FlatEdge> edges = new ArrayList<>();
        private int nextAnchorId;

        Wiring(int firstAnchorId) {
            this.nextAnchorId = firstAnchorId;
        }

        void add(PlanNode node) {
            nodes.add(new FlatNode(node.id(), node.kind(), node.label(), node.line(), node.synthetic()));
        }

        int anchor(String label, int line) {
            int id = nextAnchorId++;
            nodes.add(new FlatNode(id, NodeKind.ANCHOR, label, line, true));
            return id;
        }

        void edge(int from, int to, EdgeTag tag) {
            edges.add(new FlatEdge(from, to, tag));
        }

        void connect(Exit exit, int to) {
            edge(exit.from(), to, exit.tag());
        }
    }
}
