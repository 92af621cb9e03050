package com.funcplan;

import com.funcplan.export.DotWriter;
import com.funcplan.export.ExportFailedException;
import com.funcplan.export.SvgGraphExporter;
import com.funcplan.flatten.EdgeTag;
import com.funcplan.flatten.FlatEdge;
import com.funcplan.flatten.FlatGraph;
import com.funcplan.flatten.FlatNode;
import com.funcplan.plan.NodeKind;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static com.funcplan.PlanFixtures.graphOf;
import static org.junit.jupiter.api.Assertions.*;
import static org.junit.jupiter.api.Assumptions.assumeTrue;

class SvgGraphExporterTest {

    private static final FlatGraph LOOP = graphOf("for (int i = 0; i < n; i++) { doSomething(i); }");

    private static boolean dotAvailable() {
        try {
            Process p = new ProcessBuilder("dot", "-V").redirectErrorStream(true).start();
            return p.waitFor(10, TimeUnit.SECONDS) && p.exitValue() == 0;
        } catch (IOException e) {
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private static boolean isWindows() {
        return System.getProperty("os.name").toLowerCase().contains("win");
    }

    @Test
    void dotTextDescribesNodesAndTaggedEdges() {
        String dot = new DotWriter().write(LOOP, "repeat \"loop\"");

        assertTrue(dot.startsWith("digraph plan {"));
        assertTrue(dot.contains("label=\"repeat \\\"loop\\\"\""), dot);
        assertTrue(dot.contains("n1 [shape=hexagon"), dot);
        assertTrue(dot.contains("n0 -> n1;"), dot);
        assertTrue(dot.contains("n1 -> n2 [label=\"loop_body\"]"), dot);
        assertTrue(dot.contains("n2 -> n1 [label=\"loop_back\", style=dashed]"), dot);
        assertTrue(dot.contains("n1 -> n3 [label=\"loop_exit\"]"), dot);
        assertTrue(dot.trim().endsWith("}"));
    }

    @Test
    void missingExecutableFailsExport() {
        SvgGraphExporter exporter = new SvgGraphExporter("funcplan-no-such-dot-executable", 5);
        ExportFailedException e = assertThrows(ExportFailedException.class, () -> exporter.render(LOOP, "t"));
        assertTrue(e.getMessage().contains("not found"));
    }

    @Test
    void nonZeroExitFailsExport(@TempDir Path tmp) throws IOException {
        assumeTrue(!isWindows());
        Path script = tmp.resolve("bad-dot.sh");
        Files.writeString(script, "#!/bin/sh\ncat > /dev/null\necho 'syntax error' >&2\nexit 3\n");
        assumeTrue(script.toFile().setExecutable(true));

        SvgGraphExporter exporter = new SvgGraphExporter(script.toString(), 10);
        ExportFailedException e = assertThrows(ExportFailedException.class, () -> exporter.render(LOOP, "t"));
        assertTrue(e.getMessage().contains("exit 3"), e.getMessage());
        assertTrue(e.getMessage().contains("syntax error"), e.getMessage());
    }

    @Test
    void nonSvgOutputFailsExport(@TempDir Path tmp) throws IOException {
        assumeTrue(!isWindows());
        Path script = tmp.resolve("chatty-dot.sh");
        Files.writeString(script, "#!/bin/sh\ncat > /dev/null\necho 'not a picture'\n");
        assumeTrue(script.toFile().setExecutable(true));

        SvgGraphExporter exporter = new SvgGraphExporter(script.toString(), 10);
        assertThrows(ExportFailedException.class, () -> exporter.render(LOOP, "t"));
    }

    @Test
    void slowExecutableTimesOut(@TempDir Path tmp) throws IOException {
        assumeTrue(!isWindows());
        Path script = tmp.resolve("slow-dot.sh");
        Files.writeString(script, "#!/bin/sh\nexec sleep 30\n");
        assumeTrue(script.toFile().setExecutable(true));

        SvgGraphExporter exporter = new SvgGraphExporter(script.toString(), 1);
        ExportFailedException e = assertThrows(ExportFailedException.class, () -> exporter.render(LOOP, "t"));
        assertTrue(e.getMessage().contains("within 1s"), e.getMessage());
    }

    @Test
    void timeoutCoversDotInputLargerThanThePipe(@TempDir Path tmp) throws IOException {
        assumeTrue(!isWindows());
        Path script = tmp.resolve("deaf-dot.sh");
        Files.writeString(script, "#!/bin/sh\nexec sleep 30\n");
        assumeTrue(script.toFile().setExecutable(true));

        List<FlatNode> nodes = new ArrayList<>();
        List<FlatEdge> edges = new ArrayList<>();
        nodes.add(new FlatNode(0, NodeKind.START, "start", 0, true));
        for (int id = 1; id <= 3000; id++) {
            nodes.add(new FlatNode(id, NodeKind.CALL, "process(order" + id + ", inventory, payments)", id, false));
            edges.add(new FlatEdge(id - 1, id, EdgeTag.SEQ));
        }
        FlatGraph large = new FlatGraph(0, nodes, edges);

        SvgGraphExporter exporter = new SvgGraphExporter(script.toString(), 1);
        ExportFailedException e = assertTimeoutPreemptively(Duration.ofSeconds(10),
                () -> assertThrows(ExportFailedException.class, () -> exporter.render(large, "t")));
        assertTrue(e.getMessage().contains("within 1s"), e.getMessage());
    }

    @Test
    void rendersSvgWithGraphviz() {
        assumeTrue(dotAvailable(), "Graphviz dot not installed");
        byte[] svg = new SvgGraphExporter().render(LOOP, "repeat");
        assertTrue(new String(svg, StandardCharsets.UTF_8).contains("<svg"));
    }
}
