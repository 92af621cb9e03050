package com.funcplan.ir;

import com.funcplan.flatten.FlatEdge;
import com.funcplan.flatten.FlatGraph;
import com.funcplan.flatten.FlatNode;
import com.funcplan.plan.FunctionPlan;
import com.funcplan.plan.Plan;
import com.funcplan.plan.PlanNode;
import com.funcplan.plan.PlanWarning;
import com.funcplan.plan.SubPlan;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Builds the plan.json document from a plan and its flattened graph and writes it.
 * Graph nodes are sorted by id and edges by (from, to, tag) so identical input gives identical bytes.
 */
public class PlanSerializer {

    public static final String FILE_NAME = "plan.json";

    private static final Gson GSON = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();

    public static class SerializerException extends RuntimeException {
        public SerializerException(String msg, Throwable cause) { super(msg, cause); }
    }

    public PlanDocument.Root toDocument(String sourceFile, FunctionPlan functionPlan, FlatGraph graph) {
        PlanDocument.Root root = new PlanDocument.Root();
        root.schemaVersion = PlanDocument.SCHEMA_VERSION;
        root.toolVersion = PlanDocument.TOOL_VERSION;
        root.sourceFile = sourceFile;

        root.function = new PlanDocument.DocFunction();
        root.function.name = functionPlan.name();
        root.function.signature = functionPlan.signature();
        root.function.lineStart = functionPlan.lineStart();
        root.function.lineEnd = functionPlan.lineEnd();

        root.plan = toDocPlan(functionPlan.plan());
        root.graph = toDocGraph(graph);

        root.warnings = new ArrayList<>();
        for (PlanWarning warning : functionPlan.warnings()) {
            PlanDocument.DocWarning w = new PlanDocument.DocWarning();
            w.nodeId = warning.nodeId();
            w.line = warning.line();
            w.message = warning.message();
            root.warnings.add(w);
        }
        return root;
    }

    public String toJson(PlanDocument.Root root) {
        return GSON.toJson(root);
    }

    /**
     * Writes {@code root} to {@code outputDir/plan.json}, creating the directory if absent.
     *
     * @return the written file
     */
    public Path write(PlanDocument.Root root, Path outputDir) {
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new SerializerException("Could not create output directory: " + outputDir, e);
        }

        Path path = outputDir.resolve(FILE_NAME);
        try (Writer w = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            GSON.toJson(root, w);
            w.write('\n');
        } catch (IOException e) {
            throw new SerializerException("Failed to write " + FILE_NAME + ": " + e.getMessage(), e);
        }
        System.err.println("[funcplan] " + FILE_NAME + " written: " + path);
        return path;
    }

    private PlanDocument.DocPlan toDocPlan(Plan plan) {
        PlanDocument.DocPlan docPlan = new PlanDocument.DocPlan();
        docPlan.nodes = new ArrayList<>();
        for (PlanNode node : plan.nodes()) {
            PlanDocument.DocPlanNode n = new PlanDocument.DocPlanNode();
            n.id = node.id();
            n.kind = node.kind();
            n.label = node.label();
            n.text = node.text();
            n.line = node.line();
            n.synthetic = node.synthetic();
            if (!node.children().isEmpty()) {
                n.children = new ArrayList<>();
                for (SubPlan sub : node.children()) {
                    PlanDocument.DocSubPlan s = new PlanDocument.DocSubPlan();
                    s.name = sub.name();
                    s.header = sub.header();
                    s.plan = toDocPlan(sub.plan());
                    n.children.add(s);
                }
            }
            docPlan.nodes.add(n);
        }
        return docPlan;
    }

    private PlanDocument.DocGraph toDocGraph(FlatGraph graph) {
        PlanDocument.DocGraph docGraph = new PlanDocument.DocGraph();
        docGraph.entry = graph.entryId();

        List<FlatNode> nodes = new ArrayList<>(graph.nodes());
        nodes.sort(Comparator.comparingInt(FlatNode::id));
        docGraph.nodes = new ArrayList<>();
        for (FlatNode node : nodes) {
            PlanDocument.DocGraphNode n = new PlanDocument.DocGraphNode();
            n.id = node.id();
            n.kind = node.kind();
            n.label = node.label();
            n.line = node.line();
            n.synthetic = node.synthetic();
            docGraph.nodes.add(n);
        }

        List<FlatEdge> edges = new ArrayList<>(graph.edges());
        edges.sort(Comparator.comparingInt(FlatEdge::from)
                .thenComparingInt(FlatEdge::to)
                .thenComparing(FlatEdge::tag));
        docGraph.edges = new ArrayList<>();
        for (FlatEdge edge : edges) {
            PlanDocument.DocEdge e = new PlanDocument.DocEdge();
            e.from = edge.from();
            e.to = edge.to();
            e.tag = edge.tag();
            docGraph.edges.add(e);
        }
        return docGraph;
    }
}
