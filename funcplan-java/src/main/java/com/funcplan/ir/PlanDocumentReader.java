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
import com.google.gson.JsonParseException;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a plan.json document back into a {@link FunctionPlan} and a {@link FlatGraph}.
 */
public class PlanDocumentReader {

    public static class PlanDocumentException extends RuntimeException {
        public PlanDocumentException(String msg) { super(msg); }
        public PlanDocumentException(String msg, Throwable cause) { super(msg, cause); }
    }

    /** A decoded document. */
    public record Decoded(String sourceFile, FunctionPlan functionPlan, FlatGraph graph) {}

    public Decoded read(Path path) {
        if (!Files.exists(path)) {
            throw new PlanDocumentException("Plan document not found: " + path);
        }
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return decode(new Gson().fromJson(reader, PlanDocument.Root.class));
        } catch (IOException | JsonParseException e) {
            throw new PlanDocumentException("Failed to read plan document " + path + ": " + e.getMessage(), e);
        }
    }

    public Decoded parse(String json) {
        try {
            return decode(new Gson().fromJson(json, PlanDocument.Root.class));
        } catch (JsonParseException e) {
            throw new PlanDocumentException("Malformed plan document: " + e.getMessage(), e);
        }
    }

    private Decoded decode(PlanDocument.Root root) {
        if (root == null) {
            throw new PlanDocumentException("Plan document is empty");
        }
        checkSchema(root.schemaVersion);
        if (root.function == null || root.plan == null || root.graph == null) {
            throw new PlanDocumentException("Plan document lacks function, plan or graph section");
        }

        List<PlanWarning> warnings = new ArrayList<>();
        if (root.warnings != null) {
            for (PlanDocument.DocWarning w : root.warnings) {
                warnings.add(new PlanWarning(w.nodeId, w.line, w.message));
            }
        }
        FunctionPlan functionPlan = new FunctionPlan(root.function.name, root.function.signature,
                root.function.lineStart, root.function.lineEnd, toPlan(root.plan), warnings);
        return new Decoded(root.sourceFile, functionPlan, toGraph(root.graph));
    }

    private void checkSchema(String version) {
        if (version == null) {
            throw new PlanDocumentException("Plan document has no schema_version");
        }
        String major = version.split("\\.", 2)[0];
        String supported = PlanDocument.SCHEMA_VERSION.split("\\.", 2)[0];
        if (!major.equals(supported)) {
            throw new PlanDocumentException("Unsupported schema_version " + version
                    + " (this tool reads " + supported + ".x)");
        }
    }

    private Plan toPlan(PlanDocument.DocPlan docPlan) {
        List<PlanNode> nodes = new ArrayList<>();
        if (docPlan.nodes != null) {
            for (PlanDocument.DocPlanNode n : docPlan.nodes) {
                if (n.kind == null) {
                    throw new PlanDocumentException("Plan node " + n.id + " has an unknown kind");
                }
                List<SubPlan> children = new ArrayList<>();
                if (n.children != null) {
                    for (PlanDocument.DocSubPlan s : n.children) {
                        if (s.name == null || s.plan == null) {
                            throw new PlanDocumentException("Plan node " + n.id + " has an incomplete sub-plan");
                        }
                        children.add(new SubPlan(s.name, s.header, toPlan(s.plan)));
                    }
                }
                nodes.add(new PlanNode(n.id, n.kind, n.label, n.text, n.line, n.synthetic, children));
            }
        }
        return new Plan(nodes);
    }

    private FlatGraph toGraph(PlanDocument.DocGraph docGraph) {
        List<FlatNode> nodes = new ArrayList<>();
        if (docGraph.nodes != null) {
            for (PlanDocument.DocGraphNode n : docGraph.nodes) {
                if (n.kind == null) {
                    throw new PlanDocumentException("Graph node " + n.id + " has an unknown kind");
                }
                nodes.add(new FlatNode(n.id, n.kind, n.label, n.line, n.synthetic));
            }
        }
        List<FlatEdge> edges = new ArrayList<>();
        if (docGraph.edges != null) {
            for (PlanDocument.DocEdge e : docGraph.edges) {
                if (e.tag == null) {
                    throw new PlanDocumentException("Edge " + e.from + " -> " + e.to + " has an unknown tag");
                }
                edges.add(new FlatEdge(e.from, e.to, e.tag));
            }
        }
        return new FlatGraph(docGraph.entry, nodes, edges);
    }
}
