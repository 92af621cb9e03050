package com.funcplan.ir;

import com.funcplan.flatten.EdgeTag;
import com.funcplan.plan.NodeKind;
import com.google.gson.annotations.SerializedName;

import java.util.List;

/**
 * POJOs matching the plan.json schema v1.0.
 * Field names use @SerializedName for JSON snake_case mapping.
 */
public final class PlanDocument {

    public static final String SCHEMA_VERSION = "1.0";
    public static final String TOOL_VERSION = "0.1.0";

    private PlanDocument() {}

    public static class Root {
        @SerializedName("schema_version") public String schemaVersion;
        @SerializedName("tool_version")   public String toolVersion;
        @SerializedName("source_file")    public String sourceFile;
        @SerializedName("function")       public DocFunction function;
        @SerializedName("plan")           public DocPlan plan;
        @SerializedName("graph")          public DocGraph graph;
        @SerializedName("warnings")       public List<DocWarning> warnings;
    }

    public static class DocFunction {
        @SerializedName("name")       public String name;
        @SerializedName("signature")  public String signature;
        @SerializedName("line_start") public int lineStart;
        @SerializedName("line_end")   public int lineEnd;
    }

    public static class DocPlan {
        @SerializedName("nodes") public List<DocPlanNode> nodes;
    }

    public static class DocPlanNode {
        @SerializedName("id")        public int id;
        @SerializedName("kind")      public NodeKind kind;
        @SerializedName("label")     public String label;
        @SerializedName("text")      public String text;
        @SerializedName("line")      public int line;
        @SerializedName("synthetic") public boolean synthetic;
        @SerializedName("children")  public List<DocSubPlan> children;  // null for leaves
    }

    public static class DocSubPlan {
        @SerializedName("name")   public String name;
        @SerializedName("header") public String header;
        @SerializedName("plan")   public DocPlan plan;
    }

    public static class DocGraph {
        @SerializedName("entry") public int entry;
        @SerializedName("nodes") public List<DocGraphNode> nodes;
        @SerializedName("edges") public List<DocEdge> edges;
    }

    public static class DocGraphNode {
        @SerializedName("id")        public int id;
        @SerializedName("kind")      public NodeKind kind;
        @SerializedName("label")     public String label;
        @SerializedName("line")      public int line;
        @SerializedName("synthetic") public boolean synthetic;
    }

    public static class DocEdge {
        @SerializedName("from") public int from;
        @SerializedName("to")   public int to;
        @SerializedName("tag")  public EdgeTag tag;
    }

    public static class DocWarning {
        @SerializedName("node_id") public int nodeId;
        @SerializedName("line")    public int line;
        @SerializedName("message") public String message;
    }
}
