package com.funcplan.export;

import com.funcplan.flatten.EdgeTag;
import com.funcplan.flatten.FlatEdge;
import com.funcplan.flatten.FlatGraph;
import com.funcplan.flatten.FlatNode;

/**
 * Writes a {@link FlatGraph} in Graphviz DOT syntax, top-down, one statement per line.
 */
public class DotWriter {

    public String write(FlatGraph graph, String title) {
        StringBuilder dot = new StringBuilder();
        dot.append("digraph plan {\n");
        dot.append("  rankdir=TB;\n");
        dot.append("  graph [margin=\"0.2\", pad=\"0.3\", color=\"#bbbbbb\", labelloc=t, label=\"")
                .append(escape(title)).append("\"];\n");
        dot.append("  node [style=filled, fontname=\"Helvetica\", fontsize=11];\n");
        dot.append("  edge [fontname=\"Helvetica\", fontsize=9];\n");

        for (FlatNode node : graph.nodes()) {
            dot.append("  n").append(node.id()).append(" [").append(nodeAttributes(node)).append("];\n");
        }
        for (FlatEdge edge : graph.edges()) {
            dot.append("  n").append(edge.from()).append(" -> n").append(edge.to());
            String attributes = edgeAttributes(edge.tag());
            if (!attributes.isEmpty()) {
                dot.append(" [").append(attributes).append(']');
            }
            dot.append(";\n");
        }
        dot.append("}\n");
        return dot.toString();
    }

    private String nodeAttributes(FlatNode node) {
        String fill = "fillcolor=\"" + NodeColors.colorFor(node.kind()) + "\"";
        return switch (node.kind()) {
            case ANCHOR -> "shape=circle, width=0.15, label=\"\", " + fill;
            case START, END -> "shape=oval, label=\"" + caption(node) + "\", " + fill;
            case IF -> "shape=diamond, label=\"" + caption(node) + "\", " + fill;
            case FOR, WHILE -> "shape=hexagon, label=\"" + caption(node) + "\", " + fill;
            case TRY_EXCEPT -> "shape=box3d, label=\"" + caption(node) + "\", " + fill;
            case RETURN, RAISE, BREAK, CONTINUE ->
                    "shape=box, style=\"filled,rounded\", label=\"" + caption(node) + "\", " + fill;
            case STATEMENT, CALL, ASSIGN -> "shape=box, label=\"" + caption(node) + "\", " + fill;
        };
    }

    private String edgeAttributes(EdgeTag tag) {
        return switch (tag) {
            case SEQ -> "";
            case LOOP_BACK -> "label=\"" + tag.wireName() + "\", style=dashed";
            case EXCEPTION -> "label=\"" + tag.wireName() + "\", style=dotted, color=\"#b00000\"";
            case TRUE, FALSE, LOOP_BODY, LOOP_EXIT -> "label=\"" + tag.wireName() + "\"";
        };
    }

    private static String caption(FlatNode node) {
        String kind = node.kind().displayName();
        return node.label().isEmpty() ? kind : kind + "\\n" + escape(node.label());
    }

    static String escape(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", " ");
    }
}
