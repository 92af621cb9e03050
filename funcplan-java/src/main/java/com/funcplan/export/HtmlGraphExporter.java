package com.funcplan.export;

import com.funcplan.flatten.FlatEdge;
import com.funcplan.flatten.FlatGraph;
import com.funcplan.flatten.FlatNode;
import com.google.gson.Gson;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Produces a self-contained HTML page that lays the graph out in the browser with dagre-d3.
 * The page falls back to a plain message and the raw graph JSON when the scripts cannot load.
 */
public class HtmlGraphExporter implements GraphExporter {

    static final String TEMPLATE_RESOURCE = "/funcplan/plan-template.html";

    // Gson escapes '<', '>' and '&' by default, so the payload cannot close the script element.
    private static final Gson GSON = new Gson();

    private static final Pattern PLACEHOLDER = Pattern.compile("__TITLE__|__COLOR_MAP__|__GRAPH_JSON__");

    private record Payload(int entry, List<FlatNode> nodes, List<FlatEdge> edges) {}

    @Override
    public String format() {
        return "html";
    }

    @Override
    public byte[] render(FlatGraph graph, String title) {
        Map<String, String> values = Map.of(
                "__TITLE__", escapeHtml(title),
                "__COLOR_MAP__", GSON.toJson(NodeColors.colorMap()),
                "__GRAPH_JSON__", GSON.toJson(new Payload(graph.entryId(), graph.nodes(), graph.edges())));
        // one pass, so substituted text is never scanned for placeholders again
        String html = PLACEHOLDER.matcher(loadTemplate())
                .replaceAll(match -> Matcher.quoteReplacement(values.get(match.group())));
        return html.getBytes(StandardCharsets.UTF_8);
    }

    private String loadTemplate() {
        try (InputStream in = HtmlGraphExporter.class.getResourceAsStream(TEMPLATE_RESOURCE)) {
            if (in == null) {
                throw new ExportFailedException("HTML template not found on classpath: " + TEMPLATE_RESOURCE);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ExportFailedException("Failed to load HTML template: " + e.getMessage(), e);
        }
    }

    static String escapeHtml(String text) {
        if (text == null) {
            return "";
        }
        return text.replace("&", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;")
                .replace("\"", "&quot;");
    }
}
