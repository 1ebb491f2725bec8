package com.dotparser.maven.report;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import com.dotparser.maven.graph.EdgeKey;
import com.dotparser.maven.graph.GraphData;

/**
 * Builds the template context describing one parsed graph.
 * <p>
 * Keys: file, name, kind, strict, directed, edgeOperator, nodeCount, edgeCount,
 * graphAttributes, hasGraphAttributes, nodes, edges, truncated, showAttributes.
 */
public final class GraphSummary {

    /**
     * @param fileName name of the DOT file the graph came from
     * @param graph    parsed graph
     * @param config   report settings
     * @return context map for the summary template
     */
    public static Map<String, Object> toContext(String fileName, GraphData graph, ReportConfig config) {
        Map<String, Object> context = new LinkedHashMap<>();
        context.put("file", fileName);
        context.put("name", graph.getName().orElse(baseName(fileName)));
        context.put("kind", graph.isDirected() ? "digraph" : "graph");
        context.put("strict", graph.isStrict());
        context.put("directed", graph.isDirected());
        context.put("edgeOperator", graph.isDirected() ? "->" : "--");
        context.put("nodeCount", graph.nodeCount());
        context.put("edgeCount", graph.edgeCount());
        context.put("showAttributes", config.isShowAttributes());

        List<Map<String, Object>> graphAttributes = new ArrayList<>();
        graph.getGraphAttributes().forEach((key, value) -> {
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("key", key);
            entry.put("value", value);
            graphAttributes.add(entry);
        });
        context.put("graphAttributes", graphAttributes);
        context.put("hasGraphAttributes", !graphAttributes.isEmpty());

        context.put("nodes", nodes(graph, config));

        List<Map<String, Object>> edges = edges(graph, config);
        context.put("edges", edges);
        context.put("truncated", edges.size() < graph.edgeCount());
        return context;
    }

    private static List<Map<String, Object>> nodes(GraphData graph, ReportConfig config) {
        List<String> ids = new ArrayList<>(graph.getNodes().keySet());
        if (config.getNodeOrder() == ReportConfig.NodeOrder.NAME) {
            ids.sort(String::compareTo);
        }
        List<Map<String, Object>> nodes = new ArrayList<>();
        for (String id : ids) {
            Map<String, String> attributes = graph.getNodes().get(id);
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("id", id);
            entry.put("attributes", formatAttributes(attributes));
            entry.put("hasAttributes", !attributes.isEmpty());
            nodes.add(entry);
        }
        return nodes;
    }

    private static List<Map<String, Object>> edges(GraphData graph, ReportConfig config) {
        int limit = config.getMaxEdges() == null ? Integer.MAX_VALUE : Math.max(0, config.getMaxEdges());
        List<Map<String, Object>> edges = new ArrayList<>();
        for (Map.Entry<EdgeKey, List<Map<String, String>>> e : graph.getEdges().entrySet()) {
            int occurrence = 1;
            for (Map<String, String> attributes : e.getValue()) {
                if (edges.size() >= limit) {
                    return edges;
                }
                Map<String, Object> entry = new LinkedHashMap<>();
                entry.put("source", e.getKey().getSource());
                entry.put("target", e.getKey().getTarget());
                entry.put("occurrence", occurrence++);
                entry.put("attributes", formatAttributes(attributes));
                entry.put("hasAttributes", !attributes.isEmpty());
                edges.add(entry);
            }
        }
        return edges;
    }

    /**
     * Formats attributes as {@code [k1=v1, k2=v2]}, or an empty string when there are none.
     */
    static String formatAttributes(Map<String, String> attributes) {
        if (attributes.isEmpty()) return "";
        return attributes.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(", ", "[", "]"));
    }

    private static String baseName(String fileName) {
        if (fileName == null) return "";
        int dot = fileName.lastIndexOf('.');
        return dot > 0 ? fileName.substring(0, dot) : fileName;
    }

    private GraphSummary() {
    }
}
