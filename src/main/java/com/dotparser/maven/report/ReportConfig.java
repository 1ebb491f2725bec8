package com.dotparser.maven.report;

import java.util.Locale;
import java.util.Map;

/**
 * Settings for the per-graph summary written by the {@code summarize} goal.
 */
public class ReportConfig {

    /**
     * Order of the node list in a summary.
     */
    public enum NodeOrder {
        /** Order of first mention in the DOT source. */
        SOURCE,
        /** Lexicographic by node id. */
        NAME;

        static NodeOrder parse(String value) {
            try {
                return valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException(
                        "Unknown nodeOrder '" + value + "', expected 'source' or 'name'", e);
            }
        }
    }

    private String template = "summary.md.mustache";
    private String extension = "md";
    private NodeOrder nodeOrder = NodeOrder.SOURCE;
    private boolean showAttributes = true;
    private Integer maxEdges;

    public String getTemplate() {
        return template;
    }

    public void setTemplate(String template) {
        this.template = template;
    }

    public String getExtension() {
        return extension;
    }

    public void setExtension(String extension) {
        this.extension = extension;
    }

    public NodeOrder getNodeOrder() {
        return nodeOrder;
    }

    public void setNodeOrder(NodeOrder nodeOrder) {
        this.nodeOrder = nodeOrder;
    }

    public boolean isShowAttributes() {
        return showAttributes;
    }

    public void setShowAttributes(boolean showAttributes) {
        this.showAttributes = showAttributes;
    }

    /**
     * Maximum number of edge occurrences listed per summary, or {@code null} for no limit.
     */
    public Integer getMaxEdges() {
        return maxEdges;
    }

    public void setMaxEdges(Integer maxEdges) {
        this.maxEdges = maxEdges;
    }

    /**
     * Builds a config from a parsed YAML document. Missing keys keep their defaults.
     */
    public static ReportConfig fromMap(Map<String, Object> map) {
        ReportConfig config = new ReportConfig();
        if (map.get("template") instanceof String) {
            config.setTemplate((String) map.get("template"));
        }
        if (map.get("extension") instanceof String) {
            config.setExtension((String) map.get("extension"));
        }
        if (map.get("nodeOrder") instanceof String) {
            config.setNodeOrder(NodeOrder.parse((String) map.get("nodeOrder")));
        }
        if (map.get("showAttributes") instanceof Boolean) {
            config.setShowAttributes((Boolean) map.get("showAttributes"));
        }
        if (map.get("maxEdges") instanceof Number) {
            config.setMaxEdges(((Number) map.get("maxEdges")).intValue());
        }
        return config;
    }
}
