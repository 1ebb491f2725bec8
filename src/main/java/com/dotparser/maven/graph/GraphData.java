package com.dotparser.maven.graph;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable result of parsing one DOT graph.
 * <p>
 * Maps keep source order: nodes in order of first mention, edges in order of first
 * occurrence. Attribute values are opaque strings.
 */
public final class GraphData {

    private final String name;
    private final boolean directed;
    private final boolean strict;
    private final Map<String, Map<String, String>> nodes;
    private final Map<EdgeKey, List<Map<String, String>>> edges;
    private final Map<String, String> graphAttributes;
    private final Map<String, String> nodeDefaults;
    private final Map<String, String> edgeDefaults;

    GraphData(
            String name,
            boolean directed,
            boolean strict,
            Map<String, Map<String, String>> nodes,
            Map<EdgeKey, List<Map<String, String>>> edges,
            Map<String, String> graphAttributes,
            Map<String, String> nodeDefaults,
            Map<String, String> edgeDefaults) {
        this.name = name;
        this.directed = directed;
        this.strict = strict;
        this.nodes = nodes;
        this.edges = edges;
        this.graphAttributes = graphAttributes;
        this.nodeDefaults = nodeDefaults;
        this.edgeDefaults = edgeDefaults;
    }

    /**
     * The graph id from the header ({@code digraph deps { ... }}), if one was given.
     */
    public Optional<String> getName() {
        return Optional.ofNullable(name);
    }

    public boolean isDirected() {
        return directed;
    }

    public boolean isStrict() {
        return strict;
    }

    /**
     * Every node id mentioned anywhere in the source, mapped to its attributes.
     */
    public Map<String, Map<String, String>> getNodes() {
        return nodes;
    }

    /**
     * Edge occurrences by canonical key. In a strict graph every list has exactly one element.
     */
    public Map<EdgeKey, List<Map<String, String>>> getEdges() {
        return edges;
    }

    public Map<String, String> getGraphAttributes() {
        return graphAttributes;
    }

    /**
     * Default node attributes of the top-level statement list when it closed.
     * Defaults set inside subgraphs are not included.
     */
    public Map<String, String> getNodeDefaults() {
        return nodeDefaults;
    }

    /**
     * Default edge attributes of the top-level statement list when it closed.
     */
    public Map<String, String> getEdgeDefaults() {
        return edgeDefaults;
    }

    public int nodeCount() {
        return nodes.size();
    }

    /**
     * Total number of stored edge occurrences, counting every element of every sequence.
     */
    public int edgeCount() {
        int count = 0;
        for (List<Map<String, String>> occurrences : edges.values()) {
            count += occurrences.size();
        }
        return count;
    }

    public Optional<Map<String, String>> getNodeAttributes(String id) {
        return Optional.ofNullable(nodes.get(id));
    }

    /**
     * Looks up the occurrences stored for an edge. In an undirected graph either
     * orientation of the pair finds the same edge.
     *
     * @return the stored sequence, or an empty list if there is no such edge
     */
    public List<Map<String, String>> getEdgeOccurrences(String source, String target) {
        EdgeKey key = EdgeKey.of(source, target);
        List<Map<String, String>> found = edges.get(key);
        if (found == null && !directed) {
            found = edges.get(key.reversed());
        }
        return found == null ? List.of() : found;
    }

    @Override
    public String toString() {
        return (strict ? "strict " : "") + (directed ? "digraph" : "graph")
                + (name != null ? " " + name : "")
                + " [nodes=" + nodeCount() + ", edges=" + edgeCount() + "]";
    }
}
