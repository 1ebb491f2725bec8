package com.dotparser.maven.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * The graph under construction. Nodes and edges are only ever added or have their
 * attributes overwritten, never removed. {@link #build} freezes the result.
 */
final class GraphAccumulator {

    private final boolean directed;
    private final boolean strict;
    private final EdgeInsertionPolicy insertionPolicy;
    private final Map<String, Map<String, String>> nodes = new LinkedHashMap<>();
    private final Map<EdgeKey, List<Map<String, String>>> edges = new LinkedHashMap<>();
    private final Map<String, String> graphAttributes = new LinkedHashMap<>();

    GraphAccumulator(boolean directed, boolean strict) {
        this.directed = directed;
        this.strict = strict;
        this.insertionPolicy = EdgeInsertionPolicy.forStrict(strict);
    }

    boolean isDirected() {
        return directed;
    }

    /**
     * Creates the node from {@code defaults} if it is new, then overlays {@code attributes}
     * whether or not it was just created.
     */
    void addNode(String id, Map<String, String> defaults, Map<String, String> attributes) {
        Map<String, String> stored = nodes.computeIfAbsent(id, k -> new LinkedHashMap<>(defaults));
        stored.putAll(attributes);
    }

    void addEdgeOccurrence(String source, String target, Map<String, String> attributes) {
        EdgeKey key = canonicalKey(source, target);
        Map<String, String> frozen = Attributes.freeze(attributes);
        edges.put(key, insertionPolicy.insert(edges.get(key), frozen));
    }

    /**
     * Directed graphs keep the pair as written. Undirected graphs reuse whichever
     * orientation of the pair was inserted first.
     */
    EdgeKey canonicalKey(String source, String target) {
        EdgeKey key = EdgeKey.of(source, target);
        if (directed || edges.containsKey(key)) {
            return key;
        }
        EdgeKey reversed = key.reversed();
        return edges.containsKey(reversed) ? reversed : key;
    }

    void mergeGraphAttributes(Map<String, String> attributes) {
        graphAttributes.putAll(attributes);
    }

    /**
     * @param name      graph id from the header, or {@code null}
     * @param rootScope scope of the top-level statement list when it closed
     */
    GraphData build(String name, ScopeContext rootScope) {
        Map<String, Map<String, String>> frozenNodes = new LinkedHashMap<>();
        nodes.forEach((id, attrs) -> frozenNodes.put(id, Attributes.freeze(attrs)));

        Map<EdgeKey, List<Map<String, String>>> frozenEdges = new LinkedHashMap<>();
        edges.forEach((key, occurrences) -> frozenEdges.put(key, List.copyOf(occurrences)));

        return new GraphData(
                name,
                directed,
                strict,
                Collections.unmodifiableMap(frozenNodes),
                Collections.unmodifiableMap(frozenEdges),
                Attributes.freeze(graphAttributes),
                rootScope.getNodeDefaults(),
                rootScope.getEdgeDefaults());
    }
}
