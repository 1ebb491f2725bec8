package com.dotparser.maven.graph;

import java.util.Map;

/**
 * Default node and edge attributes in effect at some point of a statement list.
 * <p>
 * Immutable: {@code node [...]} and {@code edge [...]} produce a new context that the
 * statement list carries forward. A subgraph starts from the enclosing context and its
 * own changes end with its closing brace.
 */
final class ScopeContext {

    static final ScopeContext EMPTY = new ScopeContext(Map.of(), Map.of());

    private final Map<String, String> nodeDefaults;
    private final Map<String, String> edgeDefaults;

    private ScopeContext(Map<String, String> nodeDefaults, Map<String, String> edgeDefaults) {
        this.nodeDefaults = nodeDefaults;
        this.edgeDefaults = edgeDefaults;
    }

    Map<String, String> getNodeDefaults() {
        return nodeDefaults;
    }

    Map<String, String> getEdgeDefaults() {
        return edgeDefaults;
    }

    ScopeContext withNodeDefaults(Map<String, String> overlay) {
        if (overlay.isEmpty()) return this;
        return new ScopeContext(Attributes.frozenMerge(nodeDefaults, overlay), edgeDefaults);
    }

    ScopeContext withEdgeDefaults(Map<String, String> overlay) {
        if (overlay.isEmpty()) return this;
        return new ScopeContext(nodeDefaults, Attributes.frozenMerge(edgeDefaults, overlay));
    }
}
