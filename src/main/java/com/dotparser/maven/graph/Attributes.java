package com.dotparser.maven.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Helpers for attribute maps (string key to opaque string value, insertion-ordered).
 */
final class Attributes {

    /**
     * Returns a new mutable map holding {@code base} overlaid with {@code overlay}; overlay wins on collision.
     */
    static Map<String, String> merge(Map<String, String> base, Map<String, String> overlay) {
        Map<String, String> merged = new LinkedHashMap<>(base);
        merged.putAll(overlay);
        return merged;
    }

    static Map<String, String> frozenMerge(Map<String, String> base, Map<String, String> overlay) {
        return Collections.unmodifiableMap(merge(base, overlay));
    }

    /**
     * Unmodifiable insertion-ordered copy.
     */
    static Map<String, String> freeze(Map<String, String> attributes) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    private Attributes() {
    }
}
