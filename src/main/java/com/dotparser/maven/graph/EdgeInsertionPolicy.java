package com.dotparser.maven.graph;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * How a new edge occurrence is stored under a key that may already hold earlier ones.
 * Picked once per graph from its {@code strict} flag.
 */
enum EdgeInsertionPolicy {

    /** Non-strict graphs: one entry per occurrence, in parse order. */
    APPEND {
        @Override
        List<Map<String, String>> insert(List<Map<String, String>> existing, Map<String, String> attributes) {
            List<Map<String, String>> result = existing == null ? new ArrayList<>() : existing;
            result.add(attributes);
            return result;
        }
    },

    /** Strict graphs: the latest occurrence replaces the whole sequence. */
    REPLACE {
        @Override
        List<Map<String, String>> insert(List<Map<String, String>> existing, Map<String, String> attributes) {
            List<Map<String, String>> result = new ArrayList<>(1);
            result.add(attributes);
            return result;
        }
    };

    /**
     * @param existing   sequence currently stored for the key, or {@code null} if the key is new
     * @param attributes attributes of the new occurrence
     * @return the sequence to store for the key
     */
    abstract List<Map<String, String>> insert(List<Map<String, String>> existing, Map<String, String> attributes);

    static EdgeInsertionPolicy forStrict(boolean strict) {
        return strict ? REPLACE : APPEND;
    }
}
