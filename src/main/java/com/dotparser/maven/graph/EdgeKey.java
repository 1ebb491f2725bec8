package com.dotparser.maven.graph;

import java.util.Objects;

/**
 * Key of the edges map: an ordered (source, target) pair of node ids.
 * <p>
 * For undirected graphs the accumulator stores each unordered pair under the
 * orientation it saw first, so {@code (a,b)} and {@code (b,a)} never both appear.
 */
public final class EdgeKey {

    private final String source;
    private final String target;

    private EdgeKey(String source, String target) {
        this.source = Objects.requireNonNull(source, "source");
        this.target = Objects.requireNonNull(target, "target");
    }

    public static EdgeKey of(String source, String target) {
        return new EdgeKey(source, target);
    }

    public String getSource() {
        return source;
    }

    public String getTarget() {
        return target;
    }

    public EdgeKey reversed() {
        return new EdgeKey(target, source);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof EdgeKey)) return false;
        EdgeKey other = (EdgeKey) o;
        return source.equals(other.source) && target.equals(other.target);
    }

    @Override
    public int hashCode() {
        return Objects.hash(source, target);
    }

    @Override
    public String toString() {
        return "(" + source + ", " + target + ")";
    }
}
