package com.dotparser.maven.graph;

/**
 * A token sequence that does not match the DOT grammar.
 */
public class DotSyntaxException extends DotParseException {

    private static final long serialVersionUID = 1L;

    private final String expected;
    private final String found;

    public DotSyntaxException(String expected, Token found) {
        super("Expected " + expected + " but found " + found.describe(), found.getLine(), found.getColumn());
        this.expected = expected;
        this.found = found.describe();
    }

    /**
     * What the grammar required at this position, e.g. {@code "'{'"} or {@code "node id"}.
     */
    public String getExpected() {
        return expected;
    }

    public String getFound() {
        return found;
    }
}
