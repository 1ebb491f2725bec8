package com.dotparser.maven.graph;

/**
 * A well-formed statement that contradicts the graph header, such as {@code ->} inside an undirected graph.
 */
public class DotSemanticException extends DotParseException {

    private static final long serialVersionUID = 1L;

    public DotSemanticException(String message, int line, int column) {
        super(message, line, column);
    }
}
