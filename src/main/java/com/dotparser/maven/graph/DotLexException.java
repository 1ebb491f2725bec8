package com.dotparser.maven.graph;

/**
 * Malformed token: unterminated quoted string or comment, or a character no token starts with.
 */
public class DotLexException extends DotParseException {

    private static final long serialVersionUID = 1L;

    public DotLexException(String message, int line, int column) {
        super(message, line, column);
    }
}
