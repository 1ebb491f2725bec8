package com.dotparser.maven.graph;

/**
 * Base class for every error {@link DotParser#parse(String)} can raise.
 * <p>
 * Carries the 1-based line and column of the offending input. The message
 * already includes the position so callers can log it as-is.
 */
public abstract class DotParseException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final int line;
    private final int column;

    protected DotParseException(String message, int line, int column) {
        super(message + " at " + line + ":" + column);
        this.line = line;
        this.column = column;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
