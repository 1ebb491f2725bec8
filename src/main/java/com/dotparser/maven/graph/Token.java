package com.dotparser.maven.graph;

/**
 * A single lexical token: type, text and 1-based source position.
 */
public final class Token {

    private final TokenType type;
    private final String text;
    private final int line;
    private final int column;

    public Token(TokenType type, String text, int line, int column) {
        this.type = type;
        this.text = text == null ? "" : text;
        this.line = line;
        this.column = column;
    }

    public TokenType getType() {
        return type;
    }

    /**
     * Source text of the token. For quoted strings this is the unescaped content without the quotes.
     */
    public String getText() {
        return text;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }

    public boolean is(TokenType expected) {
        return type == expected;
    }

    /**
     * Short human-readable form used in error messages.
     */
    public String describe() {
        switch (type) {
            case EOF:
                return "end of input";
            case QUOTED_STRING:
                return "\"" + text + "\"";
            default:
                return "'" + text + "'";
        }
    }

    @Override
    public String toString() {
        return type + "(" + text + ")@" + line + ":" + column;
    }
}
