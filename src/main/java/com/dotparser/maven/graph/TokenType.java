package com.dotparser.maven.graph;

import java.util.Locale;

/**
 * Token categories produced by {@link DotLexer}.
 * Keywords get their own constant so the parser never looks at raw text to tell them apart.
 */
public enum TokenType {

    // Labels
    ID,
    QUOTED_STRING,
    NUMERAL,

    // Keywords (only ever produced from unquoted text)
    GRAPH,
    DIGRAPH,
    STRICT,
    NODE,
    EDGE,
    SUBGRAPH,

    // Operators
    UNDIRECTED_EDGE, // --
    DIRECTED_EDGE,   // ->
    LBRACKET,
    RBRACKET,
    LBRACE,
    RBRACE,
    SEMICOLON,
    COMMA,
    EQUALS,
    COLON,

    EOF;

    /**
     * True for the three token types that can serve as a label (node id, attribute key or value).
     */
    public boolean isLabel() {
        return this == ID || this == QUOTED_STRING || this == NUMERAL;
    }

    public boolean isEdgeOperator() {
        return this == UNDIRECTED_EDGE || this == DIRECTED_EDGE;
    }

    /**
     * Returns the keyword type for an unquoted word, or {@code null} if the word is a plain identifier.
     */
    static TokenType keyword(String word) {
        switch (word.toLowerCase(Locale.ROOT)) {
            case "graph":
                return GRAPH;
            case "digraph":
                return DIGRAPH;
            case "strict":
                return STRICT;
            case "node":
                return NODE;
            case "edge":
                return EDGE;
            case "subgraph":
                return SUBGRAPH;
            default:
                return null;
        }
    }
}
