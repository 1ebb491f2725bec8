package com.dotparser.maven.graph;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts DOT source text into a complete list of {@link Token}s.
 * <p>
 * Rules:
 * <ul>
 *   <li>unquoted words are promoted to keyword tokens (case-insensitive); quoted text never is</li>
 *   <li>{@code "..."} strings unescape {@code \"}; a backslash-newline is a line continuation</li>
 *   <li>numerals are {@code [-](digits[.digits] | .digits)}</li>
 *   <li>{@code //}, block and {@code #}-at-line-start comments are skipped</li>
 * </ul>
 * The returned list always ends with a single {@link TokenType#EOF} token.
 */
public final class DotLexer {

    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private int pos;
    private int line = 1;
    private int column = 1;
    // Only whitespace seen since the last newline; '#' lines are comments only there.
    private boolean lineStart = true;

    private DotLexer(String source) {
        this.source = source;
    }

    /**
     * Tokenizes the whole input.
     *
     * @param source DOT text
     * @return tokens in source order, terminated by EOF
     * @throws DotLexException on an unterminated string or comment, or an unexpected character
     */
    public static List<Token> tokenize(String source) {
        if (source == null) {
            throw new IllegalArgumentException("DOT source must not be null");
        }
        return new DotLexer(source).run();
    }

    private List<Token> run() {
        while (pos < source.length()) {
            char c = peek(0);
            if (c == '\n') {
                advance();
                lineStart = true;
                continue;
            }
            if (Character.isWhitespace(c)) {
                advance();
                continue;
            }
            if (c == '#' && lineStart) {
                skipToEndOfLine();
                continue;
            }
            lineStart = false;

            int startLine = line;
            int startColumn = column;
            if (c == '/' && peek(1) == '/') {
                skipToEndOfLine();
            } else if (c == '/' && peek(1) == '*') {
                skipBlockComment(startLine, startColumn);
            } else if (c == '"') {
                readQuoted(startLine, startColumn);
            } else if (c == '-' && peek(1) == '-') {
                emitOperator(TokenType.UNDIRECTED_EDGE, 2, startLine, startColumn);
            } else if (c == '-' && peek(1) == '>') {
                emitOperator(TokenType.DIRECTED_EDGE, 2, startLine, startColumn);
            } else if (startsNumeral()) {
                readNumeral(startLine, startColumn);
            } else if (Character.isLetter(c) || c == '_') {
                readIdentifier(startLine, startColumn);
            } else {
                TokenType punctuation = punctuation(c);
                if (punctuation == null) {
                    throw new DotLexException("Unexpected character '" + c + "'", startLine, startColumn);
                }
                emitOperator(punctuation, 1, startLine, startColumn);
            }
        }
        tokens.add(new Token(TokenType.EOF, "", line, column));
        return tokens;
    }

    private static TokenType punctuation(char c) {
        switch (c) {
            case '{':
                return TokenType.LBRACE;
            case '}':
                return TokenType.RBRACE;
            case '[':
                return TokenType.LBRACKET;
            case ']':
                return TokenType.RBRACKET;
            case ';':
                return TokenType.SEMICOLON;
            case ',':
                return TokenType.COMMA;
            case '=':
                return TokenType.EQUALS;
            case ':':
                return TokenType.COLON;
            default:
                return null;
        }
    }

    private boolean startsNumeral() {
        char c = peek(0);
        if (c == '-') {
            return isDigit(peek(1)) || (peek(1) == '.' && isDigit(peek(2)));
        }
        return isDigit(c) || (c == '.' && isDigit(peek(1)));
    }

    private void readNumeral(int startLine, int startColumn) {
        int start = pos;
        if (peek(0) == '-') {
            advance();
        }
        boolean seenDot = false;
        while (pos < source.length()) {
            char c = peek(0);
            if (isDigit(c)) {
                advance();
            } else if (c == '.' && !seenDot) {
                seenDot = true;
                advance();
            } else {
                break;
            }
        }
        tokens.add(new Token(TokenType.NUMERAL, source.substring(start, pos), startLine, startColumn));
    }

    private void readIdentifier(int startLine, int startColumn) {
        int start = pos;
        while (pos < source.length() && (Character.isLetterOrDigit(peek(0)) || peek(0) == '_')) {
            advance();
        }
        String word = source.substring(start, pos);
        TokenType keyword = TokenType.keyword(word);
        tokens.add(new Token(keyword != null ? keyword : TokenType.ID, word, startLine, startColumn));
    }

    private void readQuoted(int startLine, int startColumn) {
        advance(); // opening quote
        StringBuilder content = new StringBuilder();
        while (true) {
            if (pos >= source.length()) {
                throw new DotLexException("Unterminated quoted string", startLine, startColumn);
            }
            char c = peek(0);
            if (c == '"') {
                advance();
                break;
            }
            if (c == '\\') {
                char next = peek(1);
                if (next == '"') {
                    content.append('"');
                    advance(2);
                    continue;
                }
                if (next == '\n') {
                    advance(2);
                    continue;
                }
                if (next == '\r' && peek(2) == '\n') {
                    advance(3);
                    continue;
                }
                if (next == '\\') {
                    // Kept as written, but consumed as a pair so it cannot escape a following quote
                    content.append("\\\\");
                    advance(2);
                    continue;
                }
            }
            content.append(c);
            advance();
        }
        tokens.add(new Token(TokenType.QUOTED_STRING, content.toString(), startLine, startColumn));
    }

    private void skipToEndOfLine() {
        while (pos < source.length() && peek(0) != '\n') {
            advance();
        }
    }

    private void skipBlockComment(int startLine, int startColumn) {
        advance(2);
        while (pos < source.length()) {
            if (peek(0) == '*' && peek(1) == '/') {
                advance(2);
                return;
            }
            advance();
        }
        throw new DotLexException("Unterminated block comment", startLine, startColumn);
    }

    private void emitOperator(TokenType type, int length, int startLine, int startColumn) {
        tokens.add(new Token(type, source.substring(pos, pos + length), startLine, startColumn));
        advance(length);
    }

    private char peek(int offset) {
        int index = pos + offset;
        return index < source.length() ? source.charAt(index) : '\0';
    }

    private void advance() {
        if (source.charAt(pos) == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        pos++;
    }

    private void advance(int count) {
        for (int i = 0; i < count && pos < source.length(); i++) {
            advance();
        }
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
