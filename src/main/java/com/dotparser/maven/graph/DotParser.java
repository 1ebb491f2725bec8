package com.dotparser.maven.graph;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Recursive-descent parser turning DOT source text into {@link GraphData}.
 * <p>
 * Grammar:
 * <pre>
 * graph      := ["strict"] ("graph" | "digraph") [ID] "{" stmt_list "}"
 * stmt_list  := { stmt [";"] }
 * stmt       := attr_stmt | edge_stmt | node_stmt | subgraph | ID "=" ID
 * attr_stmt  := ("graph" | "node" | "edge") attr_list
 * node_stmt  := node_id [attr_list]
 * node_id    := ID [":" ID [":" ID]]
 * edge_stmt  := endpoint edge_op endpoint { edge_op endpoint } [attr_list]
 * endpoint   := node_id | subgraph
 * subgraph   := ["subgraph" [ID]] "{" stmt_list "}"
 * attr_list  := { "[" { ID "=" ID [("," | ";")] } "]" }
 * </pre>
 * Default attributes follow lexical blocks: a {@code node [...]} or {@code edge [...]}
 * statement affects later statements of its own block and of blocks nested in it, never
 * the enclosing block. {@code graph [...]} goes straight to the result and stays.
 * <p>
 * Every edge statement expands to the cartesian product of adjacent endpoint node sets.
 * Each produced edge gets the edge defaults in effect when the statement started,
 * overlaid with the statement's trailing attribute list.
 */
public final class DotParser {

    private final List<Token> tokens;
    private int pos;
    private GraphAccumulator graph;

    private DotParser(List<Token> tokens) {
        this.tokens = tokens;
    }

    /**
     * Parses a complete DOT graph.
     *
     * @param text full DOT source
     * @return the parsed graph
     * @throws DotLexException      on a malformed token
     * @throws DotSyntaxException   when the tokens do not match the grammar
     * @throws DotSemanticException when an edge operator does not match {@code graph}/{@code digraph}
     */
    public static GraphData parse(String text) {
        if (text == null) {
            throw new IllegalArgumentException("DOT source must not be null");
        }
        return new DotParser(DotLexer.tokenize(text)).parseGraph();
    }

    private GraphData parseGraph() {
        boolean strict = accept(TokenType.STRICT);
        boolean directed;
        if (accept(TokenType.DIGRAPH)) {
            directed = true;
        } else if (accept(TokenType.GRAPH)) {
            directed = false;
        } else {
            throw new DotSyntaxException("'graph' or 'digraph'", peek());
        }
        String name = peek().getType().isLabel() ? advance().getText() : null;
        graph = new GraphAccumulator(directed, strict);

        expect(TokenType.LBRACE, "'{'");
        ScopeContext rootScope = parseStatementList(ScopeContext.EMPTY, new LinkedHashSet<>());
        expect(TokenType.RBRACE, "'}'");
        expect(TokenType.EOF, "end of input");
        return graph.build(name, rootScope);
    }

    /**
     * Parses statements up to the closing brace of the current block, without consuming it.
     *
     * @param scope   defaults in effect at the start of the block
     * @param touched receives every node id mentioned in the block, nested blocks included
     * @return defaults in effect at the end of the block
     */
    private ScopeContext parseStatementList(ScopeContext scope, Set<String> touched) {
        while (!peek().is(TokenType.RBRACE) && !peek().is(TokenType.EOF)) {
            scope = parseStatement(scope, touched);
            accept(TokenType.SEMICOLON);
        }
        return scope;
    }

    private ScopeContext parseStatement(ScopeContext scope, Set<String> touched) {
        Token token = peek();
        switch (token.getType()) {
            case GRAPH:
                advance();
                graph.mergeGraphAttributes(parseAttributeList());
                return scope;
            case NODE:
                advance();
                return scope.withNodeDefaults(parseAttributeList());
            case EDGE:
                advance();
                return scope.withEdgeDefaults(parseAttributeList());
            case SUBGRAPH:
            case LBRACE:
                parseNodeOrEdgeStatement(scope, touched);
                return scope;
            default:
                if (!token.getType().isLabel()) {
                    throw new DotSyntaxException("statement", token);
                }
                if (peek(1).is(TokenType.EQUALS)) {
                    // ID = ID carries no node, edge or attribute
                    advance();
                    advance();
                    expectLabel("value");
                } else {
                    parseNodeOrEdgeStatement(scope, touched);
                }
                return scope;
        }
    }

    private void parseNodeOrEdgeStatement(ScopeContext scope, Set<String> touched) {
        boolean startsWithNodeId = peek().getType().isLabel();
        Set<String> first = parseEndpoint(scope, touched);
        if (peek().getType().isEdgeOperator()) {
            parseEdgeChain(first, scope, touched);
        } else if (startsWithNodeId) {
            String id = first.iterator().next();
            graph.addNode(id, scope.getNodeDefaults(), parseAttributeList());
        }
    }

    private void parseEdgeChain(Set<String> first, ScopeContext scope, Set<String> touched) {
        // scope is immutable, so its edge defaults are the snapshot taken at statement start
        Map<String, String> defaults = scope.getEdgeDefaults();

        List<Set<String>> endpoints = new ArrayList<>();
        endpoints.add(first);
        while (peek().getType().isEdgeOperator()) {
            checkEdgeOperator(advance());
            endpoints.add(parseEndpoint(scope, touched));
        }

        // Edges created inside subgraph endpoints were inserted above and are not affected
        Map<String, String> attributes = Attributes.merge(defaults, parseAttributeList());
        for (int i = 0; i + 1 < endpoints.size(); i++) {
            for (String source : endpoints.get(i)) {
                for (String target : endpoints.get(i + 1)) {
                    graph.addEdgeOccurrence(source, target, attributes);
                }
            }
        }
    }

    private void checkEdgeOperator(Token operator) {
        boolean directedOperator = operator.is(TokenType.DIRECTED_EDGE);
        if (directedOperator != graph.isDirected()) {
            String expected = graph.isDirected() ? "'->' in a digraph" : "'--' in an undirected graph";
            throw new DotSemanticException(
                    "Edge operator '" + operator.getText() + "' does not match graph type, expected " + expected,
                    operator.getLine(),
                    operator.getColumn());
        }
    }

    /**
     * Parses a node id or a subgraph and returns the node ids it denotes.
     */
    private Set<String> parseEndpoint(ScopeContext scope, Set<String> touched) {
        if (peek().is(TokenType.SUBGRAPH) || peek().is(TokenType.LBRACE)) {
            Set<String> members = parseSubgraph(scope);
            touched.addAll(members);
            return members;
        }
        String id = parseNodeId();
        graph.addNode(id, scope.getNodeDefaults(), Map.of());
        touched.add(id);
        return Set.of(id);
    }

    /**
     * The subgraph's own default changes stay inside it; only its node set comes back.
     */
    private Set<String> parseSubgraph(ScopeContext scope) {
        if (accept(TokenType.SUBGRAPH) && peek().getType().isLabel()) {
            advance(); // subgraph name
        }
        expect(TokenType.LBRACE, "'{'");
        Set<String> members = new LinkedHashSet<>();
        parseStatementList(scope, members);
        expect(TokenType.RBRACE, "'}'");
        return members;
    }

    /**
     * Reads {@code ID [":" port [":" compass]]}; port and compass are dropped.
     */
    private String parseNodeId() {
        String id = expectLabel("node id");
        if (accept(TokenType.COLON)) {
            expectLabel("port");
            if (accept(TokenType.COLON)) {
                expectLabel("compass point");
            }
        }
        return id;
    }

    /**
     * Reads zero or more bracket groups and concatenates them; later keys overwrite earlier ones.
     */
    private Map<String, String> parseAttributeList() {
        Map<String, String> attributes = new LinkedHashMap<>();
        while (accept(TokenType.LBRACKET)) {
            while (!accept(TokenType.RBRACKET)) {
                String key = expectLabel("attribute name or ']'");
                expect(TokenType.EQUALS, "'='");
                attributes.put(key, expectLabel("attribute value"));
                if (!accept(TokenType.COMMA)) {
                    accept(TokenType.SEMICOLON);
                }
            }
        }
        return attributes;
    }

    // Token stream helpers

    private Token peek() {
        return peek(0);
    }

    private Token peek(int offset) {
        int index = Math.min(pos + offset, tokens.size() - 1);
        return tokens.get(index);
    }

    private Token advance() {
        Token token = peek();
        if (!token.is(TokenType.EOF)) {
            pos++;
        }
        return token;
    }

    private boolean accept(TokenType type) {
        if (peek().is(type)) {
            advance();
            return true;
        }
        return false;
    }

    private Token expect(TokenType type, String description) {
        if (!peek().is(type)) {
            throw new DotSyntaxException(description, peek());
        }
        return advance();
    }

    private String expectLabel(String description) {
        if (!peek().getType().isLabel()) {
            throw new DotSyntaxException(description, peek());
        }
        return advance().getText();
    }
}
