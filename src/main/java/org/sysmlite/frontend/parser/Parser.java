package org.sysmlite.frontend.parser;

import org.sysmlite.diagnostics.DiagnosticsEngine;
import org.sysmlite.frontend.element.ElementHandlerRegistry;
import org.sysmlite.frontend.element.IElementHandler;
import org.sysmlite.frontend.lexer.Token;
import org.sysmlite.frontend.lexer.TokenType;
import org.sysmlite.frontend.parser.ast.AstNode;
import org.sysmlite.frontend.parser.ast.GenericNode;
import org.sysmlite.frontend.parser.ast.RootNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * The recursive-descent parser for the modeling language. It consumes a list of tokens
 * from the {@link org.sysmlite.frontend.lexer.Lexer} and produces an Abstract Syntax Tree (AST).
 * <p>
 * Elements are dispatched on their leading keyword through the {@link ElementHandlerRegistry};
 * everything else is parsed as a generic element. The first {@link ParseException} stops the
 * whole parse: it is logged and reported to the diagnostics, and the elements completed
 * before it are returned. A parser instance is single-use and not thread-safe.
 */
public class Parser implements ParsingContext {

    private static final Logger LOG = LoggerFactory.getLogger(Parser.class);

    /** Maximum number of nested bodies. Deeper input fails like any other structural error. */
    public static final int MAX_NESTING_DEPTH = 256;

    private final List<Token> tokens;
    private final DiagnosticsEngine diagnostics;
    private final ElementHandlerRegistry elementRegistry;
    private int current = 0;
    private int depth = 0;

    /**
     * Constructs a new Parser that reports only through the log.
     * @param tokens The list of tokens to parse.
     */
    public Parser(List<Token> tokens) {
        this(tokens, new DiagnosticsEngine());
    }

    /**
     * Constructs a new Parser. Comment tokens are dropped before parsing.
     * @param tokens The list of tokens to parse.
     * @param diagnostics The engine for reporting errors.
     */
    public Parser(List<Token> tokens, DiagnosticsEngine diagnostics) {
        this.tokens = tokens.stream().filter(t -> t.type() != TokenType.COMMENT).toList();
        this.diagnostics = diagnostics;
        this.elementRegistry = ElementHandlerRegistry.initialize();
    }

    /**
     * Parses the entire token stream.
     * @return The root node; its children are the top-level elements parsed before the first error, if any.
     */
    public RootNode parse() {
        List<AstNode> elements = new ArrayList<>();
        try {
            while (!isAtEnd()) {
                if (checkValue("}")) {
                    throw new ParseException("Unexpected '}' without an open body", peek());
                }
                AstNode element = element();
                if (element != null) {
                    elements.add(element);
                }
            }
        } catch (ParseException ex) {
            reportFailure(ex);
        }
        LOG.debug("Parsed {} top-level elements", elements.size());
        return new RootNode(elements);
    }

    /**
     * Parses a single element. Known keywords go to their handler, everything else
     * to the generic rule.
     * @return The parsed {@link AstNode}, or null at the end of the stream.
     */
    public AstNode element() {
        if (isAtEnd()) return null;

        if (check(TokenType.KEYWORD)) {
            Optional<IElementHandler> handler = elementRegistry.get(peek().valueText());
            if (handler.isPresent()) {
                return handler.get().parse(this);
            }
        }
        return genericElement();
    }

    /**
     * Skips one statement the grammar has no rule for. A leading identifier becomes the name,
     * an unhandled keyword is skipped with the rest. A closing brace is never consumed.
     */
    private AstNode genericElement() {
        Token first = peek();
        String name = null;
        if (match(TokenType.IDENTIFIER)) {
            name = previous().valueText();
        }

        while (!isAtEnd() && !checkValue(";") && !checkValue("}")) {
            advance();
        }
        matchValue(";");

        return new GenericNode(name, sourceInfo(first));
    }

    @Override
    public List<AstNode> block() {
        Token open = expect(TokenType.PUNCTUATION, "{");
        if (depth >= MAX_NESTING_DEPTH) {
            throw new ParseException("Nesting too deep: more than " + MAX_NESTING_DEPTH + " levels", open);
        }
        depth++;
        try {
            List<AstNode> body = new ArrayList<>();
            while (!isAtEnd() && !checkValue("}")) {
                AstNode element = element();
                if (element != null) {
                    body.add(element);
                }
            }
            expect(TokenType.PUNCTUATION, "}");
            return body;
        } finally {
            depth--;
        }
    }

    private void reportFailure(ParseException ex) {
        Token at = ex.getToken() != null ? ex.getToken() : lastToken();
        if (at != null) {
            diagnostics.reportError(ex.getMessage(), at.fileName(), at.line(), at.column());
        } else {
            diagnostics.reportError(ex.getMessage(), "<memory>", 0, 0);
        }
        LOG.error("Parse error: {}", ex.getMessage());
    }

    private Token lastToken() {
        return tokens.isEmpty() ? null : tokens.get(tokens.size() - 1);
    }

    @Override
    public Token expect(TokenType type, String value) {
        Token token = peek();
        if (token == null || token.type() != type || (value != null && !value.equals(token.value()))) {
            String expected = type + (value != null ? " '" + value + "'" : "");
            String actual = token == null ? "EOF" : token.describe();
            throw new ParseException("Expected " + expected + " but got " + actual, token);
        }
        return advance();
    }

    @Override
    public boolean match(TokenType... types) {
        for (TokenType type : types) {
            if (check(type)) {
                advance();
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean check(TokenType type) {
        if (isAtEnd()) return false;
        return peek().type() == type;
    }

    @Override
    public boolean checkValue(String value) {
        Token token = peek();
        return token != null && value.equals(token.value());
    }

    @Override
    public boolean matchValue(String value) {
        if (checkValue(value)) {
            advance();
            return true;
        }
        return false;
    }

    @Override
    public Token advance() {
        if (!isAtEnd()) current++;
        return previous();
    }

    @Override
    public boolean isAtEnd() {
        Token token = peek();
        return token == null || token.type() == TokenType.END_OF_FILE;
    }

    @Override
    public Token peek() {
        return current < tokens.size() ? tokens.get(current) : null;
    }

    @Override
    public Token previous() {
        return current > 0 ? tokens.get(current - 1) : null;
    }
}
