package org.sysmlite.frontend.parser;

import org.sysmlite.api.SourceInfo;
import org.sysmlite.frontend.lexer.Token;
import org.sysmlite.frontend.lexer.TokenType;
import org.sysmlite.frontend.parser.ast.AstNode;

import java.util.List;

/**
 * An interface that encapsulates the cursor state during parsing.
 * It provides element handlers with access to the token stream
 * without coupling them directly to the parser implementation.
 */
public interface ParsingContext {
    /**
     * Checks if the current token matches any of the given types. If so, consumes it.
     * @param types The token types to match.
     * @return true if the current token matches one of the types, false otherwise.
     */
    boolean match(TokenType... types);

    /**
     * Checks if the current token is of the given type without consuming it.
     * @param type The token type to check.
     * @return true if the current token is of the given type, false otherwise.
     */
    boolean check(TokenType type);

    /**
     * Checks if the current token's value equals the given value, regardless of its type.
     * @param value The value to compare with.
     * @return true if the values are equal, false otherwise (also at the end of the stream).
     */
    boolean checkValue(String value);

    /**
     * Consumes the current token if its value equals the given value, regardless of its type.
     * @param value The value to compare with.
     * @return true if the token was consumed, false otherwise.
     */
    boolean matchValue(String value);

    /**
     * Consumes the current token and returns it.
     * @return The consumed token.
     */
    Token advance();

    /**
     * Returns the current token without consuming it.
     * @return The current token, or {@code null} past the end of the stream.
     */
    Token peek();

    /**
     * Returns the previously consumed token.
     * @return The previous token.
     */
    Token previous();

    /**
     * Consumes the current token if it has the expected type and, if given, the expected value.
     * @param type The expected token type.
     * @param value The expected value, or {@code null} to accept any value.
     * @return The consumed token.
     * @throws ParseException if the current token does not match.
     */
    Token expect(TokenType type, String value);

    /**
     * Parses a body of the form <code>{ element* }</code>.
     * @return The elements of the body in source order.
     * @throws ParseException if the body is not closed.
     */
    List<AstNode> block();

    /**
     * Checks if the end of the token stream has been reached.
     * @return true if at the end of the stream, false otherwise.
     */
    boolean isAtEnd();

    /**
     * Converts the position of a token into a {@link SourceInfo}.
     * @param token The token.
     * @return The source position of the token.
     */
    default SourceInfo sourceInfo(Token token) {
        return new SourceInfo(token.fileName(), token.line(), token.column());
    }
}
