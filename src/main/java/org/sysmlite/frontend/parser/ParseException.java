package org.sysmlite.frontend.parser;

import org.sysmlite.frontend.lexer.Token;

/**
 * Signals a structural parse failure: the current token did not match what the
 * grammar required. It unwinds to the recovery boundary in {@link Parser#parse()}.
 */
public class ParseException extends RuntimeException {

    private final transient Token token;

    /**
     * Constructs a new parse exception.
     * @param message The detail message, naming the expected and the actual token.
     * @param token The offending token, or {@code null} if the token stream was exhausted.
     */
    public ParseException(String message, Token token) {
        super(message);
        this.token = token;
    }

    /**
     * @return The offending token, or {@code null} past the end of the token stream.
     */
    public Token getToken() {
        return token;
    }
}
