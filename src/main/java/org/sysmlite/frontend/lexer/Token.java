package org.sysmlite.frontend.lexer;

/**
 * Represents a single token extracted from the source text by the {@link Lexer}.
 *
 * @param type The type of the token (e.g., KEYWORD, IDENTIFIER, NUMBER).
 * @param text The exact text of the token from the source, empty for {@link TokenType#END_OF_FILE}.
 * @param value The decoded value: a {@link String} for textual tokens, a {@link Double} for numbers,
 *              {@code null} for the end of file.
 * @param line The 1-based line of the token's first character.
 * @param column The 1-based column of the token's first character.
 * @param fileName The logical name of the source the token was read from.
 */
public record Token(
        TokenType type,
        String text,
        Object value,
        int line,
        int column,
        String fileName
) {

    /**
     * Returns the value as a string, or {@code null} for the end-of-file token.
     * @return The string form of the value.
     */
    public String valueText() {
        return value == null ? null : value.toString();
    }

    /**
     * Describes the token the way parse errors report it, e.g. {@code KEYWORD 'part'}.
     * @return A short description of the token.
     */
    public String describe() {
        if (type == TokenType.END_OF_FILE) {
            return "EOF";
        }
        return type + " '" + value + "'";
    }
}
