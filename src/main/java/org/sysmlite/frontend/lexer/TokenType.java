package org.sysmlite.frontend.lexer;

/**
 * Defines the different types of tokens that the {@link Lexer} can recognize.
 */
public enum TokenType {
    /** A reserved word of the modeling language, such as {@code part} or {@code package}. */
    KEYWORD,
    /** An identifier, such as an element or type name. Also used for unknown single characters. */
    IDENTIFIER,
    /** A single- or double-quoted string literal. */
    STRING,
    /** A numeric literal. */
    NUMBER,
    /** One of {@code = < > ! + - * /}. */
    OPERATOR,
    /** One of <code>{ } ( ) ; : , .</code> */
    PUNCTUATION,
    /** A line or block comment. Never consumed by the grammar. */
    COMMENT,
    /** Represents the end of the source text. */
    END_OF_FILE
}
