package org.sysmlite.frontend.lexer;

import org.sysmlite.diagnostics.DiagnosticsEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * The Lexer (also known as Tokenizer or Scanner) is responsible for converting
 * a sequence of characters (model source) into a sequence of tokens.
 * <p>
 * The lexer never fails: malformed input such as an unterminated string or comment
 * degrades to a best-effort token and at most a warning in the {@link DiagnosticsEngine}.
 * The returned list always ends with exactly one {@link TokenType#END_OF_FILE} token.
 */
public class Lexer {

    private static final Logger LOG = LoggerFactory.getLogger(Lexer.class);

    private final String source;
    private final DiagnosticsEngine diagnostics;
    private final List<Token> tokens = new ArrayList<>();
    private final String logicalFileName;
    private int start = 0;
    private int current = 0;
    private int line = 1;
    private int column = 1;
    private int startLine = 1;
    private int startColumn = 1;

    /**
     * Creates a new Lexer that discards its warnings.
     * @param source The model source as a single string.
     */
    public Lexer(String source) {
        this(source, new DiagnosticsEngine());
    }

    /**
     * Creates a new Lexer.
     * @param source The model source as a single string.
     * @param diagnostics The engine for reporting warnings.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics) {
        this(source, diagnostics, "<memory>");
    }

    /**
     * Creates a new Lexer with an explicit logical file name.
     * @param source The model source as a single string.
     * @param diagnostics The engine for reporting warnings.
     * @param logicalFileName The name of the source being read, for diagnostics.
     */
    public Lexer(String source, DiagnosticsEngine diagnostics, String logicalFileName) {
        this.source = Objects.requireNonNull(source, "source");
        this.diagnostics = diagnostics;
        this.logicalFileName = logicalFileName;
    }

    /**
     * Performs the tokenization of the entire source.
     * @return A list of the recognized tokens, including comments, terminated by a single end-of-file token.
     */
    public List<Token> scanTokens() {
        while (true) {
            skipWhitespace();
            if (isAtEnd()) break;
            start = current;
            startLine = line;
            startColumn = column;
            scanToken();
        }
        tokens.add(new Token(TokenType.END_OF_FILE, "", null, line, column, logicalFileName));
        LOG.debug("Scanned {} tokens from {}", tokens.size(), logicalFileName);
        return tokens;
    }

    private void scanToken() {
        char c = advance();
        switch (c) {
            case '/':
                if (peek() == '/') {
                    lineComment();
                } else if (peek() == '*') {
                    blockComment();
                } else {
                    addToken(TokenType.OPERATOR, "/");
                }
                break;
            case '"', '\'':
                string(c);
                break;
            case '{', '}', '(', ')', ';', ':', ',', '.':
                addToken(TokenType.PUNCTUATION, String.valueOf(c));
                break;
            case '=', '<', '>', '!', '+', '-', '*':
                addToken(TokenType.OPERATOR, String.valueOf(c));
                break;
            default:
                if (isDigit(c)) {
                    number();
                } else if (isAlpha(c)) {
                    identifier();
                } else {
                    // Unknown characters become one-character identifiers.
                    addToken(TokenType.IDENTIFIER, String.valueOf(c));
                }
                break;
        }
    }

    private void lineComment() {
        // The value keeps the leading "//".
        while (peek() != '\n' && !isAtEnd()) advance();
        addToken(TokenType.COMMENT, source.substring(start, current));
    }

    private void blockComment() {
        advance(); // consume '*'
        int contentStart = current;
        while (!isAtEnd() && !(peek() == '*' && peekNext() == '/')) advance();
        String value = source.substring(contentStart, current);

        if (isAtEnd()) {
            warn("Unterminated block comment.");
        } else {
            advance();
            advance();
        }
        addToken(TokenType.COMMENT, value);
    }

    private void string(char quote) {
        StringBuilder value = new StringBuilder();
        while (!isAtEnd() && peek() != quote) {
            char c = advance();
            if (c == '\\') {
                // The escaped character is taken literally, no \n or \t translation.
                if (!isAtEnd()) value.append(advance());
            } else {
                value.append(c);
            }
        }

        if (isAtEnd()) {
            warn("Unterminated string.");
        } else {
            advance(); // The closing quote
        }
        addToken(TokenType.STRING, value.toString());
    }

    private void number() {
        while (isDigit(peek()) || peek() == '.') advance();

        String numberString = source.substring(start, current);
        double value;
        try {
            value = Double.parseDouble(numberString);
        } catch (NumberFormatException e) {
            warn("Invalid number format: " + numberString);
            value = Double.NaN;
        }
        addToken(TokenType.NUMBER, value);
    }

    private void identifier() {
        while (isAlphaNumeric(peek())) advance();
        String text = source.substring(start, current);
        TokenType type = Keywords.isKeyword(text) ? TokenType.KEYWORD : TokenType.IDENTIFIER;
        addToken(type, text);
    }

    private void skipWhitespace() {
        while (!isAtEnd() && isWhitespace(peek())) advance();
    }

    private boolean isWhitespace(char c) {
        // Unicode space separators (including no-break spaces) and the byte order mark count as well.
        return Character.isWhitespace(c) || Character.isSpaceChar(c) || c == '\uFEFF';
    }

    private char advance() {
        char c = source.charAt(current++);
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private void addToken(TokenType type, Object value) {
        String text = source.substring(start, current);
        tokens.add(new Token(type, text, value, startLine, startColumn, logicalFileName));
    }

    private void warn(String message) {
        LOG.debug("{} ({}:{}:{})", message, logicalFileName, startLine, startColumn);
        if (diagnostics != null) {
            diagnostics.reportWarning(message, logicalFileName, startLine, startColumn);
        }
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private char peek() {
        if (isAtEnd()) return '\0';
        return source.charAt(current);
    }

    private char peekNext() {
        if (current + 1 >= source.length()) return '\0';
        return source.charAt(current + 1);
    }

    private boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') ||
                (c >= 'A' && c <= 'Z') ||
                c == '_';
    }

    private boolean isAlphaNumeric(char c) {
        return isAlpha(c) || isDigit(c);
    }
}
