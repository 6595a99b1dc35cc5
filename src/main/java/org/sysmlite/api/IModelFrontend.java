package org.sysmlite.api;

import org.sysmlite.frontend.lexer.Token;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Defines the public interface of the model front end: text in, syntax tree out.
 * Malformed source never causes an exception; errors are logged and returned as diagnostics.
 */
public interface IModelFrontend {

    /**
     * Parses the given source.
     *
     * @param source The full model source.
     * @return The parse result.
     */
    default ParseResult parse(String source) {
        return parse(source, "<memory>");
    }

    /**
     * Parses the given source.
     *
     * @param source The full model source.
     * @param fileName A logical name of the source, used in diagnostics.
     * @return The parse result.
     */
    ParseResult parse(String source, String fileName);

    /**
     * Tokenizes the given source, comments included.
     *
     * @param source The full model source.
     * @return The tokens, terminated by a single end-of-file token.
     */
    List<Token> tokenize(String source);

    /**
     * Parses a UTF-8 source file.
     *
     * @param file The path of the file.
     * @return The parse result.
     * @throws IOException if the file cannot be read.
     */
    default ParseResult parseFile(Path file) throws IOException {
        return parse(Files.readString(file, StandardCharsets.UTF_8), file.toString().replace('\\', '/'));
    }
}
