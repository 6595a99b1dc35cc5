package org.sysmlite.cli.commands;

import org.sysmlite.frontend.lexer.Token;
import org.sysmlite.frontend.lexer.TokenType;
import org.sysmlite.frontend.lexer.Lexer;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;
import java.util.concurrent.Callable;

@Command(name = "tokens", description = "Prints the token stream of a model file.")
public class TokensCommand implements Callable<Integer> {

    @Option(names = {"-f", "--file"}, required = true, description = "The path to the model file.")
    private File file;

    @Option(names = "--include-comments", description = "Also print comment tokens.")
    private boolean includeComments;

    @Spec
    private CommandSpec spec;

    @Override
    public Integer call() {
        String source;
        try {
            source = Files.readString(file.toPath(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            spec.commandLine().getErr().println("Cannot read " + file + ": " + e.getMessage());
            return ParseCommand.EXIT_IO_ERROR;
        }

        List<Token> tokens = new Lexer(source).scanTokens();
        PrintWriter out = spec.commandLine().getOut();
        for (Token token : tokens) {
            if (token.type() == TokenType.COMMENT && !includeComments) {
                continue;
            }
            out.println(format(token));
        }
        out.flush();
        return 0;
    }

    static String format(Token token) {
        String position = token.line() + ":" + token.column() + " " + token.type();
        return token.type() == TokenType.END_OF_FILE ? position : position + " '" + token.value() + "'";
    }
}
