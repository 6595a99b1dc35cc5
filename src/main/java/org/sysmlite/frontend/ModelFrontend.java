package org.sysmlite.frontend;

import org.sysmlite.api.IModelFrontend;
import org.sysmlite.api.ParseResult;
import org.sysmlite.diagnostics.DiagnosticsEngine;
import org.sysmlite.frontend.lexer.Lexer;
import org.sysmlite.frontend.lexer.Token;
import org.sysmlite.frontend.parser.Parser;
import org.sysmlite.frontend.parser.ast.RootNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * The front-end pipeline: {@link Lexer} then {@link Parser}.
 * <p>
 * Every call builds a fresh lexer, parser and diagnostics engine, so one instance
 * can serve concurrent parses of different source snapshots.
 */
public class ModelFrontend implements IModelFrontend {

    private static final Logger LOG = LoggerFactory.getLogger(ModelFrontend.class);

    @Override
    public ParseResult parse(String source, String fileName) {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        // Phase 1: Lexical Analysis
        List<Token> tokens = new Lexer(source, diagnostics, fileName).scanTokens();

        // Phase 2: Parsing
        RootNode root = new Parser(tokens, diagnostics).parse();

        diagnostics.firstError().ifPresent(error -> LOG.debug("Parsing {} stopped at {}:{} after {} top-level elements",
                fileName, error.lineNumber(), error.columnNumber(), root.getChildren().size()));
        return new ParseResult(root, diagnostics.getDiagnostics());
    }

    @Override
    public List<Token> tokenize(String source) {
        return new Lexer(source).scanTokens();
    }
}
