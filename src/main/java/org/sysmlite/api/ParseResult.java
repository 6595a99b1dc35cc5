package org.sysmlite.api;

import org.sysmlite.diagnostics.Diagnostic;
import org.sysmlite.frontend.parser.ast.RootNode;

import java.util.List;
import java.util.Optional;

/**
 * The outcome of one parse run: the (possibly partial) tree and the diagnostics.
 *
 * @param root The root node. If parsing stopped on an error, it holds the elements completed before it.
 * @param diagnostics All warnings and errors of the run.
 */
public record ParseResult(RootNode root, List<Diagnostic> diagnostics) {

    public ParseResult {
        diagnostics = List.copyOf(diagnostics);
    }

    /**
     * @return true if parsing stopped on an error.
     */
    public boolean hasErrors() {
        return firstError().isPresent();
    }

    /**
     * @return The error that stopped parsing, if any.
     */
    public Optional<Diagnostic> firstError() {
        return diagnostics.stream().filter(d -> d.type() == Diagnostic.Type.ERROR).findFirst();
    }
}
