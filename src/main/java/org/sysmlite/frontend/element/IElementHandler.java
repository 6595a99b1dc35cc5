package org.sysmlite.frontend.element;

import org.sysmlite.frontend.parser.ParsingContext;
import org.sysmlite.frontend.parser.ast.AstNode;

/**
 * The base interface for all element handlers.
 * Each handler parses one element kind, starting at its leading keyword (e.g., "part").
 */
public interface IElementHandler {

    /**
     * Parses the element at the current position. The current token is the element's keyword.
     *
     * @param context The context that provides access to the token stream.
     * @return The AST node of the element.
     * @throws org.sysmlite.frontend.parser.ParseException if a nested body is malformed.
     */
    AstNode parse(ParsingContext context);
}
