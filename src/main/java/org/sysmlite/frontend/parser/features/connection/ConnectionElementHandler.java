package org.sysmlite.frontend.parser.features.connection;

import org.sysmlite.frontend.element.IElementHandler;
import org.sysmlite.frontend.lexer.Token;
import org.sysmlite.frontend.lexer.TokenType;
import org.sysmlite.frontend.parser.ParsingContext;
import org.sysmlite.frontend.parser.ast.AstNode;

/**
 * Handler for the <code>connection</code> element.
 */
public class ConnectionElementHandler implements IElementHandler {

    /**
     * Parses a connection. The syntax is
     * <code>connection &lt;name&gt;? (: (&lt;from&gt; &lt;to&gt;?)?)? ;?</code>.
     * <p>
     * Endpoints are plain identifiers. In <code>connection c : a B.c;</code> parsing stops
     * before the dot, and <code>.c;</code> becomes a generic sibling element.
     * @param context The parsing context.
     * @return A {@link ConnectionNode} representing the connection.
     */
    @Override
    public AstNode parse(ParsingContext context) {
        Token keyword = context.expect(TokenType.KEYWORD, "connection");

        String name = null;
        if (context.match(TokenType.IDENTIFIER)) {
            name = context.previous().valueText();
        }

        String fromRef = null;
        String toRef = null;
        if (context.matchValue(":") && context.match(TokenType.IDENTIFIER)) {
            fromRef = context.previous().valueText();
            if (context.match(TokenType.IDENTIFIER)) {
                toRef = context.previous().valueText();
            }
        }

        context.matchValue(";");

        return new ConnectionNode(name, fromRef, toRef, context.sourceInfo(keyword));
    }
}
