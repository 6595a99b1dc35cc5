package org.sysmlite.frontend.parser.features.port;

import org.sysmlite.frontend.element.IElementHandler;
import org.sysmlite.frontend.lexer.Token;
import org.sysmlite.frontend.lexer.TokenType;
import org.sysmlite.frontend.parser.ParsingContext;
import org.sysmlite.frontend.parser.ast.AstNode;

/**
 * Handler for the <code>port</code> element.
 */
public class PortElementHandler implements IElementHandler {

    @Override
    public AstNode parse(ParsingContext context) {
        Token keyword = context.expect(TokenType.KEYWORD, "port");

        String name = null;
        if (context.match(TokenType.IDENTIFIER)) {
            name = context.previous().valueText();
        }

        String propType = null;
        if (context.matchValue(":") && context.match(TokenType.IDENTIFIER)) {
            propType = context.previous().valueText();
        }

        context.matchValue(";");

        return new PortNode(name, propType, context.sourceInfo(keyword));
    }
}
