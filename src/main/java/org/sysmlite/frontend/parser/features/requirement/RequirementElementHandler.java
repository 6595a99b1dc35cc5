package org.sysmlite.frontend.parser.features.requirement;

import org.sysmlite.frontend.element.IElementHandler;
import org.sysmlite.frontend.lexer.Token;
import org.sysmlite.frontend.lexer.TokenType;
import org.sysmlite.frontend.parser.ParsingContext;
import org.sysmlite.frontend.parser.ast.AstNode;

import java.util.List;

/**
 * Handler for the <code>requirement</code> element. A requirement has no
 * <code>;</code>-terminated form.
 */
public class RequirementElementHandler implements IElementHandler {

    @Override
    public AstNode parse(ParsingContext context) {
        Token keyword = context.expect(TokenType.KEYWORD, "requirement");

        String name = null;
        if (context.match(TokenType.IDENTIFIER)) {
            name = context.previous().valueText();
        }

        List<AstNode> body = List.of();
        if (context.checkValue("{")) {
            body = context.block();
        }

        return new RequirementNode(name, body, context.sourceInfo(keyword));
    }
}
