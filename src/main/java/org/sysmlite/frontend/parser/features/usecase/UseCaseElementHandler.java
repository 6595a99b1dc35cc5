package org.sysmlite.frontend.parser.features.usecase;

import org.sysmlite.frontend.element.IElementHandler;
import org.sysmlite.frontend.lexer.Token;
import org.sysmlite.frontend.lexer.TokenType;
import org.sysmlite.frontend.parser.ParsingContext;
import org.sysmlite.frontend.parser.ast.AstNode;

import java.util.List;

/**
 * Handler for the <code>use case</code> element.
 */
public class UseCaseElementHandler implements IElementHandler {

    /**
     * Parses a use case. The syntax is <code>use case? &lt;name&gt;? ({ element* })?</code>;
     * the <code>case</code> keyword is optional.
     * @param context The parsing context.
     * @return A {@link UseCaseNode} representing the use case.
     */
    @Override
    public AstNode parse(ParsingContext context) {
        Token keyword = context.expect(TokenType.KEYWORD, "use");
        context.matchValue("case");

        String name = null;
        if (context.match(TokenType.IDENTIFIER)) {
            name = context.previous().valueText();
        }

        List<AstNode> body = List.of();
        if (context.checkValue("{")) {
            body = context.block();
        }

        return new UseCaseNode(name, body, context.sourceInfo(keyword));
    }
}
