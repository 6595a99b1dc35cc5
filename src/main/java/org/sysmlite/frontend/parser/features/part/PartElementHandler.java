package org.sysmlite.frontend.parser.features.part;

import org.sysmlite.frontend.element.IElementHandler;
import org.sysmlite.frontend.lexer.Token;
import org.sysmlite.frontend.lexer.TokenType;
import org.sysmlite.frontend.parser.ParsingContext;
import org.sysmlite.frontend.parser.ast.AstNode;

import java.util.List;

/**
 * Handler for the <code>part</code> element.
 */
public class PartElementHandler implements IElementHandler {

    /**
     * Parses a part. The syntax is
     * <code>part &lt;name&gt;? (specializes &lt;name&gt;?)? ({ element* } | ;)?</code>.
     * @param context The parsing context.
     * @return A {@link PartNode} representing the part.
     */
    @Override
    public AstNode parse(ParsingContext context) {
        Token keyword = context.expect(TokenType.KEYWORD, "part");

        String name = null;
        if (context.match(TokenType.IDENTIFIER)) {
            name = context.previous().valueText();
        }

        // Matched by value, the lexer classifies it as a keyword.
        String specializes = null;
        if (context.matchValue("specializes") && context.match(TokenType.IDENTIFIER)) {
            specializes = context.previous().valueText();
        }

        List<AstNode> body = List.of();
        if (context.checkValue("{")) {
            body = context.block();
        } else {
            context.matchValue(";");
        }

        return new PartNode(name, specializes, body, context.sourceInfo(keyword));
    }
}
