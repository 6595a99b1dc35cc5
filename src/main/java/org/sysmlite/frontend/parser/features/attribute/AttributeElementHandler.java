package org.sysmlite.frontend.parser.features.attribute;

import org.sysmlite.frontend.element.IElementHandler;
import org.sysmlite.frontend.lexer.Token;
import org.sysmlite.frontend.lexer.TokenType;
import org.sysmlite.frontend.parser.ParsingContext;
import org.sysmlite.frontend.parser.ast.AstNode;

/**
 * Handler for the <code>attribute</code> element.
 */
public class AttributeElementHandler implements IElementHandler {

    /**
     * Parses an attribute. The syntax is
     * <code>attribute &lt;name&gt;? (: &lt;type&gt;?)? (= (&lt;number&gt;|&lt;string&gt;)?)? ;?</code>.
     * The type must be an identifier; a keyword after the colon is left in the stream.
     * @param context The parsing context.
     * @return An {@link AttributeNode} representing the attribute.
     */
    @Override
    public AstNode parse(ParsingContext context) {
        Token keyword = context.expect(TokenType.KEYWORD, "attribute");

        String name = null;
        if (context.match(TokenType.IDENTIFIER)) {
            name = context.previous().valueText();
        }

        String propType = null;
        if (context.matchValue(":") && context.match(TokenType.IDENTIFIER)) {
            propType = context.previous().valueText();
        }

        Object defaultValue = null;
        if (context.matchValue("=") && context.match(TokenType.NUMBER, TokenType.STRING)) {
            defaultValue = context.previous().value();
        }

        context.matchValue(";");

        return new AttributeNode(name, propType, defaultValue, context.sourceInfo(keyword));
    }
}
