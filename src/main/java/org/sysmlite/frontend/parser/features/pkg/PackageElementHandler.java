package org.sysmlite.frontend.parser.features.pkg;

import org.sysmlite.frontend.element.IElementHandler;
import org.sysmlite.frontend.lexer.Token;
import org.sysmlite.frontend.lexer.TokenType;
import org.sysmlite.frontend.parser.ParsingContext;
import org.sysmlite.frontend.parser.ast.AstNode;

import java.util.List;

/**
 * Handler for the <code>package</code> element.
 */
public class PackageElementHandler implements IElementHandler {

    /**
     * Parses a package. The syntax is <code>package &lt;name&gt;? ({ element* })?</code>;
     * a package without a body needs no terminator.
     * @param context The parsing context.
     * @return A {@link PackageNode} representing the package.
     */
    @Override
    public AstNode parse(ParsingContext context) {
        Token keyword = context.expect(TokenType.KEYWORD, "package");

        String name = null;
        if (context.match(TokenType.IDENTIFIER)) {
            name = context.previous().valueText();
        }

        List<AstNode> body = List.of();
        if (context.checkValue("{")) {
            body = context.block();
        }

        return new PackageNode(name, body, context.sourceInfo(keyword));
    }
}
