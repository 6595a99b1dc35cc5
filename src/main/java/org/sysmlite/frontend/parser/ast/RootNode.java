package org.sysmlite.frontend.parser.ast;

import java.util.List;

/**
 * The synthetic root of a parsed model. Its children are the top-level elements.
 *
 * @param elements The top-level elements in source order.
 */
public record RootNode(List<AstNode> elements) implements AstNode {

    public RootNode {
        elements = List.copyOf(elements);
    }

    @Override
    public NodeType type() {
        return NodeType.ROOT;
    }

    @Override
    public List<AstNode> getChildren() {
        return elements;
    }
}
