package org.sysmlite.frontend.parser.features.usecase;

import org.sysmlite.api.SourceInfo;
import org.sysmlite.frontend.parser.ast.AstNode;
import org.sysmlite.frontend.parser.ast.NodeProperties;
import org.sysmlite.frontend.parser.ast.NodeType;
import org.sysmlite.frontend.parser.ast.PropertyKeys;

import java.util.List;
import java.util.Map;

/**
 * An AST node that represents a <code>use case</code> declaration.
 *
 * @param name The use case name, or {@code null}.
 * @param body The nested elements of the use case.
 * @param source The position of the <code>use</code> keyword.
 */
public record UseCaseNode(
        String name,
        List<AstNode> body,
        SourceInfo source
) implements AstNode {

    public UseCaseNode {
        body = List.copyOf(body);
    }

    @Override
    public NodeType type() {
        return NodeType.USECASE;
    }

    @Override
    public Map<String, Object> properties() {
        return new NodeProperties().put(PropertyKeys.NAME, name).build();
    }

    @Override
    public List<AstNode> getChildren() {
        return body;
    }
}
