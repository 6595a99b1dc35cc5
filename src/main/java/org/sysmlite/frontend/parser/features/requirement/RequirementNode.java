package org.sysmlite.frontend.parser.features.requirement;

import org.sysmlite.api.SourceInfo;
import org.sysmlite.frontend.parser.ast.AstNode;
import org.sysmlite.frontend.parser.ast.NodeProperties;
import org.sysmlite.frontend.parser.ast.NodeType;
import org.sysmlite.frontend.parser.ast.PropertyKeys;

import java.util.List;
import java.util.Map;

/**
 * An AST node that represents a <code>requirement</code> declaration.
 *
 * @param name The requirement name, or {@code null}.
 * @param body The nested elements of the requirement.
 * @param source The position of the <code>requirement</code> keyword.
 */
public record RequirementNode(
        String name,
        List<AstNode> body,
        SourceInfo source
) implements AstNode {

    public RequirementNode {
        body = List.copyOf(body);
    }

    @Override
    public NodeType type() {
        return NodeType.REQUIREMENT;
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
