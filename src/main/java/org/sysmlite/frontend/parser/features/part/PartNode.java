package org.sysmlite.frontend.parser.features.part;

import org.sysmlite.api.SourceInfo;
import org.sysmlite.frontend.parser.ast.AstNode;
import org.sysmlite.frontend.parser.ast.NodeProperties;
import org.sysmlite.frontend.parser.ast.NodeType;
import org.sysmlite.frontend.parser.ast.PropertyKeys;

import java.util.List;
import java.util.Map;

/**
 * An AST node that represents a <code>part</code> declaration.
 *
 * @param name The part name, or {@code null}.
 * @param specializes The name after <code>specializes</code>, or {@code null}.
 * @param body The nested elements of the part.
 * @param source The position of the <code>part</code> keyword.
 */
public record PartNode(
        String name,
        String specializes,
        List<AstNode> body,
        SourceInfo source
) implements AstNode {

    public PartNode {
        body = List.copyOf(body);
    }

    @Override
    public NodeType type() {
        return NodeType.PART;
    }

    @Override
    public Map<String, Object> properties() {
        return new NodeProperties()
                .put(PropertyKeys.NAME, name)
                .put(PropertyKeys.SPECIALIZES, specializes)
                .build();
    }

    @Override
    public List<AstNode> getChildren() {
        return body;
    }
}
