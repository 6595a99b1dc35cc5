package org.sysmlite.frontend.parser.features.pkg;

import org.sysmlite.api.SourceInfo;
import org.sysmlite.frontend.parser.ast.AstNode;
import org.sysmlite.frontend.parser.ast.NodeProperties;
import org.sysmlite.frontend.parser.ast.NodeType;
import org.sysmlite.frontend.parser.ast.PropertyKeys;

import java.util.List;
import java.util.Map;

/**
 * An AST node that represents a <code>package</code> declaration.
 *
 * @param name The package name, or {@code null}.
 * @param body The members of the package.
 * @param source The position of the <code>package</code> keyword.
 */
public record PackageNode(
        String name,
        List<AstNode> body,
        SourceInfo source
) implements AstNode {

    public PackageNode {
        body = List.copyOf(body);
    }

    @Override
    public NodeType type() {
        return NodeType.PACKAGE;
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
