package org.sysmlite.frontend.parser.features.port;

import org.sysmlite.api.SourceInfo;
import org.sysmlite.frontend.parser.ast.AstNode;
import org.sysmlite.frontend.parser.ast.NodeProperties;
import org.sysmlite.frontend.parser.ast.NodeType;
import org.sysmlite.frontend.parser.ast.PropertyKeys;

import java.util.Map;

/**
 * An AST node that represents a <code>port</code> declaration.
 *
 * @param name The port name, or {@code null}.
 * @param propType The port type name, or {@code null}.
 * @param source The position of the <code>port</code> keyword.
 */
public record PortNode(
        String name,
        String propType,
        SourceInfo source
) implements AstNode {

    @Override
    public NodeType type() {
        return NodeType.PORT;
    }

    @Override
    public Map<String, Object> properties() {
        return new NodeProperties()
                .put(PropertyKeys.NAME, name)
                .put(PropertyKeys.PROP_TYPE, propType)
                .build();
    }
}
