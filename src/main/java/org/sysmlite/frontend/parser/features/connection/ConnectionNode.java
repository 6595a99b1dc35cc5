package org.sysmlite.frontend.parser.features.connection;

import org.sysmlite.api.SourceInfo;
import org.sysmlite.frontend.parser.ast.AstNode;
import org.sysmlite.frontend.parser.ast.NodeProperties;
import org.sysmlite.frontend.parser.ast.NodeType;
import org.sysmlite.frontend.parser.ast.PropertyKeys;

import java.util.Map;

/**
 * An AST node that represents a <code>connection</code> declaration.
 *
 * @param name The connection name, or {@code null}.
 * @param fromRef The first endpoint name, or {@code null}.
 * @param toRef The second endpoint name, or {@code null}.
 * @param source The position of the <code>connection</code> keyword.
 */
public record ConnectionNode(
        String name,
        String fromRef,
        String toRef,
        SourceInfo source
) implements AstNode {

    @Override
    public NodeType type() {
        return NodeType.CONNECTION;
    }

    @Override
    public Map<String, Object> properties() {
        return new NodeProperties()
                .put(PropertyKeys.NAME, name)
                .put(PropertyKeys.FROM_REF, fromRef)
                .put(PropertyKeys.TO_REF, toRef)
                .build();
    }
}
