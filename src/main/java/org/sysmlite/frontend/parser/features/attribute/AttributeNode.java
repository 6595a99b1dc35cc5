package org.sysmlite.frontend.parser.features.attribute;

import org.sysmlite.api.SourceInfo;
import org.sysmlite.frontend.parser.ast.AstNode;
import org.sysmlite.frontend.parser.ast.NodeProperties;
import org.sysmlite.frontend.parser.ast.NodeType;
import org.sysmlite.frontend.parser.ast.PropertyKeys;

import java.util.Map;

/**
 * An AST node that represents an <code>attribute</code> declaration.
 *
 * @param name The attribute name, or {@code null}.
 * @param propType The declared type name, or {@code null}.
 * @param defaultValue The default value, a {@link Double} or a {@link String}, or {@code null}.
 * @param source The position of the <code>attribute</code> keyword.
 */
public record AttributeNode(
        String name,
        String propType,
        Object defaultValue,
        SourceInfo source
) implements AstNode {

    @Override
    public NodeType type() {
        return NodeType.ATTRIBUTE;
    }

    @Override
    public Map<String, Object> properties() {
        return new NodeProperties()
                .put(PropertyKeys.NAME, name)
                .put(PropertyKeys.PROP_TYPE, propType)
                .put(PropertyKeys.DEFAULT_VALUE, defaultValue)
                .build();
    }
}
