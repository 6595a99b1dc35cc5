package org.sysmlite.frontend.parser.ast;

import org.sysmlite.api.SourceInfo;

import java.util.Map;

/**
 * An AST node for a statement the parser has no dedicated rule for. Its tokens
 * are skipped; only a leading identifier is kept as the name.
 *
 * @param name The leading identifier, or {@code null}.
 * @param source The position of the first token of the statement.
 */
public record GenericNode(String name, SourceInfo source) implements AstNode {

    @Override
    public NodeType type() {
        return NodeType.GENERIC;
    }

    @Override
    public Map<String, Object> properties() {
        return new NodeProperties().put(PropertyKeys.NAME, name).build();
    }
}
