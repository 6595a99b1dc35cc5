package org.sysmlite.frontend.parser.ast;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The base interface for all nodes in the Abstract Syntax Tree (AST).
 * Nodes are immutable once the rule that built them has returned.
 */
public interface AstNode {

    /**
     * @return The type tag of this node.
     */
    NodeType type();

    /**
     * Returns the optional properties of this node in a fixed order. Keys
     * (see {@link PropertyKeys}) are only present if the source specified them.
     *
     * @return An unmodifiable map of the present properties.
     */
    default Map<String, Object> properties() {
        return Collections.emptyMap();
    }

    /**
     * Returns a list of the direct child nodes in source order.
     * This allows a generic TreeWalker to traverse the tree
     * without knowing the specific structure of each node.
     *
     * @return A list of child nodes. Returns an empty list if the node has no children.
     */
    default List<AstNode> getChildren() {
        return Collections.emptyList();
    }

    /**
     * @return The name of this node, if the source specified one.
     */
    default Optional<String> getName() {
        return Optional.ofNullable((String) properties().get(PropertyKeys.NAME));
    }

    /**
     * @return The (type, name) identity of this node.
     */
    default NodeKey key() {
        return new NodeKey(type(), getName().orElse(null));
    }
}
