package org.sysmlite.frontend.parser.ast;

/**
 * The coarse identity used by consumers to recognize a node, e.g. the selected node
 * of a diagram. Distinct nodes with the same type and name share a key.
 *
 * @param type The node type.
 * @param name The node name, or {@code null} for unnamed nodes.
 */
public record NodeKey(NodeType type, String name) {
}
