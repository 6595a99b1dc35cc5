package org.sysmlite.frontend;

import org.sysmlite.frontend.parser.ast.AstNode;
import org.sysmlite.frontend.parser.ast.NodeKey;
import org.sysmlite.frontend.parser.ast.NodeType;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * A generic class for traversing an Abstract Syntax Tree in pre-order.
 * Instead of the Visitor pattern, this walker uses a handler-based system
 * to minimize coupling between consumers and the AST structure.
 */
public class TreeWalker {

    private final Map<NodeType, Consumer<AstNode>> handlers;

    /**
     * Constructs a new TreeWalker.
     * @param handlers A map from node types to their corresponding handlers.
     */
    public TreeWalker(Map<NodeType, Consumer<AstNode>> handlers) {
        this.handlers = handlers;
    }

    /**
     * Walks a single AST node and its children recursively.
     * @param node The node to walk.
     */
    public void walk(AstNode node) {
        if (node == null) {
            return;
        }

        handlers.getOrDefault(node.type(), n -> {}).accept(node);

        for (AstNode child : node.getChildren()) {
            walk(child);
        }
    }

    /**
     * Finds the first node in pre-order whose (type, name) key equals the given key.
     * @param root The node to search from.
     * @param key The key to look for.
     * @return The first matching node, or empty if none matches.
     */
    public static Optional<AstNode> find(AstNode root, NodeKey key) {
        if (root == null) {
            return Optional.empty();
        }
        if (root.key().equals(key)) {
            return Optional.of(root);
        }
        for (AstNode child : root.getChildren()) {
            Optional<AstNode> found = find(child, key);
            if (found.isPresent()) {
                return found;
            }
        }
        return Optional.empty();
    }

    /**
     * Collects all nodes of a type in pre-order.
     * @param root The node to search from.
     * @param type The node type.
     * @return The matching nodes in source order.
     */
    public static List<AstNode> collect(AstNode root, NodeType type) {
        List<AstNode> result = new ArrayList<>();
        new TreeWalker(Map.of(type, result::add)).walk(root);
        return result;
    }
}
