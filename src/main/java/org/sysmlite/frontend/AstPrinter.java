package org.sysmlite.frontend;

import org.sysmlite.frontend.parser.ast.AstNode;

import java.util.Map;
import java.util.stream.Collectors;

/**
 * Renders an AST as indented text, one node per line, e.g.
 * <pre>
 * root
 *   package {name=Vehicle}
 *     part {name=Engine, specializes=PowerUnit}
 * </pre>
 */
public final class AstPrinter {

    private static final String INDENT = "  ";

    private AstPrinter() {}

    /**
     * Prints a node and its descendants.
     * @param node The node to print.
     * @return The indented text, with a trailing newline per node.
     */
    public static String print(AstNode node) {
        StringBuilder sb = new StringBuilder();
        print(node, 0, sb);
        return sb.toString();
    }

    private static void print(AstNode node, int depth, StringBuilder sb) {
        sb.append(INDENT.repeat(depth)).append(node.type().tag());
        Map<String, Object> properties = node.properties();
        if (!properties.isEmpty()) {
            sb.append(' ').append(properties.entrySet().stream()
                    .map(e -> e.getKey() + "=" + e.getValue())
                    .collect(Collectors.joining(", ", "{", "}")));
        }
        sb.append('\n');
        for (AstNode child : node.getChildren()) {
            print(child, depth + 1, sb);
        }
    }
}
