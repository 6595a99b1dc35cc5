package org.sysmlite.frontend;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;
import org.sysmlite.frontend.parser.ast.AstNode;

import java.util.Map;

/**
 * Exports an AST as JSON in the read-only traversal shape downstream consumers use:
 * <code>{"type": ..., "properties": {...}, "children": [...]}</code>.
 * Numeric property values stay JSON numbers.
 */
public class AstJsonExporter {

    private final Gson gson;

    /**
     * Creates a new exporter.
     * @param prettyPrint Whether to indent the output.
     */
    public AstJsonExporter(boolean prettyPrint) {
        GsonBuilder builder = new GsonBuilder().serializeSpecialFloatingPointValues();
        if (prettyPrint) {
            builder.setPrettyPrinting();
        }
        this.gson = builder.create();
    }

    /**
     * Serializes a node and its descendants.
     * @param node The node to export.
     * @return The JSON text.
     */
    public String export(AstNode node) {
        return gson.toJson(toJson(node));
    }

    /**
     * Converts a node and its descendants to a JSON tree.
     * @param node The node to convert.
     * @return The JSON object of the node.
     */
    public JsonObject toJson(AstNode node) {
        JsonObject object = new JsonObject();
        object.addProperty("type", node.type().tag());

        JsonObject properties = new JsonObject();
        for (Map.Entry<String, Object> entry : node.properties().entrySet()) {
            properties.add(entry.getKey(), toPrimitive(entry.getValue()));
        }
        object.add("properties", properties);

        JsonArray children = new JsonArray();
        for (AstNode child : node.getChildren()) {
            children.add(toJson(child));
        }
        object.add("children", children);
        return object;
    }

    private JsonPrimitive toPrimitive(Object value) {
        if (value instanceof Number number) {
            return new JsonPrimitive(number);
        }
        return new JsonPrimitive(value.toString());
    }
}
