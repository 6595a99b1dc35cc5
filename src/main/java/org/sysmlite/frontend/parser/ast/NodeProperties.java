package org.sysmlite.frontend.parser.ast;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the property map of a node, skipping absent ({@code null}) values.
 */
public final class NodeProperties {

    private final Map<String, Object> values = new LinkedHashMap<>();

    /**
     * Adds a property if the value is present.
     * @param key The property key.
     * @param value The value, or {@code null} if the source did not specify it.
     * @return This builder.
     */
    public NodeProperties put(String key, Object value) {
        if (value != null) {
            values.put(key, value);
        }
        return this;
    }

    /**
     * @return An unmodifiable map of the present properties, in insertion order.
     */
    public Map<String, Object> build() {
        return Collections.unmodifiableMap(values);
    }
}
