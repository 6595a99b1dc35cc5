package org.sysmlite.config;

/**
 * Output formats of the <code>parse</code> command.
 */
public enum OutputFormat {
    /** Indented text, one node per line. */
    TREE,
    /** The JSON traversal shape. */
    JSON;

    /**
     * Parses a format name case-insensitively.
     * @param name The format name, e.g. "json".
     * @return The format.
     * @throws IllegalArgumentException if the name is unknown.
     */
    public static OutputFormat fromName(String name) {
        for (OutputFormat format : values()) {
            if (format.name().equalsIgnoreCase(name)) {
                return format;
            }
        }
        throw new IllegalArgumentException("Unknown output format: " + name);
    }
}
