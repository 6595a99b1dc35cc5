package org.sysmlite.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;

/**
 * Typed view of the <code>sysmlite</code> configuration block.
 *
 * <pre>
 * sysmlite {
 *   output {
 *     format = "tree"   # "tree" or "json"
 *     pretty = true     # indent JSON output
 *   }
 * }
 * </pre>
 *
 * @param format The default output format.
 * @param pretty Whether JSON output is indented.
 */
public record FrontendOptions(OutputFormat format, boolean pretty) {

    private static final String FORMAT_PATH = "sysmlite.output.format";
    private static final String PRETTY_PATH = "sysmlite.output.pretty";

    /**
     * Reads the options, falling back to tree output with indentation for missing keys.
     * @param config The application configuration.
     * @return The options.
     * @throws ConfigException.BadValue if the format is unknown.
     */
    public static FrontendOptions fromConfig(Config config) {
        OutputFormat format = OutputFormat.TREE;
        if (config.hasPath(FORMAT_PATH)) {
            String name = config.getString(FORMAT_PATH);
            try {
                format = OutputFormat.fromName(name);
            } catch (IllegalArgumentException e) {
                throw new ConfigException.BadValue(FORMAT_PATH, e.getMessage(), e);
            }
        }
        boolean pretty = !config.hasPath(PRETTY_PATH) || config.getBoolean(PRETTY_PATH);
        return new FrontendOptions(format, pretty);
    }
}
