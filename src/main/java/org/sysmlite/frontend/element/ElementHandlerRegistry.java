package org.sysmlite.frontend.element;

import org.sysmlite.frontend.parser.features.attribute.AttributeElementHandler;
import org.sysmlite.frontend.parser.features.connection.ConnectionElementHandler;
import org.sysmlite.frontend.parser.features.part.PartElementHandler;
import org.sysmlite.frontend.parser.features.pkg.PackageElementHandler;
import org.sysmlite.frontend.parser.features.port.PortElementHandler;
import org.sysmlite.frontend.parser.features.requirement.RequirementElementHandler;
import org.sysmlite.frontend.parser.features.usecase.UseCaseElementHandler;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * A registry for element handlers. This class holds a map of keywords
 * to their corresponding handlers. Keywords are matched case-sensitively.
 */
public class ElementHandlerRegistry {
    private final Map<String, IElementHandler> handlers = new HashMap<>();

    /**
     * Registers a new element handler.
     * @param keyword The keyword that starts the element (e.g., "part").
     * @param handler The handler for the element.
     */
    public void register(String keyword, IElementHandler handler) {
        handlers.put(keyword, handler);
    }

    /**
     * Gets the handler for a given keyword.
     * @param keyword The keyword.
     * @return An {@link Optional} containing the handler if it exists, otherwise empty.
     */
    public Optional<IElementHandler> get(String keyword) {
        return Optional.ofNullable(handlers.get(keyword));
    }

    /**
     * Initializes the registry with all the built-in handlers. Keywords without a
     * handler (block, interface, state, ...) are parsed as generic elements.
     * @return A new instance of {@link ElementHandlerRegistry} with all handlers registered.
     */
    public static ElementHandlerRegistry initialize() {
        ElementHandlerRegistry registry = new ElementHandlerRegistry();
        registry.register("package", new PackageElementHandler());
        registry.register("part", new PartElementHandler());
        registry.register("attribute", new AttributeElementHandler());
        registry.register("port", new PortElementHandler());
        registry.register("connection", new ConnectionElementHandler());
        registry.register("requirement", new RequirementElementHandler());
        registry.register("use", new UseCaseElementHandler());
        return registry;
    }
}
