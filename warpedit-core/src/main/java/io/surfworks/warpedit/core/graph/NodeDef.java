package io.surfworks.warpedit.core.graph;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Static definition of an operation: its name, type, attributes and requested device.
 *
 * <p>NodeDefs are immutable, so cloning one for a copied operation is a matter of
 * deriving a renamed instance with {@link #withName(String)}.
 *
 * @param name       the operation name
 * @param opType     the operation type ("Add", "MatMul", "Placeholder", ...)
 * @param attributes static attributes; values must be immutable
 * @param device     the requested device, empty for unplaced
 */
public record NodeDef(
        String name,
        String opType,
        Map<String, Object> attributes,
        String device
) {

    public NodeDef {
        Objects.requireNonNull(name, "name cannot be null");
        Objects.requireNonNull(opType, "opType cannot be null");
        if (name.isEmpty()) {
            throw new IllegalArgumentException("NodeDef name cannot be empty");
        }
        attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
        device = device == null ? "" : device;
    }

    public static NodeDef of(String name, String opType) {
        return new NodeDef(name, opType, Map.of(), "");
    }

    public NodeDef withName(String newName) {
        return new NodeDef(newName, opType, attributes, device);
    }

    public NodeDef withDevice(String newDevice) {
        return new NodeDef(name, opType, attributes, newDevice);
    }

    public NodeDef withAttribute(String key, Object value) {
        Map<String, Object> attrs = new LinkedHashMap<>(attributes);
        attrs.put(key, value);
        return new NodeDef(name, opType, attrs, device);
    }

    /**
     * Gets an attribute value.
     *
     * @param key the attribute name
     * @param <T> the expected type
     * @return the attribute value, or null if not present
     */
    @SuppressWarnings("unchecked")
    public <T> T attribute(String key) {
        return (T) attributes.get(key);
    }
}
