package io.daqflow.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import java.util.Objects;

/**
 * An instance of a typed DAQ component in the program graph.
 *
 * <p>The record is treated as immutable: the property tree is copied on construction and edits
 * produce a new record via {@link #withLabel(String)} / {@link #withProperties(JsonNode)} that
 * replaces the old one in the {@link ProgramGraph}. Callers must not mutate the tree returned by
 * {@link #properties()}.
 *
 * @param id            stable instance key, passed to the runtime as {@code instance_id}
 * @param componentType component type tag, e.g. {@code "mock_device"}
 * @param label         free-form user label; empty when unset
 * @param properties    component configuration as a JSON-like tree (an object, possibly empty)
 */
public record ComponentNode(String id, String componentType, String label, JsonNode properties) {

    public ComponentNode {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(componentType, "componentType must not be null");
        if (id.isEmpty() || componentType.isEmpty()) {
            throw new IllegalArgumentException("node id and componentType must not be empty");
        }
        label = label == null ? "" : label;
        properties = properties == null || properties.isNull() || properties.isMissingNode()
                ? JsonNodeFactory.instance.objectNode()
                : properties.deepCopy();
    }

    /** Creates a node with no properties. */
    public static ComponentNode of(String id, String componentType, String label) {
        return new ComponentNode(id, componentType, label, null);
    }

    public ComponentNode withLabel(String newLabel) {
        return new ComponentNode(id, componentType, newLabel, properties);
    }

    public ComponentNode withProperties(JsonNode newProperties) {
        return new ComponentNode(id, componentType, label, newProperties);
    }
}
