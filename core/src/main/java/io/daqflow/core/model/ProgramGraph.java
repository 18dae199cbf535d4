package io.daqflow.core.model;

import io.daqflow.core.error.StructureViolationException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Ordered component nodes plus ordered wires. Insertion order is preserved and is the order the
 * graph compiler emits in; there is no topological reordering.
 *
 * <p>All edits go through this class so the graph stays reference-valid: node ids are unique,
 * every wire's endpoints exist, and removing a node removes its incident wires.
 *
 * <p>Not thread-safe.
 */
public final class ProgramGraph {

    private final Map<String, ComponentNode> nodes = new LinkedHashMap<>();
    private final List<Wire> wires = new ArrayList<>();

    /**
     * Appends a node.
     *
     * @throws StructureViolationException if a node with the same id exists
     */
    public ProgramGraph addNode(ComponentNode node) {
        Objects.requireNonNull(node, "node must not be null");
        if (nodes.containsKey(node.id())) {
            throw new StructureViolationException("Duplicate node id '" + node.id() + "'", node.id());
        }
        nodes.put(node.id(), node);
        return this;
    }

    /**
     * Replaces the node with the same id, keeping its position in the emission order.
     *
     * @throws StructureViolationException if no node with that id exists
     */
    public ProgramGraph replaceNode(ComponentNode node) {
        Objects.requireNonNull(node, "node must not be null");
        if (!nodes.containsKey(node.id())) {
            throw new StructureViolationException("Unknown node id '" + node.id() + "'", node.id());
        }
        nodes.put(node.id(), node);
        return this;
    }

    /**
     * Removes a node together with every wire that touches it.
     *
     * @return the removed wires, in their original order; empty if the node did not exist
     */
    public List<Wire> removeNode(String nodeId) {
        if (nodes.remove(nodeId) == null) {
            return List.of();
        }
        List<Wire> removed = new ArrayList<>();
        wires.removeIf(w -> {
            if (w.touches(nodeId)) {
                removed.add(w);
                return true;
            }
            return false;
        });
        return removed;
    }

    /**
     * Appends a wire.
     *
     * @throws StructureViolationException if either endpoint node does not exist, the wire leads
     *     from a node back to itself, or the same wire is already present
     */
    public ProgramGraph connect(Wire wire) {
        Objects.requireNonNull(wire, "wire must not be null");
        if (!nodes.containsKey(wire.sourceNodeId())) {
            throw new StructureViolationException(
                    "Wire " + wire + " references unknown source node '" + wire.sourceNodeId() + "'",
                    wire.sourceNodeId());
        }
        if (!nodes.containsKey(wire.targetNodeId())) {
            throw new StructureViolationException(
                    "Wire " + wire + " references unknown target node '" + wire.targetNodeId() + "'",
                    wire.targetNodeId());
        }
        if (wire.sourceNodeId().equals(wire.targetNodeId())) {
            throw new StructureViolationException(
                    "Wire " + wire + " forms a self-loop on node '" + wire.sourceNodeId() + "'", wire.sourceNodeId());
        }
        if (wires.contains(wire)) {
            throw new StructureViolationException("Duplicate wire " + wire, wire.sourceNodeId());
        }
        wires.add(wire);
        return this;
    }

    /** Convenience overload of {@link #connect(Wire)}. */
    public ProgramGraph connect(String sourceNodeId, String sourcePortId, String targetNodeId, String targetPortId) {
        return connect(new Wire(sourceNodeId, sourcePortId, targetNodeId, targetPortId));
    }

    /** Removes a wire; returns {@code true} if it was present. */
    public boolean disconnect(Wire wire) {
        return wires.remove(wire);
    }

    public Optional<ComponentNode> node(String nodeId) {
        return Optional.ofNullable(nodes.get(nodeId));
    }

    /** Unmodifiable snapshot of the nodes in insertion order. */
    public List<ComponentNode> nodes() {
        return List.copyOf(nodes.values());
    }

    /** Unmodifiable view of the wires in insertion order. */
    public List<Wire> wires() {
        return Collections.unmodifiableList(wires);
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }
}
