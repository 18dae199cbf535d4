package io.daqflow.core.model;

import java.util.Objects;

/**
 * A directed connection from one node's output port to another node's input port. Endpoints are
 * referenced by node id; the owning {@link ProgramGraph} removes the wire when either endpoint is
 * removed.
 */
public record Wire(String sourceNodeId, String sourcePortId, String targetNodeId, String targetPortId) {

    public Wire {
        Objects.requireNonNull(sourceNodeId, "sourceNodeId must not be null");
        Objects.requireNonNull(sourcePortId, "sourcePortId must not be null");
        Objects.requireNonNull(targetNodeId, "targetNodeId must not be null");
        Objects.requireNonNull(targetPortId, "targetPortId must not be null");
    }

    /** True if this wire starts or ends at the given node. */
    public boolean touches(String nodeId) {
        return sourceNodeId.equals(nodeId) || targetNodeId.equals(nodeId);
    }

    @Override
    public String toString() {
        return sourceNodeId + "." + sourcePortId + " -> " + targetNodeId + "." + targetPortId;
    }
}
