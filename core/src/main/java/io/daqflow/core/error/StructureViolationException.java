package io.daqflow.core.error;

/**
 * Thrown by the model's mutation API when an edit would break a structural invariant: a block
 * attached under its own descendant, a block given a second parent, a duplicate id, or a wire
 * whose endpoint does not exist. The offending edit is not applied.
 */
public final class StructureViolationException extends DaqflowException {

    private static final long serialVersionUID = 1L;

    public StructureViolationException(String message, String elementId) {
        super(message, elementId, Phase.EDIT);
    }
}
