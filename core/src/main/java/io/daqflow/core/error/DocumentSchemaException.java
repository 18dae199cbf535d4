package io.daqflow.core.error;

import java.util.List;

/** Thrown when a project document does not conform to the bundled project JSON Schema. */
public final class DocumentSchemaException extends DocumentLoadException {

    private static final long serialVersionUID = 1L;

    private final List<String> violations;

    public DocumentSchemaException(String message, List<String> violations, String source) {
        super(message, null, source);
        this.violations = List.copyOf(violations);
    }

    /** The individual schema violation messages, in validator order. */
    public List<String> violations() {
        return violations;
    }
}
