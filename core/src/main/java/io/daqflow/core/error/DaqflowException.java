package io.daqflow.core.error;

/**
 * Abstract base for all daqflow exceptions. Never thrown directly. Editing errors surface as
 * {@link StructureViolationException}; loading errors as subclasses of {@link DocumentLoadException}.
 *
 * <p>The compilers themselves never throw these: unresolved types, unconnected sockets and
 * malformed block definitions degrade to best-effort text.
 */
public abstract class DaqflowException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        EDIT,
        LOAD
    }

    private final String elementId;
    private final Phase phase;

    protected DaqflowException(String message, String elementId, Phase phase) {
        super(message);
        this.elementId = elementId;
        this.phase = phase;
    }

    protected DaqflowException(String message, Throwable cause, String elementId, Phase phase) {
        super(message, cause);
        this.elementId = elementId;
        this.phase = phase;
    }

    /** The block, node or wire that triggered the error, or {@code null} if not identified. */
    public String elementId() {
        return elementId;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
