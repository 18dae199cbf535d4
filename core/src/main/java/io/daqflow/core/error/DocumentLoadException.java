package io.daqflow.core.error;

/**
 * Abstract parent for errors raised while reading a project or workspace document. Carries a
 * {@code source} field identifying the file or resource that caused the error.
 */
public abstract class DocumentLoadException extends DaqflowException {

    private static final long serialVersionUID = 1L;

    private final String source;

    protected DocumentLoadException(String message, String elementId, String source) {
        super(message, elementId, Phase.LOAD);
        this.source = source;
    }

    protected DocumentLoadException(String message, Throwable cause, String elementId, String source) {
        super(message, cause, elementId, Phase.LOAD);
        this.source = source;
    }

    /** The file path or resource identifier that caused the error. */
    public String source() {
        return source;
    }
}
