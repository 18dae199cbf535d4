package io.daqflow.core.error;

/** Thrown when a document has invalid syntax, a missing required field, or an unknown key. */
public final class DocumentParseException extends DocumentLoadException {

    private static final long serialVersionUID = 1L;

    public DocumentParseException(String message, String elementId, String source) {
        super(message, elementId, source);
    }

    public DocumentParseException(String message, Throwable cause, String elementId, String source) {
        super(message, cause, elementId, source);
    }
}
