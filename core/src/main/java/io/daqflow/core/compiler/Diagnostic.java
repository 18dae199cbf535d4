package io.daqflow.core.compiler;

/**
 * A problem found while compiling a block tree. Compilation never fails; diagnostics describe
 * where it fell back.
 *
 * @param blockId   id of the offending block
 * @param blockType its type tag
 * @param message   human-readable description
 * @param inline    true if the compiled text already carries a comment for it
 */
public record Diagnostic(String blockId, String blockType, String message, boolean inline) {

    /** The diagnostic as a single Python comment line, without trailing newline. */
    public String asComment() {
        return "# warning: " + message + " (block " + blockId + ")";
    }
}
