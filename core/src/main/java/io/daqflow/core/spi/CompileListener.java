package io.daqflow.core.spi;

/**
 * Observability hook for the compilers. Host applications bridge it to their own metrics or
 * editor UI (e.g. to badge degraded blocks).
 *
 * <p>Implementations MUST be thread-safe and non-blocking. Exceptions thrown by listeners are
 * caught by the compiler and logged; they never affect the generated text.
 */
public interface CompileListener {

    /** Called after a program graph has been compiled. */
    void onProgramCompiled(ProgramCompiledEvent event);

    /**
     * Called when a block or component type could not be resolved and a fallback was used, or a
     * block rule failed and its block degraded to a diagnostic.
     */
    void onDegraded(DegradedEvent event);

    /** Called after a block definition has been compiled by the schema meta-compiler. */
    void onSchemaCompiled(SchemaCompiledEvent event);

    // --- Event records ---

    /** Event emitted when a program graph compiles. */
    record ProgramCompiledEvent(int nodeCount, int wireCount, int classCount, long durationMs) {}

    /** What kind of fallback a {@link DegradedEvent} reports. */
    enum DegradeKind {
        UNKNOWN_BLOCK_TYPE,
        MISPLACED_BLOCK,
        RULE_FAILURE,
        UNRESOLVED_COMPONENT_TYPE,
        SCRIPT_FAILURE
    }

    /** Event emitted when an element compiles through a fallback path. */
    record DegradedEvent(DegradeKind kind, String elementId, String typeTag, String detail) {}

    /** Event emitted when the schema meta-compiler produces a definition. */
    record SchemaCompiledEvent(String blockType, int inputCount, int fieldCount) {}
}
