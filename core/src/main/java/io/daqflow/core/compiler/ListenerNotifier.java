package io.daqflow.core.compiler;

import io.daqflow.core.spi.CompileListener;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Fans events out to the configured listeners; a failing listener is logged and skipped. */
final class ListenerNotifier {

    private static final Logger LOG = LoggerFactory.getLogger(ListenerNotifier.class);

    private final List<CompileListener> listeners;

    ListenerNotifier(List<CompileListener> listeners) {
        this.listeners = listeners;
    }

    void programCompiled(CompileListener.ProgramCompiledEvent event) {
        for (CompileListener listener : listeners) {
            try {
                listener.onProgramCompiled(event);
            } catch (RuntimeException e) {
                LOG.warn("CompileListener.onProgramCompiled failed", e);
            }
        }
    }

    void degraded(CompileListener.DegradedEvent event) {
        for (CompileListener listener : listeners) {
            try {
                listener.onDegraded(event);
            } catch (RuntimeException e) {
                LOG.warn("CompileListener.onDegraded failed", e);
            }
        }
    }

    void schemaCompiled(CompileListener.SchemaCompiledEvent event) {
        for (CompileListener listener : listeners) {
            try {
                listener.onSchemaCompiled(event);
            } catch (RuntimeException e) {
                LOG.warn("CompileListener.onSchemaCompiled failed", e);
            }
        }
    }
}
