package io.daqflow.core.compiler;

import java.util.Objects;

/**
 * Knobs for the generated program text.
 *
 * @param indentUnit        whitespace used for one indentation level
 * @param idleSleepSeconds  sleep interval of the main loop in the lifecycle scaffold
 * @param engineModule      Python module that provides the engine class
 * @param engineClass       engine class name
 * @param componentsModule  Python module that provides the component classes
 */
public record OutputOptions(
        String indentUnit, double idleSleepSeconds, String engineModule, String engineClass, String componentsModule) {

    public static final String DEFAULT_INDENT = LiteralSerializer.DEFAULT_INDENT;
    public static final double DEFAULT_IDLE_SLEEP_SECONDS = 0.1;
    public static final String DEFAULT_ENGINE_MODULE = "daq_core.engine";
    public static final String DEFAULT_ENGINE_CLASS = "DAQEngine";
    public static final String DEFAULT_COMPONENTS_MODULE = "daq_core.components";

    public OutputOptions {
        Objects.requireNonNull(indentUnit, "indentUnit must not be null");
        Objects.requireNonNull(engineModule, "engineModule must not be null");
        Objects.requireNonNull(engineClass, "engineClass must not be null");
        Objects.requireNonNull(componentsModule, "componentsModule must not be null");
        if (indentUnit.isEmpty() || !indentUnit.isBlank()) {
            throw new IllegalArgumentException("indentUnit must be non-empty whitespace");
        }
        if (!(idleSleepSeconds > 0) || Double.isInfinite(idleSleepSeconds)) {
            throw new IllegalArgumentException("idleSleepSeconds must be a positive number, got " + idleSleepSeconds);
        }
    }

    public static OutputOptions defaults() {
        return new OutputOptions(
                DEFAULT_INDENT,
                DEFAULT_IDLE_SLEEP_SECONDS,
                DEFAULT_ENGINE_MODULE,
                DEFAULT_ENGINE_CLASS,
                DEFAULT_COMPONENTS_MODULE);
    }

    public OutputOptions withIndentUnit(String unit) {
        return new OutputOptions(unit, idleSleepSeconds, engineModule, engineClass, componentsModule);
    }

    public OutputOptions withIdleSleepSeconds(double seconds) {
        return new OutputOptions(indentUnit, seconds, engineModule, engineClass, componentsModule);
    }
}
