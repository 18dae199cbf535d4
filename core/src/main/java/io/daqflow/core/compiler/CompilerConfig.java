package io.daqflow.core.compiler;

import io.daqflow.core.rules.BuiltinRules;
import io.daqflow.core.spi.CompileListener;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Everything the compilers need besides their input, built once at start-up and shared by
 * reference. The registries are thread-safe, so one config serves concurrent compilations.
 *
 * @param rules     block rules and definitions
 * @param classes   component type to runtime class table
 * @param output    program text options
 * @param listeners compile listeners, notified in list order
 */
public record CompilerConfig(
        RuleRegistry rules, ClassTable classes, OutputOptions output, List<CompileListener> listeners) {

    public CompilerConfig {
        Objects.requireNonNull(rules, "rules must not be null");
        Objects.requireNonNull(classes, "classes must not be null");
        Objects.requireNonNull(output, "output must not be null");
        listeners = listeners == null ? List.of() : List.copyOf(listeners);
    }

    /** Built-in rules, the bundled class table and default output options. */
    public static CompilerConfig defaults() {
        RuleRegistry rules = new RuleRegistry();
        BuiltinRules.registerAll(rules);
        return new CompilerConfig(rules, ClassTable.withDefaults(), OutputOptions.defaults(), List.of());
    }

    public CompilerConfig withListener(CompileListener listener) {
        Objects.requireNonNull(listener, "listener must not be null");
        List<CompileListener> all = new ArrayList<>(listeners);
        all.add(listener);
        return new CompilerConfig(rules, classes, output, all);
    }

    public CompilerConfig withOutput(OutputOptions newOutput) {
        return new CompilerConfig(rules, classes, newOutput, listeners);
    }

    public CompilerConfig withClasses(ClassTable newClasses) {
        return new CompilerConfig(rules, newClasses, output, listeners);
    }
}
