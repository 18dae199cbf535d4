package io.daqflow.core.rules;

import io.daqflow.core.compiler.RuleRegistry;

/**
 * Entry point for the built-in Python rules: the standard math, logic, text, variable and
 * control blocks of the script editor, plus the DAQ port blocks.
 */
public final class BuiltinRules {

    private BuiltinRules() {}

    /** Registers every built-in rule; existing rules for the same types are replaced. */
    public static RuleRegistry registerAll(RuleRegistry registry) {
        MathRules.register(registry);
        LogicRules.register(registry);
        TextRules.register(registry);
        VariableRules.register(registry);
        ControlRules.register(registry);
        DaqRules.register(registry);
        return registry;
    }
}
