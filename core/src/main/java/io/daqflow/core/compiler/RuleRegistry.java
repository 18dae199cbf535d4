package io.daqflow.core.compiler;

import io.daqflow.core.model.BlockDefinition;
import io.daqflow.core.spi.BlockRule;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registry of block rules and block definitions, keyed by block type tag. Thread-safe:
 * registration and lookup can happen concurrently with compilation.
 *
 * <p>A type with a definition but no rule is a declared block that still lacks a generator; the
 * compiler reports it differently from a type it has never heard of.
 */
public final class RuleRegistry {

    private final Map<String, BlockRule> rules = new ConcurrentHashMap<>();
    private final Map<String, BlockDefinition> definitions = new ConcurrentHashMap<>();

    /**
     * Registers a rule. A rule already registered for the same type is replaced (last-write-wins).
     *
     * @throws NullPointerException     if rule or rule.type() is null
     * @throws IllegalArgumentException if rule.type() is empty
     */
    public RuleRegistry register(BlockRule rule) {
        if (rule == null) {
            throw new NullPointerException("rule must not be null");
        }
        String type = rule.type();
        if (type == null) {
            throw new NullPointerException("rule type must not be null");
        }
        if (type.isEmpty()) {
            throw new IllegalArgumentException("rule type must not be empty");
        }
        rules.put(type, rule);
        return this;
    }

    /** Registers a block definition produced by the schema meta-compiler (last-write-wins). */
    public RuleRegistry registerDefinition(BlockDefinition definition) {
        if (definition == null) {
            throw new NullPointerException("definition must not be null");
        }
        definitions.put(definition.type(), definition);
        return this;
    }

    public Optional<BlockRule> rule(String type) {
        return Optional.ofNullable(rules.get(type));
    }

    public Optional<BlockDefinition> definition(String type) {
        return Optional.ofNullable(definitions.get(type));
    }

    /** Returns {@code true} if a rule is registered for the type. */
    public boolean hasRule(String type) {
        return rules.containsKey(type);
    }

    /** Returns the number of registered rules. */
    public int size() {
        return rules.size();
    }
}
