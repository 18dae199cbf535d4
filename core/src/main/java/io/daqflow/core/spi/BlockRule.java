package io.daqflow.core.spi;

/**
 * Code-generation rule for one block type (the SPI consumed by the expression compiler).
 * Implementations are registered with {@code RuleRegistry.register(BlockRule)} and implement
 * {@link ValueRule}, {@link StatementRule}, or both.
 *
 * <p>Implementations MUST be stateless and thread-safe; a single rule instance is shared by every
 * compilation.
 */
public interface BlockRule {

    /**
     * Returns the block type tag this rule compiles, e.g. {@code "math_arithmetic"}.
     *
     * @return a non-null, non-empty type tag
     */
    String type();
}
