package io.daqflow.core.model;

/**
 * Binding strength of a compiled Python expression, tightest first. Every value rule declares the
 * {@code Order} of the text it emits, and every operand position declares the {@code Order} it
 * requires; the operand is parenthesized iff its own order is strictly looser than the required
 * one.
 *
 * <p>The ladder follows Python's operator precedence table.
 */
public enum Order {
    /** Literals, names, parenthesized and bracketed forms. */
    ATOMIC,
    /** Calls, subscripts and attribute references. */
    FUNCTION_CALL,
    /** {@code **}. */
    EXPONENTIATION,
    /** Unary {@code -}, {@code +} and {@code ~}. */
    UNARY,
    /** {@code *}, {@code /}, {@code //} and {@code %}. */
    MULTIPLICATIVE,
    /** {@code +} and {@code -}. */
    ADDITIVE,
    /** Comparisons, membership and identity tests. */
    RELATIONAL,
    /** {@code not}. */
    LOGICAL_NOT,
    /** {@code and}. */
    LOGICAL_AND,
    /** {@code or}. */
    LOGICAL_OR,
    /** {@code x if c else y}. */
    CONDITIONAL,
    /** Loosest; used where any expression is acceptable. */
    NONE;

    /** True if this order binds strictly looser than {@code other}. */
    public boolean isLooserThan(Order other) {
        return compareTo(other) > 0;
    }

    /** True if this order binds strictly tighter than {@code other}. */
    public boolean isTighterThan(Order other) {
        return compareTo(other) < 0;
    }

    /**
     * The next tighter order, used for operand positions that must not accept an expression of the
     * same strength (the right operand of {@code -} or {@code /}). {@link #ATOMIC} maps to itself.
     */
    public Order tighter() {
        return this == ATOMIC ? ATOMIC : values()[ordinal() - 1];
    }
}
