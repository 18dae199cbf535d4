package io.daqflow.core.model;

import java.util.Objects;

/**
 * A compiled value expression: Python source text plus the {@link Order} it binds at.
 *
 * <p>Immutable and thread-safe.
 */
public record Expr(String text, Order order) {

    public Expr {
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(order, "order must not be null");
        if (text.isEmpty()) {
            throw new IllegalArgumentException("expression text must not be empty");
        }
    }

    /** Creates an {@link Order#ATOMIC} expression, the usual shape of a literal or socket fallback. */
    public static Expr atomic(String text) {
        return new Expr(text, Order.ATOMIC);
    }

    /**
     * Renders this expression for a position that requires {@code required}: parenthesized iff this
     * expression's order is strictly looser, otherwise the bare text.
     *
     * @param required the order the enclosing position demands
     * @return the text, parenthesized only when needed
     */
    public String textAt(Order required) {
        return order.isLooserThan(required) ? "(" + text + ")" : text;
    }

    /** True if rendering at {@code required} adds parentheses. */
    public boolean needsParensAt(Order required) {
        return order.isLooserThan(required);
    }
}
