package io.daqflow.core.compiler;

import io.daqflow.core.model.Expr;
import io.daqflow.core.model.Order;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Builds an {@link Expr} from an ordered list of fragments: literal text, and operands tagged with
 * the {@link Order} their position requires. Rendering applies the parenthesization rule to each
 * operand, so rules never concatenate child text by hand.
 *
 * <pre>{@code
 * Expr sum = CodeTemplate.producing(Order.ADDITIVE)
 *         .operand(left, Order.ADDITIVE)
 *         .text(" - ")
 *         .operand(right, Order.ADDITIVE.tighter())
 *         .build();
 * }</pre>
 *
 * <p>A built {@code Expr} can be fed as an operand into the next template, which is how
 * multi-stage conversions compose.
 */
public final class CodeTemplate {

    /** One piece of a template. */
    public sealed interface Fragment permits Text, Operand {

        String render();
    }

    /** Literal text, emitted as-is. */
    public record Text(String text) implements Fragment {

        public Text {
            Objects.requireNonNull(text, "text must not be null");
        }

        @Override
        public String render() {
            return text;
        }
    }

    /** A sub-expression at a position requiring {@code required}. */
    public record Operand(Expr expr, Order required) implements Fragment {

        public Operand {
            Objects.requireNonNull(expr, "expr must not be null");
            Objects.requireNonNull(required, "required must not be null");
        }

        @Override
        public String render() {
            return expr.textAt(required);
        }
    }

    private final Order resultOrder;
    private final List<Fragment> fragments = new ArrayList<>();

    private CodeTemplate(Order resultOrder) {
        this.resultOrder = Objects.requireNonNull(resultOrder, "resultOrder must not be null");
    }

    /** Starts a template whose rendered text binds at {@code resultOrder}. */
    public static CodeTemplate producing(Order resultOrder) {
        return new CodeTemplate(resultOrder);
    }

    public CodeTemplate text(String text) {
        fragments.add(new Text(text));
        return this;
    }

    public CodeTemplate operand(Expr expr, Order required) {
        fragments.add(new Operand(expr, required));
        return this;
    }

    /**
     * Appends operands separated by {@code separator}, each at {@code required}. Used for call
     * argument lists.
     */
    public CodeTemplate operands(List<Expr> exprs, String separator, Order required) {
        for (int i = 0; i < exprs.size(); i++) {
            if (i > 0) {
                text(separator);
            }
            operand(exprs.get(i), required);
        }
        return this;
    }

    /** The fragments added so far. */
    public List<Fragment> fragments() {
        return List.copyOf(fragments);
    }

    /**
     * Renders the fragments into an expression.
     *
     * @throws IllegalStateException if the template renders to empty text
     */
    public Expr build() {
        StringBuilder out = new StringBuilder();
        for (Fragment fragment : fragments) {
            out.append(fragment.render());
        }
        if (out.length() == 0) {
            throw new IllegalStateException("template rendered to empty text");
        }
        return new Expr(out.toString(), resultOrder);
    }
}
