package io.daqflow.core.rules;

import io.daqflow.core.compiler.RuleRegistry;
import io.daqflow.core.model.Expr;
import io.daqflow.core.model.Order;

/** Rules for {@code text} and {@code text_print}. */
final class TextRules {

    static final Expr EMPTY_STRING = Expr.atomic("\"\"");

    private TextRules() {}

    static void register(RuleRegistry registry) {
        registry.register(new SimpleValueRule("text", ctx -> Expr.atomic(ctx.stringLiteral(ctx.field("TEXT", "")))));
        registry.register(new SimpleStatementRule(
                "text_print", ctx -> "print(" + ctx.valueAt("TEXT", Order.NONE, EMPTY_STRING) + ")\n"));
    }
}
