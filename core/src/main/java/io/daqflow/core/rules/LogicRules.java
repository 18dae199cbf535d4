package io.daqflow.core.rules;

import io.daqflow.core.compiler.CodeTemplate;
import io.daqflow.core.compiler.RuleRegistry;
import io.daqflow.core.model.Expr;
import io.daqflow.core.model.Order;
import io.daqflow.core.spi.BlockContext;
import java.util.Map;

/** Rules for boolean literals, comparisons, boolean operators, {@code None} and the ternary. */
final class LogicRules {

    static final Expr TRUE = Expr.atomic("True");
    static final Expr FALSE = Expr.atomic("False");
    static final Expr NONE = Expr.atomic("None");

    private static final Map<String, String> COMPARISONS =
            Map.of("EQ", "==", "NEQ", "!=", "LT", "<", "LTE", "<=", "GT", ">", "GTE", ">=");

    private LogicRules() {}

    static void register(RuleRegistry registry) {
        registry.register(new SimpleValueRule("logic_boolean", LogicRules::bool));
        registry.register(new SimpleValueRule("logic_compare", LogicRules::compare));
        registry.register(new SimpleValueRule("logic_operation", LogicRules::operation));
        registry.register(new SimpleValueRule("logic_negate", LogicRules::negate));
        registry.register(new SimpleValueRule("logic_null", ctx -> NONE));
        registry.register(new SimpleValueRule("logic_ternary", LogicRules::ternary));
    }

    static Expr bool(BlockContext ctx) {
        return "FALSE".equals(ctx.field("BOOL", "TRUE")) ? FALSE : TRUE;
    }

    // Operands bind tighter than a comparison so that chained comparisons are never produced.
    static Expr compare(BlockContext ctx) {
        String op = ctx.field("OP", "EQ");
        String operator = COMPARISONS.get(op);
        if (operator == null) {
            ctx.diagnostic("unknown comparison '" + op + "', using EQ");
            operator = "==";
        }
        return CodeTemplate.producing(Order.RELATIONAL)
                .operand(ctx.value("A", MathRules.ZERO), Order.RELATIONAL.tighter())
                .text(" " + operator + " ")
                .operand(ctx.value("B", MathRules.ZERO), Order.RELATIONAL.tighter())
                .build();
    }

    static Expr operation(BlockContext ctx) {
        boolean and = !"OR".equals(ctx.field("OP", "AND"));
        Order order = and ? Order.LOGICAL_AND : Order.LOGICAL_OR;
        boolean bothMissing = ctx.block().valueInput("A") == null && ctx.block().valueInput("B") == null;
        // One missing operand takes the identity of the operator; both missing is False.
        Expr fallback = bothMissing ? FALSE : and ? TRUE : FALSE;
        return CodeTemplate.producing(order)
                .operand(ctx.value("A", fallback), order)
                .text(and ? " and " : " or ")
                .operand(ctx.value("B", fallback), order)
                .build();
    }

    static Expr negate(BlockContext ctx) {
        return CodeTemplate.producing(Order.LOGICAL_NOT)
                .text("not ")
                .operand(ctx.value("BOOL", TRUE), Order.LOGICAL_NOT)
                .build();
    }

    static Expr ternary(BlockContext ctx) {
        return CodeTemplate.producing(Order.CONDITIONAL)
                .operand(ctx.value("THEN", NONE), Order.CONDITIONAL.tighter())
                .text(" if ")
                .operand(ctx.value("IF", FALSE), Order.CONDITIONAL.tighter())
                .text(" else ")
                .operand(ctx.value("ELSE", NONE), Order.CONDITIONAL)
                .build();
    }
}
