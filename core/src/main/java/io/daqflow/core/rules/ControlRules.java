package io.daqflow.core.rules;

import io.daqflow.core.compiler.RuleRegistry;
import io.daqflow.core.model.Block;
import io.daqflow.core.model.Expr;
import io.daqflow.core.model.Order;
import io.daqflow.core.spi.BlockContext;

/** Rules for {@code controls_if}, {@code controls_whileUntil} and {@code controls_repeat_ext}. */
final class ControlRules {

    private ControlRules() {}

    static void register(RuleRegistry registry) {
        registry.register(new SimpleStatementRule("controls_if", ControlRules::ifElse));
        registry.register(new SimpleStatementRule("controls_whileUntil", ControlRules::whileUntil));
        registry.register(new SimpleStatementRule("controls_repeat_ext", ControlRules::repeat));
    }

    /** {@code IF0/DO0} is always emitted; {@code IFn/DOn} while either socket is connected; {@code ELSE} if set. */
    static String ifElse(BlockContext ctx) {
        Block block = ctx.block();
        StringBuilder out = new StringBuilder();
        int n = 0;
        do {
            out.append(n == 0 ? "if " : "elif ")
                    .append(ctx.valueAt("IF" + n, Order.NONE, LogicRules.FALSE))
                    .append(":\n")
                    .append(ctx.body("DO" + n));
            n++;
        } while (block.valueInput("IF" + n) != null || block.statementInput("DO" + n) != null);
        if (block.statementInput("ELSE") != null) {
            out.append("else:\n").append(ctx.body("ELSE"));
        }
        return out.toString();
    }

    static String whileUntil(BlockContext ctx) {
        boolean until = "UNTIL".equals(ctx.field("MODE", "WHILE"));
        String condition = until
                ? "not " + ctx.valueAt("BOOL", Order.LOGICAL_NOT, LogicRules.FALSE)
                : ctx.valueAt("BOOL", Order.NONE, LogicRules.FALSE);
        return "while " + condition + ":\n" + ctx.body("DO");
    }

    static String repeat(BlockContext ctx) {
        Expr times = ctx.value("TIMES", MathRules.ZERO);
        String count = times.text().matches("\\d+") ? times.text() : "int(" + times.textAt(Order.NONE) + ")";
        return "for count in range(" + count + "):\n" + ctx.body("DO");
    }
}
