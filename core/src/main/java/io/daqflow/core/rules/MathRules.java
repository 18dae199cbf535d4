package io.daqflow.core.rules;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.DoubleNode;
import io.daqflow.core.compiler.CodeTemplate;
import io.daqflow.core.compiler.RuleRegistry;
import io.daqflow.core.model.Expr;
import io.daqflow.core.model.Order;
import io.daqflow.core.spi.BlockContext;
import java.math.BigDecimal;

/** Rules for {@code math_number}, {@code math_arithmetic}, {@code math_single} and {@code math_round}. */
final class MathRules {

    static final Expr ZERO = Expr.atomic("0");
    private static final String IMPORT_MATH = "import math";

    private MathRules() {}

    static void register(RuleRegistry registry) {
        registry.register(new SimpleValueRule("math_number", MathRules::number));
        registry.register(new SimpleValueRule("math_arithmetic", MathRules::arithmetic));
        registry.register(new SimpleValueRule("math_single", MathRules::single));
        registry.register(new SimpleValueRule("math_round", MathRules::round));
    }

    static Expr number(BlockContext ctx) {
        JsonNode raw = ctx.fieldValue("NUM");
        String text;
        if (raw != null && raw.isNumber()) {
            text = ctx.literal(raw);
        } else {
            String field = ctx.field("NUM", "0").trim();
            try {
                BigDecimal value = new BigDecimal(field);
                text = value.scale() > 0 || field.contains("e") || field.contains("E")
                        ? ctx.literal(DoubleNode.valueOf(value.doubleValue()))
                        : value.toBigInteger().toString();
            } catch (NumberFormatException e) {
                ctx.diagnostic("invalid number '" + field + "', using 0");
                text = "0";
            }
        }
        if (text.startsWith("-")) {
            return new Expr(text, Order.UNARY);
        }
        // out-of-range values render as float("inf")
        return text.endsWith(")") ? new Expr(text, Order.FUNCTION_CALL) : Expr.atomic(text);
    }

    static Expr arithmetic(BlockContext ctx) {
        String op = ctx.field("OP", "ADD");
        Expr a = ctx.value("A", ZERO);
        Expr b = ctx.value("B", ZERO);
        return switch (op) {
            case "MINUS" -> binary(a, " - ", b, Order.ADDITIVE, Order.ADDITIVE.tighter());
            case "MULTIPLY" -> binary(a, " * ", b, Order.MULTIPLICATIVE, Order.MULTIPLICATIVE);
            case "DIVIDE" -> binary(a, " / ", b, Order.MULTIPLICATIVE, Order.MULTIPLICATIVE.tighter());
            case "POWER" -> CodeTemplate.producing(Order.EXPONENTIATION)
                    .operand(a, Order.EXPONENTIATION.tighter())
                    .text(" ** ")
                    .operand(b, Order.EXPONENTIATION)
                    .build();
            case "ADD" -> binary(a, " + ", b, Order.ADDITIVE, Order.ADDITIVE);
            default -> {
                ctx.diagnostic("unknown arithmetic operator '" + op + "', using ADD");
                yield binary(a, " + ", b, Order.ADDITIVE, Order.ADDITIVE);
            }
        };
    }

    private static Expr binary(Expr a, String operator, Expr b, Order order, Order rightRequired) {
        return CodeTemplate.producing(order)
                .operand(a, order)
                .text(operator)
                .operand(b, rightRequired)
                .build();
    }

    static Expr single(BlockContext ctx) {
        String op = ctx.field("OP", "ROOT");
        Expr x = ctx.value("NUM", ZERO);
        switch (op) {
            case "NEG":
                return CodeTemplate.producing(Order.UNARY).text("-").operand(x, Order.UNARY.tighter()).build();
            case "ABS":
                return call("abs", x);
            case "POW10":
                return CodeTemplate.producing(Order.EXPONENTIATION)
                        .text("10 ** ")
                        .operand(x, Order.EXPONENTIATION)
                        .build();
            case "LN":
                ctx.requireImport(IMPORT_MATH);
                return call("math.log", x);
            case "LOG10":
                ctx.requireImport(IMPORT_MATH);
                return call("math.log10", x);
            case "EXP":
                ctx.requireImport(IMPORT_MATH);
                return call("math.exp", x);
            case "ROOT":
                ctx.requireImport(IMPORT_MATH);
                return call("math.sqrt", x);
            default:
                ctx.diagnostic("unknown math function '" + op + "', using ROOT");
                ctx.requireImport(IMPORT_MATH);
                return call("math.sqrt", x);
        }
    }

    static Expr round(BlockContext ctx) {
        String op = ctx.field("OP", "ROUND");
        Expr x = ctx.value("NUM", ZERO);
        switch (op) {
            case "ROUNDUP":
                ctx.requireImport(IMPORT_MATH);
                return call("math.ceil", x);
            case "ROUNDDOWN":
                ctx.requireImport(IMPORT_MATH);
                return call("math.floor", x);
            default:
                return call("round", x);
        }
    }

    static Expr call(String function, Expr argument) {
        return CodeTemplate.producing(Order.FUNCTION_CALL)
                .text(function + "(")
                .operand(argument, Order.NONE)
                .text(")")
                .build();
    }
}
