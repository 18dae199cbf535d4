package io.daqflow.core.rules;

import io.daqflow.core.compiler.CodeTemplate;
import io.daqflow.core.compiler.RuleRegistry;
import io.daqflow.core.model.Expr;
import io.daqflow.core.model.Order;
import io.daqflow.core.spi.BlockContext;

/**
 * Rules for the blocks that talk to the hosting script component: reading an input port,
 * setting an output port, and converting between temperature units.
 */
final class DaqRules {

    static final String DEFAULT_INPUT_PORT = "input1";
    static final String DEFAULT_OUTPUT_PORT = "output1";

    private DaqRules() {}

    static void register(RuleRegistry registry) {
        registry.register(new SimpleValueRule("daq_read_input", DaqRules::readInput));
        registry.register(new SimpleStatementRule("daq_set_output", DaqRules::setOutput));
        registry.register(new SimpleValueRule("daq_convert_unit", DaqRules::convertUnit));
    }

    static Expr readInput(BlockContext ctx) {
        String port = ctx.field("PORT_NAME", DEFAULT_INPUT_PORT);
        return new Expr("get_input(" + ctx.stringLiteral(port) + ")", Order.FUNCTION_CALL);
    }

    static String setOutput(BlockContext ctx) {
        String port = ctx.field("PORT_NAME", DEFAULT_OUTPUT_PORT);
        return "set_output(" + ctx.stringLiteral(port) + ", " + ctx.valueAt("VALUE", Order.NONE, MathRules.ZERO)
                + ")\n";
    }

    /**
     * Each conversion is one or two templates applied in sequence; the intermediate result is
     * parenthesized by the second template only when its order requires it.
     */
    static Expr convertUnit(BlockContext ctx) {
        Expr x = ctx.value("VALUE", MathRules.ZERO);
        String unit = ctx.field("UNIT", "C_TO_F");
        switch (unit) {
            case "C_TO_F": {
                Expr scaled = CodeTemplate.producing(Order.MULTIPLICATIVE)
                        .operand(x, Order.MULTIPLICATIVE)
                        .text(" * 1.8")
                        .build();
                return CodeTemplate.producing(Order.ADDITIVE)
                        .operand(scaled, Order.ADDITIVE)
                        .text(" + 32")
                        .build();
            }
            case "F_TO_C": {
                Expr shifted = CodeTemplate.producing(Order.ADDITIVE)
                        .operand(x, Order.ADDITIVE)
                        .text(" - 32")
                        .build();
                return CodeTemplate.producing(Order.MULTIPLICATIVE)
                        .operand(shifted, Order.MULTIPLICATIVE)
                        .text(" / 1.8")
                        .build();
            }
            case "C_TO_K":
                return CodeTemplate.producing(Order.ADDITIVE)
                        .operand(x, Order.ADDITIVE)
                        .text(" + 273.15")
                        .build();
            case "K_TO_C":
                return CodeTemplate.producing(Order.ADDITIVE)
                        .operand(x, Order.ADDITIVE)
                        .text(" - 273.15")
                        .build();
            default:
                ctx.diagnostic("unknown unit conversion '" + unit + "', value passed through");
                return x;
        }
    }
}
