package io.daqflow.core.rules;

import com.fasterxml.jackson.databind.JsonNode;
import io.daqflow.core.compiler.RuleRegistry;
import io.daqflow.core.model.Expr;
import io.daqflow.core.model.Order;
import io.daqflow.core.spi.BlockContext;

/**
 * Rules for {@code variables_get} and {@code variables_set}. The {@code VAR} field holds the
 * variable name, either as text or as an object with a {@code name} entry.
 */
final class VariableRules {

    private VariableRules() {}

    static void register(RuleRegistry registry) {
        registry.register(new SimpleValueRule("variables_get", ctx -> Expr.atomic(variableName(ctx))));
        registry.register(new SimpleStatementRule(
                "variables_set",
                ctx -> variableName(ctx) + " = " + ctx.valueAt("VALUE", Order.NONE, LogicRules.NONE) + "\n"));
    }

    static String variableName(BlockContext ctx) {
        JsonNode raw = ctx.fieldValue("VAR");
        String name = raw != null && raw.isObject() ? raw.path("name").asText("") : ctx.field("VAR", "");
        if (name.isEmpty()) {
            ctx.diagnostic("variable has no name");
            name = "item";
        }
        return ctx.identifier(name);
    }
}
