package io.daqflow.core.rules;

import io.daqflow.core.model.Expr;
import io.daqflow.core.spi.BlockContext;
import io.daqflow.core.spi.ValueRule;
import java.util.Objects;
import java.util.function.Function;

/** A {@link ValueRule} backed by a function. */
record SimpleValueRule(String type, Function<BlockContext, Expr> body) implements ValueRule {

    SimpleValueRule {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(body, "body must not be null");
    }

    @Override
    public Expr compileValue(BlockContext ctx) {
        return body.apply(ctx);
    }
}
