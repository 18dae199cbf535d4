package io.daqflow.core.rules;

import io.daqflow.core.spi.BlockContext;
import io.daqflow.core.spi.StatementRule;
import java.util.Objects;
import java.util.function.Function;

/** A {@link StatementRule} backed by a function. */
record SimpleStatementRule(String type, Function<BlockContext, String> body) implements StatementRule {

    SimpleStatementRule {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(body, "body must not be null");
    }

    @Override
    public String compileStatement(BlockContext ctx) {
        return body.apply(ctx);
    }
}
