package io.daqflow.core.spi;

import io.daqflow.core.model.Expr;

/** A rule for blocks that produce a value: the result is expression text plus its binding order. */
public interface ValueRule extends BlockRule {

    /**
     * Compiles the context's block into an expression.
     *
     * @param ctx access to the block's fields and child sockets
     * @return the expression and the {@link io.daqflow.core.model.Order} it binds at; never empty
     */
    Expr compileValue(BlockContext ctx);
}
