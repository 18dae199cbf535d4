package io.daqflow.core.spi;

/**
 * A rule for blocks that produce statements. The returned text holds zero or more complete lines,
 * each terminated by {@code '\n'}, at indentation level zero; nesting is applied by the compiler.
 * The {@code next} chain is compiled by the compiler, not by the rule.
 */
public interface StatementRule extends BlockRule {

    /**
     * Compiles the context's block into statement lines.
     *
     * @param ctx access to the block's fields, child sockets and nested bodies
     * @return the statement text, possibly empty
     */
    String compileStatement(BlockContext ctx);
}
