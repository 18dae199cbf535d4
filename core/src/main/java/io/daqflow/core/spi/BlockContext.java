package io.daqflow.core.spi;

import com.fasterxml.jackson.databind.JsonNode;
import io.daqflow.core.model.Block;
import io.daqflow.core.model.Expr;
import io.daqflow.core.model.Order;

/**
 * The view a {@link BlockRule} gets of the block being compiled and of the compilation in
 * progress. Created by the compiler for a single rule invocation.
 */
public interface BlockContext {

    /** The block being compiled. */
    Block block();

    /** The field as text, or {@code defaultValue} when absent or empty. */
    String field(String name, String defaultValue);

    /** The raw field literal, or {@code null} when the field is not set. */
    JsonNode fieldValue(String name);

    /**
     * Compiles the block in the named value socket. An unconnected socket yields {@code fallback}
     * unchanged; this is not an error.
     *
     * @param socket   value socket name
     * @param fallback the socket's default literal and its order
     * @return the child's expression with its own order (not yet parenthesized)
     */
    Expr value(String socket, Expr fallback);

    /**
     * Compiles the named value socket and renders it for a position requiring {@code required},
     * adding parentheses only when the child's order is strictly looser.
     */
    default String valueAt(String socket, Order required, Expr fallback) {
        return value(socket, fallback).textAt(required);
    }

    /**
     * Compiles the chain in the named statement socket, indented one level. An empty socket yields
     * the empty string.
     */
    String statements(String socket);

    /**
     * Like {@link #statements(String)}, but an empty body yields a single indented {@code pass}
     * line so the result is always a valid Python suite.
     */
    String body(String socket);

    /** Renders a JSON-like value as a Python literal. */
    String literal(JsonNode value);

    /** Renders a string as a quoted, escaped Python string literal. */
    String stringLiteral(String value);

    /** Derives a Python identifier from a free-form name, e.g. a variable field. */
    String identifier(String name);

    /**
     * Requests a top-of-file import line such as {@code "import math"}. Repeated requests are
     * emitted once, in first-request order.
     */
    void requireImport(String importLine);

    /** Records a diagnostic against the current block. */
    void diagnostic(String message);
}
