package io.daqflow.core.model;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.Objects;

/**
 * A block schema authored in the block factory: the JSON block definition plus the connection
 * shape it declares. Registered with the rule registry so the compiler can tell a declared block
 * that still lacks a generator apart from an unknown one.
 *
 * @param type       block type tag
 * @param schema     JSON block definition ({@code type}, {@code message0}, {@code args0}, ...)
 * @param connection the connection shape of the block
 */
public record BlockDefinition(String type, ObjectNode schema, Connection connection) {

    /** Connection shape, mirroring the factory's {@code CONNECTIONS} choice. */
    public enum Connection {
        NONE,
        LEFT,
        BOTH,
        TOP,
        BOTTOM;

        /** Parses a factory choice, defaulting to {@link #NONE} for unknown values. */
        public static Connection fromChoice(String choice) {
            if (choice != null) {
                for (Connection c : values()) {
                    if (c.name().equals(choice)) {
                        return c;
                    }
                }
            }
            return NONE;
        }
    }

    public BlockDefinition {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(schema, "schema must not be null");
        Objects.requireNonNull(connection, "connection must not be null");
        schema = schema.deepCopy();
    }

    /** True if blocks of this type produce a value (a left output connection). */
    public boolean isValueBlock() {
        return connection == Connection.LEFT;
    }
}
