package io.daqflow.core;

import io.daqflow.core.model.Block;

/** Shorthand factories for the block trees used across tests. */
public final class Blocks {

    private Blocks() {}

    public static Block number(String id, long value) {
        return new Block(id, "math_number").setField("NUM", value);
    }

    public static Block number(String id, double value) {
        return new Block(id, "math_number").setField("NUM", value);
    }

    public static Block arithmetic(String id, String op, Block a, Block b) {
        Block block = new Block(id, "math_arithmetic").setField("OP", op);
        if (a != null) {
            block.setValueInput("A", a);
        }
        if (b != null) {
            block.setValueInput("B", b);
        }
        return block;
    }

    public static Block compare(String id, String op, Block a, Block b) {
        return new Block(id, "logic_compare").setField("OP", op).setValueInput("A", a).setValueInput("B", b);
    }

    public static Block text(String id, String value) {
        return new Block(id, "text").setField("TEXT", value);
    }

    public static Block print(String id, Block value) {
        return new Block(id, "text_print").setValueInput("TEXT", value);
    }

    public static Block readInput(String id, String port) {
        return new Block(id, "daq_read_input").setField("PORT_NAME", port);
    }

    public static Block setOutput(String id, String port, Block value) {
        return new Block(id, "daq_set_output").setField("PORT_NAME", port).setValueInput("VALUE", value);
    }

    public static Block variable(String id, String name) {
        return new Block(id, "variables_get").setField("VAR", name);
    }
}
