package io.daqflow.core.compiler;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.core.util.Separators;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.daqflow.core.model.Block;
import io.daqflow.core.model.BlockDefinition;
import io.daqflow.core.model.BlockDefinition.Connection;
import io.daqflow.core.model.Workspace;
import io.daqflow.core.spi.CompileListener.SchemaCompiledEvent;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The block factory's meta-compiler: walks a tree of descriptor blocks rooted at a
 * {@code factory_base} block and produces the JSON definition of a new block type together with
 * a Java rule skeleton for it.
 *
 * <p>The root's {@code INPUTS} chain holds input descriptors ({@code input_value},
 * {@code input_statement}, {@code input_dummy}); each input's {@code FIELDS} chain holds field
 * descriptors. Unknown descriptor kinds are skipped and a missing root yields placeholder
 * comments, so a half-built definition never fails to compile.
 *
 * <p>Thread-safe.
 */
public final class SchemaCompiler {

    private static final Logger LOG = LoggerFactory.getLogger(SchemaCompiler.class);

    public static final String ROOT_TYPE = "factory_base";
    public static final String DEFAULT_BLOCK_TYPE = "block_type";
    public static final int DEFAULT_HUE = 230;

    static final String NO_ROOT_SCHEMA = "// Add inputs and other blocks to the factory_base block";
    static final String NO_ROOT_STUB = "// No generator code yet";

    /** Field descriptors that carry a named value the generator reads. */
    private static final Set<String> STUB_FIELD_KINDS = Set.of(
            "field_input",
            "field_number",
            "field_angle",
            "field_dropdown",
            "field_checkbox",
            "field_colour",
            "field_variable");

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final ObjectWriter PRETTY = MAPPER.writer(prettyPrinter());

    private final ListenerNotifier notifier;

    public SchemaCompiler(CompilerConfig config) {
        this.notifier = new ListenerNotifier(Objects.requireNonNull(config, "config must not be null").listeners());
    }

    /** Compiles the first {@code factory_base} top-level block of an authoring workspace. */
    public SchemaCompilation compileSchema(Workspace workspace) {
        Objects.requireNonNull(workspace, "workspace must not be null");
        return compileSchema(workspace.firstTopBlockOfType(ROOT_TYPE).orElse(null));
    }

    /**
     * Compiles a definition root.
     *
     * @param root a {@code factory_base} block, or {@code null}
     * @return the schema and stub; placeholders when {@code root} is null or not a factory root
     */
    public SchemaCompilation compileSchema(Block root) {
        if (root == null || !ROOT_TYPE.equals(root.type())) {
            return new SchemaCompilation(DEFAULT_BLOCK_TYPE, NO_ROOT_SCHEMA, NO_ROOT_STUB, null);
        }
        String blockType = blockTypeName(root.fieldText("NAME", ""));
        Connection connection = Connection.fromChoice(root.fieldText("CONNECTIONS", "NONE"));

        List<Block> inputs = chain(root.statementInput("INPUTS"));
        ObjectNode schema = buildSchema(blockType, root, connection, inputs);
        String stub = buildStub(blockType, connection, inputs);
        BlockDefinition definition = new BlockDefinition(blockType, schema, connection);

        String schemaText;
        try {
            schemaText = PRETTY.writeValueAsString(schema);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to render block definition for " + blockType, e);
        }
        int fieldCount = schema.path("args0").size() - inputs.size();
        LOG.debug("Compiled block schema '{}': inputs={}, fields={}", blockType, inputs.size(), fieldCount);
        notifier.schemaCompiled(new SchemaCompiledEvent(blockType, inputs.size(), fieldCount));
        return new SchemaCompilation(blockType, schemaText, stub, definition);
    }

    /** {@code NAME} trimmed, lowercased, non-word characters replaced by {@code _}. */
    static String blockTypeName(String name) {
        String trimmed = name == null ? "" : name.trim();
        if (trimmed.isEmpty()) {
            return DEFAULT_BLOCK_TYPE;
        }
        return replaceNonWord(trimmed.toLowerCase(Locale.ROOT));
    }

    // --- JSON definition ---

    private ObjectNode buildSchema(String blockType, Block root, Connection connection, List<Block> inputs) {
        ObjectNode js = MAPPER.createObjectNode();
        js.put("type", blockType);
        List<String> message = new ArrayList<>();
        ArrayNode args = MAPPER.createArrayNode();

        for (Block input : inputs) {
            for (Block field : chain(input.statementInput("FIELDS"))) {
                if ("field_static".equals(field.type())) {
                    message.add(field.fieldText("TEXT", ""));
                    continue;
                }
                ObjectNode arg = fieldJson(field);
                if (arg != null) {
                    args.add(arg);
                    message.add("%" + args.size());
                }
            }
            ObjectNode arg = MAPPER.createObjectNode();
            arg.put("type", input.type());
            if (!"input_dummy".equals(input.type())) {
                arg.put("name", input.fieldText("INPUTNAME", "NAME"));
            }
            String check = typeCheck(input.valueInput("TYPE"));
            if (check != null) {
                arg.put("check", check);
            }
            String align = input.fieldText("ALIGN", "LEFT");
            if (!"LEFT".equals(align)) {
                arg.put("align", align);
            }
            args.add(arg);
            message.add("%" + args.size());
        }

        js.put("message0", String.join(" ", message));
        if (!args.isEmpty()) {
            js.set("args0", args);
        }
        String inline = root.fieldText("INLINE", "AUTO");
        if ("EXT".equals(inline)) {
            js.put("inputsInline", false);
        } else if ("INT".equals(inline)) {
            js.put("inputsInline", true);
        }
        switch (connection) {
            case LEFT -> js.put("output", typeCheck(root.valueInput("OUTPUTTYPE")));
            case BOTH -> {
                js.put("previousStatement", typeCheck(root.valueInput("TOPTYPE")));
                js.put("nextStatement", typeCheck(root.valueInput("BOTTOMTYPE")));
            }
            case TOP -> js.put("previousStatement", typeCheck(root.valueInput("TOPTYPE")));
            case BOTTOM -> js.put("nextStatement", typeCheck(root.valueInput("BOTTOMTYPE")));
            case NONE -> {
                // no connections
            }
        }
        Block colour = root.valueInput("COLOUR");
        if (colour != null) {
            js.put("colour", hue(colour.fieldText("HUE", "")));
        }
        js.put("tooltip", textOf(root.valueInput("TOOLTIP")));
        js.put("helpUrl", textOf(root.valueInput("HELPURL")));
        return js;
    }

    /** JSON for one field descriptor, or {@code null} for an unknown kind. */
    private ObjectNode fieldJson(Block field) {
        ObjectNode arg = MAPPER.createObjectNode();
        String name = field.fieldText("FIELDNAME", "NAME");
        switch (field.type()) {
            case "field_input" -> {
                arg.put("type", "field_input").put("name", name).put("text", field.fieldText("TEXT", "default"));
            }
            case "field_number" -> {
                arg.put("type", "field_number").put("name", name);
                putNumber(arg, "value", number(field, "VALUE", 0));
                for (String bound : List.of("MIN", "MAX", "PRECISION")) {
                    if (field.field(bound) != null) {
                        putNumber(arg, bound.toLowerCase(Locale.ROOT), number(field, bound, 0));
                    }
                }
            }
            case "field_angle" -> {
                arg.put("type", "field_angle").put("name", name);
                putNumber(arg, "angle", number(field, "ANGLE", 90));
            }
            case "field_dropdown" -> {
                arg.put("type", "field_dropdown").put("name", name);
                arg.set("options", dropdownOptions(field));
            }
            case "field_checkbox" -> arg.put("type", "field_checkbox")
                    .put("name", name)
                    .put("checked", "TRUE".equalsIgnoreCase(field.fieldText("CHECKED", "TRUE")));
            case "field_colour" -> arg.put("type", "field_colour")
                    .put("name", name)
                    .put("colour", field.fieldText("COLOUR", "#ff0000"));
            case "field_variable" -> arg.put("type", "field_variable")
                    .put("name", name)
                    .put("variable", field.fieldText("TEXT", "item"));
            case "field_image" -> {
                arg.put("type", "field_image").put("src", field.fieldText("SRC", ""));
                putNumber(arg, "width", number(field, "WIDTH", 15));
                putNumber(arg, "height", number(field, "HEIGHT", 15));
                arg.put("alt", field.fieldText("ALT", "*"));
            }
            default -> {
                LOG.debug("Skipping unknown field descriptor '{}' ({})", field.type(), field.id());
                return null;
            }
        }
        return arg;
    }

    /**
     * Options from {@code USER0..2}/{@code CPU0..2} pairs, or from a comma-separated
     * {@code OPTIONS} field where each option is both label and value.
     */
    private static ArrayNode dropdownOptions(Block field) {
        ArrayNode options = MAPPER.createArrayNode();
        if (field.field("OPTIONS") != null && field.field("USER0") == null) {
            for (String option : field.fieldText("OPTIONS", "").split(",")) {
                String trimmed = option.trim();
                if (!trimmed.isEmpty()) {
                    options.addArray().add(trimmed).add(trimmed);
                }
            }
            return options;
        }
        for (int i = 0; i < 3; i++) {
            options.addArray().add(field.fieldText("USER" + i, "option")).add(field.fieldText("CPU" + i, "OPTIONNAME"));
        }
        return options;
    }

    /** The connection check for a type block; {@code null} means any type. */
    static String typeCheck(Block typeBlock) {
        if (typeBlock == null) {
            return null;
        }
        return switch (typeBlock.type()) {
            case "type_boolean" -> "Boolean";
            case "type_number" -> "Number";
            case "type_string" -> "String";
            case "type_list" -> "Array";
            case "type_other" -> typeBlock.fieldText("TYPE", null);
            default -> null;
        };
    }

    private static int hue(String text) {
        try {
            return Integer.parseInt(text.trim());
        } catch (NumberFormatException e) {
            return DEFAULT_HUE;
        }
    }

    private static double number(Block block, String name, double defaultValue) {
        JsonNode value = block.field(name);
        if (value != null && value.isNumber()) {
            return value.doubleValue();
        }
        try {
            return Double.parseDouble(block.fieldText(name, Double.toString(defaultValue)).trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    /** Whole numbers are written as integers, the way the editor stores them. */
    private static void putNumber(ObjectNode node, String key, double value) {
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            node.put(key, (long) value);
        } else {
            node.put(key, value);
        }
    }

    private static String textOf(Block textBlock) {
        return textBlock == null ? "" : textBlock.fieldText("TEXT", "");
    }

    // --- Java rule stub ---

    private static String buildStub(String blockType, Connection connection, List<Block> inputs) {
        boolean value = connection == Connection.LEFT;
        StringBuilder out = new StringBuilder();
        out.append("public final class ").append(className(blockType))
                .append(value ? " implements ValueRule {\n\n" : " implements StatementRule {\n\n");
        out.append("    @Override\n");
        out.append("    public String type() {\n");
        out.append("        return ").append(javaQuote(blockType)).append(";\n");
        out.append("    }\n\n");
        out.append("    @Override\n");
        out.append(value
                ? "    public Expr compileValue(BlockContext ctx) {\n"
                : "    public String compileStatement(BlockContext ctx) {\n");
        for (Block input : inputs) {
            for (Block field : chain(input.statementInput("FIELDS"))) {
                String fieldName = field.fieldText("FIELDNAME", null);
                if (fieldName == null || !STUB_FIELD_KINDS.contains(field.type())) {
                    continue;
                }
                String var = replaceNonWord(fieldName.toLowerCase(Locale.ROOT));
                if ("field_checkbox".equals(field.type())) {
                    out.append("        boolean checkbox_").append(var).append(" = \"TRUE\".equals(ctx.field(")
                            .append(javaQuote(fieldName)).append(", \"FALSE\"));\n");
                } else {
                    String prefix = field.type().substring("field_".length());
                    out.append("        String ").append(prefix).append('_').append(var).append(" = ctx.field(")
                            .append(javaQuote(fieldName)).append(", \"\");\n");
                }
            }
            String inputName = input.fieldText("INPUTNAME", "NAME");
            String var = replaceNonWord(inputName.toLowerCase(Locale.ROOT));
            if ("input_value".equals(input.type())) {
                out.append("        String value_").append(var).append(" = ctx.valueAt(")
                        .append(javaQuote(inputName))
                        .append(", Order.ATOMIC, Expr.atomic(\"None\"));\n");
            } else if ("input_statement".equals(input.type())) {
                out.append("        String statements_").append(var).append(" = ctx.body(")
                        .append(javaQuote(inputName)).append(");\n");
            }
        }
        out.append("        // TODO: Assemble Python into code variable.\n");
        if (value) {
            out.append("        String code = \"...\";\n");
            out.append("        // TODO: Change Order.NONE to the correct strength.\n");
            out.append("        return new Expr(code, Order.NONE);\n");
        } else {
            out.append("        String code = \"...\\n\";\n");
            out.append("        return code;\n");
        }
        out.append("    }\n");
        out.append("}\n");
        return out.toString();
    }

    /** A double-quoted Java string literal; control characters use octal escapes. */
    static String javaQuote(String value) {
        StringBuilder out = new StringBuilder(value.length() + 2).append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '"' -> out.append("\\\"");
                case '\\' -> out.append("\\\\");
                case '\n' -> out.append("\\n");
                case '\r' -> out.append("\\r");
                case '\t' -> out.append("\\t");
                case '\b' -> out.append("\\b");
                case '\f' -> out.append("\\f");
                default -> {
                    if (c < 0x20 || c == 0x7f) {
                        out.append(String.format("\\%03o", (int) c));
                    } else {
                        out.append(c);
                    }
                }
            }
        }
        return out.append('"').toString();
    }

    /** {@code my_block} becomes {@code MyBlockRule}. */
    static String className(String blockType) {
        StringBuilder out = new StringBuilder();
        for (String segment : blockType.split("_")) {
            if (!segment.isEmpty()) {
                out.append(Character.toUpperCase(segment.charAt(0))).append(segment.substring(1));
            }
        }
        if (out.length() == 0 || !Character.isJavaIdentifierStart(out.charAt(0))) {
            out.insert(0, "Block");
        }
        return out.append("Rule").toString();
    }

    // --- helpers ---

    private static List<Block> chain(Block head) {
        List<Block> blocks = new ArrayList<>();
        for (Block b = head; b != null; b = b.next()) {
            blocks.add(b);
        }
        return blocks;
    }

    private static String replaceNonWord(String text) {
        StringBuilder out = new StringBuilder(text.length());
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            boolean word = (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9') || c == '_';
            out.append(word ? c : '_');
        }
        return out.toString();
    }

    private static DefaultPrettyPrinter prettyPrinter() {
        DefaultIndenter indenter = new DefaultIndenter("  ", "\n");
        DefaultPrettyPrinter printer = new DefaultPrettyPrinter()
                .withSeparators(Separators.createDefaultInstance()
                        .withObjectFieldValueSpacing(Separators.Spacing.AFTER));
        printer.indentArraysWith(indenter);
        printer.indentObjectsWith(indenter);
        return printer;
    }
}
