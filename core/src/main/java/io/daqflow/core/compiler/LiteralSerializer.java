package io.daqflow.core.compiler;

import com.fasterxml.jackson.databind.JsonNode;
import java.math.BigDecimal;
import java.util.Iterator;
import java.util.Map;

/**
 * Serializes JSON-like value trees into Python literal source text.
 *
 * <p>Scalars render inline. Non-empty lists and dicts render one element per line, each at
 * {@code indentLevel + 1}, with the closing bracket at {@code indentLevel}. Dict keys are emitted
 * as string literals in document order. The output is accepted by a Python literal reader and
 * reproduces the input tree.
 */
public final class LiteralSerializer {

    /** Default indent unit: four spaces. */
    public static final String DEFAULT_INDENT = "    ";

    private final String indentUnit;

    public LiteralSerializer() {
        this(DEFAULT_INDENT);
    }

    public LiteralSerializer(String indentUnit) {
        if (indentUnit == null || indentUnit.isEmpty() || !indentUnit.isBlank()) {
            throw new IllegalArgumentException("indent unit must be non-empty whitespace");
        }
        this.indentUnit = indentUnit;
    }

    /**
     * Renders {@code value} as a Python literal.
     *
     * @param value       the value tree; {@code null} renders as {@code None}
     * @param indentLevel the indentation level of the line the literal starts on
     * @return Python literal text
     */
    public String toLiteral(JsonNode value, int indentLevel) {
        StringBuilder out = new StringBuilder();
        write(value, indentLevel, out);
        return out.toString();
    }

    /** Renders a string as a double-quoted Python string literal. */
    public static String quote(String value) {
        StringBuilder out = new StringBuilder(value.length() + 2);
        appendQuoted(value, out);
        return out.toString();
    }

    private void write(JsonNode value, int level, StringBuilder out) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            out.append("None");
        } else if (value.isBoolean()) {
            out.append(value.booleanValue() ? "True" : "False");
        } else if (value.isIntegralNumber()) {
            out.append(value.bigIntegerValue().toString());
        } else if (value.isNumber()) {
            out.append(floatText(value));
        } else if (value.isArray()) {
            writeArray(value, level, out);
        } else if (value.isObject()) {
            writeObject(value, level, out);
        } else {
            appendQuoted(value.asText(), out);
        }
    }

    private void writeArray(JsonNode array, int level, StringBuilder out) {
        if (array.isEmpty()) {
            out.append("[]");
            return;
        }
        out.append("[\n");
        Iterator<JsonNode> it = array.elements();
        while (it.hasNext()) {
            indent(level + 1, out);
            write(it.next(), level + 1, out);
            out.append(it.hasNext() ? ",\n" : "\n");
        }
        indent(level, out);
        out.append(']');
    }

    private void writeObject(JsonNode object, int level, StringBuilder out) {
        if (object.isEmpty()) {
            out.append("{}");
            return;
        }
        out.append("{\n");
        Iterator<Map.Entry<String, JsonNode>> it = object.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> entry = it.next();
            indent(level + 1, out);
            appendQuoted(entry.getKey(), out);
            out.append(": ");
            write(entry.getValue(), level + 1, out);
            out.append(it.hasNext() ? ",\n" : "\n");
        }
        indent(level, out);
        out.append('}');
    }

    private void indent(int level, StringBuilder out) {
        for (int i = 0; i < level; i++) {
            out.append(indentUnit);
        }
    }

    private static String floatText(JsonNode value) {
        if (value.isBigDecimal()) {
            String text = value.decimalValue().toString();
            return hasFloatMarker(text) ? text : new BigDecimal(text).toPlainString() + ".0";
        }
        double d = value.doubleValue();
        if (Double.isNaN(d)) {
            return "float(\"nan\")";
        }
        if (Double.isInfinite(d)) {
            return d > 0 ? "float(\"inf\")" : "-float(\"inf\")";
        }
        // Double.toString always carries '.' or an exponent.
        return Double.toString(d);
    }

    private static boolean hasFloatMarker(String text) {
        return text.indexOf('.') >= 0 || text.indexOf('E') >= 0 || text.indexOf('e') >= 0;
    }

    private static void appendQuoted(String value, StringBuilder out) {
        out.append('"');
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            switch (c) {
                case '\\' -> out.append("\\\\");
                case '"' -> out.append("\\\"");
                case '\n' -> out.append("\\n");
                case '\r' -> out.append("\\r");
                case '\t' -> out.append("\\t");
                default -> {
                    if (c < 0x20 || c == 0x7f) {
                        out.append(String.format("\\x%02x", (int) c));
                    } else if (Character.isSurrogate(c) && !isPairedSurrogate(value, i)) {
                        out.append(String.format("\\u%04x", (int) c));
                    } else {
                        out.append(c);
                    }
                }
            }
        }
        out.append('"');
    }

    private static boolean isPairedSurrogate(String s, int i) {
        char c = s.charAt(i);
        if (Character.isHighSurrogate(c)) {
            return i + 1 < s.length() && Character.isLowSurrogate(s.charAt(i + 1));
        }
        return i > 0 && Character.isHighSurrogate(s.charAt(i - 1));
    }
}
