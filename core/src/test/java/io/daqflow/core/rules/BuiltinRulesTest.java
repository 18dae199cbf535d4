package io.daqflow.core.rules;

import static io.daqflow.core.Blocks.arithmetic;
import static io.daqflow.core.Blocks.compare;
import static io.daqflow.core.Blocks.number;
import static io.daqflow.core.Blocks.print;
import static io.daqflow.core.Blocks.readInput;
import static io.daqflow.core.Blocks.setOutput;
import static io.daqflow.core.Blocks.text;
import static io.daqflow.core.Blocks.variable;
import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.daqflow.core.compiler.CompilerConfig;
import io.daqflow.core.compiler.ExpressionCompiler;
import io.daqflow.core.compiler.WorkspaceCompilation;
import io.daqflow.core.model.Block;
import io.daqflow.core.model.Workspace;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Tests for the rules registered by {@link BuiltinRules}. */
class BuiltinRulesTest {

    private final ExpressionCompiler compiler = new ExpressionCompiler(CompilerConfig.defaults());

    private String value(Block block) {
        return compiler.compileValue(block).text();
    }

    private String statement(Block block) {
        return compiler.compileStatementChain(block);
    }

    private static Block bool(String id, boolean value) {
        return new Block(id, "logic_boolean").setField("BOOL", value ? "TRUE" : "FALSE");
    }

    private static Block logic(String id, String op, Block a, Block b) {
        Block block = new Block(id, "logic_operation").setField("OP", op);
        if (a != null) {
            block.setValueInput("A", a);
        }
        if (b != null) {
            block.setValueInput("B", b);
        }
        return block;
    }

    private static Block convert(String id, String unit, Block value) {
        return new Block(id, "daq_convert_unit").setField("UNIT", unit).setValueInput("VALUE", value);
    }

    @Nested
    @DisplayName("Math")
    class MathBlocks {

        @Test
        void numberFieldAcceptsNumericText() {
            assertThat(value(new Block("n1", "math_number").setField("NUM", "3.50"))).isEqualTo("3.5");
            assertThat(value(new Block("n2", "math_number").setField("NUM", "12"))).isEqualTo("12");
            assertThat(value(new Block("n3", "math_number").setField("NUM", "1e3"))).isEqualTo("1000.0");
        }

        @Test
        void overflowingNumberTextBecomesInfinity() {
            assertThat(value(new Block("n1", "math_number").setField("NUM", "1e400"))).isEqualTo("float(\"inf\")");
            assertThat(value(new Block("n2", "math_number").setField("NUM", "-1e400"))).isEqualTo("-float(\"inf\")");
            assertThat(value(arithmetic("a", "MULTIPLY", number("x", 2),
                            new Block("n3", "math_number").setField("NUM", "1E400"))))
                    .isEqualTo("2 * float(\"inf\")");
        }

        @Test
        void invalidNumberFallsBackToZeroWithDiagnostic() {
            Workspace ws = new Workspace().addTopBlock(
                    setOutput("o", "output1", new Block("n", "math_number").setField("NUM", "abc")));

            WorkspaceCompilation result = compiler.compile(ws);

            assertThat(result.body()).isEqualTo("set_output(\"output1\", 0)\n");
            assertThat(result.diagnostics()).singleElement()
                    .satisfies(d -> assertThat(d.message()).contains("invalid number 'abc'"));
        }

        @Test
        void singleFunctionsMapToPythonCalls() {
            Block abs = new Block("s1", "math_single").setField("OP", "ABS").setValueInput("NUM", number("n", -2));
            Block pow10 = new Block("s2", "math_single").setField("OP", "POW10")
                    .setValueInput("NUM", arithmetic("a", "ADD", number("x", 1), number("y", 1)));

            assertThat(value(abs)).isEqualTo("abs(-2)");
            assertThat(value(pow10)).isEqualTo("10 ** (1 + 1)");
        }

        @Test
        void roundingVariantsRequireMathOnlyWhenNeeded() {
            Block up = new Block("r1", "math_round").setField("OP", "ROUNDUP").setValueInput("NUM", number("n", 1.2));
            Block plain = new Block("r2", "math_round").setField("OP", "ROUND").setValueInput("NUM", number("m", 1.5));

            WorkspaceCompilation ceil = compiler.compile(new Workspace().addTopBlock(setOutput("o1", "out", up)));
            WorkspaceCompilation round = compiler.compile(new Workspace().addTopBlock(setOutput("o2", "out", plain)));

            assertThat(ceil.body()).isEqualTo("set_output(\"out\", math.ceil(1.2))\n");
            assertThat(ceil.imports()).containsExactly("import math");
            assertThat(round.body()).isEqualTo("set_output(\"out\", round(1.5))\n");
            assertThat(round.imports()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Logic")
    class LogicBlocks {

        @Test
        void comparisonOperandsBindTighterThanComparison() {
            Block sum = arithmetic("add", "ADD", number("a", 1), number("b", 2));
            Block nested = compare("c2", "EQ", compare("c1", "EQ", number("x", 1), number("y", 2)), bool("f", false));

            assertThat(value(compare("c", "LT", sum, number("z", 3)))).isEqualTo("1 + 2 < 3");
            assertThat(value(nested)).isEqualTo("(1 == 2) == False");
        }

        @Test
        void orInsideAndIsParenthesized() {
            Block tree = logic("and", "AND", logic("or", "OR", variable("v1", "a"), variable("v2", "b")),
                    variable("v3", "c"));

            assertThat(value(tree)).isEqualTo("(a or b) and c");
        }

        @Test
        void missingLogicOperandsUseIdentity() {
            assertThat(value(logic("l1", "AND", null, null))).isEqualTo("False and False");
            assertThat(value(logic("l2", "AND", variable("v", "a"), null))).isEqualTo("a and True");
            assertThat(value(logic("l3", "OR", null, variable("w", "b")))).isEqualTo("False or b");
        }

        @Test
        void negationParenthesizesLooserOperand() {
            Block notCompare = new Block("n1", "logic_negate")
                    .setValueInput("BOOL", compare("c", "LT", number("a", 1), number("b", 2)));
            Block notAnd = new Block("n2", "logic_negate")
                    .setValueInput("BOOL", logic("and", "AND", variable("v1", "a"), variable("v2", "b")));

            assertThat(value(notCompare)).isEqualTo("not 1 < 2");
            assertThat(value(notAnd)).isEqualTo("not (a and b)");
        }

        @Test
        void ternaryChainsOnTheElseSide() {
            Block inner = new Block("t2", "logic_ternary")
                    .setValueInput("IF", bool("b2", false))
                    .setValueInput("THEN", number("two", 2))
                    .setValueInput("ELSE", number("three", 3));
            Block outer = new Block("t1", "logic_ternary")
                    .setValueInput("IF", bool("b1", true))
                    .setValueInput("THEN", number("one", 1))
                    .setValueInput("ELSE", inner);

            assertThat(value(outer)).isEqualTo("1 if True else 2 if False else 3");
            assertThat(value(new Block("t3", "logic_ternary"))).isEqualTo("None if False else None");
            assertThat(value(new Block("nul", "logic_null"))).isEqualTo("None");
        }
    }

    @Nested
    @DisplayName("Text and variables")
    class TextAndVariables {

        @Test
        void textIsQuotedAndEscaped() {
            assertThat(value(text("t", "he said \"hi\"\n"))).isEqualTo("\"he said \\\"hi\\\"\\n\"");
            assertThat(statement(new Block("p", "text_print"))).isEqualTo("print(\"\")\n");
        }

        @Test
        void variableNamesAreSanitizedAndKeptClearOfKeywords() {
            Block assign = new Block("set", "variables_set")
                    .setField("VAR", JsonNodeFactory.instance.objectNode().put("name", "Class"))
                    .setValueInput("VALUE", number("n", 1));

            assertThat(statement(assign)).isEqualTo("class_ = 1\n");
            assertThat(value(variable("g", "Tank Level"))).isEqualTo("tank_level");
        }

        @Test
        void unnamedVariableFallsBackToItem() {
            assertThat(value(new Block("g", "variables_get"))).isEqualTo("item");
            assertThat(statement(new Block("s", "variables_set"))).isEqualTo("item = None\n");
        }
    }

    @Nested
    @DisplayName("Control")
    class Control {

        @Test
        void ifElifElse() {
            Block ifBlock = new Block("if", "controls_if")
                    .setValueInput("IF0", compare("c0", "GT", readInput("r0", "input1"), number("n0", 10)))
                    .setStatementInput("DO0", print("p0", text("t0", "high")))
                    .setValueInput("IF1", compare("c1", "LT", readInput("r1", "input1"), number("n1", 0)))
                    .setStatementInput("DO1", print("p1", text("t1", "low")))
                    .setStatementInput("ELSE", print("p2", text("t2", "ok")));

            assertThat(statement(ifBlock)).isEqualTo("if get_input(\"input1\") > 10:\n"
                    + "    print(\"high\")\n"
                    + "elif get_input(\"input1\") < 0:\n"
                    + "    print(\"low\")\n"
                    + "else:\n"
                    + "    print(\"ok\")\n");
        }

        @Test
        void elifWithoutBodyEmitsPass() {
            Block ifBlock = new Block("if", "controls_if")
                    .setValueInput("IF0", bool("b0", true))
                    .setValueInput("IF1", bool("b1", false));

            assertThat(statement(ifBlock)).isEqualTo("if True:\n    pass\nelif False:\n    pass\n");
        }

        @Test
        void untilNegatesCondition() {
            Block loop = new Block("w", "controls_whileUntil")
                    .setField("MODE", "UNTIL")
                    .setValueInput("BOOL", logic("or", "OR", variable("v1", "done"), variable("v2", "failed")));

            assertThat(statement(loop)).isEqualTo("while not (done or failed):\n    pass\n");
        }

        @Test
        void repeatCastsNonLiteralCounts() {
            Block literal = new Block("r1", "controls_repeat_ext").setValueInput("TIMES", number("n", 10))
                    .setStatementInput("DO", print("p", text("t", "x")));
            Block computed = new Block("r2", "controls_repeat_ext").setValueInput("TIMES", readInput("i", "input1"));

            assertThat(statement(literal)).isEqualTo("for count in range(10):\n    print(\"x\")\n");
            assertThat(statement(computed)).isEqualTo("for count in range(int(get_input(\"input1\"))):\n    pass\n");
        }
    }

    @Nested
    @DisplayName("DAQ ports and unit conversion")
    class Daq {

        @Test
        void portBlocksUseFieldsAndDefaults() {
            assertThat(value(readInput("r", "input2"))).isEqualTo("get_input(\"input2\")");
            assertThat(value(new Block("r0", "daq_read_input"))).isEqualTo("get_input(\"input1\")");
            assertThat(statement(new Block("s0", "daq_set_output"))).isEqualTo("set_output(\"output1\", 0)\n");
        }

        @Test
        void celsiusToFahrenheitComposesTwoStages() {
            assertThat(value(convert("c1", "C_TO_F", readInput("r", "input1"))))
                    .isEqualTo("get_input(\"input1\") * 1.8 + 32");
            assertThat(value(convert("c2", "C_TO_F", arithmetic("a", "ADD", variable("v", "t"), number("n", 1)))))
                    .isEqualTo("(t + 1) * 1.8 + 32");
        }

        @Test
        void fahrenheitToCelsiusParenthesizesShift() {
            assertThat(value(convert("c1", "F_TO_C", variable("v", "t")))).isEqualTo("(t - 32) / 1.8");
            assertThat(value(convert("c2", "F_TO_C",
                            arithmetic("m", "MULTIPLY", variable("w", "t"), number("n", 2)))))
                    .isEqualTo("(t * 2 - 32) / 1.8");
        }

        @Test
        void kelvinConversionsAreAdditive() {
            assertThat(value(convert("c1", "C_TO_K", variable("v", "t")))).isEqualTo("t + 273.15");
            assertThat(value(convert("c2", "K_TO_C", variable("w", "t")))).isEqualTo("t - 273.15");
        }

        @Test
        void conversionInsideProductIsParenthesized() {
            Block tree = arithmetic("m", "MULTIPLY", convert("c", "C_TO_F", variable("v", "t")), number("n", 2));

            assertThat(value(tree)).isEqualTo("(t * 1.8 + 32) * 2");
        }

        @Test
        void unknownUnitPassesValueThrough() {
            Workspace ws = new Workspace().addTopBlock(
                    setOutput("o", "output1", convert("c", "PSI_TO_BAR", variable("v", "p"))));

            WorkspaceCompilation result = compiler.compile(ws);

            assertThat(result.body()).isEqualTo("set_output(\"output1\", p)\n");
            assertThat(result.text()).startsWith("# warning: unknown unit conversion 'PSI_TO_BAR'");
        }
    }
}
