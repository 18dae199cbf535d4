package io.daqflow.core.compiler;

import static io.daqflow.core.Blocks.arithmetic;
import static io.daqflow.core.Blocks.number;
import static io.daqflow.core.Blocks.print;
import static io.daqflow.core.Blocks.readInput;
import static io.daqflow.core.Blocks.setOutput;
import static io.daqflow.core.Blocks.text;
import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.daqflow.core.model.Block;
import io.daqflow.core.model.BlockDefinition;
import io.daqflow.core.model.Expr;
import io.daqflow.core.model.Order;
import io.daqflow.core.model.Workspace;
import io.daqflow.core.spi.BlockContext;
import io.daqflow.core.spi.StatementRule;
import io.daqflow.core.spi.ValueRule;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Tests for {@link ExpressionCompiler}. */
@DisplayName("ExpressionCompiler")
class ExpressionCompilerTest {

    private final CompilerConfig config = CompilerConfig.defaults();
    private final ExpressionCompiler compiler = new ExpressionCompiler(config);

    @Nested
    @DisplayName("Minimal parentheses")
    class MinimalParens {

        @Test
        @DisplayName("(2 * 3) + 4 needs no parentheses")
        void productInsideSum() {
            Block tree = arithmetic("add", "ADD", arithmetic("mul", "MULTIPLY", number("a", 2), number("b", 3)),
                    number("c", 4));

            Expr expr = compiler.compileValue(tree);

            assertThat(expr.text()).isEqualTo("2 * 3 + 4");
            assertThat(expr.order()).isEqualTo(Order.ADDITIVE);
        }

        @Test
        @DisplayName("(2 + 3) * 4 keeps its parentheses")
        void sumInsideProduct() {
            Block tree = arithmetic("mul", "MULTIPLY", arithmetic("add", "ADD", number("a", 2), number("b", 3)),
                    number("c", 4));

            assertThat(compiler.compileValue(tree).text()).isEqualTo("(2 + 3) * 4");
        }

        @Test
        void rightOperandOfSubtractionIsParenthesized() {
            Block right = arithmetic("r", "MINUS", number("a", 1),
                    arithmetic("inner", "MINUS", number("b", 2), number("c", 3)));
            Block left = arithmetic("l", "MINUS", arithmetic("inner2", "MINUS", number("d", 1), number("e", 2)),
                    number("f", 3));

            assertThat(compiler.compileValue(right).text()).isEqualTo("1 - (2 - 3)");
            assertThat(compiler.compileValue(left).text()).isEqualTo("1 - 2 - 3");
        }

        @Test
        void divisionOfProductParenthesizesDivisor() {
            Block tree = arithmetic("d", "DIVIDE", number("a", 8),
                    arithmetic("m", "MULTIPLY", number("b", 2), number("c", 2)));

            assertThat(compiler.compileValue(tree).text()).isEqualTo("8 / (2 * 2)");
        }

        @Test
        void powerIsRightAssociative() {
            Block rightNested = arithmetic("p1", "POWER", number("a", 2),
                    arithmetic("p2", "POWER", number("b", 3), number("c", 2)));
            Block leftNested = arithmetic("p3", "POWER",
                    arithmetic("p4", "POWER", number("d", 2), number("e", 3)), number("f", 2));

            assertThat(compiler.compileValue(rightNested).text()).isEqualTo("2 ** 3 ** 2");
            assertThat(compiler.compileValue(leftNested).text()).isEqualTo("(2 ** 3) ** 2");
        }

        @Test
        void parenthesizedResultIsAtomic() {
            Block sum = arithmetic("add", "ADD", number("a", 1), number("b", 2));

            Expr expr = compiler.compileValue(sum, Order.MULTIPLICATIVE);

            assertThat(expr).isEqualTo(Expr.atomic("(1 + 2)"));
        }

        @Test
        void negativeLiteralUnderNegationIsParenthesized() {
            Block neg = new Block("neg", "math_single").setField("OP", "NEG").setValueInput("NUM", number("n", -5));

            assertThat(compiler.compileValue(neg).text()).isEqualTo("-(-5)");
        }
    }

    @Nested
    @DisplayName("Unconnected sockets and fallbacks")
    class Fallbacks {

        @Test
        void missingOperandsUseSocketDefaults() {
            Block empty = arithmetic("add", "ADD", null, number("b", 7));

            assertThat(compiler.compileValue(empty).text()).isEqualTo("0 + 7");
        }

        @Test
        void unknownValueBlockBecomesNoneWithDiagnostic() {
            Block tree = arithmetic("add", "ADD", new Block("m1", "mystery_block"), number("b", 1));
            Workspace ws = new Workspace().addTopBlock(print("p", tree));

            WorkspaceCompilation result = compiler.compile(ws);

            assertThat(result.body()).isEqualTo("print(None + 1)\n");
            assertThat(result.diagnostics()).singleElement().satisfies(d -> {
                assertThat(d.blockId()).isEqualTo("m1");
                assertThat(d.inline()).isFalse();
            });
            assertThat(result.text())
                    .startsWith("# warning: unknown block type: 'mystery_block' (block m1)\n")
                    .endsWith("print(None + 1)\n");
        }

        @Test
        void unknownStatementBlockBecomesInlineComment() {
            Block head = print("p1", text("t1", "a"));
            head.setNext(new Block("x1", "robot_arm_move"));
            head.next().setNext(print("p2", text("t2", "b")));

            String code = compiler.compileStatementChain(head);

            assertThat(code).isEqualTo("print(\"a\")\n# unknown block type: 'robot_arm_move'\nprint(\"b\")\n");
        }

        @Test
        void declaredBlockWithoutRuleIsReportedAsMissingGenerator() {
            config.rules().registerDefinition(new BlockDefinition(
                    "draft_block", JsonNodeFactory.instance.objectNode(), BlockDefinition.Connection.BOTH));

            String code = compiler.compileStatementChain(new Block("d1", "draft_block"));

            assertThat(code).isEqualTo("# no generator registered for block type: 'draft_block'\n");
        }

        @Test
        void statementBlockInValuePositionIsNone() {
            Block tree = print("p", print("inner", text("t", "x")));

            assertThat(compiler.compileStatementChain(tree)).isEqualTo("print(None)\n");
        }

        @Test
        void failingRuleDegradesInsteadOfThrowing() {
            config.rules().register(new ValueRule() {
                @Override
                public String type() {
                    return "exploding_value";
                }

                @Override
                public Expr compileValue(BlockContext ctx) {
                    throw new IllegalStateException("boom");
                }
            });
            config.rules().register(new StatementRule() {
                @Override
                public String type() {
                    return "exploding_statement";
                }

                @Override
                public String compileStatement(BlockContext ctx) {
                    throw new IllegalStateException("boom");
                }
            });

            assertThat(compiler.compileValue(new Block("e1", "exploding_value")).text()).isEqualTo("None");
            assertThat(compiler.compileStatementChain(new Block("e2", "exploding_statement")))
                    .isEqualTo("# generator for block type 'exploding_statement' failed\n");
        }
    }

    @Nested
    @DisplayName("Statements")
    class Statements {

        @Test
        void ifWithEmptyBodyEmitsPass() {
            Block ifBlock = new Block("if", "controls_if").setValueInput("IF0", new Block("b", "logic_boolean"));

            assertThat(compiler.compileStatementChain(ifBlock)).isEqualTo("if True:\n    pass\n");
        }

        @Test
        void nestedBodiesIndentOneLevelPerDepth() {
            Block inner = new Block("if2", "controls_if")
                    .setValueInput("IF0", new Block("b2", "logic_boolean").setField("BOOL", "FALSE"))
                    .setStatementInput("DO0", print("p2", text("t2", "deep")));
            Block outer = new Block("if1", "controls_if")
                    .setValueInput("IF0", new Block("b1", "logic_boolean"))
                    .setStatementInput("DO0", inner);

            assertThat(compiler.compileStatementChain(outer))
                    .isEqualTo("if True:\n    if False:\n        print(\"deep\")\n");
        }

        @Test
        void topLevelValueBlockBecomesExpressionStatement() {
            Workspace ws = new Workspace().addTopBlock(readInput("r", "input1"));

            assertThat(compiler.compileWorkspace(ws)).isEqualTo("get_input(\"input1\")\n");
        }

        @Test
        void chainsAreSeparatedByBlankLine() {
            Workspace ws = new Workspace()
                    .addTopBlock(print("p1", text("t1", "a")))
                    .addTopBlock(print("p2", text("t2", "b")));

            assertThat(compiler.compileWorkspace(ws)).isEqualTo("print(\"a\")\n\nprint(\"b\")\n");
        }

        @Test
        void importsAreCollectedOnceAheadOfCode() {
            Block sqrt = new Block("s1", "math_single").setField("OP", "ROOT").setValueInput("NUM", number("n1", 2));
            Block ln = new Block("s2", "math_single").setField("OP", "LN").setValueInput("NUM", number("n2", 3));
            Workspace ws = new Workspace().addTopBlock(setOutput("o1", "output1", sqrt));
            ws.topBlocks().get(0).setNext(setOutput("o2", "output2", ln));

            WorkspaceCompilation result = compiler.compile(ws);

            assertThat(result.imports()).containsExactly("import math");
            assertThat(result.text()).isEqualTo("import math\n\n"
                    + "set_output(\"output1\", math.sqrt(2))\n"
                    + "set_output(\"output2\", math.log(3))\n");
        }

        @Test
        void emptyWorkspaceCompilesToEmptyText() {
            assertThat(compiler.compileWorkspace(new Workspace())).isEmpty();
            assertThat(compiler.compileStatementChain(null)).isEmpty();
        }

        @Test
        void customIndentUnitIsHonoured() {
            ExpressionCompiler twoSpace =
                    new ExpressionCompiler(config.withOutput(OutputOptions.defaults().withIndentUnit("  ")));
            Block loop = new Block("w", "controls_whileUntil")
                    .setValueInput("BOOL", new Block("b", "logic_boolean"))
                    .setStatementInput("DO", print("p", text("t", "tick")));

            assertThat(twoSpace.compileStatementChain(loop)).isEqualTo("while True:\n  print(\"tick\")\n");
        }
    }

    @Test
    void compilationIsDeterministic() {
        Block tree = setOutput("o", "output1", arithmetic("mul", "MULTIPLY",
                arithmetic("add", "ADD", readInput("r", "input1"), number("a", 1)), number("b", 2.5)));
        Workspace ws = new Workspace().addTopBlock(tree);

        String first = compiler.compileWorkspace(ws);
        String second = new ExpressionCompiler(CompilerConfig.defaults()).compileWorkspace(ws);

        assertThat(first).isEqualTo("set_output(\"output1\", (get_input(\"input1\") + 1) * 2.5)\n");
        assertThat(second).isEqualTo(first);
    }

    @Test
    void indentSkipsBlankLines() {
        assertThat(compiler.indent("a\n\nb\n")).isEqualTo("    a\n\n    b\n");
        assertThat(compiler.indent("")).isEmpty();
        assertThat(compiler.indent("x")).isEqualTo("    x");
    }
}
