package io.daqflow.core.compiler;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.daqflow.core.model.Block;
import io.daqflow.core.model.BlockDefinition;
import io.daqflow.core.model.Workspace;
import io.daqflow.core.spi.CompileListener;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/** Tests for {@link SchemaCompiler}. */
@DisplayName("SchemaCompiler")
class SchemaCompilerTest {

    private static final ObjectMapper JSON = new ObjectMapper();

    private final SchemaCompiler compiler = new SchemaCompiler(CompilerConfig.defaults());

    /** A value block: "scale [FACTOR] (VALUE:Number)" plus a MODE dropdown, tinted hue 120. */
    private static Block valueBlockDefinition() {
        Block number = new Block("f2", "field_number")
                .setField("FIELDNAME", "FACTOR")
                .setField("VALUE", 2L)
                .setField("MIN", 0L);
        Block label = new Block("f1", "field_static").setField("TEXT", "scale");
        label.setNext(number);
        Block valueInput = new Block("i1", "input_value")
                .setField("INPUTNAME", "VALUE")
                .setField("ALIGN", "LEFT")
                .setValueInput("TYPE", new Block("t1", "type_number"))
                .setStatementInput("FIELDS", label);
        Block dummy = new Block("i2", "input_dummy").setStatementInput("FIELDS",
                new Block("f3", "field_dropdown").setField("FIELDNAME", "MODE").setField("OPTIONS", "fast, slow"));
        valueInput.setNext(dummy);
        return new Block("root", "factory_base")
                .setField("NAME", "My Block")
                .setField("CONNECTIONS", "LEFT")
                .setField("INLINE", "INT")
                .setStatementInput("INPUTS", valueInput)
                .setValueInput("OUTPUTTYPE", new Block("t2", "type_number"))
                .setValueInput("COLOUR", new Block("c1", "colour_hue").setField("HUE", "120"))
                .setValueInput("TOOLTIP", new Block("tt", "text").setField("TEXT", "Scales"));
    }

    @Nested
    @DisplayName("Block definition JSON")
    class DefinitionJson {

        @Test
        void valueBlockDefinitionJson() throws Exception {
            SchemaCompilation result = compiler.compileSchema(valueBlockDefinition());
            JsonNode schema = JSON.readTree(result.schemaText());

            assertThat(result.blockType()).isEqualTo("my_block");
            assertThat(schema.get("type").asText()).isEqualTo("my_block");
            assertThat(schema.get("message0").asText()).isEqualTo("scale %1 %2 %3 %4");
            assertThat(schema.get("args0")).hasSize(4);
            assertThat(schema.at("/args0/0")).isEqualTo(
                    JSON.readTree("{\"type\": \"field_number\", \"name\": \"FACTOR\", \"value\": 2, \"min\": 0}"));
            assertThat(schema.at("/args0/1")).isEqualTo(
                    JSON.readTree("{\"type\": \"input_value\", \"name\": \"VALUE\", \"check\": \"Number\"}"));
            assertThat(schema.at("/args0/2/options")).isEqualTo(JSON.readTree("[[\"fast\", \"fast\"], [\"slow\", \"slow\"]]"));
            assertThat(schema.at("/args0/3")).isEqualTo(JSON.readTree("{\"type\": \"input_dummy\"}"));
            assertThat(schema.get("inputsInline").asBoolean()).isTrue();
            assertThat(schema.get("output").asText()).isEqualTo("Number");
            assertThat(schema.get("colour").asInt()).isEqualTo(120);
            assertThat(schema.get("tooltip").asText()).isEqualTo("Scales");
            assertThat(schema.get("helpUrl").asText()).isEmpty();
        }

        @Test
        void schemaTextIsTwoSpaceIndentedJson() {
            String text = compiler.compileSchema(valueBlockDefinition()).schemaText();

            assertThat(text).startsWith("{\n  \"type\": \"my_block\",\n  \"message0\": \"scale %1 %2 %3 %4\",\n");
        }

        @Test
        void statementBlockDeclaresBothConnectionsAsAnyType() throws Exception {
            Block root = new Block("root", "factory_base")
                    .setField("NAME", "run step")
                    .setField("CONNECTIONS", "BOTH")
                    .setStatementInput("INPUTS", new Block("i1", "input_statement").setField("INPUTNAME", "DO"));

            JsonNode schema = JSON.readTree(compiler.compileSchema(root).schemaText());

            assertThat(schema.get("type").asText()).isEqualTo("run_step");
            assertThat(schema.has("previousStatement")).isTrue();
            assertThat(schema.get("previousStatement").isNull()).isTrue();
            assertThat(schema.get("nextStatement").isNull()).isTrue();
            assertThat(schema.has("output")).isFalse();
            assertThat(schema.has("colour")).isFalse();
            assertThat(schema.has("inputsInline")).isFalse();
        }

        @Test
        void unknownFieldKindsAreSkipped() throws Exception {
            Block fields = new Block("f1", "field_hologram");
            fields.setNext(new Block("f2", "field_checkbox").setField("FIELDNAME", "ON").setField("CHECKED", "FALSE"));
            Block root = new Block("root", "factory_base")
                    .setStatementInput("INPUTS", new Block("i1", "input_dummy").setStatementInput("FIELDS", fields));

            JsonNode schema = JSON.readTree(compiler.compileSchema(root).schemaText());

            assertThat(schema.get("type").asText()).isEqualTo(SchemaCompiler.DEFAULT_BLOCK_TYPE);
            assertThat(schema.get("message0").asText()).isEqualTo("%1 %2");
            assertThat(schema.at("/args0/0/type").asText()).isEqualTo("field_checkbox");
            assertThat(schema.at("/args0/0/checked").asBoolean()).isFalse();
        }

        @Test
        void customTypeCheckUsesTypeField() {
            Block other = new Block("t", "type_other").setField("TYPE", "Sensor");

            assertThat(SchemaCompiler.typeCheck(other)).isEqualTo("Sensor");
            assertThat(SchemaCompiler.typeCheck(new Block("a", "type_null"))).isNull();
            assertThat(SchemaCompiler.typeCheck(null)).isNull();
        }
    }

    @Nested
    @DisplayName("Rule stub")
    class RuleStub {

        @Test
        void valueBlockStubImplementsValueRule() {
            String stub = compiler.compileSchema(valueBlockDefinition()).generatorStubText();

            assertThat(stub).startsWith("public final class MyBlockRule implements ValueRule {\n");
            assertThat(stub).contains(
                    "        return \"my_block\";\n",
                    "        String number_factor = ctx.field(\"FACTOR\", \"\");\n",
                    "        String value_value = ctx.valueAt(\"VALUE\", Order.ATOMIC, Expr.atomic(\"None\"));\n",
                    "        String dropdown_mode = ctx.field(\"MODE\", \"\");\n",
                    "        return new Expr(code, Order.NONE);\n");
        }

        @Test
        void statementBlockStubReadsBody() {
            Block root = new Block("root", "factory_base")
                    .setField("NAME", "run step")
                    .setField("CONNECTIONS", "BOTH")
                    .setStatementInput("INPUTS", new Block("i1", "input_statement").setField("INPUTNAME", "DO"));

            String stub = compiler.compileSchema(root).generatorStubText();

            assertThat(stub).startsWith("public final class RunStepRule implements StatementRule {\n");
            assertThat(stub).contains("        String statements_do = ctx.body(\"DO\");\n", "        return code;\n");
        }

        @Test
        void stubStringsUseJavaEscapes() {
            Block fields = new Block("f1", "field_input").setField("FIELDNAME", "MO\u0001DE \"x\"\\");
            Block root = new Block("root", "factory_base")
                    .setField("NAME", "odd names")
                    .setField("CONNECTIONS", "LEFT")
                    .setStatementInput("INPUTS", new Block("i1", "input_dummy").setStatementInput("FIELDS", fields));

            String stub = compiler.compileSchema(root).generatorStubText();

            assertThat(stub).contains("ctx.field(\"MO\\001DE \\\"x\\\"\\\\\", \"\")");
            assertThat(stub).doesNotContain("\\x01");
        }

        @Test
        void javaQuoteEscapesControlCharacters() {
            assertThat(SchemaCompiler.javaQuote("a\tb\nc")).isEqualTo("\"a\\tb\\nc\"");
            assertThat(SchemaCompiler.javaQuote("\u001f\u007f")).isEqualTo("\"\\037\\177\"");
            assertThat(SchemaCompiler.javaQuote("überwachung")).isEqualTo("\"überwachung\"");
        }
    }

    @Test
    void missingRootYieldsPlaceholders() {
        Workspace ws = new Workspace().addTopBlock(new Block("x", "text"));

        SchemaCompilation result = compiler.compileSchema(ws);

        assertThat(result.isPlaceholder()).isTrue();
        assertThat(result.blockDefinition()).isEmpty();
        assertThat(result.schemaText()).isEqualTo("// Add inputs and other blocks to the factory_base block");
        assertThat(result.generatorStubText()).isEqualTo("// No generator code yet");
    }

    @Test
    void definitionCanBeRegisteredAndIsReported() {
        GraphCompilerTest.RecordingListener listener = new GraphCompilerTest.RecordingListener();
        CompilerConfig config = CompilerConfig.defaults().withListener(listener);
        Workspace ws = new Workspace().addTopBlock(valueBlockDefinition());

        SchemaCompilation result = new SchemaCompiler(config).compileSchema(ws);
        BlockDefinition definition = result.blockDefinition().orElseThrow();
        config.rules().registerDefinition(definition);

        assertThat(definition.isValueBlock()).isTrue();
        assertThat(config.rules().definition("my_block")).isPresent();
        assertThat(listener.events).containsExactly(new CompileListener.SchemaCompiledEvent("my_block", 2, 2));
    }

    @Test
    void blockTypeNameNormalizesUserInput() {
        assertThat(SchemaCompiler.blockTypeName("  Read Sensor#2 ")).isEqualTo("read_sensor_2");
        assertThat(SchemaCompiler.blockTypeName("")).isEqualTo("block_type");
        assertThat(SchemaCompiler.className("read_sensor_2")).isEqualTo("ReadSensor2Rule");
    }
}
