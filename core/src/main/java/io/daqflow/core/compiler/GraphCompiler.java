package io.daqflow.core.compiler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.daqflow.core.document.WorkspaceSerializer;
import io.daqflow.core.error.DocumentParseException;
import io.daqflow.core.model.ComponentNode;
import io.daqflow.core.model.ProgramGraph;
import io.daqflow.core.model.ProjectMeta;
import io.daqflow.core.model.Wire;
import io.daqflow.core.model.Workspace;
import io.daqflow.core.spi.CompileListener.DegradeKind;
import io.daqflow.core.spi.CompileListener.DegradedEvent;
import io.daqflow.core.spi.CompileListener.ProgramCompiledEvent;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compiles a {@link ProgramGraph} into a runnable Python program for the DAQ runtime.
 *
 * <p>The program imports each component class once (first-seen order), instantiates every node in
 * graph order, wires them by node id and port id in wire order, and runs the engine inside a
 * {@code try/except KeyboardInterrupt/finally} scaffold whose {@code finally} stops the engine.
 * Output is deterministic: no timestamps and no hash-ordered enumeration.
 *
 * <p>Nodes whose properties carry a {@code blocks} workspace are script nodes: the blocks are
 * compiled with the {@link ExpressionCompiler} and passed to the runtime as {@code generatedCode}.
 *
 * <p>Thread-safe.
 */
public final class GraphCompiler {

    private static final Logger LOG = LoggerFactory.getLogger(GraphCompiler.class);

    /** Property holding a script node's block workspace. */
    public static final String BLOCKS_PROPERTY = "blocks";

    /** Property the compiled script is passed in. */
    public static final String GENERATED_CODE_PROPERTY = "generatedCode";

    static final Set<String> SCAFFOLD_NAMES = Set.of("engine", "time", "json", "main");

    private final CompilerConfig config;
    private final ExpressionCompiler expressions;
    private final LiteralSerializer literals;
    private final WorkspaceSerializer workspaces = new WorkspaceSerializer();
    private final ListenerNotifier notifier;

    public GraphCompiler(CompilerConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
        this.expressions = new ExpressionCompiler(config);
        this.literals = new LiteralSerializer(config.output().indentUnit());
        this.notifier = new ListenerNotifier(config.listeners());
    }

    /** Compiles a graph with default project metadata. */
    public String compileProgram(ProgramGraph graph) {
        return compileProgram(graph, ProjectMeta.untitled());
    }

    /**
     * Compiles a graph into program text.
     *
     * @param graph the program graph; its structural invariants are assumed to hold
     * @param meta  project metadata for the module docstring
     * @return the complete program text
     */
    public String compileProgram(ProgramGraph graph, ProjectMeta meta) {
        Objects.requireNonNull(graph, "graph must not be null");
        Objects.requireNonNull(meta, "meta must not be null");
        long start = System.nanoTime();
        OutputOptions out = config.output();
        String i1 = out.indentUnit();
        String i2 = i1 + i1;
        String i3 = i2 + i1;

        Map<String, String> classes = resolveClasses(graph);

        StringBuilder py = new StringBuilder();
        py.append("#!/usr/bin/env python3\n");
        py.append("\"\"\"\n");
        py.append(docstringText(meta.name() + " v" + meta.version())).append('\n');
        py.append("Auto-generated DAQ application\n");
        if (!meta.description().isBlank()) {
            py.append('\n').append(docstringText(meta.description())).append('\n');
        }
        py.append("\"\"\"\n\n");

        py.append("import time\n");
        py.append("import json\n");
        py.append("from ").append(out.engineModule()).append(" import ").append(out.engineClass()).append('\n');
        if (!classes.isEmpty()) {
            py.append("from ").append(out.componentsModule()).append(" import (\n");
            new LinkedHashSet<>(classes.values())
                    .forEach(cls -> py.append(i1).append(cls).append(",\n"));
            py.append(")\n");
        }
        py.append("\n\n");

        py.append("def main():\n");
        py.append(i1).append("\"\"\"Main entry point for the DAQ application.\"\"\"\n");
        py.append(i1).append("engine = ").append(out.engineClass()).append("()\n");

        py.append('\n').append(i1).append("# === Component Instances ===\n");
        Set<String> taken = new HashSet<>(SCAFFOLD_NAMES);
        taken.addAll(classes.values());
        for (ComponentNode node : graph.nodes()) {
            String var = variableName(node, taken);
            String comment = node.label().isEmpty() ? node.componentType() : node.label();
            py.append('\n');
            py.append(i1).append("# ").append(singleLine(comment)).append('\n');
            py.append(i1).append(var).append(" = ").append(classes.get(node.componentType())).append("(\n");
            py.append(i2).append("instance_id=").append(LiteralSerializer.quote(node.id())).append(",\n");
            py.append(i2).append("config=").append(literals.toLiteral(config(node), 2)).append('\n');
            py.append(i1).append(")\n");
            py.append(i1).append("engine.add_component(").append(var).append(")\n");
        }

        py.append('\n').append(i1).append("# === Wire Connections ===\n");
        for (Wire wire : graph.wires()) {
            py.append(i1)
                    .append("engine.connect(")
                    .append(LiteralSerializer.quote(wire.sourceNodeId()))
                    .append(", ")
                    .append(LiteralSerializer.quote(wire.sourcePortId()))
                    .append(", ")
                    .append(LiteralSerializer.quote(wire.targetNodeId()))
                    .append(", ")
                    .append(LiteralSerializer.quote(wire.targetPortId()))
                    .append(")\n");
        }

        py.append('\n').append(i1).append("# === Run Engine ===\n");
        py.append(i1).append("try:\n");
        py.append(i2).append("print(\"Starting DAQ Engine...\")\n");
        py.append(i2).append("engine.start()\n");
        py.append(i2).append("# Run until interrupted\n");
        py.append(i2).append("while True:\n");
        py.append(i3).append("time.sleep(").append(Double.toString(out.idleSleepSeconds())).append(")\n");
        py.append(i1).append("except KeyboardInterrupt:\n");
        py.append(i2).append("print(\"\\nShutting down...\")\n");
        py.append(i1).append("finally:\n");
        py.append(i2).append("engine.stop()\n");
        py.append("\n\n");
        py.append("if __name__ == \"__main__\":\n");
        py.append(i1).append("main()\n");

        long durationMs = (System.nanoTime() - start) / 1_000_000;
        LOG.debug(
                "Compiled program '{}': nodes={}, wires={}, classes={}, durationMs={}",
                meta.name(),
                graph.nodes().size(),
                graph.wires().size(),
                classes.size(),
                durationMs);
        notifier.programCompiled(new ProgramCompiledEvent(
                graph.nodes().size(), graph.wires().size(), new HashSet<>(classes.values()).size(), durationMs));
        return py.toString();
    }

    /** componentType to class, in first-seen order. */
    private Map<String, String> resolveClasses(ProgramGraph graph) {
        Map<String, String> classes = new LinkedHashMap<>();
        for (ComponentNode node : graph.nodes()) {
            String type = node.componentType();
            if (classes.containsKey(type)) {
                continue;
            }
            String cls = config.classes().resolve(type);
            if (!config.classes().isRegistered(type)) {
                LOG.debug("Component type '{}' is not registered, using fallback class {}", type, cls);
                notifier.degraded(new DegradedEvent(
                        DegradeKind.UNRESOLVED_COMPONENT_TYPE, node.id(), type, "fallback class " + cls));
            }
            classes.put(type, cls);
        }
        return classes;
    }

    /**
     * Sanitized label (or id when unlabeled), kept clear of keywords and scaffold names and made
     * unique with a numeric suffix.
     */
    private static String variableName(ComponentNode node, Set<String> taken) {
        String source = node.label().isEmpty() ? node.id() : node.label();
        String base = IdentifierSanitizer.sanitize(source, node.id());
        if (PythonNames.isReserved(base) || SCAFFOLD_NAMES.contains(base)) {
            base = base + "_";
        }
        String name = base;
        for (int n = 2; taken.contains(name); n++) {
            name = base + "_" + n;
        }
        taken.add(name);
        return name;
    }

    /**
     * The node's properties with the type's configuration defaults filled in, and a script
     * workspace replaced by its compiled code.
     */
    private JsonNode config(ComponentNode node) {
        JsonNode properties = config.classes().applyConfigDefaults(node.componentType(), node.properties());
        JsonNode blocks = properties.get(BLOCKS_PROPERTY);
        if (blocks == null || !properties.isObject()) {
            return properties;
        }
        String code = compileScript(node, blocks);
        ObjectNode rewritten = JsonNodeFactory.instance.objectNode();
        properties.properties().forEach(entry -> {
            if (entry.getKey().equals(BLOCKS_PROPERTY)) {
                rewritten.put(GENERATED_CODE_PROPERTY, code);
            } else if (!entry.getKey().equals(GENERATED_CODE_PROPERTY)) {
                rewritten.set(entry.getKey(), entry.getValue());
            }
        });
        return rewritten;
    }

    private String compileScript(ComponentNode node, JsonNode blocks) {
        ObjectNode document = JsonNodeFactory.instance.objectNode();
        document.set(BLOCKS_PROPERTY, blocks);
        try {
            Workspace workspace = workspaces.fromJson(document, "node " + node.id());
            return expressions.compileWorkspace(workspace);
        } catch (DocumentParseException e) {
            LOG.warn("Script blocks of node '{}' are malformed: {}", node.id(), e.getMessage());
            notifier.degraded(new DegradedEvent(
                    DegradeKind.SCRIPT_FAILURE, node.id(), node.componentType(), e.getMessage()));
            return "# could not compile script blocks: " + singleLine(e.getMessage()) + "\n";
        }
    }

    private static String singleLine(String text) {
        return text.replace("\r\n", " ").replace('\n', ' ').replace('\r', ' ');
    }

    /** Text safe inside a triple-quoted docstring. */
    private static String docstringText(String text) {
        return text.replace("\\", "\\\\").replace("\"\"\"", "\\\"\\\"\\\"");
    }
}
