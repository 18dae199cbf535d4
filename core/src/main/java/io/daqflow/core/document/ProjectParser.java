package io.daqflow.core.document;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import io.daqflow.core.error.DocumentParseException;
import io.daqflow.core.error.DocumentSchemaException;
import io.daqflow.core.error.StructureViolationException;
import io.daqflow.core.model.ComponentNode;
import io.daqflow.core.model.ProgramGraph;
import io.daqflow.core.model.ProjectMeta;
import io.daqflow.core.model.Wire;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses project documents ({@code .daq} files, JSON or YAML) into a {@link DaqProject}.
 *
 * <p>The document is validated against the bundled JSON Schema ({@value #SCHEMA_RESOURCE}) before
 * it is mapped, so unknown keys and wrongly typed values are reported together. The graph is then
 * built through {@link ProgramGraph}'s mutation API: duplicate node ids and wires that reference
 * missing nodes are rejected. Node types may carry a {@code daq:} namespace prefix, which is
 * stripped. The {@code devices} and {@code ui} sections are accepted and ignored.
 *
 * <p>Thread-safe.
 */
public final class ProjectParser {

    private static final Logger LOG = LoggerFactory.getLogger(ProjectParser.class);

    /** Classpath location of the project document schema. */
    public static final String SCHEMA_RESOURCE = "schemas/project.schema.json";

    /** Namespace prefix the editor puts on node types. */
    public static final String TYPE_PREFIX = "daq:";

    /** Document format versions this parser was written against. */
    static final Set<String> SUPPORTED_SCHEMA_VERSIONS = Set.of("0.1.0");

    // YAML is a superset of JSON, so one mapper reads both formats.
    private static final ObjectMapper YAML_MAPPER = DocumentMappers.yaml();
    private static final JsonSchemaFactory SCHEMA_FACTORY =
            JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V202012);

    private final JsonSchema schema;

    public ProjectParser() {
        try (InputStream in = ProjectParser.class.getClassLoader().getResourceAsStream(SCHEMA_RESOURCE)) {
            if (in == null) {
                throw new IllegalStateException("Missing classpath resource " + SCHEMA_RESOURCE);
            }
            this.schema = SCHEMA_FACTORY.getSchema(in);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + SCHEMA_RESOURCE, e);
        }
    }

    /**
     * Parses the project document at {@code path}.
     *
     * @throws DocumentParseException  if the file cannot be read, is not JSON/YAML, or its graph
     *                                 is structurally invalid
     * @throws DocumentSchemaException if the document does not conform to the project schema
     */
    public DaqProject parse(Path path) {
        Objects.requireNonNull(path, "path must not be null");
        String source = path.toString();
        JsonNode root;
        try {
            root = YAML_MAPPER.readTree(path.toFile());
        } catch (IOException e) {
            throw new DocumentParseException("Failed to read or parse project document: " + e.getMessage(), e, null,
                    source);
        }
        return parse(root, source);
    }

    /** Parses a project document held in memory. */
    public DaqProject parse(String content, String source) {
        Objects.requireNonNull(content, "content must not be null");
        JsonNode root;
        try {
            root = YAML_MAPPER.readTree(content);
        } catch (IOException e) {
            throw new DocumentParseException("Failed to parse project document: " + e.getMessage(), e, null, source);
        }
        return parse(root, source);
    }

    /** Validates and maps an already-parsed document tree. */
    public DaqProject parse(JsonNode root, String source) {
        if (root == null || root.isMissingNode() || !root.isObject()) {
            throw new DocumentParseException("Project document must be a mapping", null, source);
        }
        validate(root, source);

        ProjectMeta meta = parseMeta(root.path("meta"));
        if (!SUPPORTED_SCHEMA_VERSIONS.contains(meta.schemaVersion())) {
            LOG.warn(
                    "Project '{}' uses schema version {}, which may not be fully compatible (supported: {})",
                    meta.name(),
                    meta.schemaVersion(),
                    SUPPORTED_SCHEMA_VERSIONS);
        }

        ProgramGraph graph = new ProgramGraph();
        JsonNode logic = root.path("logic");
        try {
            for (JsonNode node : logic.path("nodes")) {
                graph.addNode(new ComponentNode(
                        node.get("id").asText(),
                        stripPrefix(node.get("type").asText()),
                        node.path("label").asText(""),
                        node.get("properties")));
            }
            for (JsonNode wire : logic.path("wires")) {
                JsonNode from = wire.get("source");
                JsonNode to = wire.get("target");
                graph.connect(new Wire(
                        from.get("nodeId").asText(),
                        from.get("portId").asText(),
                        to.get("nodeId").asText(),
                        to.get("portId").asText()));
            }
        } catch (StructureViolationException e) {
            throw new DocumentParseException(e.getMessage(), e, e.elementId(), source);
        } catch (IllegalArgumentException e) {
            throw new DocumentParseException("Invalid node: " + e.getMessage(), e, null, source);
        }

        LOG.info(
                "Loaded project '{}' from {}: nodes={}, wires={}",
                meta.name(),
                source,
                graph.nodes().size(),
                graph.wires().size());
        return new DaqProject(meta, graph);
    }

    private void validate(JsonNode root, String source) {
        Set<ValidationMessage> errors = schema.validate(root);
        if (!errors.isEmpty()) {
            List<String> messages = errors.stream()
                    .map(ValidationMessage::getMessage)
                    .sorted()
                    .collect(Collectors.toList());
            throw new DocumentSchemaException(
                    "Project document does not conform to " + SCHEMA_RESOURCE + ": " + messages, messages, source);
        }
    }

    private static ProjectMeta parseMeta(JsonNode meta) {
        return new ProjectMeta(
                textOrNull(meta, "name"),
                textOrNull(meta, "version"),
                textOrNull(meta, "schemaVersion"),
                textOrNull(meta, "description"));
    }

    private static String textOrNull(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    static String stripPrefix(String type) {
        return type.startsWith(TYPE_PREFIX) ? type.substring(TYPE_PREFIX.length()) : type;
    }
}
