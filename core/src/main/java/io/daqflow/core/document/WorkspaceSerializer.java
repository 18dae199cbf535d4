package io.daqflow.core.document;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.daqflow.core.error.DocumentParseException;
import io.daqflow.core.error.StructureViolationException;
import io.daqflow.core.model.Block;
import io.daqflow.core.model.Workspace;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads and writes block workspaces as JSON state documents:
 *
 * <pre>{@code
 * {"blocks": {"languageVersion": 0, "blocks": [
 *   {"type": "controls_if", "id": "b1",
 *    "fields": {...},
 *    "inputs": {"IF0": {"block": {...}}},
 *    "statements": {"DO0": {"block": {...}}},
 *    "next": {"block": {...}}}
 * ]}}
 * }</pre>
 *
 * Value sockets are written under {@code inputs}, statement sockets under {@code statements}.
 * Restoring goes through the model's mutation API, so a document with duplicate block ids is
 * rejected. Thread-safe.
 */
public final class WorkspaceSerializer {

    private static final ObjectMapper MAPPER = DocumentMappers.json();

    private static final Set<String> KNOWN_BLOCK_KEYS =
            Set.of("type", "id", "x", "y", "fields", "inputs", "statements", "next", "collapsed", "disabled");

    /** Serializes a workspace to its JSON state document. */
    public ObjectNode toJson(Workspace workspace) {
        ObjectNode root = MAPPER.createObjectNode();
        ObjectNode section = root.putObject("blocks");
        section.put("languageVersion", 0);
        ArrayNode blocks = section.putArray("blocks");
        for (Block top : workspace.topBlocks()) {
            blocks.add(chainToJson(top));
        }
        return root;
    }

    /** Serializes a workspace to pretty-printed JSON text. */
    public String toJsonString(Workspace workspace) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(toJson(workspace));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize workspace", e);
        }
    }

    /**
     * Restores a workspace. Accepts the full document ({@code {"blocks": {"blocks": [...]}}}) or
     * just its {@code blocks} section ({@code {"blocks": [...]}}).
     *
     * @param source identifies the document in error messages
     * @throws DocumentParseException if the document is malformed
     */
    public Workspace fromJson(JsonNode document, String source) {
        if (document == null || !document.isObject()) {
            throw new DocumentParseException("Workspace document must be a JSON object", null, source);
        }
        JsonNode section = document.get("blocks");
        if (section != null && section.isObject()) {
            section = section.get("blocks");
        }
        Workspace workspace = new Workspace();
        if (section == null || section.isNull()) {
            return workspace;
        }
        if (!section.isArray()) {
            throw new DocumentParseException("'blocks' must be an array of top-level blocks", null, source);
        }
        for (JsonNode entry : section) {
            Block top = chainFromJson(entry, source);
            try {
                workspace.addTopBlock(top);
            } catch (StructureViolationException e) {
                throw new DocumentParseException(e.getMessage(), e, e.elementId(), source);
            }
        }
        return workspace;
    }

    /** Parses JSON text and restores the workspace. */
    public Workspace fromJsonString(String json, String source) {
        try {
            return fromJson(MAPPER.readTree(json), source);
        } catch (JsonProcessingException e) {
            throw new DocumentParseException("Invalid workspace JSON: " + e.getOriginalMessage(), e, null, source);
        }
    }

    /** A statement chain as nested {@code next} entries, walked iteratively. */
    private ObjectNode chainToJson(Block head) {
        ObjectNode first = null;
        ObjectNode previous = null;
        for (Block block = head; block != null; block = block.next()) {
            ObjectNode node = blockToJson(block);
            if (previous == null) {
                first = node;
            } else {
                previous.putObject("next").set("block", node);
            }
            previous = node;
        }
        return first;
    }

    /** One block with its sockets; the {@code next} link is left to {@link #chainToJson}. */
    private ObjectNode blockToJson(Block block) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("type", block.type());
        node.put("id", block.id());
        if (!block.fields().isEmpty()) {
            ObjectNode fields = node.putObject("fields");
            block.fields().forEach((name, value) -> fields.set(name, value.deepCopy()));
        }
        if (!block.valueInputs().isEmpty()) {
            ObjectNode inputs = node.putObject("inputs");
            block.valueInputs().forEach((socket, child) -> inputs.putObject(socket).set("block", chainToJson(child)));
        }
        if (!block.statementInputs().isEmpty()) {
            ObjectNode statements = node.putObject("statements");
            block.statementInputs()
                    .forEach((socket, head) -> statements.putObject(socket).set("block", chainToJson(head)));
        }
        return node;
    }

    /** Restores a statement chain, following {@code next} entries iteratively. */
    private Block chainFromJson(JsonNode head, String source) {
        List<Block> chain = new ArrayList<>();
        JsonNode node = head;
        while (node != null) {
            Block block = blockFromJson(node, source);
            chain.add(block);
            JsonNode next = node.get("next");
            node = connection(next, block.id(), source);
        }
        try {
            for (int i = chain.size() - 2; i >= 0; i--) {
                chain.get(i).setNext(chain.get(i + 1));
            }
        } catch (StructureViolationException e) {
            throw new DocumentParseException(e.getMessage(), e, e.elementId(), source);
        }
        return chain.get(0);
    }

    /** One block with its sockets; the {@code next} entry is left to {@link #chainFromJson}. */
    private Block blockFromJson(JsonNode node, String source) {
        if (node == null || !node.isObject()) {
            throw new DocumentParseException("Block entry must be a JSON object", null, source);
        }
        String id = requireText(node, "id", null, source);
        String type = requireText(node, "type", id, source);
        for (Map.Entry<String, JsonNode> entry : node.properties()) {
            if (!KNOWN_BLOCK_KEYS.contains(entry.getKey())) {
                throw new DocumentParseException(
                        "Unknown key '" + entry.getKey() + "' in block '" + id + "'", id, source);
            }
        }
        Block block = new Block(id, type);
        JsonNode fields = node.get("fields");
        if (fields != null && fields.isObject()) {
            for (Map.Entry<String, JsonNode> field : fields.properties()) {
                block.setField(field.getKey(), field.getValue());
            }
        }
        try {
            JsonNode inputs = node.get("inputs");
            if (inputs != null && inputs.isObject()) {
                for (Map.Entry<String, JsonNode> input : inputs.properties()) {
                    Block child = connected(input.getValue(), id, source);
                    if (child != null) {
                        block.setValueInput(input.getKey(), child);
                    }
                }
            }
            JsonNode statements = node.get("statements");
            if (statements != null && statements.isObject()) {
                for (Map.Entry<String, JsonNode> statement : statements.properties()) {
                    Block head = connected(statement.getValue(), id, source);
                    if (head != null) {
                        block.setStatementInput(statement.getKey(), head);
                    }
                }
            }
        } catch (StructureViolationException e) {
            throw new DocumentParseException(e.getMessage(), e, e.elementId(), source);
        }
        return block;
    }

    private Block connected(JsonNode connection, String ownerId, String source) {
        JsonNode child = connection(connection, ownerId, source);
        return child == null ? null : chainFromJson(child, source);
    }

    /** The {@code block} entry of a connection, or {@code null} when nothing is connected. */
    private static JsonNode connection(JsonNode connection, String ownerId, String source) {
        if (connection == null || connection.isNull()) {
            return null;
        }
        if (!connection.isObject()) {
            throw new DocumentParseException(
                    "Connection on block '" + ownerId + "' must be an object with a 'block' entry", ownerId, source);
        }
        JsonNode child = connection.get("block");
        return child == null || child.isNull() ? null : child;
    }

    private static String requireText(JsonNode node, String key, String elementId, String source) {
        JsonNode value = node.get(key);
        if (value == null || !value.isTextual() || value.asText().isEmpty()) {
            throw new DocumentParseException("Missing or invalid required field: '" + key + "'", elementId, source);
        }
        return value.asText();
    }
}
