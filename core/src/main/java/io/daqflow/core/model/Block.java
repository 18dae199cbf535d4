package io.daqflow.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import io.daqflow.core.error.StructureViolationException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;

/**
 * A node in a visual expression/statement tree.
 *
 * <p>A block exclusively owns the blocks plugged into its value sockets, the chains plugged into
 * its statement sockets, and its {@code next} chain. Ownership is a tree: every block has at most
 * one parent, and the attach methods reject any edit that would give a block a second parent,
 * attach a block under itself or one of its descendants, or introduce a duplicate id into the
 * tree or workspace. The compilers rely on this and do not check for cycles.
 *
 * <p>Fields hold JSON-like literals. Insertion order of fields and sockets is preserved and is the
 * order used by serialization.
 *
 * <p>Not thread-safe; blocks are edited from a single editor thread.
 */
public final class Block {

    private final String id;
    private final String type;
    private final Map<String, JsonNode> fields = new LinkedHashMap<>();
    private final Map<String, Block> valueInputs = new LinkedHashMap<>();
    private final Map<String, Block> statementInputs = new LinkedHashMap<>();
    private Block next;
    private Block parent;
    private Workspace owner;

    /**
     * Creates a detached block.
     *
     * @param id   unique block id
     * @param type block type tag, e.g. {@code "math_arithmetic"}
     * @throws NullPointerException     if id or type is null
     * @throws IllegalArgumentException if id or type is empty
     */
    public Block(String id, String type) {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(type, "type must not be null");
        if (id.isEmpty() || type.isEmpty()) {
            throw new IllegalArgumentException("block id and type must not be empty");
        }
        this.id = id;
        this.type = type;
    }

    public String id() {
        return id;
    }

    public String type() {
        return type;
    }

    // --- Fields ---

    /** Sets a field to a literal value; {@code null} stores a JSON null. Returns this block. */
    public Block setField(String name, JsonNode value) {
        Objects.requireNonNull(name, "field name must not be null");
        fields.put(name, value == null ? JsonNodeFactory.instance.nullNode() : value.deepCopy());
        return this;
    }

    public Block setField(String name, String value) {
        return setField(name, JsonNodeFactory.instance.textNode(value));
    }

    public Block setField(String name, double value) {
        return setField(name, JsonNodeFactory.instance.numberNode(value));
    }

    public Block setField(String name, long value) {
        return setField(name, JsonNodeFactory.instance.numberNode(value));
    }

    public Block setField(String name, boolean value) {
        return setField(name, JsonNodeFactory.instance.booleanNode(value));
    }

    /** Returns the field value, or {@code null} if the field is not set. */
    public JsonNode field(String name) {
        return fields.get(name);
    }

    /**
     * Returns the field as text, or {@code defaultValue} when the field is absent, null, or an empty
     * string.
     */
    public String fieldText(String name, String defaultValue) {
        JsonNode value = fields.get(name);
        if (value == null || value.isNull() || value.isMissingNode()) {
            return defaultValue;
        }
        String text = value.asText();
        return text.isEmpty() ? defaultValue : text;
    }

    /** Unmodifiable view of all fields in insertion order. */
    public Map<String, JsonNode> fields() {
        return Collections.unmodifiableMap(fields);
    }

    // --- Sockets ---

    /**
     * Plugs {@code child} into the named value socket, detaching whatever was there. Passing
     * {@code null} disconnects the socket.
     *
     * @throws StructureViolationException if the edit would break the tree invariants
     */
    public Block setValueInput(String socket, Block child) {
        Objects.requireNonNull(socket, "socket must not be null");
        if (child != null && valueInputs.get(socket) == child) {
            return this;
        }
        attach(child, valueInputs.get(socket));
        Block previous = child == null ? valueInputs.remove(socket) : valueInputs.put(socket, child);
        release(previous);
        return this;
    }

    /**
     * Plugs the chain headed by {@code head} into the named statement socket, detaching whatever
     * chain was there. Passing {@code null} empties the socket.
     *
     * @throws StructureViolationException if the edit would break the tree invariants
     */
    public Block setStatementInput(String socket, Block head) {
        Objects.requireNonNull(socket, "socket must not be null");
        if (head != null && statementInputs.get(socket) == head) {
            return this;
        }
        attach(head, statementInputs.get(socket));
        Block previous = head == null ? statementInputs.remove(socket) : statementInputs.put(socket, head);
        release(previous);
        return this;
    }

    /**
     * Sets the block that follows this one in its chain, detaching the previous follower. Passing
     * {@code null} ends the chain here.
     *
     * @throws StructureViolationException if the edit would break the tree invariants
     */
    public Block setNext(Block follower) {
        if (follower != null && next == follower) {
            return this;
        }
        attach(follower, next);
        Block previous = next;
        next = follower;
        release(previous);
        return this;
    }

    /** The block in the named value socket, or {@code null} if unconnected. */
    public Block valueInput(String socket) {
        return valueInputs.get(socket);
    }

    /** The head of the chain in the named statement socket, or {@code null} if empty. */
    public Block statementInput(String socket) {
        return statementInputs.get(socket);
    }

    public Map<String, Block> valueInputs() {
        return Collections.unmodifiableMap(valueInputs);
    }

    public Map<String, Block> statementInputs() {
        return Collections.unmodifiableMap(statementInputs);
    }

    /** The next block in this chain, or {@code null}. */
    public Block next() {
        return next;
    }

    /** The owning block, or {@code null} for a detached or top-level block. */
    public Block parent() {
        return parent;
    }

    /** The workspace this block belongs to, or {@code null} when it is not part of one. */
    public Workspace workspace() {
        return root().owner;
    }

    /** The outermost ancestor of this block (itself when it has no parent). */
    public Block root() {
        Block current = this;
        while (current.parent != null) {
            current = current.parent;
        }
        return current;
    }

    /**
     * Removes this block (with everything it owns) from its parent. A top-level block is left in
     * its workspace; use {@link Workspace#removeTopBlock(Block)} for that.
     */
    public void detach() {
        if (parent == null) {
            return;
        }
        Block p = parent;
        if (p.next == this) {
            p.next = null;
        }
        p.valueInputs.values().removeIf(b -> b == this);
        p.statementInputs.values().removeIf(b -> b == this);
        parent = null;
    }

    /**
     * Visits this block and every block it owns, depth-first: value sockets, then statement
     * sockets, then the {@code next} chain.
     */
    public void forEachInTree(Consumer<Block> visitor) {
        List<Block> stack = new ArrayList<>();
        stack.add(this);
        while (!stack.isEmpty()) {
            Block current = stack.remove(stack.size() - 1);
            visitor.accept(current);
            if (current.next != null) {
                stack.add(current.next);
            }
            List<Block> children = new ArrayList<>(current.valueInputs.values());
            children.addAll(current.statementInputs.values());
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.add(children.get(i));
            }
        }
    }

    /** Ids of this block and every block it owns. */
    public Set<String> treeIds() {
        Set<String> ids = new HashSet<>();
        forEachInTree(b -> ids.add(b.id));
        return ids;
    }

    void assignOwner(Workspace workspace) {
        this.owner = workspace;
    }

    Workspace owner() {
        return owner;
    }

    private void attach(Block child, Block displaced) {
        if (child == null) {
            return;
        }
        if (child == this) {
            throw new StructureViolationException("Block '" + id + "' cannot be attached to itself", id);
        }
        if (child.parent != null) {
            throw new StructureViolationException(
                    "Block '" + child.id + "' already has a parent ('" + child.parent.id + "'); detach it first",
                    child.id);
        }
        if (child.owner != null) {
            throw new StructureViolationException(
                    "Block '" + child.id + "' is a top-level block of a workspace; remove it first", child.id);
        }
        for (Block ancestor = parent; ancestor != null; ancestor = ancestor.parent) {
            if (ancestor == child) {
                throw new StructureViolationException(
                        "Attaching block '" + child.id + "' under '" + id + "' would create a cycle", child.id);
            }
        }
        Workspace workspace = workspace();
        Set<String> taken = workspace != null ? workspace.blockIds() : root().treeIds();
        if (displaced != null) {
            taken.removeAll(displaced.treeIds());
        }
        Set<String> incoming = new HashSet<>();
        child.forEachInTree(b -> {
            if (taken.contains(b.id) || !incoming.add(b.id)) {
                throw new StructureViolationException("Duplicate block id '" + b.id + "'", b.id);
            }
        });
        child.parent = this;
    }

    private static void release(Block previous) {
        if (previous != null) {
            previous.parent = null;
        }
    }

    @Override
    public String toString() {
        return "Block[" + type + "#" + id + "]";
    }
}
