package io.daqflow.core.model;

import io.daqflow.core.error.StructureViolationException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Owns the ordered list of top-level chain heads of one block editor. Block ids are unique across
 * the whole workspace; {@link #addTopBlock(Block)} and every attach inside a member tree enforce
 * this.
 *
 * <p>Top-level order is insertion order and is the order in which the chains are compiled.
 */
public final class Workspace {

    private final List<Block> topBlocks = new ArrayList<>();

    /**
     * Adds a detached block (and everything it owns) as a new top-level chain head.
     *
     * @throws StructureViolationException if the block already has a parent or belongs to a
     *     workspace, or if any id in its tree is already in use
     */
    public Workspace addTopBlock(Block block) {
        Objects.requireNonNull(block, "block must not be null");
        if (block.parent() != null) {
            throw new StructureViolationException(
                    "Block '" + block.id() + "' has a parent; detach it before adding it to the workspace", block.id());
        }
        if (block.owner() != null) {
            throw new StructureViolationException(
                    "Block '" + block.id() + "' already belongs to a workspace", block.id());
        }
        Set<String> taken = blockIds();
        Set<String> incoming = new HashSet<>();
        block.forEachInTree(b -> {
            if (taken.contains(b.id()) || !incoming.add(b.id())) {
                throw new StructureViolationException("Duplicate block id '" + b.id() + "'", b.id());
            }
        });
        block.assignOwner(this);
        topBlocks.add(block);
        return this;
    }

    /**
     * Removes a top-level block and everything it owns.
     *
     * @return {@code true} if the block was a top-level block of this workspace
     */
    public boolean removeTopBlock(Block block) {
        boolean removed = topBlocks.remove(block);
        if (removed) {
            block.assignOwner(null);
        }
        return removed;
    }

    /** Unmodifiable view of the top-level chain heads in insertion order. */
    public List<Block> topBlocks() {
        return Collections.unmodifiableList(topBlocks);
    }

    /** Finds a block anywhere in the workspace by id. */
    public Optional<Block> findBlock(String id) {
        for (Block top : topBlocks) {
            Block[] found = new Block[1];
            top.forEachInTree(b -> {
                if (found[0] == null && b.id().equals(id)) {
                    found[0] = b;
                }
            });
            if (found[0] != null) {
                return Optional.of(found[0]);
            }
        }
        return Optional.empty();
    }

    /** The first top-level block of the given type, if any. */
    public Optional<Block> firstTopBlockOfType(String type) {
        return topBlocks.stream().filter(b -> b.type().equals(type)).findFirst();
    }

    /** A fresh, mutable set of every block id in the workspace. */
    public Set<String> blockIds() {
        Set<String> ids = new HashSet<>();
        for (Block top : topBlocks) {
            top.forEachInTree(b -> ids.add(b.id()));
        }
        return ids;
    }

    public boolean isEmpty() {
        return topBlocks.isEmpty();
    }
}
