// file: src/main/java/io/vaultlite/core/Database.java
package io.vaultlite.core;

import io.vaultlite.core.merge.MergeEngine;
import io.vaultlite.core.merge.MergeLog;
import io.vaultlite.core.merge.MergeOptions;

import java.time.Clock;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * A credential database: the root group plus the tombstone ledger.
 * <p>
 * The root always carries {@link NodeId#ROOT} and is never deleted.
 * <p>
 * Not thread safe. The host must give one writer exclusive access to the
 * whole value (tree and ledger) for the duration of any mutation, deletion
 * or merge.
 */
public final class Database {

    public static final String DEFAULT_ROOT_NAME = "Root";

    private Group root;
    private TombstoneLedger tombstones;

    /** Empty database with a root named {@value #DEFAULT_ROOT_NAME}. */
    public Database() {
        this(new Group(NodeId.ROOT, DEFAULT_ROOT_NAME, Times.now()), new TombstoneLedger());
    }

    public Database(Group root, TombstoneLedger tombstones) {
        Objects.requireNonNull(root, "root");
        if (!root.id().equals(NodeId.ROOT)) {
            throw new IllegalArgumentException("root group must have id " + NodeId.ROOT + " but was " + root.id());
        }
        this.root = root;
        this.tombstones = Objects.requireNonNull(tombstones, "tombstones");
    }

    public Group root() { return root; }

    public TombstoneLedger tombstones() { return tombstones; }

    /**
     * Checked insert: append {@code node} under the group {@code parentId}.
     *
     * @throws IllegalArgumentException if the parent is missing or not a group,
     *         or if any identity in {@code node}'s subtree already exists in this tree.
     */
    public void addChild(NodeId parentId, Node node) {
        Objects.requireNonNull(node, "node");
        Group parent = root.findGroup(parentId)
                .orElseThrow(() -> new IllegalArgumentException("no group with id " + parentId));

        Set<NodeId> existing = new HashSet<>();
        for (Node n : root.traverse()) existing.add(n.id());

        Iterable<Node> incoming = node instanceof Group g ? g.traverse() : List.of(node);
        Set<NodeId> seen = new HashSet<>();
        for (Node n : incoming) {
            if (existing.contains(n.id()) || !seen.add(n.id())) {
                throw new IllegalArgumentException("duplicate node id " + n.id());
            }
        }
        parent.addChild(node);
    }

    public Optional<Node> findById(NodeId id) {
        return root.findById(id);
    }

    public Optional<Node> findByPath(String... path) {
        return root.findByPath(path);
    }

    /** Delete with the system UTC clock. See {@link DeletionEngine}. */
    public Optional<Node> deleteById(NodeId id, boolean logDeletion) {
        return new DeletionEngine(Clock.systemUTC()).deleteById(this, id, logDeletion);
    }

    /** Merge {@code incoming} into this database with default options. See {@link MergeEngine}. */
    public MergeLog merge(Database incoming) {
        return new MergeEngine(MergeOptions.defaults()).merge(this, incoming);
    }

    /**
     * Swap in a new tree and ledger in one step. Used by the merge engine to
     * commit a fully validated result.
     */
    public void replaceContents(Group newRoot, TombstoneLedger newTombstones) {
        Objects.requireNonNull(newRoot, "newRoot");
        if (!newRoot.id().equals(NodeId.ROOT)) {
            throw new IllegalArgumentException("root group must have id " + NodeId.ROOT);
        }
        this.root = newRoot;
        this.tombstones = Objects.requireNonNull(newTombstones, "newTombstones");
    }

    /** Independent copy: same identities, no shared mutable state. */
    public Database deepCopy() {
        return new Database(root.deepCopy(), tombstones.copy());
    }
}
