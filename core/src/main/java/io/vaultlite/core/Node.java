// file: src/main/java/io/vaultlite/core/Node.java
package io.vaultlite.core;

/**
 * A node of the database tree: either a {@link Group} or an {@link Entry}.
 * <p>
 * The variant is closed. Consumers switch on {@link #kind()} (or use
 * {@code instanceof}) instead of relying on virtual dispatch, so traversal
 * results can be filtered by kind without unchecked downcasts.
 * <p>
 * A node is owned by at most one parent group. Moving a node between trees
 * means detaching it first (see {@link DeletionEngine}) or copying it
 * (see {@link #deepCopy()}).
 */
public sealed interface Node permits Group, Entry {

    enum Kind { GROUP, ENTRY }

    NodeId id();

    Kind kind();

    Times times();

    /** Independent copy of this node and everything it owns, same identities. */
    Node deepCopy();

    default boolean isGroup() { return kind() == Kind.GROUP; }

    default boolean isEntry() { return kind() == Kind.ENTRY; }
}
