// file: src/main/java/io/vaultlite/core/merge/MergeException.java
package io.vaultlite.core.merge;

import io.vaultlite.core.NodeId;

import java.util.Objects;

/**
 * A merge was rejected. The local database is left exactly as it was.
 */
public final class MergeException extends RuntimeException {

    public enum Reason {
        /** The same identity is a group on one side and an entry on the other. */
        KIND_CONFLICT,
        /** A tree is malformed (duplicate identities, misplaced root, unresolvable parent). */
        STRUCTURAL_INCONSISTENCY
    }

    private final Reason reason;
    private final NodeId nodeId;

    public MergeException(Reason reason, NodeId nodeId, String message) {
        super(reason + " on " + nodeId + ": " + message);
        this.reason = Objects.requireNonNull(reason, "reason");
        this.nodeId = nodeId;
    }

    public Reason reason() { return reason; }

    public NodeId nodeId() { return nodeId; }
}
