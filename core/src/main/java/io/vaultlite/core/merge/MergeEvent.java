// file: src/main/java/io/vaultlite/core/merge/MergeEvent.java
package io.vaultlite.core.merge;

import io.vaultlite.core.NodeId;

import java.util.Objects;

/**
 * One change applied to the local database by a merge.
 */
public record MergeEvent(Type type, NodeId nodeId) {

    public enum Type {
        /** A tombstone was added to or moved forward in the local ledger. */
        TOMBSTONE_APPLIED,
        /** A live local node was removed because its identity is tombstoned. */
        NODE_DELETED,
        ENTRY_CREATED,
        ENTRY_UPDATED,
        ENTRY_RELOCATED,
        GROUP_CREATED,
        GROUP_UPDATED,
        GROUP_RELOCATED
    }

    public MergeEvent {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(nodeId, "nodeId");
    }
}
