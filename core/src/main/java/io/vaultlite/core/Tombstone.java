// file: src/main/java/io/vaultlite/core/Tombstone.java
package io.vaultlite.core;

import java.time.Instant;
import java.util.Objects;

/**
 * Record of a deletion: the identity that was removed and when.
 * Immutable; a later deletion of the same identity supersedes it in the
 * {@link TombstoneLedger}, it is never edited.
 */
public record Tombstone(NodeId id, Instant deletedAt) {
    public Tombstone {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(deletedAt, "deletedAt");
    }
}
