// file: src/main/java/io/vaultlite/core/TombstoneLedger.java
package io.vaultlite.core;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Set of tombstones for a database, at most one per identity.
 * <p>
 * Semantics:
 *  - record() inserts a tombstone or moves an existing one forward in time;
 *    the latest deletion timestamp seen for an identity is kept.
 *  - There is no removal. Forgetting a tombstone would let a stale replica
 *    re-introduce the deleted node on its next merge, so the ledger grows
 *    for the lifetime of the database.
 *  - Iteration follows first-insertion order.
 */
public final class TombstoneLedger {

    private final Map<NodeId, Instant> deletedAt = new LinkedHashMap<>();

    public TombstoneLedger() {
    }

    public TombstoneLedger(Iterable<Tombstone> tombstones) {
        for (Tombstone t : tombstones) {
            record(t.id(), t.deletedAt());
        }
    }

    /**
     * Insert or update the tombstone for {@code id}, keeping the later timestamp.
     *
     * @return true if the ledger changed.
     */
    public boolean record(NodeId id, Instant timestamp) {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(timestamp, "timestamp");
        Instant prev = deletedAt.get(id);
        if (prev != null && !timestamp.isAfter(prev)) {
            return false;
        }
        deletedAt.put(id, timestamp);
        return true;
    }

    public boolean record(Tombstone t) {
        return record(t.id(), t.deletedAt());
    }

    public boolean contains(NodeId id) {
        return deletedAt.containsKey(id);
    }

    public Optional<Instant> timestampOf(NodeId id) {
        return Optional.ofNullable(deletedAt.get(id));
    }

    public int size() { return deletedAt.size(); }

    public boolean isEmpty() { return deletedAt.isEmpty(); }

    /** Snapshot of all tombstones in insertion order. */
    public List<Tombstone> tombstones() {
        List<Tombstone> out = new ArrayList<>(deletedAt.size());
        deletedAt.forEach((id, ts) -> out.add(new Tombstone(id, ts)));
        return List.copyOf(out);
    }

    /**
     * Merge {@code other} into this ledger, keeping the latest timestamp per identity.
     *
     * @return tombstones of this ledger that were added or moved forward.
     */
    public List<Tombstone> unionWith(TombstoneLedger other) {
        List<Tombstone> changed = new ArrayList<>();
        for (var e : other.deletedAt.entrySet()) {
            if (record(e.getKey(), e.getValue())) {
                changed.add(new Tombstone(e.getKey(), e.getValue()));
            }
        }
        return changed;
    }

    public TombstoneLedger copy() {
        TombstoneLedger c = new TombstoneLedger();
        c.deletedAt.putAll(deletedAt);
        return c;
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TombstoneLedger l)) return false;
        return deletedAt.equals(l.deletedAt);
    }

    @Override public int hashCode() { return deletedAt.hashCode(); }

    @Override public String toString() { return "TombstoneLedger" + deletedAt; }
}
