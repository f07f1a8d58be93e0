// file: src/main/java/io/vaultlite/core/DeletionEngine.java
package io.vaultlite.core;

import java.time.Clock;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Identity-based search-and-remove over a whole database.
 * <p>
 * Algorithm:
 *  1) Locate the node with a read-only pre-order search from the root.
 *     The root itself is never a deletion target.
 *  2) Re-resolve the parent from the location and detach the node. Later
 *     siblings keep their relative order; a group leaves with its subtree.
 *  3) If logDeletion is set, tombstone the removed identity at clock time.
 * <p>
 * Only the removed identity is tombstoned, not the descendants of a removed
 * group. The merge engine treats a tombstoned group as covering everything
 * that was inside it.
 * <p>
 * Cost is O(tree size) per call; no index is kept.
 */
public final class DeletionEngine {
    private static final Logger log = Logger.getLogger(DeletionEngine.class.getName());

    private final Clock clock;

    public DeletionEngine(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Remove the node with {@code id} from the database tree.
     *
     * @param logDeletion true to record a tombstone so the deletion propagates
     *                    to other replicas on merge; false for a purely local discard.
     * @return the detached node with everything it owned, or empty if no such
     *         node exists (the ledger is then left untouched).
     */
    public Optional<Node> deleteById(Database db, NodeId id, boolean logDeletion) {
        Objects.requireNonNull(id, "id");
        Group root = db.root();
        if (root.id().equals(id)) {
            log.log(Level.FINE, "Refusing to delete root group {0}", id);
            return Optional.empty();
        }

        Optional<NodeLocation> location = root.locate(id);
        if (location.isEmpty()) {
            return Optional.empty();
        }

        NodeLocation loc = location.get();
        Group parent = root.resolveParent(loc)
                .orElseThrow(() -> new IllegalStateException("location of " + id + " did not resolve"));
        Node removed = parent.removeChildAt(loc.index());
        if (!removed.id().equals(id)) {
            throw new IllegalStateException("expected " + id + " at index " + loc.index() + " but found " + removed.id());
        }

        if (logDeletion) {
            db.tombstones().record(id, clock.instant());
        }
        log.log(Level.FINE, "Deleted {0} {1} from group {2} (logged={3})",
                new Object[]{removed.kind(), id, parent.id(), logDeletion});
        return Optional.of(removed);
    }
}
