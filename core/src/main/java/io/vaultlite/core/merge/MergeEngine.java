// file: src/main/java/io/vaultlite/core/merge/MergeEngine.java
package io.vaultlite.core.merge;

import io.vaultlite.core.Database;
import io.vaultlite.core.DeletionEngine;
import io.vaultlite.core.Entry;
import io.vaultlite.core.Group;
import io.vaultlite.core.Node;
import io.vaultlite.core.NodeId;
import io.vaultlite.core.Times;
import io.vaultlite.core.Tombstone;
import io.vaultlite.core.TombstoneLedger;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Two-way, timestamp driven reconciliation of two replicas of the same database.
 * <p>
 * Algorithm ({@code merge(local, incoming)}):
 *  0) Index both trees by identity. Duplicate identities or a misplaced root
 *     identity reject the merge (STRUCTURAL_INCONSISTENCY); an identity that is
 *     a group on one side and an entry on the other rejects it (KIND_CONFLICT).
 *  1) Tombstones first. The local ledger becomes the per-identity latest union
 *     of both ledgers, then every live local node whose identity is in that
 *     union is removed together with its subtree. A deletion therefore beats
 *     any edit, however recent, once the replicas meet.
 *  2) Walk incoming top-down, pairing each incoming group with its local
 *     counterpart:
 *      - tombstoned incoming nodes are skipped with their whole subtree,
 *      - unknown identities are inserted under the counterpart parent
 *        (groups first, then their children by the same rules),
 *      - known identities placed under another parent move when the incoming
 *        locationChanged is strictly later; under the same parent the later
 *        locationChanged of the two is kept,
 *      - content (entry fields, group name) follows the strictly newer
 *        lastModification; on a tie local content stays.
 *  3) Validate the result: unique identities, no live tombstoned identity.
 * <p>
 * Every step runs against a deep copy of local. The copy replaces local's tree
 * and ledger only after validation, so a rejected merge leaves local untouched.
 * Incoming is only read; nodes taken from it are copied.
 * <p>
 * Ordering: local children keep their order, new children are appended in
 * incoming order, relocated nodes are appended to their new parent.
 * <p>
 * Entry history: when the two sides' fields differ, the losing snapshot is
 * added to the winner's history, and both histories are united (oldest first).
 * This makes merge(A, B) and merge(B, A) agree on fields and on history.
 */
public final class MergeEngine {
    private static final Logger log = Logger.getLogger(MergeEngine.class.getName());

    private static final Comparator<Entry.Snapshot> OLDEST_FIRST =
            Comparator.comparing(Entry.Snapshot::lastModification);

    private final MergeOptions options;

    public MergeEngine(MergeOptions options) {
        this.options = Objects.requireNonNull(options, "options");
    }

    /**
     * Merge {@code incoming} into {@code local}.
     *
     * @return the applied changes; empty if local already contained everything.
     * @throws MergeException if the trees cannot be reconciled. Local is unchanged.
     */
    public MergeLog merge(Database local, Database incoming) {
        Objects.requireNonNull(local, "local");
        Objects.requireNonNull(incoming, "incoming");

        // 0) Pre-validation against the untouched inputs.
        Index localIndex = Index.build(local.root());
        Index incomingIndex = Index.build(incoming.root());
        for (var e : incomingIndex.nodes.entrySet()) {
            Node mine = localIndex.nodes.get(e.getKey());
            if (mine != null && mine.kind() != e.getValue().kind()) {
                throw new MergeException(MergeException.Reason.KIND_CONFLICT, e.getKey(),
                        "local " + mine.kind() + " vs incoming " + e.getValue().kind());
            }
        }

        Database staged = local.deepCopy();
        MergeLog result = new MergeLog();
        Session session = new Session(staged, result);

        // 1) Tombstones before structure.
        session.applyTombstones(incoming.tombstones());

        // 2) Structural merge.
        session.mergeTree(incoming.root());

        // 3) Validate, then commit in one step. A no-op merge keeps local's own objects.
        session.validate();
        if (!result.isEmpty()) {
            local.replaceContents(staged.root(), staged.tombstones());
        }

        for (String w : result.warnings()) {
            log.log(Level.WARNING, "merge: {0}", w);
        }
        log.log(Level.INFO, "Merged database: {0} events, {1} warnings, {2} tombstones",
                new Object[]{result.events().size(), result.warnings().size(), staged.tombstones().size()});
        return result;
    }

    // ---------- merge session over the staged copy ----------

    private final class Session {
        private final Database staged;
        private final MergeLog result;
        private Index index;

        Session(Database staged, MergeLog result) {
            this.staged = staged;
            this.result = result;
        }

        void applyTombstones(TombstoneLedger incomingLedger) {
            TombstoneLedger ledger = staged.tombstones();
            for (Tombstone t : ledger.unionWith(incomingLedger)) {
                event(MergeEvent.Type.TOMBSTONE_APPLIED, t.id());
            }

            // Removal only needs the engine's search-and-detach; no new tombstones are written.
            DeletionEngine detacher = new DeletionEngine(Clock.systemUTC());
            Index before = Index.build(staged.root());
            for (Tombstone t : ledger.tombstones()) {
                if (t.id().equals(NodeId.ROOT)) {
                    result.warn("ignoring tombstone for the root group " + t.id());
                    continue;
                }
                if (!before.nodes.containsKey(t.id())) continue;
                // Empty when an earlier removal already took the node with its ancestor.
                detacher.deleteById(staged, t.id(), false)
                        .ifPresent(n -> event(MergeEvent.Type.NODE_DELETED, n.id()));
            }
            index = Index.build(staged.root());
        }

        void mergeTree(Group incomingRoot) {
            record Pair(Group local, Group incoming) {}

            Group localRoot = staged.root();
            mergeGroupContent(localRoot, incomingRoot, true);

            Deque<Pair> work = new ArrayDeque<>();
            work.add(new Pair(localRoot, incomingRoot));
            while (!work.isEmpty()) {
                Pair p = work.poll();
                for (Node child : p.incoming().children()) {
                    NodeId id = child.id();
                    if (staged.tombstones().contains(id)) {
                        result.skip(id);
                        log.log(Level.FINE, "merge skipped deleted {0}", id);
                        continue;
                    }

                    Node existing = index.nodes.get(id);
                    if (existing == null) {
                        if (child instanceof Group g) {
                            Group copy = g.shallowCopy();
                            attach(p.local(), copy);
                            event(MergeEvent.Type.GROUP_CREATED, id);
                            work.add(new Pair(copy, g));
                        } else {
                            attach(p.local(), child.deepCopy());
                            event(MergeEvent.Type.ENTRY_CREATED, id);
                        }
                        continue;
                    }

                    if (existing.kind() != child.kind()) {
                        throw new MergeException(MergeException.Reason.KIND_CONFLICT, id,
                                "local " + existing.kind() + " vs incoming " + child.kind());
                    }

                    boolean samePlace = maybeRelocate(existing, child, p.local());

                    if (existing instanceof Group lg) {
                        mergeGroupContent(lg, (Group) child, samePlace);
                        work.add(new Pair(lg, (Group) child));
                    } else {
                        mergeEntry((Entry) existing, (Entry) child, samePlace);
                    }
                }
            }
        }

        /**
         * Move {@code existing} under {@code targetParent} if the incoming placement is newer.
         *
         * @return true if the node ends up under {@code targetParent}.
         */
        private boolean maybeRelocate(Node existing, Node incoming, Group targetParent) {
            NodeId id = existing.id();
            Group currentParent = index.parents.get(id);
            if (currentParent == null) {
                throw new MergeException(MergeException.Reason.STRUCTURAL_INCONSISTENCY, id,
                        "local node has no resolvable parent group");
            }
            if (currentParent.id().equals(targetParent.id())) return true;

            Instant mine = existing.times().locationChanged();
            Instant theirs = incoming.times().locationChanged();
            if (!theirs.isAfter(mine)) return false;

            if (existing instanceof Group g && isWithin(targetParent, g)) {
                result.warn("not moving group " + id + " into its own subtree " + targetParent.id());
                return false;
            }

            currentParent.removeChild(id);
            targetParent.addChild(existing);
            index.parents.put(id, targetParent);
            if (existing instanceof Group g) {
                g.setTimes(g.times().withLocationChanged(theirs));
                event(MergeEvent.Type.GROUP_RELOCATED, id);
            } else {
                Entry e = (Entry) existing;
                e.setTimes(e.times().withLocationChanged(theirs));
                event(MergeEvent.Type.ENTRY_RELOCATED, id);
            }
            return true;
        }

        /** True if {@code candidate} is {@code group} or lies below it in the staged tree. */
        private boolean isWithin(Group candidate, Group group) {
            NodeId cursor = candidate.id();
            while (cursor != null) {
                if (cursor.equals(group.id())) return true;
                Group parent = index.parents.get(cursor);
                cursor = parent == null ? null : parent.id();
            }
            return false;
        }

        private void mergeGroupContent(Group mine, Group theirs, boolean samePlace) {
            boolean theirsNewer = theirs.times().lastModification().isAfter(mine.times().lastModification());
            boolean changed = false;
            if (theirsNewer && !mine.name().equals(theirs.name())) {
                mine.setName(theirs.name());
                changed = true;
            }
            Times merged = mergeTimes(mine.times(), theirs.times(), theirsNewer, samePlace);
            if (!merged.equals(mine.times())) {
                mine.setTimes(merged);
                changed = true;
            }
            if (changed) event(MergeEvent.Type.GROUP_UPDATED, mine.id());
        }

        private void mergeEntry(Entry mine, Entry theirs, boolean samePlace) {
            boolean theirsNewer = theirs.times().lastModification().isAfter(mine.times().lastModification());
            boolean differs = !mine.sameContent(theirs);
            boolean changed = false;

            List<Entry.Snapshot> additions = new ArrayList<>();
            for (Entry.Snapshot s : theirs.history()) {
                if (!mine.history().contains(s)) additions.add(s);
            }
            if (differs) {
                Entry.Snapshot loser = theirsNewer ? mine.snapshot() : theirs.snapshot();
                if (!mine.history().contains(loser) && !additions.contains(loser)) additions.add(loser);
            }

            if (theirsNewer && differs) {
                mine.replaceFields(theirs.fields());
                changed = true;
            }

            if (!additions.isEmpty()) {
                List<Entry.Snapshot> history = new ArrayList<>(mine.history());
                history.addAll(additions);
                history.sort(OLDEST_FIRST);
                mine.replaceHistory(history);
                changed = true;
            }
            if (options.historyBounded() && mine.history().size() > options.historyMaxItems()) {
                List<Entry.Snapshot> history = mine.history();
                mine.replaceHistory(new ArrayList<>(
                        history.subList(history.size() - options.historyMaxItems(), history.size())));
                changed = true;
            }

            Times merged = mergeTimes(mine.times(), theirs.times(), theirsNewer, samePlace);
            if (!merged.equals(mine.times())) {
                mine.setTimes(merged);
                changed = true;
            }
            if (changed) event(MergeEvent.Type.ENTRY_UPDATED, mine.id());
        }

        private void attach(Group parent, Node node) {
            parent.addChild(node);
            index.add(node, parent);
        }

        void validate() {
            Index after = Index.build(staged.root());
            for (NodeId id : after.nodes.keySet()) {
                if (!id.equals(NodeId.ROOT) && staged.tombstones().contains(id)) {
                    throw new MergeException(MergeException.Reason.STRUCTURAL_INCONSISTENCY, id,
                            "merged tree still holds a tombstoned node");
                }
            }
        }

        private void event(MergeEvent.Type type, NodeId id) {
            result.event(type, id);
            log.log(Level.FINE, "merge {0} {1}", new Object[]{type, id});
        }
    }

    /**
     * Creation is the earliest seen and lastModification comes from the content
     * winner. locationChanged is the later of the two when both sides agree on
     * the parent; otherwise it stays as relocation left it.
     */
    private static Times mergeTimes(Times mine, Times theirs, boolean theirsNewer, boolean samePlace) {
        Instant creation = theirs.creation().isBefore(mine.creation()) ? theirs.creation() : mine.creation();
        Instant modified = theirsNewer ? theirs.lastModification() : mine.lastModification();
        Instant placed = samePlace && theirs.locationChanged().isAfter(mine.locationChanged())
                ? theirs.locationChanged() : mine.locationChanged();
        return new Times(creation, modified, placed);
    }

    // ---------- identity index ----------

    /**
     * Identity -> node and identity -> parent group for one tree.
     * Building it rejects duplicate identities and a root identity below the root.
     */
    private static final class Index {
        final Map<NodeId, Node> nodes = new HashMap<>();
        final Map<NodeId, Group> parents = new HashMap<>();

        static Index build(Group root) {
            Index idx = new Index();
            idx.nodes.put(root.id(), root);
            Deque<Group> stack = new ArrayDeque<>();
            stack.push(root);
            while (!stack.isEmpty()) {
                Group g = stack.pop();
                for (Node child : g.children()) {
                    if (child.id().equals(NodeId.ROOT)) {
                        throw new MergeException(MergeException.Reason.STRUCTURAL_INCONSISTENCY, child.id(),
                                "root identity used below the root");
                    }
                    if (idx.nodes.putIfAbsent(child.id(), child) != null) {
                        throw new MergeException(MergeException.Reason.STRUCTURAL_INCONSISTENCY, child.id(),
                                "identity appears more than once in one tree");
                    }
                    idx.parents.put(child.id(), g);
                    if (child instanceof Group sub) stack.push(sub);
                }
            }
            return idx;
        }

        void add(Node node, Group parent) {
            nodes.put(node.id(), node);
            parents.put(node.id(), parent);
        }
    }
}
