// file: src/test/java/io/vaultlite/core/merge/MergeConvergenceTest.java
package io.vaultlite.core.merge;

import io.vaultlite.core.Database;
import io.vaultlite.core.DeletionEngine;
import io.vaultlite.core.Entry;
import io.vaultlite.core.Group;
import io.vaultlite.core.Node;
import io.vaultlite.core.NodeId;
import io.vaultlite.core.NodeLocation;
import io.vaultlite.core.Tombstone;
import io.vaultlite.core.Value;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import static io.vaultlite.core.Fixtures.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Replicas edited independently from a common origin, then merged in
 * different orders, must end up with the same live nodes and content.
 * <p>
 * Each replica stamps its edits with its own residue modulo the replica
 * count, so no two replicas ever produce the same timestamp.
 */
class MergeConvergenceTest {

    private final MergeEngine merger = new MergeEngine(MergeOptions.defaults());

    private static Database origin() {
        Database db = emptyDb();
        for (int g = 0; g < 3; g++) {
            Group group = group("G" + g, 0);
            for (int e = 0; e < 3; e++) {
                group.addChild(entry("E" + g + e, 0));
            }
            db.root().addChild(group);
        }
        return db;
    }

    /** Apply {@code ops} random edits to {@code db}, timestamps {@code replica + k * stride}. */
    private static void scramble(Database db, long seed, int replica, int stride, int ops) {
        Random rnd = new Random(seed);
        List<Group> groups = db.root().children().stream().map(Group.class::cast).toList();
        for (int k = 1; k <= ops; k++) {
            long now = replica + (long) k * stride;
            List<Entry> live = db.root().entries().toList();
            int op = rnd.nextInt(5);
            if (live.isEmpty()) op = 0;
            switch (op) {
                case 0 -> {
                    Group target = groups.get(rnd.nextInt(groups.size()));
                    target.addChild(entry("new-" + replica + "-" + k, now));
                }
                case 1 -> {
                    Entry e = live.get(rnd.nextInt(live.size()));
                    edit(e, now, Entry.NOTES, Value.plain("note-" + replica + "-" + k));
                }
                case 2 -> {
                    Entry e = live.get(rnd.nextInt(live.size()));
                    new DeletionEngine(Clock.fixed(t(now), ZoneOffset.UTC)).deleteById(db, e.id(), true);
                }
                case 3 -> {
                    Entry e = live.get(rnd.nextInt(live.size()));
                    Group target = groups.get(rnd.nextInt(groups.size()));
                    NodeLocation loc = db.root().locate(e.id()).orElseThrow();
                    if (loc.parentId().equals(target.id())) break;
                    db.root().resolveParent(loc).orElseThrow().removeChildAt(loc.index());
                    target.addChild(e);
                    e.setTimes(e.times().withLocationChanged(t(now)));
                }
                default -> {
                    Group g = groups.get(rnd.nextInt(groups.size()));
                    g.setName("G-" + replica + "-" + k);
                    g.setTimes(g.times().withLastModification(t(now)));
                }
            }
        }
    }

    private Database mergedInOrder(Database... replicas) {
        Database acc = replicas[0].deepCopy();
        for (int i = 1; i < replicas.length; i++) {
            merger.merge(acc, replicas[i]);
        }
        return acc;
    }

    private static void assertInvariants(Database db) {
        Set<NodeId> seen = new HashSet<>();
        for (Node n : db.root().traverse()) {
            assertTrue(seen.add(n.id()), "identity appears twice: " + n.id());
        }
        for (Tombstone t : db.tombstones().tombstones()) {
            assertFalse(seen.contains(t.id()), "tombstoned node is live: " + t.id());
        }
        for (Entry e : db.root().entries().toList()) {
            for (Entry.Snapshot s : e.history()) {
                assertFalse(s.lastModification().isAfter(e.times().lastModification()));
            }
        }
    }

    @Test
    void two_replicas_converge_in_either_merge_order() {
        for (long seed = 1; seed <= 25; seed++) {
            Database origin = origin();
            Database a = origin.deepCopy();
            Database b = origin.deepCopy();
            scramble(a, seed, 0, 2, 30);
            scramble(b, seed * 31, 1, 2, 30);

            Database ab = mergedInOrder(a, b);
            Database ba = mergedInOrder(b, a);

            assertInvariants(ab);
            assertInvariants(ba);
            assertEquals(contentView(ab), contentView(ba), "seed " + seed);
            assertEquals(ab.tombstones(), ba.tombstones(), "seed " + seed);

            // A merged result absorbs either input again without change.
            var settled = contentView(ab);
            merger.merge(ab, a);
            merger.merge(ab, b);
            assertEquals(settled, contentView(ab), "seed " + seed);
        }
    }

    @Test
    void three_replicas_converge_in_any_merge_order() {
        for (long seed = 1; seed <= 10; seed++) {
            Database origin = origin();
            Database a = origin.deepCopy();
            Database b = origin.deepCopy();
            Database c = origin.deepCopy();
            scramble(a, seed, 0, 3, 20);
            scramble(b, seed + 100, 1, 3, 20);
            scramble(c, seed + 200, 2, 3, 20);

            var expected = contentView(mergedInOrder(a, b, c));
            assertEquals(expected, contentView(mergedInOrder(c, a, b)), "seed " + seed);
            assertEquals(expected, contentView(mergedInOrder(b, c, a)), "seed " + seed);
            assertEquals(expected, contentView(mergedInOrder(a, c, b)), "seed " + seed);
        }
    }

    @Test
    void non_resurrection_holds_after_every_merge() {
        for (long seed = 1; seed <= 25; seed++) {
            Database origin = origin();
            Database a = origin.deepCopy();
            Database b = origin.deepCopy();
            scramble(a, seed, 0, 2, 30);
            scramble(b, seed + 7, 1, 2, 30);

            Database merged = mergedInOrder(a, b);
            for (Tombstone t : a.tombstones().tombstones()) {
                assertTrue(merged.findById(t.id()).isEmpty(), "seed " + seed + " resurrected " + t.id());
            }
            for (Tombstone t : b.tombstones().tombstones()) {
                assertTrue(merged.findById(t.id()).isEmpty(), "seed " + seed + " resurrected " + t.id());
            }
        }
    }
}
