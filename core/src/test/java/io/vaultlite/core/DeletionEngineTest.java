// file: src/test/java/io/vaultlite/core/DeletionEngineTest.java
package io.vaultlite.core;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.List;

import static io.vaultlite.core.Fixtures.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Tree layout used by most cases:
 * <pre>
 * Root
 *  +- G1
 *  |   +- E1
 *  |   +- G2
 *  |       +- E2
 *  +- E3
 * </pre>
 */
class DeletionEngineTest {

    private final DeletionEngine engine = new DeletionEngine(Clock.fixed(t(100), ZoneOffset.UTC));

    private Database db;
    private Group g1;
    private Group g2;
    private Entry e1;
    private Entry e2;
    private Entry e3;

    @BeforeEach
    void setUp() {
        db = emptyDb();
        g1 = group("G1", 0);
        e1 = entry("E1", 0);
        g2 = group("G2", 0);
        e2 = entry("E2", 0);
        e3 = entry("E3", 0);
        g2.addChild(e2);
        g1.addChild(e1).addChild(g2);
        db.root().addChild(g1).addChild(e3);
    }

    @Test
    void deleting_nested_entry_with_logging_records_one_tombstone() {
        var removed = engine.deleteById(db, e2.id(), true);

        assertTrue(removed.isPresent());
        assertSame(e2, removed.get());
        assertEquals(Node.Kind.ENTRY, removed.get().kind());
        assertTrue(db.findById(e2.id()).isEmpty());
        assertEquals(0, g2.children().size());

        assertEquals(1, db.tombstones().size());
        assertEquals(t(100), db.tombstones().timestampOf(e2.id()).orElseThrow());
    }

    @Test
    void deleting_group_without_logging_takes_subtree_and_leaves_ledger_alone() {
        engine.deleteById(db, e2.id(), true);

        var removed = engine.deleteById(db, g1.id(), false);

        assertTrue(removed.isPresent());
        Group g = (Group) removed.get();
        assertEquals(g1.id(), g.id());
        assertEquals(2, g.children().size(), "E1 and G2 travel with their group");

        assertEquals(List.of(e3.id()), db.root().children().stream().map(Node::id).toList());
        assertTrue(db.findById(e1.id()).isEmpty());
        assertTrue(db.findById(g2.id()).isEmpty());
        assertEquals(1, db.tombstones().size(), "unlogged delete writes no tombstone");
        assertFalse(db.tombstones().contains(g1.id()));
    }

    @Test
    void deleting_group_with_logging_tombstones_only_the_group() {
        engine.deleteById(db, g1.id(), true);

        assertTrue(db.tombstones().contains(g1.id()));
        assertFalse(db.tombstones().contains(e1.id()));
        assertFalse(db.tombstones().contains(g2.id()));
        assertFalse(db.tombstones().contains(e2.id()));
        assertEquals(1, db.tombstones().size());
    }

    @Test
    void missing_identity_returns_empty_and_keeps_ledger() {
        engine.deleteById(db, e2.id(), true);

        assertTrue(engine.deleteById(db, NodeId.random(), true).isEmpty());
        // Already deleted: not found the second time either.
        assertTrue(engine.deleteById(db, e2.id(), true).isEmpty());
        assertEquals(1, db.tombstones().size());
        assertEquals(t(100), db.tombstones().timestampOf(e2.id()).orElseThrow());
    }

    @Test
    void root_is_never_a_deletion_target() {
        assertTrue(engine.deleteById(db, NodeId.ROOT, true).isEmpty());
        assertEquals(6, db.root().size());
        assertTrue(db.tombstones().isEmpty());
    }

    @Test
    void siblings_keep_their_relative_order() {
        Entry a = entry("a", 0);
        Entry b = entry("b", 0);
        Entry c = entry("c", 0);
        g2.addChild(a).addChild(b).addChild(c);

        engine.deleteById(db, a.id(), false);

        assertEquals(List.of(e2.id(), b.id(), c.id()), g2.children().stream().map(Node::id).toList());
    }

    @Test
    void database_delete_uses_current_time() {
        var removed = db.deleteById(e1.id(), true);

        assertSame(e1, removed.orElseThrow());
        assertTrue(db.tombstones().timestampOf(e1.id()).orElseThrow().isAfter(t(0)));
        assertTrue(db.findByPath("G1", "E1").isEmpty());
    }
}
