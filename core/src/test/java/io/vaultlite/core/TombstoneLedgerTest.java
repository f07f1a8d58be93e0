// file: src/test/java/io/vaultlite/core/TombstoneLedgerTest.java
package io.vaultlite.core;

import org.junit.jupiter.api.Test;

import java.util.List;

import static io.vaultlite.core.Fixtures.t;
import static org.junit.jupiter.api.Assertions.*;

class TombstoneLedgerTest {

    @Test
    void record_keeps_latest_timestamp_and_is_idempotent() {
        var ledger = new TombstoneLedger();
        var id = NodeId.random();

        assertTrue(ledger.record(id, t(10)));
        assertFalse(ledger.record(id, t(10)), "same tombstone twice is a no-op");
        assertFalse(ledger.record(id, t(5)), "older deletion does not rewind");
        assertEquals(t(10), ledger.timestampOf(id).orElseThrow());

        assertTrue(ledger.record(id, t(20)));
        assertEquals(t(20), ledger.timestampOf(id).orElseThrow());
        assertEquals(1, ledger.size());
    }

    @Test
    void contains_and_missing_lookups() {
        var ledger = new TombstoneLedger();
        var id = NodeId.random();
        assertTrue(ledger.isEmpty());
        assertFalse(ledger.contains(id));
        assertTrue(ledger.timestampOf(id).isEmpty());

        ledger.record(new Tombstone(id, t(1)));
        assertTrue(ledger.contains(id));
    }

    @Test
    void union_takes_per_identity_maximum_and_reports_changes() {
        var a = NodeId.random();
        var b = NodeId.random();
        var c = NodeId.random();

        var left = new TombstoneLedger(List.of(new Tombstone(a, t(10)), new Tombstone(b, t(30))));
        var right = new TombstoneLedger(List.of(new Tombstone(a, t(20)), new Tombstone(b, t(5)), new Tombstone(c, t(1))));

        var changed = left.unionWith(right);
        assertEquals(List.of(new Tombstone(a, t(20)), new Tombstone(c, t(1))), changed);
        assertEquals(t(20), left.timestampOf(a).orElseThrow());
        assertEquals(t(30), left.timestampOf(b).orElseThrow());
        assertEquals(t(1), left.timestampOf(c).orElseThrow());

        // Union is order independent.
        var other = new TombstoneLedger(right.tombstones());
        other.unionWith(new TombstoneLedger(List.of(new Tombstone(a, t(10)), new Tombstone(b, t(30)))));
        assertEquals(left, other);
    }

    @Test
    void copy_is_independent_and_tombstones_snapshot_is_immutable() {
        var ledger = new TombstoneLedger();
        ledger.record(NodeId.random(), t(1));
        var copy = ledger.copy();
        copy.record(NodeId.random(), t(2));

        assertEquals(1, ledger.size());
        assertEquals(2, copy.size());
        assertThrows(UnsupportedOperationException.class,
                () -> ledger.tombstones().add(new Tombstone(NodeId.random(), t(3))));
    }
}
