package io.vaultlite.storage;

import io.vaultlite.core.Database;
import io.vaultlite.core.Entry;
import io.vaultlite.core.Group;
import io.vaultlite.core.Node;

import java.util.Iterator;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Ordered, field-by-field comparison of two databases.
 */
final class DatabaseAssertions {

    private DatabaseAssertions() {
    }

    static void assertSameDatabase(Database expected, Database actual) {
        Iterator<Node> a = expected.root().traverse().iterator();
        Iterator<Node> b = actual.root().traverse().iterator();
        while (a.hasNext()) {
            assertTrue(b.hasNext(), "actual tree is shorter");
            assertSameNode(a.next(), b.next());
        }
        assertFalse(b.hasNext(), "actual tree is longer");
        assertEquals(expected.tombstones().tombstones(), actual.tombstones().tombstones());
    }

    private static void assertSameNode(Node x, Node y) {
        assertEquals(x.id(), y.id());
        assertEquals(x.kind(), y.kind());
        assertEquals(x.times(), y.times());
        if (x instanceof Group g) {
            Group h = (Group) y;
            assertEquals(g.name(), h.name());
            assertEquals(g.children().size(), h.children().size());
        } else {
            Entry e = (Entry) x;
            Entry f = (Entry) y;
            // List form checks insertion order too.
            assertEquals(e.fields().entrySet().stream().toList(), f.fields().entrySet().stream().toList());
            assertEquals(e.history(), f.history());
        }
    }
}
