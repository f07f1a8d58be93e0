// file: src/test/java/io/vaultlite/core/Fixtures.java
package io.vaultlite.core;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Shared builders and tree views for core tests.
 */
public final class Fixtures {

    public static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private Fixtures() {
    }

    public static Instant t(long seconds) {
        return T0.plusSeconds(seconds);
    }

    public static Database emptyDb() {
        return new Database(new Group(NodeId.ROOT, Database.DEFAULT_ROOT_NAME, Times.createdAt(T0)),
                new TombstoneLedger());
    }

    public static Group group(String name, long createdAt) {
        return new Group(NodeId.random(), name, Times.createdAt(t(createdAt)));
    }

    public static Entry entry(String title, long createdAt) {
        Entry e = new Entry(NodeId.random(), Times.createdAt(t(createdAt)));
        e.putField(Entry.TITLE, Value.plain(title));
        return e;
    }

    /** Record an edit at {@code at} and set one field. */
    public static void edit(Entry e, long at, String field, Value value) {
        e.recordEdit(t(at));
        e.putField(field, value);
    }

    /**
     * Order-insensitive view of a tree: identity -> description of the node,
     * its parent and its content (fields, history, name, times).
     */
    public static Map<NodeId, String> contentView(Database db) {
        Map<NodeId, String> view = new TreeMap<>();
        describe(db.root(), null, view);
        return view;
    }

    private static void describe(Group g, NodeId parent, Map<NodeId, String> view) {
        view.put(g.id(), "group parent=" + parent + " name=" + g.name() + " times=" + g.times());
        for (Node child : g.children()) {
            if (child instanceof Group sub) {
                describe(sub, g.id(), view);
            } else {
                Entry e = (Entry) child;
                view.put(e.id(), "entry parent=" + g.id()
                        + " fields=" + new TreeMap<>(plainView(e.fields()))
                        + " history=" + historyView(e)
                        + " times=" + e.times());
            }
        }
    }

    private static Map<String, String> plainView(Map<String, Value> fields) {
        Map<String, String> out = new LinkedHashMap<>();
        fields.forEach((k, v) -> out.put(k, v.kind() + ":" + (v.textOrNull() != null ? v.textOrNull() : v.toString())));
        return out;
    }

    private static List<String> historyView(Entry e) {
        List<String> out = new ArrayList<>();
        for (Entry.Snapshot s : e.history()) {
            out.add(s.lastModification() + new TreeMap<>(plainView(s.fields())).toString());
        }
        return out;
    }
}
