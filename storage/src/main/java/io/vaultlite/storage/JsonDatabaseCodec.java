// file: src/main/java/io/vaultlite/storage/JsonDatabaseCodec.java
package io.vaultlite.storage;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.vaultlite.core.Database;
import io.vaultlite.core.Entry;
import io.vaultlite.core.Group;
import io.vaultlite.core.Node;
import io.vaultlite.core.NodeId;
import io.vaultlite.core.Times;
import io.vaultlite.core.Tombstone;
import io.vaultlite.core.TombstoneLedger;
import io.vaultlite.core.Value;
import io.vaultlite.storage.dto.DatabaseDocument;
import io.vaultlite.storage.dto.EntryDocument;
import io.vaultlite.storage.dto.GroupDocument;
import io.vaultlite.storage.dto.NodeDocument;
import io.vaultlite.storage.dto.SnapshotDocument;
import io.vaultlite.storage.dto.TimesDocument;
import io.vaultlite.storage.dto.TombstoneDocument;
import io.vaultlite.storage.dto.ValueDocument;

import java.io.IOException;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * {@link DatabaseCodec} that writes the database as a JSON document (Jackson)
 * inside an authenticated {@link Envelope}.
 * <p>
 * Document shape:
 * <pre>
 * { "root": { "kind": "group", "id": ..., "name": ..., "times": {...},
 *             "children": [ { "kind": "entry", "id": ..., "fields": {...}, "history": [...] }, ... ] },
 *   "tombstones": [ { "id": ..., "deletedAt": ... } ] }
 * </pre>
 * Child order, field order, value kinds, history and tombstones are all kept,
 * so a decode of an encode reproduces the database exactly.
 */
public final class JsonDatabaseCodec implements DatabaseCodec {

    private static final String PLAIN = "plain";
    private static final String SECRET = "secret";
    private static final String BINARY = "binary";

    private final ObjectMapper mapper;

    public JsonDatabaseCodec() {
        this.mapper = new ObjectMapper().setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    @Override
    public byte[] encode(Database db, DatabaseKey key) {
        try {
            byte[] payload = mapper.writeValueAsBytes(toDocument(db));
            return Envelope.seal(payload, key);
        } catch (JsonProcessingException e) {
            throw new EncodeException("Failed to serialize database", e);
        }
    }

    @Override
    public Database decode(byte[] bytes, DatabaseKey key) {
        byte[] payload = Envelope.open(bytes, key);
        DatabaseDocument doc;
        try {
            doc = mapper.readValue(payload, DatabaseDocument.class);
        } catch (IOException e) {
            throw new DecodeException(DecodeException.Reason.MALFORMED, "payload is not a database document", e);
        }
        try {
            return fromDocument(doc);
        } catch (IllegalArgumentException | NullPointerException | DateTimeParseException e) {
            throw new DecodeException(DecodeException.Reason.MALFORMED, e.getMessage(), e);
        }
    }

    // ---------- model -> document ----------

    private static DatabaseDocument toDocument(Database db) {
        record Pair(Group group, GroupDocument doc) {}

        DatabaseDocument out = new DatabaseDocument();
        out.root = groupHeader(db.root());

        Deque<Pair> work = new ArrayDeque<>();
        work.push(new Pair(db.root(), out.root));
        while (!work.isEmpty()) {
            Pair p = work.pop();
            for (Node child : p.group().children()) {
                if (child instanceof Group g) {
                    GroupDocument gd = groupHeader(g);
                    p.doc().children.add(gd);
                    work.push(new Pair(g, gd));
                } else {
                    p.doc().children.add(entryDocument((Entry) child));
                }
            }
        }

        for (Tombstone t : db.tombstones().tombstones()) {
            TombstoneDocument td = new TombstoneDocument();
            td.id = t.id().toString();
            td.deletedAt = t.deletedAt().toString();
            out.tombstones.add(td);
        }
        return out;
    }

    private static GroupDocument groupHeader(Group g) {
        GroupDocument d = new GroupDocument();
        d.id = g.id().toString();
        d.name = g.name();
        d.times = timesDocument(g.times());
        return d;
    }

    private static EntryDocument entryDocument(Entry e) {
        EntryDocument d = new EntryDocument();
        d.id = e.id().toString();
        d.times = timesDocument(e.times());
        d.fields = fieldDocuments(e.fields());
        for (Entry.Snapshot s : e.history()) {
            SnapshotDocument sd = new SnapshotDocument();
            sd.lastModification = s.lastModification().toString();
            sd.fields = fieldDocuments(s.fields());
            d.history.add(sd);
        }
        return d;
    }

    private static TimesDocument timesDocument(Times t) {
        TimesDocument d = new TimesDocument();
        d.creation = t.creation().toString();
        d.lastModification = t.lastModification().toString();
        d.locationChanged = t.locationChanged().toString();
        return d;
    }

    private static LinkedHashMap<String, ValueDocument> fieldDocuments(Map<String, Value> fields) {
        LinkedHashMap<String, ValueDocument> out = new LinkedHashMap<>();
        fields.forEach((name, v) -> {
            ValueDocument vd = new ValueDocument();
            if (v instanceof Value.Plain p) {
                vd.type = PLAIN;
                vd.text = p.text();
            } else if (v instanceof Value.Secret s) {
                vd.type = SECRET;
                vd.text = s.text();
            } else {
                vd.type = BINARY;
                vd.data = ((Value.Binary) v).data();
            }
            out.put(name, vd);
        });
        return out;
    }

    // ---------- document -> model ----------

    private static Database fromDocument(DatabaseDocument doc) {
        record Pair(GroupDocument doc, Group group) {}

        if (doc.root == null) throw new IllegalArgumentException("document has no root group");
        Group root = group(doc.root);
        if (!root.id().equals(NodeId.ROOT)) {
            throw new IllegalArgumentException("root group id is " + root.id() + ", expected " + NodeId.ROOT);
        }

        Set<NodeId> seen = new HashSet<>();
        seen.add(root.id());
        Deque<Pair> work = new ArrayDeque<>();
        work.push(new Pair(doc.root, root));
        while (!work.isEmpty()) {
            Pair p = work.pop();
            if (p.doc().children == null) continue;
            for (NodeDocument child : p.doc().children) {
                Node node;
                if (child instanceof GroupDocument gd) {
                    Group g = group(gd);
                    work.push(new Pair(gd, g));
                    node = g;
                } else if (child instanceof EntryDocument ed) {
                    node = entry(ed);
                } else {
                    throw new IllegalArgumentException("unknown node document " + child);
                }
                if (!seen.add(node.id())) {
                    throw new IllegalArgumentException("duplicate node id " + node.id());
                }
                p.group().addChild(node);
            }
        }

        List<Tombstone> tombstones = new ArrayList<>();
        if (doc.tombstones != null) {
            for (TombstoneDocument td : doc.tombstones) {
                tombstones.add(new Tombstone(NodeId.parse(td.id), Instant.parse(td.deletedAt)));
            }
        }
        TombstoneLedger ledger = new TombstoneLedger(tombstones);
        // The root cannot be deleted, so a tombstone naming it is inert.
        for (NodeId id : seen) {
            if (!id.equals(NodeId.ROOT) && ledger.contains(id)) {
                throw new IllegalArgumentException("node " + id + " is live and tombstoned");
            }
        }
        return new Database(root, ledger);
    }

    private static Group group(GroupDocument d) {
        return new Group(NodeId.parse(d.id), d.name, times(d.times));
    }

    private static Entry entry(EntryDocument d) {
        Entry e = new Entry(NodeId.parse(d.id), times(d.times));
        e.replaceFields(fields(d.fields));
        if (d.history != null) {
            List<Entry.Snapshot> history = new ArrayList<>(d.history.size());
            Instant current = e.times().lastModification();
            for (SnapshotDocument sd : d.history) {
                Instant at = Instant.parse(sd.lastModification);
                if (at.isAfter(current)) {
                    throw new IllegalArgumentException("entry " + e.id() + " has history newer than its last modification");
                }
                history.add(new Entry.Snapshot(at, fields(sd.fields)));
            }
            e.replaceHistory(history);
        }
        return e;
    }

    private static Times times(TimesDocument d) {
        if (d == null) throw new IllegalArgumentException("node has no times");
        return new Times(Instant.parse(d.creation), Instant.parse(d.lastModification), Instant.parse(d.locationChanged));
    }

    private static Map<String, Value> fields(Map<String, ValueDocument> docs) {
        Map<String, Value> out = new LinkedHashMap<>();
        if (docs == null) return out;
        docs.forEach((name, vd) -> {
            if (vd == null || vd.type == null) throw new IllegalArgumentException("field " + name + " has no type");
            Value v = switch (vd.type) {
                case PLAIN -> Value.plain(vd.text);
                case SECRET -> Value.secret(vd.text);
                case BINARY -> Value.binary(vd.data);
                default -> throw new IllegalArgumentException("field " + name + " has unknown type " + vd.type);
            };
            out.put(name, v);
        });
        return out;
    }
}
