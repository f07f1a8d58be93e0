// file: src/main/java/io/vaultlite/core/Entry.java
package io.vaultlite.core;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A credential record: named field values plus its own edit history.
 * <p>
 * Fields keep insertion order so that a decode/encode round trip reproduces
 * the original layout. Equality of field maps ignores order.
 * <p>
 * Invariant: {@code times().lastModification()} is not earlier than any
 * snapshot timestamp in {@link #history()}. History is ordered oldest first.
 */
public final class Entry implements Node {

    public static final String TITLE = "Title";
    public static final String USERNAME = "UserName";
    public static final String PASSWORD = "Password";
    public static final String URL = "URL";
    public static final String NOTES = "Notes";

    /**
     * Immutable prior state of an entry.
     */
    public record Snapshot(Instant lastModification, Map<String, Value> fields) {
        public Snapshot {
            Objects.requireNonNull(lastModification, "lastModification");
            fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        }
    }

    private final NodeId id;
    private final LinkedHashMap<String, Value> fields = new LinkedHashMap<>();
    private final List<Snapshot> history = new ArrayList<>();
    private Times times;

    /** New entry with a fresh identity, timestamped now. */
    public Entry() {
        this(NodeId.random(), Times.now());
    }

    public Entry(NodeId id, Times times) {
        this.id = Objects.requireNonNull(id, "id");
        this.times = Objects.requireNonNull(times, "times");
    }

    @Override public NodeId id() { return id; }

    @Override public Kind kind() { return Kind.ENTRY; }

    @Override public Times times() { return times; }

    public void setTimes(Times times) {
        this.times = Objects.requireNonNull(times, "times");
    }

    /** Read-only view of the fields in insertion order. */
    public Map<String, Value> fields() {
        return Collections.unmodifiableMap(fields);
    }

    public Optional<Value> field(String name) {
        return Optional.ofNullable(fields.get(name));
    }

    /**
     * Set a field. Does not touch timestamps or history; use
     * {@link #recordEdit(Instant)} before a user-visible change.
     */
    public Entry putField(String name, Value value) {
        Objects.requireNonNull(name, "name");
        fields.put(name, Objects.requireNonNull(value, "value"));
        return this;
    }

    /** Replace all fields, keeping the iteration order of {@code newFields}. */
    public void replaceFields(Map<String, Value> newFields) {
        fields.clear();
        fields.putAll(newFields);
    }

    public Optional<String> title() { return text(TITLE); }

    public Optional<String> password() { return text(PASSWORD); }

    /** Text of a Plain or Secret field; empty for missing or binary fields. */
    public Optional<String> text(String name) {
        Value v = fields.get(name);
        return v == null ? Optional.empty() : Optional.ofNullable(v.textOrNull());
    }

    /** Prior states, oldest first (read-only view). */
    public List<Snapshot> history() {
        return Collections.unmodifiableList(history);
    }

    /** Current state as a snapshot (no history). */
    public Snapshot snapshot() {
        return new Snapshot(times.lastModification(), fields);
    }

    /**
     * Push the current state onto the history and advance the modification
     * time to {@code at} (never backwards). Call before changing fields.
     */
    public void recordEdit(Instant at) {
        history.add(snapshot());
        Instant last = times.lastModification();
        times = times.withLastModification(at.isAfter(last) ? at : last);
    }

    public void replaceHistory(List<Snapshot> snapshots) {
        history.clear();
        history.addAll(snapshots);
    }

    /** True when fields are equal, ignoring order and history. */
    public boolean sameContent(Entry other) {
        return fields.equals(other.fields);
    }

    @Override
    public Entry deepCopy() {
        Entry copy = new Entry(id, times);
        copy.fields.putAll(fields);
        copy.history.addAll(history);
        return copy;
    }

    @Override
    public String toString() {
        return "Entry{" + id + ", title=" + title().orElse("") + "}";
    }
}
