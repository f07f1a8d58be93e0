// file: src/main/java/io/vaultlite/core/merge/MergeLog.java
package io.vaultlite.core.merge;

import io.vaultlite.core.NodeId;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of a successful merge: the applied events in order, the incoming
 * nodes left out because they are deleted, and non-fatal warnings (for
 * example a refused relocation). Only events count as changes.
 */
public final class MergeLog {
    private final List<MergeEvent> events = new ArrayList<>();
    private final List<NodeId> skipped = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();

    void event(MergeEvent.Type type, NodeId id) {
        events.add(new MergeEvent(type, id));
    }

    void skip(NodeId id) {
        skipped.add(id);
    }

    void warn(String warning) {
        warnings.add(warning);
    }

    public List<MergeEvent> events() { return List.copyOf(events); }

    /** Incoming nodes (subtree roots) not taken over because the ledger names them. */
    public List<NodeId> skipped() { return List.copyOf(skipped); }

    public List<String> warnings() { return List.copyOf(warnings); }

    /** Events of one type, in order. */
    public List<MergeEvent> events(MergeEvent.Type type) {
        return events.stream().filter(e -> e.type() == type).toList();
    }

    /** True when the merge recorded no events; local then keeps its own tree and ledger. */
    public boolean isEmpty() {
        return events.isEmpty();
    }

    @Override
    public String toString() {
        return "MergeLog{events=" + events.size() + ", skipped=" + skipped.size()
                + ", warnings=" + warnings.size() + "}";
    }
}
