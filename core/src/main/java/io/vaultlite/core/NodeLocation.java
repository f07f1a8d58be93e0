// file: src/main/java/io/vaultlite/core/NodeLocation.java
package io.vaultlite.core;

import java.util.List;
import java.util.Objects;

/**
 * Position of a node inside a tree, produced by a read-only search.
 * <p>
 * Fields:
 *  - ancestry: group identities from the searched group down to the direct
 *              parent (both ends included).
 *  - index:    position of the node in its parent's child list.
 *  - id:       identity of the located node.
 * <p>
 * A location is a value, not a reference: mutation passes re-resolve it with
 * {@link Group#resolveParent(NodeLocation)} so no interior reference has to
 * survive between the search and the change.
 */
public record NodeLocation(List<NodeId> ancestry, int index, NodeId id) {

    public NodeLocation {
        ancestry = List.copyOf(ancestry);
        Objects.requireNonNull(id, "id");
        if (ancestry.isEmpty()) throw new IllegalArgumentException("ancestry must include the parent");
        if (index < 0) throw new IllegalArgumentException("index must be >= 0");
    }

    public NodeId parentId() {
        return ancestry.get(ancestry.size() - 1);
    }

    /** Number of edges between the searched group and the node. */
    public int depth() {
        return ancestry.size();
    }
}
