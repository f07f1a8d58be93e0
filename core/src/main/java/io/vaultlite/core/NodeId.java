// file: src/main/java/io/vaultlite/core/NodeId.java
package io.vaultlite.core;

import java.util.Objects;
import java.util.UUID;

/**
 * Permanent identity of a group or entry.
 * <p>
 * Assigned once when a node is created (or taken from the encoded form when a
 * database is decoded) and never reassigned. It is the only key used for
 * equality, deletion and merge correlation across replicas.
 * <p>
 * Cross-replica correctness depends on identities never colliding. Random
 * (version 4) UUIDs are assumed to be unique; the core does not re-verify
 * this beyond the duplicate checks in {@link Database#addChild} and merge
 * validation.
 */
public record NodeId(UUID uuid) implements Comparable<NodeId> {

    /** Well-known identity of every database root group. */
    public static final NodeId ROOT = new NodeId(new UUID(0L, 1L));

    public NodeId {
        Objects.requireNonNull(uuid, "uuid");
    }

    /** Fresh random identity. */
    public static NodeId random() {
        return new NodeId(UUID.randomUUID());
    }

    /** Parse the canonical 36-character UUID form. */
    public static NodeId parse(String s) {
        return new NodeId(UUID.fromString(s));
    }

    @Override
    public int compareTo(NodeId o) {
        return uuid.compareTo(o.uuid);
    }

    @Override
    public String toString() {
        return uuid.toString();
    }
}
