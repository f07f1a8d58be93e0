// file: src/main/java/io/vaultlite/core/Times.java
package io.vaultlite.core;

import java.time.Instant;
import java.util.Objects;

/**
 * Timestamps carried by every node.
 * <p>
 * Fields:
 *  - creation:         when the node was first created.
 *  - lastModification: last content change; decides which side wins a merge.
 *  - locationChanged:  last time the node moved to another parent; decides
 *                      which side's placement wins a merge.
 */
public record Times(Instant creation, Instant lastModification, Instant locationChanged) {

    public Times {
        Objects.requireNonNull(creation, "creation");
        Objects.requireNonNull(lastModification, "lastModification");
        Objects.requireNonNull(locationChanged, "locationChanged");
    }

    /** All three timestamps set to {@code at}. */
    public static Times createdAt(Instant at) {
        return new Times(at, at, at);
    }

    public static Times now() {
        return createdAt(Instant.now());
    }

    public Times withLastModification(Instant at) {
        return new Times(creation, at, locationChanged);
    }

    public Times withLocationChanged(Instant at) {
        return new Times(creation, lastModification, at);
    }
}
