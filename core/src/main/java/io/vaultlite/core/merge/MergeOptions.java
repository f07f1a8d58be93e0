// file: src/main/java/io/vaultlite/core/merge/MergeOptions.java
package io.vaultlite.core.merge;

/**
 * Tunables for {@link MergeEngine}.
 *
 * @param historyMaxItems cap on the number of history snapshots kept per
 *                        merged entry (oldest dropped first); negative means
 *                        unbounded.
 */
public record MergeOptions(int historyMaxItems) {

    public static final int UNBOUNDED = -1;

    public static MergeOptions defaults() {
        return new MergeOptions(UNBOUNDED);
    }

    public boolean historyBounded() {
        return historyMaxItems >= 0;
    }
}
