// file: src/main/java/io/vaultlite/core/Value.java
package io.vaultlite.core;

import java.util.Arrays;
import java.util.Objects;

/**
 * Tagged field value stored in an {@link Entry}.
 * <p>
 * Variants:
 *  - Plain:  ordinary text.
 *  - Secret: text flagged for confidential handling by the codec/UI layers.
 *            The core compares and merges it exactly like plain text.
 *  - Binary: opaque bytes (attachments), compared by content.
 */
public sealed interface Value permits Value.Plain, Value.Secret, Value.Binary {

    enum Kind { PLAIN, SECRET, BINARY }

    Kind kind();

    static Value plain(String text) { return new Plain(text); }

    static Value secret(String text) { return new Secret(text); }

    static Value binary(byte[] data) { return new Binary(data); }

    record Plain(String text) implements Value {
        public Plain {
            Objects.requireNonNull(text, "text");
        }

        @Override public Kind kind() { return Kind.PLAIN; }
    }

    record Secret(String text) implements Value {
        public Secret {
            Objects.requireNonNull(text, "text");
        }

        @Override public Kind kind() { return Kind.SECRET; }

        // Keep secrets out of logs and assertion messages.
        @Override public String toString() { return "Secret[***]"; }
    }

    final class Binary implements Value {
        private final byte[] data;

        public Binary(byte[] data) {
            Objects.requireNonNull(data, "data");
            this.data = Arrays.copyOf(data, data.length);
        }

        public byte[] data() { return Arrays.copyOf(data, data.length); }

        @Override public Kind kind() { return Kind.BINARY; }

        @Override public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof Binary b)) return false;
            return Arrays.equals(data, b.data);
        }

        @Override public int hashCode() { return Arrays.hashCode(data); }

        @Override public String toString() { return "Binary[" + data.length + " bytes]"; }
    }

    /**
     * Text content for Plain and Secret values, null for Binary.
     */
    default String textOrNull() {
        if (this instanceof Plain p) return p.text();
        if (this instanceof Secret s) return s.text();
        return null;
    }
}
