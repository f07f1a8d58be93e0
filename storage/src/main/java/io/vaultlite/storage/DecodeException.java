// file: src/main/java/io/vaultlite/storage/DecodeException.java
package io.vaultlite.storage;

import java.util.Objects;

public final class DecodeException extends CodecException {

    public enum Reason {
        /** Input does not start with the expected magic number. */
        BAD_MAGIC,
        UNSUPPORTED_VERSION,
        /** Header or payload shorter than declared. */
        TRUNCATED,
        /** Authentication tag mismatch: wrong key or altered bytes. */
        AUTHENTICATION_FAILED,
        /** Authentic payload that does not describe a valid database. */
        MALFORMED
    }

    private final Reason reason;

    public DecodeException(Reason reason, String message) {
        this(reason, message, null);
    }

    public DecodeException(Reason reason, String message, Throwable cause) {
        super(reason + ": " + message, cause);
        this.reason = Objects.requireNonNull(reason, "reason");
    }

    public Reason reason() { return reason; }
}
