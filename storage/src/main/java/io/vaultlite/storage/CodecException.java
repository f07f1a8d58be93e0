// file: src/main/java/io/vaultlite/storage/CodecException.java
package io.vaultlite.storage;

/**
 * Base type for failures crossing the {@link DatabaseCodec} boundary.
 */
public abstract class CodecException extends RuntimeException {
    protected CodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
