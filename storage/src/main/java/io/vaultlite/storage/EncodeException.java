// file: src/main/java/io/vaultlite/storage/EncodeException.java
package io.vaultlite.storage;

public final class EncodeException extends CodecException {
    public EncodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
