// file: src/main/java/io/vaultlite/storage/DatabaseKey.java
package io.vaultlite.storage;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Opaque key material handed to a {@link DatabaseCodec}.
 * <p>
 * No key derivation happens here; the bytes are used as given. Defensive
 * copies are taken on input and output.
 */
public final class DatabaseKey {
    private final byte[] material;

    private DatabaseKey(byte[] material) {
        if (material == null || material.length == 0) {
            throw new IllegalArgumentException("key material must not be empty");
        }
        this.material = Arrays.copyOf(material, material.length);
    }

    public static DatabaseKey of(byte[] material) {
        return new DatabaseKey(material);
    }

    /** Key material taken from the UTF-8 bytes of a password. */
    public static DatabaseKey ofPassword(String password) {
        if (password == null) throw new IllegalArgumentException("password");
        return new DatabaseKey(password.getBytes(StandardCharsets.UTF_8));
    }

    public byte[] material() {
        return Arrays.copyOf(material, material.length);
    }

    @Override public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DatabaseKey k)) return false;
        return Arrays.equals(material, k.material);
    }

    @Override public int hashCode() { return Arrays.hashCode(material); }

    @Override public String toString() { return "DatabaseKey[***]"; }
}
