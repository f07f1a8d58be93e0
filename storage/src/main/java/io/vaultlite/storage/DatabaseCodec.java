// file: src/main/java/io/vaultlite/storage/DatabaseCodec.java
package io.vaultlite.storage;

import io.vaultlite.core.Database;

/**
 * Boundary between the in-memory database and its serialized form.
 * <p>
 * Contract:
 *  - decode(encode(db, k), k) is observationally equal to db: every field
 *    (value kinds included), all timestamps, every history snapshot, child
 *    order and the full tombstone ledger survive.
 *  - decode with the wrong key or of altered bytes fails with a
 *    {@link DecodeException}, never with a partially filled database.
 */
public interface DatabaseCodec {

    /**
     * @throws DecodeException if the bytes are not a valid database for this key.
     */
    Database decode(byte[] bytes, DatabaseKey key);

    /**
     * @throws EncodeException if the database cannot be serialized.
     */
    byte[] encode(Database db, DatabaseKey key);
}
