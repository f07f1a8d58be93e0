// file: src/main/java/io/vaultlite/storage/FileDatabaseStore.java
package io.vaultlite.storage;

import io.vaultlite.core.Database;
import io.vaultlite.core.merge.MergeEngine;
import io.vaultlite.core.merge.MergeLog;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;

/**
 * Database persisted in a single file through a {@link DatabaseCodec}.
 * <p>
 * Atomicity:
 *   - save() writes "&lt;file&gt;.tmp" first,
 *   - then moves it over the database file using ATOMIC_MOVE,
 *   so readers see either the old or the new file, never a torn one.
 * <p>
 * Methods are synchronized: one save, load or merge at a time per store.
 */
public final class FileDatabaseStore {
    private static final Logger log = Logger.getLogger(FileDatabaseStore.class.getName());

    private final StoreConfig config;
    private final DatabaseCodec codec;
    private final DatabaseKey key;

    public FileDatabaseStore(StoreConfig config, DatabaseCodec codec, DatabaseKey key) {
        this.config = Objects.requireNonNull(config, "config");
        this.codec = Objects.requireNonNull(codec, "codec");
        this.key = Objects.requireNonNull(key, "key");
    }

    public Path path() {
        return config.databasePath();
    }

    public synchronized boolean exists() {
        return Files.exists(config.databasePath());
    }

    /**
     * Create and save an empty database.
     *
     * @throws IllegalStateException if the file already exists.
     */
    public synchronized Database create() {
        if (exists()) {
            throw new IllegalStateException("database already exists: " + config.databasePath());
        }
        Database db = new Database();
        save(db);
        log.log(Level.INFO, "Created database {0}", config.databasePath());
        return db;
    }

    /**
     * Read and decode the database file.
     *
     * @throws DecodeException if the file is not a database for this key.
     */
    public synchronized Database load() {
        return read(config.databasePath(), key);
    }

    /** Encode and atomically replace the database file. */
    public synchronized void save(Database db) {
        Path dst = config.databasePath();
        byte[] bytes = codec.encode(db, key);
        Path tmp = dst.resolveSibling(dst.getFileName() + ".tmp");
        try {
            Path parent = dst.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            Files.write(tmp, bytes, StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING,
                    StandardOpenOption.WRITE);
            Files.move(tmp, dst, ATOMIC_MOVE, REPLACE_EXISTING);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to save database to " + dst, e);
        }
        log.log(Level.FINE, "Saved {0} bytes to {1}", new Object[]{bytes.length, dst});
    }

    /**
     * Open another replica of this database (same key), merge it into the
     * stored database and save the result.
     *
     * @return what the merge changed.
     * @throws io.vaultlite.core.merge.MergeException if the replicas conflict;
     *         the stored file is then left as it was.
     */
    public synchronized MergeLog mergeFrom(Path replicaFile) {
        return mergeFrom(replicaFile, key);
    }

    /** Like {@link #mergeFrom(Path)} for a replica protected by a different key. */
    public synchronized MergeLog mergeFrom(Path replicaFile, DatabaseKey replicaKey) {
        Database local = load();
        Database incoming = read(replicaFile, replicaKey);
        MergeLog result = new MergeEngine(config.mergeOptions()).merge(local, incoming);
        if (!result.isEmpty()) {
            save(local);
        }
        log.log(Level.INFO, "Merged {0} into {1}: {2}", new Object[]{replicaFile, config.databasePath(), result});
        return result;
    }

    private Database read(Path file, DatabaseKey k) {
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(file);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read database " + file, e);
        }
        return codec.decode(bytes, k);
    }
}
