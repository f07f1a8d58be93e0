// file: src/main/java/io/vaultlite/storage/StoreConfig.java
package io.vaultlite.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.vaultlite.core.merge.MergeOptions;
import io.vaultlite.storage.dto.JsonStoreConfig;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Settings for a {@link FileDatabaseStore}.
 *
 * @param databasePath    file holding the encoded database
 * @param historyMaxItems history snapshots kept per entry when merging;
 *                        negative means unbounded
 */
public record StoreConfig(Path databasePath, int historyMaxItems) {

    public StoreConfig {
        Objects.requireNonNull(databasePath, "databasePath");
    }

    public static StoreConfig of(Path databasePath) {
        return new StoreConfig(databasePath, MergeOptions.UNBOUNDED);
    }

    /**
     * Load from a JSON file such as:
     * <pre>
     * { "databasePath": "vault.db", "historyMaxItems": 10 }
     * </pre>
     * A relative databasePath is resolved against the config file's directory.
     * historyMaxItems is optional.
     */
    public static StoreConfig fromJsonFile(Path path) {
        ObjectMapper mapper = new ObjectMapper();
        try {
            JsonStoreConfig cfg = mapper.readValue(path.toFile(), JsonStoreConfig.class);
            if (cfg.databasePath == null || cfg.databasePath.isBlank()) {
                throw new IllegalArgumentException("databasePath must be set in " + path);
            }
            Path db = Path.of(cfg.databasePath);
            if (!db.isAbsolute()) {
                Path dir = path.toAbsolutePath().getParent();
                db = dir.resolve(db);
            }
            int history = cfg.historyMaxItems == null ? MergeOptions.UNBOUNDED : cfg.historyMaxItems;
            return new StoreConfig(db, history);
        } catch (IOException e) {
            throw new RuntimeException("Failed to load StoreConfig from " + path, e);
        }
    }

    public MergeOptions mergeOptions() {
        return new MergeOptions(historyMaxItems);
    }
}
