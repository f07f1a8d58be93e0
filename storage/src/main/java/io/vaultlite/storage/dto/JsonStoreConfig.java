package io.vaultlite.storage.dto;

public class JsonStoreConfig {
    public String databasePath;
    public Integer historyMaxItems;
}
