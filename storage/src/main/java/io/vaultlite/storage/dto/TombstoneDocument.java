package io.vaultlite.storage.dto;

public class TombstoneDocument {
    public String id;
    public String deletedAt;
}
