package io.vaultlite.storage.dto;

import java.util.LinkedHashMap;

public class SnapshotDocument {
    public String lastModification;
    public LinkedHashMap<String, ValueDocument> fields = new LinkedHashMap<>();
}
