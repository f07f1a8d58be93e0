package io.vaultlite.storage.dto;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;

public class EntryDocument extends NodeDocument {
    public LinkedHashMap<String, ValueDocument> fields = new LinkedHashMap<>();
    public List<SnapshotDocument> history = new ArrayList<>();
}
