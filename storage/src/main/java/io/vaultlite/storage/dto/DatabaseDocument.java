package io.vaultlite.storage.dto;

import java.util.ArrayList;
import java.util.List;

public class DatabaseDocument {
    public GroupDocument root;
    public List<TombstoneDocument> tombstones = new ArrayList<>();
}
