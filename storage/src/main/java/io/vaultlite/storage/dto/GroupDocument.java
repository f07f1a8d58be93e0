package io.vaultlite.storage.dto;

import java.util.ArrayList;
import java.util.List;

public class GroupDocument extends NodeDocument {
    public String name;
    public List<NodeDocument> children = new ArrayList<>();
}
