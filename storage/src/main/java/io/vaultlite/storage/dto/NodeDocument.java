package io.vaultlite.storage.dto;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * JSON form of a tree node; the "kind" property selects the subtype.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = GroupDocument.class, name = "group"),
        @JsonSubTypes.Type(value = EntryDocument.class, name = "entry")
})
public abstract class NodeDocument {
    public String id;
    public TimesDocument times;
}
