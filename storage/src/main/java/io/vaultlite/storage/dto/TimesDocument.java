package io.vaultlite.storage.dto;

/** ISO-8601 instants, nanosecond precision preserved. */
public class TimesDocument {
    public String creation;
    public String lastModification;
    public String locationChanged;
}
