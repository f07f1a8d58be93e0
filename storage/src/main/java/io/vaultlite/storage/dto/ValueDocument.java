package io.vaultlite.storage.dto;

/**
 * Field value: {@code type} is "plain", "secret" or "binary".
 * Text values use {@code text}; binary values use {@code data} (base64 in JSON).
 */
public class ValueDocument {
    public String type;
    public String text;
    public byte[] data;
}
