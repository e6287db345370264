package com.stride.backend.crypto;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;
import java.util.Optional;

/**
 * AES-GCM output as stored at rest. All binary parts are lower-case hex.
 *
 * <pre>{"data": "...", "iv": "&lt;32 hex&gt;", "tag": "&lt;32 hex&gt;", "encrypted": true}</pre>
 *
 * Readers also accept {@code ciphertext} for {@code data} and {@code authTag}
 * for {@code tag}. Field decryption pattern-matches on this shape, so it must
 * not change.
 */
public record EncryptedField(
        @JsonProperty("data") @JsonAlias("ciphertext") String data,
        @JsonProperty("iv") String iv,
        @JsonProperty("tag") @JsonAlias("authTag") String tag,
        @JsonProperty("encrypted") boolean encrypted
) {

    @JsonCreator
    public EncryptedField {
    }

    public static EncryptedField of(String data, String iv, String tag) {
        return new EncryptedField(data, iv, tag, true);
    }

    /**
     * Structural match against a generic map, as produced by deserialising a
     * record without type information.
     */
    public static Optional<EncryptedField> fromMap(Map<?, ?> map) {
        if (map == null || !Boolean.TRUE.equals(map.get("encrypted"))) {
            return Optional.empty();
        }
        Object data = map.containsKey("data") ? map.get("data") : map.get("ciphertext");
        Object iv = map.get("iv");
        Object tag = map.containsKey("tag") ? map.get("tag") : map.get("authTag");
        if (data instanceof String d && iv instanceof String i && tag instanceof String t) {
            return Optional.of(new EncryptedField(d, i, t, true));
        }
        return Optional.empty();
    }

    /**
     * Returns the value as an {@code EncryptedField} when it is one or is shaped
     * like one.
     */
    public static Optional<EncryptedField> match(Object value) {
        if (value instanceof EncryptedField field) {
            return field.encrypted() ? Optional.of(field) : Optional.empty();
        }
        if (value instanceof Map<?, ?> map) {
            return fromMap(map);
        }
        return Optional.empty();
    }
}
