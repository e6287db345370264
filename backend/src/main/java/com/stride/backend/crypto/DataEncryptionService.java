package com.stride.backend.crypto;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import com.stride.backend.exception.DecryptionException;
import lombok.extern.slf4j.Slf4j;

import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Collection;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * AES-256-GCM encryption of sensitive values at rest.
 *
 * Every call draws a fresh 16 byte IV, so encrypting the same plaintext twice
 * yields different output. The key is fixed at construction and the instance
 * holds no other state, which makes it safe to share between request threads.
 */
@Slf4j
public class DataEncryptionService {

    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int IV_BYTES = 16;
    private static final int TAG_BYTES = 16;
    private static final byte[] AAD = "stride-data".getBytes(StandardCharsets.UTF_8);
    private static final SecureRandom RNG = new SecureRandom();
    private static final HexFormat HEX = HexFormat.of();
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final SecretKey secretKey;
    private final ObjectMapper objectMapper;
    private final ObjectReader strictReader;

    public DataEncryptionService(SecretKey secretKey, ObjectMapper objectMapper) {
        this.secretKey = secretKey;
        this.objectMapper = objectMapper;
        this.strictReader = objectMapper.readerFor(Object.class)
                .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    public EncryptedField encrypt(String plaintext) {
        if (plaintext == null) {
            throw new IllegalArgumentException("plaintext must not be null");
        }
        try {
            byte[] iv = new byte[IV_BYTES];
            RNG.nextBytes(iv);

            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, secretKey, new GCMParameterSpec(TAG_BYTES * 8, iv));
            cipher.updateAAD(AAD);
            byte[] sealed = cipher.doFinal(plaintext.getBytes(StandardCharsets.UTF_8));

            // JCE appends the tag to the ciphertext
            int ciphertextLength = sealed.length - TAG_BYTES;
            String data = HEX.formatHex(sealed, 0, ciphertextLength);
            String tag = HEX.formatHex(sealed, ciphertextLength, sealed.length);
            return EncryptedField.of(data, HEX.formatHex(iv), tag);
        } catch (GeneralSecurityException e) {
            log.error("Encryption failed: {}", e.getMessage());
            throw new IllegalStateException("Encryption failed", e);
        }
    }

    public String decrypt(EncryptedField field) {
        if (field == null || !field.encrypted()) {
            throw new DecryptionException("Data is not encrypted");
        }
        byte[] iv;
        byte[] tag;
        byte[] ciphertext;
        try {
            iv = HEX.parseHex(field.iv());
            tag = HEX.parseHex(field.tag());
            ciphertext = HEX.parseHex(field.data());
        } catch (IllegalArgumentException | NullPointerException e) {
            throw new DecryptionException("Encrypted value is not valid hex", e);
        }
        if (iv.length != IV_BYTES || tag.length != TAG_BYTES) {
            throw new DecryptionException("Encrypted value has invalid iv or tag length");
        }
        try {
            byte[] sealed = new byte[ciphertext.length + tag.length];
            System.arraycopy(ciphertext, 0, sealed, 0, ciphertext.length);
            System.arraycopy(tag, 0, sealed, ciphertext.length, tag.length);

            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, secretKey, new GCMParameterSpec(TAG_BYTES * 8, iv));
            cipher.updateAAD(AAD);
            return new String(cipher.doFinal(sealed), StandardCharsets.UTF_8);
        } catch (GeneralSecurityException e) {
            throw new DecryptionException("Decryption failed", e);
        }
    }

    public EncryptedField encryptObject(Object value) {
        return encrypt(toJson(value));
    }

    public Map<String, Object> decryptObject(EncryptedField field) {
        try {
            return objectMapper.readValue(decrypt(field), MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new DecryptionException("Decrypted payload is not a JSON object", e);
        }
    }

    public <T> T decryptObject(EncryptedField field, Class<T> type) {
        try {
            return objectMapper.readValue(decrypt(field), type);
        } catch (JsonProcessingException e) {
            throw new DecryptionException("Decrypted payload does not map to " + type.getSimpleName(), e);
        }
    }

    /**
     * Replaces each named, non-null field with its {@link EncryptedField}.
     * Every value, strings included, is JSON encoded before encryption so that
     * {@link #decryptFields} restores the original type. The input map is not modified.
     */
    public Map<String, Object> encryptFields(Map<String, ?> source, Collection<String> fieldNames) {
        Map<String, Object> result = new LinkedHashMap<>(source);
        for (String name : fieldNames) {
            Object value = result.get(name);
            if (value == null || EncryptedField.match(value).isPresent()) {
                continue;
            }
            result.put(name, encrypt(toJson(value)));
        }
        return result;
    }

    public Map<String, Object> encryptFields(Map<String, ?> source, SensitiveFields preset) {
        return encryptFields(source, preset.fields());
    }

    /**
     * Decrypts each named field that is shaped like an {@link EncryptedField}.
     *
     * A field that fails to decrypt keeps its encrypted value and the call
     * carries on with the remaining fields; callers detect the failure by
     * checking whether the returned value still matches the encrypted shape.
     */
    public Map<String, Object> decryptFields(Map<String, ?> source, Collection<String> fieldNames) {
        Map<String, Object> result = new LinkedHashMap<>(source);
        for (String name : fieldNames) {
            Optional<EncryptedField> encrypted = EncryptedField.match(result.get(name));
            if (encrypted.isEmpty()) {
                continue;
            }
            try {
                result.put(name, restore(decrypt(encrypted.get())));
            } catch (DecryptionException e) {
                log.warn("Leaving field encrypted after failed decryption field={} reason={}", name, e.getMessage());
            }
        }
        return result;
    }

    public Map<String, Object> decryptFields(Map<String, ?> source, SensitiveFields preset) {
        return decryptFields(source, preset.fields());
    }

    /**
     * True when the string is the JSON form of an {@link EncryptedField}.
     */
    public boolean looksEncrypted(String value) {
        if (value == null || !value.trim().startsWith("{")) {
            return false;
        }
        return parseField(value).isPresent();
    }

    public Optional<EncryptedField> parseField(String json) {
        try {
            Map<String, Object> map = objectMapper.readValue(json, MAP_TYPE);
            return EncryptedField.fromMap(map);
        } catch (JsonProcessingException e) {
            return Optional.empty();
        }
    }

    public String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Value cannot be serialised to JSON", e);
        }
    }

    // values written as raw text rather than JSON come back as the plain string
    private Object restore(String decrypted) {
        if (decrypted.isBlank()) {
            return decrypted;
        }
        try {
            return strictReader.readValue(decrypted);
        } catch (JsonProcessingException e) {
            return decrypted;
        }
    }
}
