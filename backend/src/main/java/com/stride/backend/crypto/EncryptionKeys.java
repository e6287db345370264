package com.stride.backend.crypto;

import com.stride.backend.exception.ConfigurationException;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.HexFormat;

/**
 * Parsing and generation of 256-bit data encryption keys.
 *
 * A 64 character value is read as hex, anything else as base64.
 */
public final class EncryptionKeys {

    public static final int KEY_BYTES = 32;

    private static final SecureRandom RNG = new SecureRandom();
    private static final String DEV_KEY_PHRASE = "stride-dev-encryption-key";

    private EncryptionKeys() {
    }

    public record GeneratedKey(String hex, String base64) {
    }

    public static byte[] decode(String encoded) {
        if (encoded == null || encoded.isBlank()) {
            throw new ConfigurationException("Encryption key is empty");
        }
        String value = encoded.trim();
        byte[] bytes;
        try {
            if (value.length() == KEY_BYTES * 2) {
                bytes = HexFormat.of().parseHex(value);
            } else {
                bytes = Base64.getDecoder().decode(value);
            }
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid DATA_ENCRYPTION_KEY format", e);
        }
        if (bytes.length != KEY_BYTES) {
            throw new ConfigurationException("Encryption key must be " + KEY_BYTES + " bytes but was " + bytes.length);
        }
        return bytes;
    }

    public static SecretKey toSecretKey(byte[] keyBytes) {
        if (keyBytes == null || keyBytes.length != KEY_BYTES) {
            throw new ConfigurationException("Encryption key must be " + KEY_BYTES + " bytes");
        }
        return new SecretKeySpec(keyBytes, "AES");
    }

    public static boolean isValidKey(String encoded) {
        try {
            decode(encoded);
            return true;
        } catch (ConfigurationException e) {
            return false;
        }
    }

    public static GeneratedKey generateKey() {
        byte[] key = new byte[KEY_BYTES];
        RNG.nextBytes(key);
        return new GeneratedKey(HexFormat.of().formatHex(key), Base64.getEncoder().encodeToString(key));
    }

    /**
     * Stable key for local development so data written in one run can be read in the next.
     */
    static byte[] developmentKey() {
        try {
            return MessageDigest.getInstance("SHA-256").digest(DEV_KEY_PHRASE.getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
