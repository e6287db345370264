package com.stride.backend.crypto;

import com.stride.backend.exception.ConfigurationException;
import org.junit.jupiter.api.Test;

import java.util.Base64;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EncryptionKeysTest {

    @Test
    void generatedKeyDecodesFromBothEncodings() {
        EncryptionKeys.GeneratedKey key = EncryptionKeys.generateKey();

        assertThat(key.hex()).hasSize(64);
        assertThat(EncryptionKeys.decode(key.hex())).isEqualTo(EncryptionKeys.decode(key.base64()));
        assertThat(EncryptionKeys.isValidKey(key.base64())).isTrue();
    }

    @Test
    void wrongLengthIsRejected() {
        String shortKey = Base64.getEncoder().encodeToString(new byte[16]);

        assertThatThrownBy(() -> EncryptionKeys.decode(shortKey))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("32 bytes");
        assertThat(EncryptionKeys.isValidKey(shortKey)).isFalse();
    }

    @Test
    void garbageAndEmptyValuesAreRejected() {
        assertThat(EncryptionKeys.isValidKey("not a key!")).isFalse();
        assertThat(EncryptionKeys.isValidKey("zz".repeat(32))).isFalse();
        assertThat(EncryptionKeys.isValidKey("")).isFalse();
        assertThat(EncryptionKeys.isValidKey(null)).isFalse();
    }

    @Test
    void developmentKeyIsStable() {
        assertThat(EncryptionKeys.developmentKey()).hasSize(32).isEqualTo(EncryptionKeys.developmentKey());
    }
}
