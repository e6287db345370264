package com.stride.backend.crypto;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class EncryptedFieldConverterTest {

    private final DataEncryptionService service = new DataEncryptionService(
            EncryptionKeys.toSecretKey(EncryptionKeys.developmentKey()), new ObjectMapper());
    private final EncryptedFieldConverter converter = new EncryptedFieldConverter(service);

    @Test
    void columnValueIsEncryptedJson() {
        String column = converter.convertToDatabaseColumn("ann@example.com");

        assertThat(service.looksEncrypted(column)).isTrue();
        assertThat(converter.convertToEntityAttribute(column)).isEqualTo("ann@example.com");
    }

    @Test
    void legacyPlaintextIsReadAsIs() {
        assertThat(converter.convertToEntityAttribute("ann@example.com")).isEqualTo("ann@example.com");
        assertThat(converter.convertToEntityAttribute(null)).isNull();
        assertThat(converter.convertToDatabaseColumn(null)).isNull();
    }

    @Test
    void undecryptableValueIsReturnedRaw() {
        DataEncryptionService other = new DataEncryptionService(
                EncryptionKeys.toSecretKey(EncryptionKeys.decode(EncryptionKeys.generateKey().base64())),
                new ObjectMapper());
        String foreign = other.toJson(other.encrypt("ann@example.com"));

        assertThat(converter.convertToEntityAttribute(foreign)).isEqualTo(foreign);
    }
}
