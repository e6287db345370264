package com.stride.backend.crypto;

import com.stride.backend.exception.DecryptionException;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Stores a string column as the JSON of an {@link EncryptedField}.
 *
 * Values written before encryption was enabled are read back as they are.
 * A value that fails to decrypt is returned still encrypted instead of
 * failing the whole entity load.
 */
@Slf4j
@Component
@Converter
@RequiredArgsConstructor
public class EncryptedFieldConverter implements AttributeConverter<String, String> {

    private final DataEncryptionService dataEncryptionService;

    @Override
    public String convertToDatabaseColumn(String attribute) {
        if (attribute == null || dataEncryptionService.looksEncrypted(attribute)) {
            return attribute;
        }
        return dataEncryptionService.toJson(dataEncryptionService.encrypt(attribute));
    }

    @Override
    public String convertToEntityAttribute(String dbData) {
        if (dbData == null) {
            return null;
        }
        Optional<EncryptedField> field = dataEncryptionService.parseField(dbData);
        if (field.isEmpty()) {
            return dbData;
        }
        try {
            return dataEncryptionService.decrypt(field.get());
        } catch (DecryptionException e) {
            log.error("Failed to decrypt column value: {}", e.getMessage());
            return dbData;
        }
    }
}
