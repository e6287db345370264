package com.stride.backend.crypto;

import java.util.List;

/**
 * Named field lists for {@link DataEncryptionService#encryptFields}.
 */
public enum SensitiveFields {
    USER(List.of("email", "phone", "address", "fullName")),
    AUTH(List.of("password", "resetToken", "mfaSecret")),
    PAYMENT(List.of("cardNumber", "accountNumber", "routingNumber")),
    PERSONAL(List.of("ssn", "taxId", "driversLicense")),
    MEDICAL(List.of("medicalConditions", "medications", "allergies"));

    private final List<String> fields;

    SensitiveFields(List<String> fields) {
        this.fields = fields;
    }

    public List<String> fields() {
        return fields;
    }
}
