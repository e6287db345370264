package com.stride.backend.service.secrets;

import java.util.Optional;

/**
 * Source of key material such as {@code JWT_SECRET} and {@code DATA_ENCRYPTION_KEY}.
 * Implementations return trimmed values and never log them.
 */
public interface SecretsProvider {

    Optional<String> getSecret(String key);

    /** Label used in startup logs to say where a secret came from. */
    default String name() {
        return getClass().getSimpleName();
    }
}
