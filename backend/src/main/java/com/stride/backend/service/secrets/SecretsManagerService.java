package com.stride.backend.service.secrets;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class SecretsManagerService {

    private final List<SecretsProvider> providers;
    private final Environment environment;

    /**
     * Resolves the first non-blank value for any of the given keys, asking every
     * provider before falling back to Spring properties.
     */
    public Optional<String> resolve(String... keys) {
        for (String key : keys) {
            for (SecretsProvider provider : providers) {
                Optional<String> secret = provider.getSecret(key);
                if (secret.isPresent()) {
                    log.info("Resolved {} from {}", key, provider.name());
                    return secret;
                }
            }
        }
        for (String key : keys) {
            String property = environment.getProperty(key);
            if (property != null && !property.isBlank()) {
                log.info("Resolved {} from application properties", key);
                return Optional.of(property.trim());
            }
        }
        return Optional.empty();
    }

    public boolean isProduction() {
        return Arrays.stream(environment.getActiveProfiles())
                .anyMatch(p -> "prod".equalsIgnoreCase(p) || "production".equalsIgnoreCase(p));
    }
}
