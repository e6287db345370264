package com.stride.backend.crypto;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.stride.backend.config.SecurityProperties;
import com.stride.backend.exception.ConfigurationException;
import com.stride.backend.service.secrets.SecretsManagerService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Optional;

@Slf4j
@Configuration
public class CryptoConfig {

    static final String KEY_ENV = "DATA_ENCRYPTION_KEY";
    static final String KEY_PROPERTY = "stride.security.encryption.key";

    @Bean
    public DataEncryptionService dataEncryptionService(SecretsManagerService secretsManagerService,
                                                      SecurityProperties securityProperties,
                                                      ObjectMapper objectMapper) {
        Optional<String> configured = secretsManagerService.resolve(KEY_ENV, KEY_PROPERTY);
        byte[] key;
        if (configured.isPresent()) {
            key = EncryptionKeys.decode(configured.get());
        } else if (secretsManagerService.isProduction() || securityProperties.getEncryption().isRequireKey()) {
            log.error("{} is not configured", KEY_ENV);
            throw new ConfigurationException(KEY_ENV + " must be set in production");
        } else {
            log.warn("{} not set; using the development encryption key", KEY_ENV);
            key = EncryptionKeys.developmentKey();
        }
        return new DataEncryptionService(EncryptionKeys.toSecretKey(key), objectMapper);
    }
}
