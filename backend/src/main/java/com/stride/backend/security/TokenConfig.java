package com.stride.backend.security;

import com.stride.backend.config.SecurityProperties;
import com.stride.backend.exception.ConfigurationException;
import com.stride.backend.service.secrets.SecretsManagerService;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.time.Clock;
import java.util.Optional;

@Slf4j
@Configuration
public class TokenConfig {

    static final String SECRET_ENV = "JWT_SECRET";
    static final String SECRET_PROPERTY = "stride.security.jwt.secret";
    static final int MIN_SECRET_LENGTH = 32;

    @Bean
    public TokenSigner tokenSigner(SecretsManagerService secretsManagerService,
                                   SecurityProperties securityProperties,
                                   Clock clock) {
        Optional<String> secret = secretsManagerService.resolve(SECRET_ENV, SECRET_PROPERTY);
        byte[] keyBytes;
        if (secret.isPresent() && secret.get().length() >= MIN_SECRET_LENGTH) {
            keyBytes = secret.get().getBytes(StandardCharsets.UTF_8);
        } else {
            String reason = secret.isEmpty()
                    ? "Missing JWT secret. Set JWT_SECRET environment variable."
                    : "JWT secret must be at least " + MIN_SECRET_LENGTH + " characters.";
            if (secretsManagerService.isProduction()) {
                log.error(reason);
                throw new ConfigurationException(reason);
            }
            log.error("{} Using an ephemeral key; tokens will not survive a restart.", reason);
            keyBytes = new byte[MIN_SECRET_LENGTH];
            new SecureRandom().nextBytes(keyBytes);
        }
        SecurityProperties.Jwt jwt = securityProperties.getJwt();
        return new JwtTokenSigner(Keys.hmacShaKeyFor(keyBytes), jwt.getIssuer(), jwt.getAudience(), clock);
    }
}
