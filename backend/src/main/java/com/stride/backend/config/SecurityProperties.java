package com.stride.backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Configuration
@ConfigurationProperties(prefix = "stride.security")
@Data
public class SecurityProperties {

    private Jwt jwt = new Jwt();
    private Encryption encryption = new Encryption();
    private Cors cors = new Cors();
    private int bcryptRounds = 12;
    private boolean publicHealthEndpoint = true;
    /** Accounts granted ROLE_ADMIN (audit queries, metrics reset). */
    private List<String> adminEmails = new ArrayList<>();

    @Data
    public static class Jwt {
        private String issuer = "stride-app";
        private String audience = "stride-app-users";
        private Duration accessTtl = Duration.ofHours(1);
        private Duration refreshTtl = Duration.ofDays(7);
        /**
         * Issue a new refresh token and revoke the presented one on every refresh.
         * Turning this off keeps a refresh token valid for its whole lifetime even
         * after it has been used.
         */
        private boolean rotateRefreshTokens = true;
        private String revocationStore = "memory";
        private Duration revocationPurgeInterval = Duration.ofMinutes(10);
    }

    @Data
    public static class Encryption {
        /** Treat a missing {@code DATA_ENCRYPTION_KEY} as fatal outside the prod profile too. */
        private boolean requireKey = false;
    }

    @Data
    public static class Cors {
        private List<String> allowedOrigins = new ArrayList<>();
        private List<String> allowedMethods = List.of("GET", "POST", "PUT", "DELETE", "OPTIONS");
    }
}
