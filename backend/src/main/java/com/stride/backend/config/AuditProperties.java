package com.stride.backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "stride.audit")
@Data
public class AuditProperties {

    /** {@code jpa} or {@code memory}. */
    private String storage = "jpa";
    private int maxMemoryEvents = 10_000;
    private int retentionDays = 365;
    private Duration cleanupInterval = Duration.ofHours(24);
    private boolean encryptSensitiveDetails = true;
    private int defaultQueryLimit = 100;
    private int maxQueryLimit = 1_000;
}
