package com.stride.backend.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.stride.backend.config.AuditProperties;
import com.stride.backend.crypto.DataEncryptionService;
import com.stride.backend.crypto.EncryptedField;
import com.stride.backend.exception.DecryptionException;
import com.stride.backend.exception.ValidationException;
import com.stride.backend.metrics.SecurityMetricsCollector;
import com.stride.backend.model.AuditEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Records and queries security audit events.
 *
 * Writing an event never fails the caller: if the store rejects it, the event
 * is written to the {@code audit.fallback} logger instead.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AuditService {

    private static final Logger fallbackLog = LoggerFactory.getLogger("audit.fallback");

    static final String REDACTED = "[REDACTED]";
    private static final Set<String> REDACTED_KEYS = Set.of("password", "token", "secret", "key", "credential");
    private static final Set<AuditAction> SENSITIVE_ACTIONS = EnumSet.of(
            AuditAction.AUTH_LOGIN,
            AuditAction.AUTH_REGISTER,
            AuditAction.AUTH_PASSWORD_CHANGE,
            AuditAction.AUTH_PASSWORD_RESET,
            AuditAction.DATA_EXPORT,
            AuditAction.ADMIN_USER_CREATE,
            AuditAction.ADMIN_SETTINGS_CHANGE);
    private static final int TOP_N = 10;
    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private final AuditEventStore auditEventStore;
    private final DataEncryptionService dataEncryptionService;
    private final SecurityMetricsCollector securityMetrics;
    private final AuditProperties auditProperties;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public void logEvent(AuditAction action, String resource, AuditOutcome outcome) {
        logEvent(action, resource, outcome, AuditContext.empty());
    }

    public void logEvent(AuditAction action, String resource, AuditOutcome outcome, AuditContext context) {
        AuditContext ctx = context == null ? AuditContext.empty() : context;
        AuditEvent event;
        try {
            event = AuditEvent.builder()
                    .id(UUID.randomUUID().toString())
                    .timestamp(clock.instant())
                    .userId(ctx.getUserId())
                    .action(action)
                    .resource(resource)
                    .resourceId(ctx.getResourceId())
                    .outcome(outcome)
                    .riskLevel(RiskClassifier.classify(action, outcome))
                    .details(serializeDetails(action, ctx.getDetails()))
                    .ipAddress(ctx.getIpAddress())
                    .userAgent(ctx.getUserAgent())
                    .sessionId(ctx.getSessionId())
                    .correlationId(ctx.getCorrelationId() != null ? ctx.getCorrelationId() : MDC.get("correlationId"))
                    .build();
        } catch (RuntimeException e) {
            log.error("Failed to build audit event {} {} {}", action, resource, outcome, e);
            return;
        }

        try {
            auditEventStore.append(event);
        } catch (RuntimeException e) {
            log.error("Failed to persist audit event id={} action={}: {}", event.getId(), action.code(), e.getMessage());
            fallbackLog.warn("{}", event);
            securityMetrics.increment("audit_write_failures");
            return;
        }

        securityMetrics.increment("audit_" + action.metricName());
        securityMetrics.increment("audit_outcome_" + outcome.code());
        securityMetrics.increment("audit_risk_" + event.getRiskLevel().code());

        if (event.getRiskLevel().isElevated()) {
            log.warn("High-risk audit event action={} outcome={} risk={} auditId={} userId={}",
                    action.code(), outcome.code(), event.getRiskLevel().code(), event.getId(), event.getUserId());
        }
    }

    /**
     * Events matching the query, newest first. Sensitive details are decrypted
     * in the returned copies when the key allows it.
     */
    public List<AuditEvent> queryEvents(AuditQuery query) {
        AuditQuery q = query == null ? AuditQuery.all() : query;
        int limit = q.limitOrDefault(auditProperties.getDefaultQueryLimit());
        int offset = q.offsetOrZero();
        if (limit < 1 || limit > auditProperties.getMaxQueryLimit()) {
            throw new ValidationException("limit must be between 1 and " + auditProperties.getMaxQueryLimit());
        }
        if (offset < 0) {
            throw new ValidationException("offset must not be negative");
        }
        if (q.startDate() != null && q.endDate() != null && q.startDate().isAfter(q.endDate())) {
            throw new ValidationException("startDate must not be after endDate");
        }
        return auditEventStore.query(q, limit, offset).stream()
                .map(this::withReadableDetails)
                .toList();
    }

    public AuditStatistics getStatistics(AuditTimeframe timeframe) {
        AuditTimeframe window = timeframe == null ? AuditTimeframe.DAY : timeframe;
        Instant end = clock.instant();
        Instant start = window.startFrom(end);

        return new AuditStatistics(
                window,
                start,
                end,
                auditEventStore.count(start, end),
                auditEventStore.countBy(AuditDimension.ACTION, start, end),
                auditEventStore.countBy(AuditDimension.OUTCOME, start, end),
                auditEventStore.countBy(AuditDimension.RISK_LEVEL, start, end),
                top(auditEventStore.countBy(AuditDimension.USER, start, end)),
                top(auditEventStore.countBy(AuditDimension.RESOURCE, start, end)));
    }

    /**
     * Removes events older than the configured retention.
     */
    public long cleanup() {
        Instant cutoff = clock.instant().minus(auditProperties.getRetentionDays(), ChronoUnit.DAYS);
        long removed = auditEventStore.deleteOlderThan(cutoff);
        if (removed > 0) {
            log.info("Cleaned up {} audit events older than {}", removed, cutoff);
        }
        return removed;
    }

    public Map<String, Object> readDetails(AuditEvent event) {
        if (event.getDetails() == null) {
            return Collections.emptyMap();
        }
        try {
            return objectMapper.readValue(event.getDetails(), MAP_TYPE);
        } catch (JsonProcessingException e) {
            log.warn("Unreadable details on audit event {}", event.getId());
            return Map.of("raw", event.getDetails());
        }
    }

    static boolean isSensitive(AuditAction action) {
        return SENSITIVE_ACTIONS.contains(action);
    }

    static Map<String, Object> sanitize(Map<String, Object> details) {
        Map<String, Object> sanitized = new LinkedHashMap<>(details);
        for (Map.Entry<String, Object> entry : sanitized.entrySet()) {
            if (entry.getValue() != null && REDACTED_KEYS.contains(entry.getKey().toLowerCase(Locale.ROOT))) {
                entry.setValue(REDACTED);
            }
        }
        return sanitized;
    }

    private String serializeDetails(AuditAction action, Map<String, Object> details) {
        if (details == null || details.isEmpty()) {
            return null;
        }
        Map<String, Object> sanitized = sanitize(details);
        if (auditProperties.isEncryptSensitiveDetails() && isSensitive(action)) {
            try {
                return dataEncryptionService.toJson(dataEncryptionService.encryptObject(sanitized));
            } catch (RuntimeException e) {
                log.error("Failed to encrypt audit details for {}; storing them unencrypted", action.code(), e);
                securityMetrics.increment("audit_encryption_failures");
            }
        }
        return dataEncryptionService.toJson(sanitized);
    }

    private AuditEvent withReadableDetails(AuditEvent event) {
        String details = event.getDetails();
        if (details == null || !dataEncryptionService.looksEncrypted(details)) {
            return event;
        }
        EncryptedField field = dataEncryptionService.parseField(details).orElse(null);
        if (field == null) {
            return event;
        }
        try {
            return event.toBuilder().details(dataEncryptionService.decrypt(field)).build();
        } catch (DecryptionException e) {
            log.warn("Could not decrypt details of audit event {}", event.getId());
            return event;
        }
    }

    private static List<AuditStatistics.Count> top(Map<String, Long> counts) {
        return counts.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry.<String, Long>comparingByKey()))
                .limit(TOP_N)
                .map(e -> new AuditStatistics.Count(e.getKey(), e.getValue()))
                .toList();
    }
}
