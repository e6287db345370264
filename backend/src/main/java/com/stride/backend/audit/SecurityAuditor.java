package com.stride.backend.audit;

import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Presets for attacks, suspicious traffic and access-control outcomes.
 */
@Component
@RequiredArgsConstructor
public class SecurityAuditor {

    static final String SYSTEM = "system";

    private final AuditService auditService;

    public void suspiciousActivity(HttpServletRequest request, String activity, Map<String, Object> details) {
        auditService.logEvent(AuditAction.SECURITY_SUSPICIOUS_ACTIVITY, SYSTEM, AuditOutcome.BLOCKED,
                context(request, null, merge("activity", activity, details)));
    }

    public void attackDetected(HttpServletRequest request, String attackType, Map<String, Object> details) {
        auditService.logEvent(AuditAction.SECURITY_ATTACK_DETECTED, SYSTEM, AuditOutcome.BLOCKED,
                context(request, null, merge("attackType", attackType, details)));
    }

    public void rateLimitExceeded(HttpServletRequest request, String endpoint) {
        auditService.logEvent(AuditAction.SECURITY_RATE_LIMIT_EXCEEDED, endpoint, AuditOutcome.BLOCKED,
                context(request, null, null));
    }

    public void accessDenied(HttpServletRequest request, String userId, String resource) {
        auditService.logEvent(AuditAction.AUTHZ_ACCESS_DENIED, resource, AuditOutcome.FAILURE,
                context(request, userId, null));
    }

    public void privilegeEscalationAttempt(HttpServletRequest request, String userId, String resource) {
        auditService.logEvent(AuditAction.AUTHZ_PRIVILEGE_ESCALATION, resource, AuditOutcome.BLOCKED,
                context(request, userId, null));
    }

    /**
     * Records rejected input; {@code action} must be one of the {@code validation.*} actions.
     */
    public void validationFailure(HttpServletRequest request, AuditAction action, String resource,
                                  Map<String, Object> details) {
        if (!"validation".equals(action.family())) {
            throw new IllegalArgumentException("Not a validation action: " + action.code());
        }
        auditService.logEvent(action, resource, AuditOutcome.BLOCKED, context(request, null, details));
    }

    private static AuditContext context(HttpServletRequest request, String userId, Map<String, Object> details) {
        return AuditContext.from(request).userId(userId).details(details).build();
    }

    private static Map<String, Object> merge(String key, Object value, Map<String, Object> details) {
        Map<String, Object> merged = new LinkedHashMap<>();
        merged.put(key, value);
        if (details != null) {
            merged.putAll(details);
        }
        return merged;
    }
}
