package com.stride.backend.audit;

import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Authentication presets over {@link AuditService#logEvent}.
 */
@Component
@RequiredArgsConstructor
public class AuthAuditor {

    static final String RESOURCE = "user";

    private final AuditService auditService;

    public void login(HttpServletRequest request, String userId, AuditOutcome outcome, Map<String, Object> details) {
        log(AuditAction.AUTH_LOGIN, request, userId, outcome, details);
    }

    public void register(HttpServletRequest request, String userId, AuditOutcome outcome) {
        log(AuditAction.AUTH_REGISTER, request, userId, outcome, null);
    }

    public void refresh(HttpServletRequest request, String userId, AuditOutcome outcome) {
        log(AuditAction.AUTH_TOKEN_REFRESH, request, userId, outcome, null);
    }

    public void logout(HttpServletRequest request, String userId) {
        log(AuditAction.AUTH_LOGOUT, request, userId, AuditOutcome.SUCCESS, null);
    }

    public void passwordChange(HttpServletRequest request, String userId, AuditOutcome outcome) {
        log(AuditAction.AUTH_PASSWORD_CHANGE, request, userId, outcome, null);
    }

    public void tokenRejected(HttpServletRequest request, String reason) {
        log(AuditAction.AUTH_TOKEN_INVALID, request, null, AuditOutcome.FAILURE, Map.of("reason", reason));
    }

    private void log(AuditAction action, HttpServletRequest request, String userId, AuditOutcome outcome,
                     Map<String, Object> details) {
        auditService.logEvent(action, RESOURCE, outcome, AuditContext.from(request)
                .userId(userId)
                .details(details)
                .build());
    }
}
