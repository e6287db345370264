package com.stride.backend.audit;

import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class DataAuditor {

    private final AuditService auditService;

    public void create(HttpServletRequest request, String userId, String resource, String resourceId, AuditOutcome outcome) {
        log(AuditAction.DATA_CREATE, request, userId, resource, resourceId, outcome);
    }

    public void read(HttpServletRequest request, String userId, String resource, String resourceId) {
        log(AuditAction.DATA_READ, request, userId, resource, resourceId, AuditOutcome.SUCCESS);
    }

    public void update(HttpServletRequest request, String userId, String resource, String resourceId, AuditOutcome outcome) {
        log(AuditAction.DATA_UPDATE, request, userId, resource, resourceId, outcome);
    }

    public void delete(HttpServletRequest request, String userId, String resource, String resourceId, AuditOutcome outcome) {
        log(AuditAction.DATA_DELETE, request, userId, resource, resourceId, outcome);
    }

    private void log(AuditAction action, HttpServletRequest request, String userId, String resource,
                     String resourceId, AuditOutcome outcome) {
        auditService.logEvent(action, resource, outcome, AuditContext.from(request)
                .userId(userId)
                .resourceId(resourceId)
                .build());
    }
}
