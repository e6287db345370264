package com.stride.backend.service;

import com.stride.backend.audit.AuditService;
import com.stride.backend.security.TokenService;
import lombok.RequiredArgsConstructor;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * Periodic housekeeping for the revocation set and the audit log.
 */
@Service
@RequiredArgsConstructor
public class SecurityMaintenanceScheduler {

    private final TokenService tokenService;
    private final AuditService auditService;
    private final ScheduledTaskGuard scheduledTaskGuard;

    @Scheduled(fixedDelayString = "${stride.security.jwt.revocation-purge-interval:PT10M}",
            initialDelayString = "${stride.security.jwt.revocation-purge-interval:PT10M}")
    public void purgeRevocations() {
        scheduledTaskGuard.run("revocationPurge", tokenService::purgeExpiredRevocations);
    }

    @Scheduled(fixedDelayString = "${stride.audit.cleanup-interval:PT24H}",
            initialDelayString = "${stride.audit.cleanup-interval:PT24H}")
    public void cleanupAuditLog() {
        scheduledTaskGuard.run("auditRetention", auditService::cleanup);
    }
}
