package com.stride.backend.config;

import com.stride.backend.audit.AuditAction;
import com.stride.backend.audit.AuditOutcome;
import com.stride.backend.audit.AuditService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Records startup and shutdown in the audit log.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LifecycleAuditListener {

    private final AuditService auditService;

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        log.info("Application ready");
        auditService.logEvent(AuditAction.SYSTEM_STARTUP, "system", AuditOutcome.SUCCESS);
    }

    @EventListener(ContextClosedEvent.class)
    public void onShutdown() {
        auditService.logEvent(AuditAction.SYSTEM_SHUTDOWN, "system", AuditOutcome.SUCCESS);
    }
}
