package com.stride.backend.service;

import com.stride.backend.audit.AuditAction;
import com.stride.backend.audit.AuditContext;
import com.stride.backend.audit.AuditOutcome;
import com.stride.backend.audit.AuditService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.HashMap;

@Service
@Slf4j
@RequiredArgsConstructor
public class ScheduledTaskGuard {

    private final AuditService auditService;

    public void run(String taskName, Runnable task) {
        try {
            task.run();
        } catch (Exception e) {
            log.error("Scheduled task failed task={}", taskName, e);
            HashMap<String, Object> metadata = new HashMap<>();
            metadata.put("task", taskName);
            metadata.put("error", String.valueOf(e.getMessage()));
            auditService.logEvent(AuditAction.SYSTEM_MAINTENANCE, "scheduler", AuditOutcome.FAILURE,
                    AuditContext.builder().details(metadata).build());
        }
    }
}
