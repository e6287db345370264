package com.stride.backend.audit;

import java.util.EnumSet;
import java.util.Set;

/**
 * Derives the risk level of an audit event from its action and outcome.
 * The mapping is fixed; callers cannot override it.
 */
public final class RiskClassifier {

    private static final Set<AuditAction> ALWAYS_HIGH = EnumSet.of(
            AuditAction.AUTHZ_ACCESS_DENIED,
            AuditAction.VALIDATION_XSS,
            AuditAction.VALIDATION_PATH_TRAVERSAL);

    private static final Set<AuditAction> CRITICAL_ON_FAILURE = EnumSet.of(
            AuditAction.AUTHZ_PRIVILEGE_ESCALATION,
            AuditAction.SECURITY_ATTACK_DETECTED,
            AuditAction.VALIDATION_SQL_INJECTION,
            AuditAction.VALIDATION_COMMAND_INJECTION);

    private RiskClassifier() {
    }

    public static RiskLevel classify(AuditAction action, AuditOutcome outcome) {
        boolean failed = outcome.isNegative();
        String code = action.code();
        String family = action.family();

        if (ALWAYS_HIGH.contains(action)) {
            return RiskLevel.HIGH;
        }
        if (CRITICAL_ON_FAILURE.contains(action) || "admin".equals(family) || code.endsWith(".delete")) {
            return failed ? RiskLevel.CRITICAL : RiskLevel.HIGH;
        }
        if ("security".equals(family) || code.contains("password") || action == AuditAction.DATA_EXPORT) {
            return failed ? RiskLevel.HIGH : RiskLevel.MEDIUM;
        }
        if ("authz".equals(family)) {
            return failed ? RiskLevel.HIGH : RiskLevel.LOW;
        }
        // auth, data and everything else
        return failed ? RiskLevel.MEDIUM : RiskLevel.LOW;
    }
}
