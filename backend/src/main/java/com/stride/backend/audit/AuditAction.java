package com.stride.backend.audit;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

public enum AuditAction {
    // authentication
    AUTH_LOGIN("auth.login"),
    AUTH_LOGOUT("auth.logout"),
    AUTH_REGISTER("auth.register"),
    AUTH_PASSWORD_CHANGE("auth.password_change"),
    AUTH_PASSWORD_RESET("auth.password_reset"),
    AUTH_TOKEN_REFRESH("auth.token_refresh"),
    AUTH_TOKEN_INVALID("auth.token_invalid"),
    AUTH_MFA_ENABLE("auth.mfa_enable"),
    AUTH_MFA_DISABLE("auth.mfa_disable"),
    AUTH_SESSION_TIMEOUT("auth.session_timeout"),
    // authorization
    AUTHZ_ACCESS_GRANTED("authz.access_granted"),
    AUTHZ_ACCESS_DENIED("authz.access_denied"),
    AUTHZ_PRIVILEGE_ESCALATION("authz.privilege_escalation"),
    AUTHZ_ROLE_CHANGE("authz.role_change"),
    // input validation
    VALIDATION_SQL_INJECTION("validation.sql_injection_attempt"),
    VALIDATION_COMMAND_INJECTION("validation.command_injection_attempt"),
    VALIDATION_XSS("validation.xss_attempt"),
    VALIDATION_PATH_TRAVERSAL("validation.path_traversal_attempt"),
    VALIDATION_INVALID_INPUT("validation.invalid_input"),
    // data
    DATA_CREATE("data.create"),
    DATA_READ("data.read"),
    DATA_UPDATE("data.update"),
    DATA_DELETE("data.delete"),
    DATA_EXPORT("data.export"),
    DATA_IMPORT("data.import"),
    DATA_BACKUP("data.backup"),
    DATA_RESTORE("data.restore"),
    // security
    SECURITY_ATTACK_DETECTED("security.attack_detected"),
    SECURITY_RATE_LIMIT_EXCEEDED("security.rate_limit_exceeded"),
    SECURITY_SUSPICIOUS_ACTIVITY("security.suspicious_activity"),
    SECURITY_POLICY_VIOLATION("security.policy_violation"),
    SECURITY_ENCRYPTION_FAILURE("security.encryption_failure"),
    SECURITY_CERTIFICATE_ERROR("security.certificate_error"),
    // system
    SYSTEM_STARTUP("system.startup"),
    SYSTEM_SHUTDOWN("system.shutdown"),
    SYSTEM_CONFIG_CHANGE("system.config_change"),
    SYSTEM_BACKUP("system.backup"),
    SYSTEM_MAINTENANCE("system.maintenance"),
    // admin
    ADMIN_USER_CREATE("admin.user_create"),
    ADMIN_USER_DELETE("admin.user_delete"),
    ADMIN_USER_SUSPEND("admin.user_suspend"),
    ADMIN_SETTINGS_CHANGE("admin.settings_change"),
    ADMIN_SYSTEM_ACCESS("admin.system_access");

    private final String code;

    AuditAction(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public String family() {
        return code.substring(0, code.indexOf('.'));
    }

    /** Metric-safe form, e.g. {@code auth_login}. */
    public String metricName() {
        return code.replace('.', '_');
    }

    public static Optional<AuditAction> fromCode(String code) {
        return Arrays.stream(values()).filter(a -> a.code.equals(code)).findFirst();
    }

    @JsonCreator
    public static AuditAction parse(String code) {
        return fromCode(code).orElseThrow(() -> new IllegalArgumentException("Unknown audit action: " + code));
    }
}
