package com.stride.backend.exception;

/**
 * Base type for every bearer-token failure.
 *
 * The set of reasons is closed: callers that need to react differently per
 * failure switch over {@link #getReason()} instead of catching subclasses.
 * HTTP responses never expose the reason; it is for logging and metrics only.
 */
public abstract class TokenException extends RuntimeException {

    public enum Reason {
        MALFORMED,
        EXPIRED,
        WRONG_TYPE,
        INVALID_SIGNATURE,
        REVOKED
    }

    private final Reason reason;

    protected TokenException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    protected TokenException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }

    /**
     * Metric/audit friendly name, e.g. {@code wrong_type}.
     */
    public String reasonCode() {
        return reason.name().toLowerCase();
    }
}
