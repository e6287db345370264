package com.stride.backend.exception;

public class RevokedTokenException extends TokenException {

    public RevokedTokenException(String message) {
        super(Reason.REVOKED, message);
    }

    public RevokedTokenException(String message, Throwable cause) {
        super(Reason.REVOKED, message, cause);
    }
}
