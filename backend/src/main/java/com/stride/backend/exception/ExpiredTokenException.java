package com.stride.backend.exception;

public class ExpiredTokenException extends TokenException {

    public ExpiredTokenException(String message) {
        super(Reason.EXPIRED, message);
    }

    public ExpiredTokenException(String message, Throwable cause) {
        super(Reason.EXPIRED, message, cause);
    }
}
