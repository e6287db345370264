package com.stride.backend.exception;

public class MalformedTokenException extends TokenException {

    public MalformedTokenException(String message) {
        super(Reason.MALFORMED, message);
    }

    public MalformedTokenException(String message, Throwable cause) {
        super(Reason.MALFORMED, message, cause);
    }
}
