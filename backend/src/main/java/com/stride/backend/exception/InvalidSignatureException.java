package com.stride.backend.exception;

public class InvalidSignatureException extends TokenException {

    public InvalidSignatureException(String message) {
        super(Reason.INVALID_SIGNATURE, message);
    }

    public InvalidSignatureException(String message, Throwable cause) {
        super(Reason.INVALID_SIGNATURE, message, cause);
    }
}
