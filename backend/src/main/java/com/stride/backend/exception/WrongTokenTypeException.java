package com.stride.backend.exception;

public class WrongTokenTypeException extends TokenException {

    public WrongTokenTypeException(String message) {
        super(Reason.WRONG_TYPE, message);
    }

    public WrongTokenTypeException(String message, Throwable cause) {
        super(Reason.WRONG_TYPE, message, cause);
    }
}
