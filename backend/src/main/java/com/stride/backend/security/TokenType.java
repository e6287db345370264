package com.stride.backend.security;

import java.util.Arrays;
import java.util.Optional;

public enum TokenType {
    ACCESS("access"),
    REFRESH("refresh");

    private final String code;

    TokenType(String code) {
        this.code = code;
    }

    /** Value of the {@code type} claim. */
    public String code() {
        return code;
    }

    public static Optional<TokenType> fromCode(String code) {
        return Arrays.stream(values()).filter(t -> t.code.equals(code)).findFirst();
    }
}
