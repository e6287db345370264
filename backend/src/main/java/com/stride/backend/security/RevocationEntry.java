package com.stride.backend.security;

import java.time.Instant;
import java.util.Objects;

/**
 * A revoked token id. The entry only matters until the token would have
 * expired anyway; after that it is treated as absent.
 */
public record RevocationEntry(String jti, Instant expiresAt) {

    public RevocationEntry {
        Objects.requireNonNull(jti, "jti");
        Objects.requireNonNull(expiresAt, "expiresAt");
    }

    public boolean isActive(Instant now) {
        return now.isBefore(expiresAt);
    }
}
