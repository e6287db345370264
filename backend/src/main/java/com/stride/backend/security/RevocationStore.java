package com.stride.backend.security;

import java.time.Instant;

/**
 * Set of revoked token ids. Implementations must be safe for concurrent use.
 */
public interface RevocationStore {

    /**
     * Adds the entry unless an active entry for the same id exists.
     *
     * @return true if this call revoked the token, false if it was already revoked
     */
    boolean revoke(RevocationEntry entry, Instant now);

    /**
     * Lookup with lazy expiry: an entry past its expiry counts as absent and may
     * be removed here.
     */
    boolean isRevoked(String jti, Instant now);

    /**
     * Physically removes expired entries and returns how many were dropped.
     */
    int purgeExpired(Instant now);

    int size();
}
