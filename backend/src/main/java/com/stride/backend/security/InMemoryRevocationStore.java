package com.stride.backend.security;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Process-local revocation set. Entries are lost on restart and not shared
 * between instances; use the JPA store when either matters.
 */
@Component
@ConditionalOnProperty(prefix = "stride.security.jwt", name = "revocation-store", havingValue = "memory", matchIfMissing = true)
public class InMemoryRevocationStore implements RevocationStore {

    private final ConcurrentHashMap<String, RevocationEntry> entries = new ConcurrentHashMap<>();

    @Override
    public boolean revoke(RevocationEntry entry, Instant now) {
        AtomicBoolean inserted = new AtomicBoolean(false);
        entries.compute(entry.jti(), (jti, existing) -> {
            if (existing != null && existing.isActive(now)) {
                return existing;
            }
            inserted.set(true);
            return entry;
        });
        return inserted.get();
    }

    @Override
    public boolean isRevoked(String jti, Instant now) {
        RevocationEntry entry = entries.get(jti);
        if (entry == null) {
            return false;
        }
        if (entry.isActive(now)) {
            return true;
        }
        // only drops this exact entry, never one inserted concurrently
        entries.remove(jti, entry);
        return false;
    }

    @Override
    public int purgeExpired(Instant now) {
        int removed = 0;
        for (RevocationEntry entry : entries.values()) {
            if (!entry.isActive(now) && entries.remove(entry.jti(), entry)) {
                removed++;
            }
        }
        return removed;
    }

    @Override
    public int size() {
        return entries.size();
    }
}
