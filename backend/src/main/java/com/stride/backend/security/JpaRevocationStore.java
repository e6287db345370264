package com.stride.backend.security;

import com.stride.backend.model.RevokedToken;
import com.stride.backend.repository.RevokedTokenRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.util.Optional;

/**
 * Revocation set kept in the {@code revoked_tokens} table so it survives
 * restarts and is shared by every instance.
 */
@Slf4j
@Component
@ConditionalOnProperty(prefix = "stride.security.jwt", name = "revocation-store", havingValue = "jpa")
public class JpaRevocationStore implements RevocationStore {

    private final RevokedTokenRepository revokedTokenRepository;
    private final TransactionTemplate requiresNew;

    public JpaRevocationStore(RevokedTokenRepository revokedTokenRepository,
                              PlatformTransactionManager transactionManager) {
        this.revokedTokenRepository = revokedTokenRepository;
        this.requiresNew = new TransactionTemplate(transactionManager);
        this.requiresNew.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    /**
     * Runs in its own transaction so that a concurrent insert of the same
     * {@code jti} surfaces here as a key conflict, which counts as already revoked.
     */
    @Override
    public boolean revoke(RevocationEntry entry, Instant now) {
        try {
            return Boolean.TRUE.equals(requiresNew.execute(status -> insertOrRenew(entry, now)));
        } catch (DataIntegrityViolationException e) {
            log.debug("Concurrent revocation of jti={} lost the insert", entry.jti());
            return false;
        }
    }

    private boolean insertOrRenew(RevocationEntry entry, Instant now) {
        Optional<RevokedToken> existing = revokedTokenRepository.findById(entry.jti());
        if (existing.isPresent()) {
            RevokedToken token = existing.get();
            if (now.isBefore(token.getExpiresAt())) {
                return false;
            }
            token.setExpiresAt(entry.expiresAt());
            token.setRevokedAt(now);
            revokedTokenRepository.saveAndFlush(token);
            return true;
        }
        revokedTokenRepository.saveAndFlush(RevokedToken.builder()
                .jti(entry.jti())
                .expiresAt(entry.expiresAt())
                .revokedAt(now)
                .build());
        return true;
    }

    @Override
    @Transactional
    public boolean isRevoked(String jti, Instant now) {
        if (revokedTokenRepository.existsByJtiAndExpiresAtAfter(jti, now)) {
            return true;
        }
        revokedTokenRepository.deleteExpired(jti, now);
        return false;
    }

    @Override
    @Transactional
    public int purgeExpired(Instant now) {
        return revokedTokenRepository.deleteAllExpired(now);
    }

    @Override
    public int size() {
        return (int) revokedTokenRepository.count();
    }
}
