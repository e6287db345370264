package com.stride.backend.repository;

import com.stride.backend.model.RevokedToken;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;

public interface RevokedTokenRepository extends JpaRepository<RevokedToken, String> {

    boolean existsByJtiAndExpiresAtAfter(String jti, Instant now);

    @Modifying
    @Query("delete from RevokedToken t where t.jti = :jti and t.expiresAt <= :now")
    int deleteExpired(@Param("jti") String jti, @Param("now") Instant now);

    @Modifying
    @Query("delete from RevokedToken t where t.expiresAt <= :now")
    int deleteAllExpired(@Param("now") Instant now);
}
