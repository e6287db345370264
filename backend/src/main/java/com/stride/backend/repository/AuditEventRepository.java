package com.stride.backend.repository;

import com.stride.backend.model.AuditEvent;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;

public interface AuditEventRepository extends JpaRepository<AuditEvent, String> {

    long countByTimestampBetween(Instant from, Instant to);

    @Modifying
    @Query("delete from AuditEvent e where e.timestamp < :cutoff")
    int deleteOlderThan(@Param("cutoff") Instant cutoff);
}
