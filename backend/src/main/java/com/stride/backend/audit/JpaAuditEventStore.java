package com.stride.backend.audit;

import com.stride.backend.model.AuditEvent;
import com.stride.backend.repository.AuditEventRepository;
import jakarta.persistence.EntityManager;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Path;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "stride.audit", name = "storage", havingValue = "jpa", matchIfMissing = true)
public class JpaAuditEventStore implements AuditEventStore {

    private final AuditEventRepository auditEventRepository;
    private final EntityManager entityManager;

    @Override
    @Transactional
    public void append(AuditEvent event) {
        auditEventRepository.save(event);
    }

    @Override
    @Transactional(readOnly = true)
    public List<AuditEvent> query(AuditQuery query, int limit, int offset) {
        CriteriaBuilder cb = entityManager.getCriteriaBuilder();
        CriteriaQuery<AuditEvent> cq = cb.createQuery(AuditEvent.class);
        Root<AuditEvent> root = cq.from(AuditEvent.class);

        List<Predicate> predicates = new ArrayList<>();
        if (query.userId() != null) {
            predicates.add(cb.equal(root.get("userId"), query.userId()));
        }
        if (query.action() != null) {
            predicates.add(cb.equal(root.get("action"), query.action()));
        }
        if (query.resource() != null) {
            predicates.add(cb.equal(root.get("resource"), query.resource()));
        }
        if (query.outcome() != null) {
            predicates.add(cb.equal(root.get("outcome"), query.outcome()));
        }
        if (query.riskLevel() != null) {
            predicates.add(cb.equal(root.get("riskLevel"), query.riskLevel()));
        }
        if (query.startDate() != null) {
            predicates.add(cb.greaterThanOrEqualTo(root.<Instant>get("timestamp"), query.startDate()));
        }
        if (query.endDate() != null) {
            predicates.add(cb.lessThanOrEqualTo(root.<Instant>get("timestamp"), query.endDate()));
        }

        cq.select(root)
                .where(predicates.toArray(new Predicate[0]))
                .orderBy(cb.desc(root.get("timestamp")), cb.desc(root.get("id")));

        return entityManager.createQuery(cq)
                .setFirstResult(offset)
                .setMaxResults(limit)
                .getResultList();
    }

    @Override
    @Transactional(readOnly = true)
    public long count(Instant from, Instant to) {
        return auditEventRepository.countByTimestampBetween(from, to);
    }

    @Override
    @Transactional(readOnly = true)
    public Map<String, Long> countBy(AuditDimension dimension, Instant from, Instant to) {
        CriteriaBuilder cb = entityManager.getCriteriaBuilder();
        CriteriaQuery<Object[]> cq = cb.createQuery(Object[].class);
        Root<AuditEvent> root = cq.from(AuditEvent.class);
        Path<Object> key = root.get(dimension.attribute());

        cq.multiselect(key, cb.count(root))
                .where(cb.between(root.<Instant>get("timestamp"), from, to), cb.isNotNull(key))
                .groupBy(key);

        Map<String, Long> counts = new TreeMap<>();
        for (Object[] row : entityManager.createQuery(cq).getResultList()) {
            counts.put(dimension.keyOf(row[0]), (Long) row[1]);
        }
        return counts;
    }

    @Override
    @Transactional
    public long deleteOlderThan(Instant cutoff) {
        return auditEventRepository.deleteOlderThan(cutoff);
    }
}
