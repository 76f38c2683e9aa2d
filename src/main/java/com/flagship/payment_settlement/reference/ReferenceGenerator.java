package com.flagship.payment_settlement.reference;

import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Allocates organization-scoped references from a counter row per
 * (organization, kind).
 *
 * <p>The counter is advanced with one atomic {@code INSERT ... ON CONFLICT DO UPDATE ...
 * RETURNING}; concurrent callers serialize on the row lock held by the upsert, so no two
 * of them can see the same value. The caller's transaction owns the lock, which means a
 * rolled-back entity also gives its number back.
 */
@Service
@Slf4j
public class ReferenceGenerator {

    @PersistenceContext
    private EntityManager entityManager;

    private final Clock clock;

    public ReferenceGenerator(Clock clock) {
        this.clock = clock;
    }

    @Transactional
    public String nextReference(UUID organizationId, String organizationName, ReferenceKind kind) {
        long sequence = nextSequence(organizationId, kind);
        String reference = ReferenceFormatter.format(kind, organizationName, LocalDate.now(clock), sequence);
        log.debug("Allocated reference {} for organization {}", reference, organizationId);
        return reference;
    }

    @Transactional
    public long nextSequence(UUID organizationId, ReferenceKind kind) {
        Object result = entityManager
                .createNativeQuery(
                        "INSERT INTO reference_counters (organization_id, entity_kind, next_value)"
                                + " VALUES (:organizationId, :kind, 2)"
                                + " ON CONFLICT (organization_id, entity_kind)"
                                + " DO UPDATE SET next_value = reference_counters.next_value + 1,"
                                + " updated_at = now()"
                                + " RETURNING next_value - 1")
                .setParameter("organizationId", organizationId)
                .setParameter("kind", kind.name())
                .getSingleResult();
        return ((Number) result).longValue();
    }
}
