package com.flagship.payment_settlement.payment;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface PaymentRepository extends JpaRepository<PaymentEntity, UUID> {

    Optional<PaymentEntity> findByIdempotencyKey(String idempotencyKey);

    Optional<PaymentEntity> findByIdAndOrganizationId(UUID id, UUID organizationId);

    List<PaymentEntity> findByInvoiceIdOrderByCreatedAtAsc(UUID invoiceId);

    List<PaymentEntity> findByPaymentPlanIdOrderByCreatedAtAsc(UUID paymentPlanId);

    /**
     * Row-locks a payment for a transition. Concurrent callers queue behind the lock
     * and then see whatever the first one committed.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM PaymentEntity p WHERE p.id = :id")
    Optional<PaymentEntity> findByIdForUpdate(@Param("id") UUID id);

    /**
     * Correlation lookup for a callback: only payments still waiting for a result can
     * match. The partial unique index on checkout_request_id guarantees at most one row.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("""
        SELECT p FROM PaymentEntity p
        WHERE p.checkoutRequestId = :checkoutRequestId
          AND p.status IN :statuses
        """)
    Optional<PaymentEntity> findByCheckoutRequestIdForUpdate(
            @Param("checkoutRequestId") String checkoutRequestId,
            @Param("statuses") Collection<PaymentStatus> statuses);

    /**
     * Any payment that ever carried the checkout id, newest first. Used to tell a
     * duplicate delivery apart from an orphan callback.
     */
    Optional<PaymentEntity> findFirstByCheckoutRequestIdOrderByCreatedAtDesc(String checkoutRequestId);

    /**
     * Claims a pending payment for dispatch. Returns 0 when another request claimed it
     * first or it is no longer pending.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
        UPDATE PaymentEntity p
        SET p.status = :claimed, p.initiatedAt = :now, p.updatedAt = :now
        WHERE p.id = :id AND p.status = :expected
        """)
    int claimForDispatch(@Param("id") UUID id,
                         @Param("expected") PaymentStatus expected,
                         @Param("claimed") PaymentStatus claimed,
                         @Param("now") Instant now);

    /**
     * Payments whose dispatch was claimed but never recorded provider ids, e.g. the
     * process died during the provider call.
     */
    @Query("""
        SELECT p.id FROM PaymentEntity p
        WHERE p.status = :status
          AND p.checkoutRequestId IS NULL
          AND p.initiatedAt < :cutoff
        """)
    List<UUID> findInterruptedDispatches(@Param("status") PaymentStatus status,
                                         @Param("cutoff") Instant cutoff);

    @Query("""
        SELECT p.id FROM PaymentEntity p
        WHERE p.status IN :statuses
          AND p.checkoutRequestId IS NOT NULL
          AND p.initiatedAt < :cutoff
        """)
    List<UUID> findCallbacksOverdue(@Param("statuses") Collection<PaymentStatus> statuses,
                                    @Param("cutoff") Instant cutoff);

    @Query("""
        SELECT p.status AS status, COUNT(p) AS count, COALESCE(SUM(p.amount), 0) AS total
        FROM PaymentEntity p
        WHERE p.organizationId = :organizationId
        GROUP BY p.status
        """)
    List<StatusTotal> summarizeByStatus(@Param("organizationId") UUID organizationId);

    long countByStatusIn(Collection<PaymentStatus> statuses);

    interface StatusTotal {
        PaymentStatus getStatus();

        Long getCount();

        BigDecimal getTotal();
    }
}
