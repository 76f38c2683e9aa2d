package com.flagship.payment_settlement.notification;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface NotificationRepository extends JpaRepository<Notification, UUID> {

    /**
     * Claims the next due notification. SKIP LOCKED lets several workers drain the
     * queue without handing the same row to two of them.
     */
    @Query(value = """
        SELECT * FROM notifications
        WHERE (status = 'PENDING' AND (scheduled_for IS NULL OR scheduled_for <= :now))
           OR (status = 'FAILED' AND next_attempt_at IS NOT NULL AND next_attempt_at <= :now)
        ORDER BY CASE priority
                     WHEN 'URGENT' THEN 0
                     WHEN 'HIGH' THEN 1
                     WHEN 'NORMAL' THEN 2
                     ELSE 3
                 END,
                 created_at
        LIMIT 1
        FOR UPDATE SKIP LOCKED
        """, nativeQuery = true)
    Optional<Notification> claimNextDue(@Param("now") Instant now);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT n FROM Notification n WHERE n.id = :id")
    Optional<Notification> findByIdForUpdate(@Param("id") UUID id);

    long countByPaymentId(UUID paymentId);

    long countByStatus(NotificationStatus status);

    List<Notification> findByPaymentIdOrderByCreatedAtAsc(UUID paymentId);

    List<Notification> findByInvoiceIdOrderByCreatedAtAsc(UUID invoiceId);
}
