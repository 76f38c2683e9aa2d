package com.flagship.payment_settlement.ledger;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface PaymentPlanRepository extends JpaRepository<PaymentPlan, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM PaymentPlan p WHERE p.id = :id")
    Optional<PaymentPlan> findByIdForUpdate(@Param("id") UUID id);

    @Query("""
        SELECT p.id FROM PaymentPlan p
        WHERE p.status = com.flagship.payment_settlement.ledger.PaymentPlanStatus.ACTIVE
          AND p.endDate < :today
          AND p.balance > 0
        """)
    List<UUID> findOverdueCandidates(@Param("today") LocalDate today);
}
