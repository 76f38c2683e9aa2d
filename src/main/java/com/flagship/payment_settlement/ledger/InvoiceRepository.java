package com.flagship.payment_settlement.ledger;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface InvoiceRepository extends JpaRepository<Invoice, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT i FROM Invoice i WHERE i.id = :id")
    Optional<Invoice> findByIdForUpdate(@Param("id") UUID id);

    @Query("""
        SELECT i.id FROM Invoice i
        WHERE i.dueDate < :today
          AND i.status IN :statuses
          AND i.amountPaid = 0
        """)
    List<UUID> findOverdueCandidates(@Param("today") LocalDate today,
                                     @Param("statuses") Collection<InvoiceStatus> statuses);
}
