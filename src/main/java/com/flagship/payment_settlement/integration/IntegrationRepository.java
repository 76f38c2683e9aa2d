package com.flagship.payment_settlement.integration;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Repository
public interface IntegrationRepository extends JpaRepository<Integration, UUID> {

    List<Integration> findByOrganizationIdAndProviderAndStatus(UUID organizationId, String provider,
                                                               IntegrationStatus status);

    /**
     * Counters are bumped in SQL so concurrent dispatches do not lose updates.
     */
    @Modifying
    @Query("""
        UPDATE Integration i
        SET i.totalRequests = i.totalRequests + 1,
            i.successfulRequests = i.successfulRequests + :success,
            i.failedRequests = i.failedRequests + :failure,
            i.lastUsedAt = :usedAt
        WHERE i.id = :id
        """)
    int recordUsage(@Param("id") UUID id,
                    @Param("success") long success,
                    @Param("failure") long failure,
                    @Param("usedAt") Instant usedAt);
}
