package com.flagship.payment_settlement.integration;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface ApiLogRepository extends JpaRepository<ApiLog, UUID> {

    List<ApiLog> findByCorrelationIdOrderByRequestTimestampAsc(String correlationId);

    List<ApiLog> findByExternalIdOrderByRequestTimestampAsc(String externalId);

    List<ApiLog> findByPaymentIdOrderByRequestTimestampAsc(UUID paymentId);

    List<ApiLog> findByIntegrationIdAndRequestTypeOrderByRequestTimestampAsc(UUID integrationId,
                                                                             ApiRequestType requestType);
}
