package com.flagship.payment_settlement.integration;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Provider audit trail.
 *
 * Every write runs in its own transaction: a webhook that is rejected, or whose
 * reconciliation rolls back, still leaves its row behind.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ApiLogService {

    private final ApiLogRepository apiLogRepository;
    private final IntegrationRepository integrationRepository;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public ApiLog record(ApiLog.ApiLogBuilder entry) {
        ApiLog saved = apiLogRepository.save(entry.build());
        log.debug("Audit {} {} -> {} ({})", saved.getRequestType(), saved.getEndpoint(),
                saved.getStatus(), saved.getCorrelationId());
        return saved;
    }

    /**
     * Records an outbound call and bumps the integration's usage counters in the same
     * transaction.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public ApiLog recordOutbound(ApiLog.ApiLogBuilder entry) {
        ApiLog saved = apiLogRepository.save(entry.build());
        if (saved.getIntegrationId() != null) {
            boolean success = saved.getStatus() == ApiLogStatus.SUCCESS;
            integrationRepository.recordUsage(saved.getIntegrationId(),
                    success ? 1 : 0, success ? 0 : 1, Instant.now());
        }
        return saved;
    }

    @Transactional(readOnly = true)
    public List<ApiLog> findByCorrelationId(String correlationId) {
        return apiLogRepository.findByCorrelationIdOrderByRequestTimestampAsc(correlationId);
    }

    @Transactional(readOnly = true)
    public List<ApiLog> findByExternalId(String externalId) {
        return apiLogRepository.findByExternalIdOrderByRequestTimestampAsc(externalId);
    }

    @Transactional(readOnly = true)
    public List<ApiLog> findByPayment(UUID paymentId) {
        return apiLogRepository.findByPaymentIdOrderByRequestTimestampAsc(paymentId);
    }

    @Transactional(readOnly = true)
    public List<ApiLog> findByIntegration(UUID integrationId, ApiRequestType requestType) {
        return apiLogRepository.findByIntegrationIdAndRequestTypeOrderByRequestTimestampAsc(integrationId, requestType);
    }
}
