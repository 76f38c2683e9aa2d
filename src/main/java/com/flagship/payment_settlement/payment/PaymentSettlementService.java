package com.flagship.payment_settlement.payment;

import com.flagship.payment_settlement.exception.InvalidSignatureException;
import com.flagship.payment_settlement.integration.ApiLog;
import com.flagship.payment_settlement.integration.ApiLogService;
import com.flagship.payment_settlement.integration.ApiLogStatus;
import com.flagship.payment_settlement.integration.ApiRequestType;
import com.flagship.payment_settlement.integration.Integration;
import com.flagship.payment_settlement.integration.IntegrationService;
import com.flagship.payment_settlement.observability.CorrelationContext;
import com.flagship.payment_settlement.observability.SettlementMetrics;
import com.flagship.payment_settlement.outbox.OutboxService;
import com.flagship.payment_settlement.payment.event.PaymentFailedEvent;
import com.flagship.payment_settlement.provider.MoneyMovementProvider;
import com.flagship.payment_settlement.provider.daraja.StkCallback;
import com.flagship.payment_settlement.provider.daraja.StkCallbackParser;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Applies provider callbacks to payments.
 *
 * <p>Order of work for one callback:
 * <ol>
 *   <li>resolve the integration from the callback URL and verify the body's signature
 *       against its webhook secret; nothing is touched when this fails</li>
 *   <li>parse the result and row-lock the payment still awaiting it</li>
 *   <li>apply the transition and, on success, every settlement effect in the same
 *       transaction</li>
 *   <li>write the audit row in its own transaction, whatever happened</li>
 * </ol>
 *
 * Redelivered, late and unknown callbacks are acknowledged without changes so the
 * provider stops retrying them.
 */
@Service
@Slf4j
public class PaymentSettlementService {

    static final String WEBHOOK_ENDPOINT = "/webhooks/mpesa/";

    private final IntegrationService integrationService;
    private final MoneyMovementProvider provider;
    private final StkCallbackParser callbackParser;
    private final PaymentPersistenceService persistenceService;
    private final SettlementEffects settlementEffects;
    private final OutboxService outboxService;
    private final ApiLogService apiLogService;
    private final SettlementMetrics metrics;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public PaymentSettlementService(IntegrationService integrationService,
                                    MoneyMovementProvider provider,
                                    StkCallbackParser callbackParser,
                                    PaymentPersistenceService persistenceService,
                                    SettlementEffects settlementEffects,
                                    OutboxService outboxService,
                                    ApiLogService apiLogService,
                                    SettlementMetrics metrics,
                                    PlatformTransactionManager transactionManager,
                                    Clock clock) {
        this.integrationService = integrationService;
        this.provider = provider;
        this.callbackParser = callbackParser;
        this.persistenceService = persistenceService;
        this.settlementEffects = settlementEffects;
        this.outboxService = outboxService;
        this.apiLogService = apiLogService;
        this.metrics = metrics;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
    }

    /**
     * @param integrationId integration named in the callback URL
     * @param rawBody       body exactly as received; the signature covers these bytes
     * @param signature     value of the signature header, may be null
     * @throws InvalidSignatureException if the integration is unknown or the signature
     *                                   is missing or wrong
     */
    public ReconciliationResult reconcileCallback(UUID integrationId, String rawBody, String signature) {
        long startTime = System.currentTimeMillis();
        Instant receivedAt = Instant.now(clock);
        ApiLog.ApiLogBuilder audit = ApiLog.builder()
                .integrationId(integrationId)
                .requestType(ApiRequestType.WEBHOOK)
                .endpoint(WEBHOOK_ENDPOINT + integrationId)
                .method("POST")
                .requestBody(rawBody)
                .requestTimestamp(receivedAt);

        Optional<Integration> integration = integrationService.findById(integrationId);
        if (integration.isEmpty()) {
            rejectSignature(audit, startTime, "Unknown integration " + integrationId);
        }
        audit.organizationId(integration.get().getOrganizationId());

        if (signature == null || signature.isBlank()) {
            rejectSignature(audit, startTime, "Missing callback signature");
        }
        if (!provider.verifyWebhookSignature(rawBody, signature, integration.get().getWebhookSecret())) {
            rejectSignature(audit, startTime, "Callback signature does not match");
        }

        StkCallback callback;
        try {
            callback = callbackParser.parse(rawBody);
        } catch (IllegalArgumentException e) {
            log.warn("Malformed callback for integration {}: {}", integrationId, e.getMessage());
            metrics.recordReconciliation("malformed");
            apiLogService.record(audit
                    .responseStatusCode(200)
                    .status(ApiLogStatus.FAILED)
                    .errorMessage(e.getMessage())
                    .correlationId(CorrelationContext.getCorrelationId())
                    .durationMs(System.currentTimeMillis() - startTime));
            return ReconciliationResult.of(Outcome.MALFORMED, null);
        }

        audit.correlationId(callback.getCheckoutRequestId())
                .externalId(callback.getReceiptNumber() != null
                        ? callback.getReceiptNumber()
                        : callback.getMerchantRequestId());

        ReconciliationResult result;
        try {
            result = transactionTemplate.execute(status ->
                    apply(integration.get(), callback, Instant.now(clock)));
        } catch (RuntimeException e) {
            log.error("Reconciliation of checkout {} failed and was rolled back",
                    callback.getCheckoutRequestId(), e);
            metrics.recordReconciliation("error");
            apiLogService.record(audit
                    .responseStatusCode(500)
                    .status(ApiLogStatus.FAILED)
                    .errorMessage(e.getMessage())
                    .durationMs(System.currentTimeMillis() - startTime));
            throw e;
        }

        metrics.recordReconciliation(result.getOutcome().name());
        metrics.recordPaymentLatency("reconcile", System.currentTimeMillis() - startTime);
        apiLogService.record(audit
                .paymentId(result.getPaymentId())
                .responseStatusCode(200)
                .status(result.getOutcome().isRejected() ? ApiLogStatus.FAILED : ApiLogStatus.SUCCESS)
                .errorMessage(result.getOutcome().isApplied() ? null : result.getOutcome().description())
                .durationMs(System.currentTimeMillis() - startTime));
        return result;
    }

    private ReconciliationResult apply(Integration integration, StkCallback callback, Instant now) {
        String checkoutRequestId = callback.getCheckoutRequestId();
        Optional<Payment> awaiting = persistenceService.lockAwaitingCallback(checkoutRequestId);

        if (awaiting.isEmpty()) {
            return persistenceService.findLatestByCheckoutRequestId(checkoutRequestId)
                    .map(existing -> {
                        log.info("Callback for checkout {} ignored, payment {} is already {}",
                                checkoutRequestId, existing.getPaymentReference(), existing.getStatus());
                        return ReconciliationResult.of(Outcome.DUPLICATE, existing.getId());
                    })
                    .orElseGet(() -> {
                        log.warn("Callback for unknown checkout {} (merchant request {})",
                                checkoutRequestId, callback.getMerchantRequestId());
                        return ReconciliationResult.of(Outcome.ORPHAN, null);
                    });
        }

        Payment payment = awaiting.get();
        try (CorrelationContext.LogScope ignored = CorrelationContext.forPayment(payment.getId())) {
            if (!payment.getOrganizationId().equals(integration.getOrganizationId())) {
                log.warn("Callback for payment {} arrived on integration {} of another organization",
                        payment.getPaymentReference(), integration.getId());
                return ReconciliationResult.of(Outcome.ORGANIZATION_MISMATCH, payment.getId());
            }

            Payment processing = payment.getStatus() == PaymentStatus.INITIATED
                    ? payment.markProcessing()
                    : payment;

            if (callback.isSuccessful()) {
                Payment completed = persistenceService.update(processing.complete(
                        callback.getReceiptNumber(), callback.getAmount(), callback.getPhoneNumber(), now));
                settlementEffects.applyCompleted(completed);
                log.info("Payment {} completed, receipt {}", completed.getPaymentReference(),
                        completed.getExternalReference());
                return ReconciliationResult.of(Outcome.COMPLETED, completed.getId());
            }

            String reason = callback.getResultDescription() != null
                    ? callback.getResultDescription()
                    : "Provider result code " + callback.getResultCode();
            Payment failed = persistenceService.update(processing.fail(reason));
            outboxService.savePaymentEvent(PaymentFailedEvent.fromPayment(failed));
            log.info("Payment {} failed: {} ({})", failed.getPaymentReference(), reason, callback.getResultCode());
            return ReconciliationResult.of(Outcome.FAILED, failed.getId());
        }
    }

    private void rejectSignature(ApiLog.ApiLogBuilder audit, long startTime, String message) {
        log.warn("Rejected callback: {}", message);
        metrics.recordReconciliation("invalid_signature");
        apiLogService.record(audit
                .responseStatusCode(401)
                .status(ApiLogStatus.FAILED)
                .errorMessage(message)
                .correlationId(CorrelationContext.getCorrelationId())
                .durationMs(System.currentTimeMillis() - startTime));
        throw new InvalidSignatureException(message);
    }

    public enum Outcome {
        COMPLETED,
        FAILED,
        DUPLICATE,
        ORPHAN,
        ORGANIZATION_MISMATCH,
        MALFORMED;

        public boolean isApplied() {
            return this == COMPLETED || this == FAILED;
        }

        /**
         * Callbacks that matched no payment of the integration's organization. Duplicates
         * are not rejections; the payment they name was already settled.
         */
        boolean isRejected() {
            return this == ORPHAN || this == ORGANIZATION_MISMATCH;
        }

        String description() {
            return switch (this) {
                case DUPLICATE -> "Payment already settled, callback ignored";
                case ORPHAN -> "PaymentNotFound: no payment matches the checkout request id";
                case ORGANIZATION_MISMATCH -> "Payment belongs to another organization";
                case MALFORMED -> "Callback body could not be parsed";
                default -> null;
            };
        }
    }

    @Value(staticConstructor = "of")
    public static class ReconciliationResult {
        Outcome outcome;
        UUID paymentId;
    }
}
