package com.flagship.payment_settlement.payment;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.payment_settlement.customer.CustomerService;
import com.flagship.payment_settlement.exception.AlreadyTerminalException;
import com.flagship.payment_settlement.exception.InvalidAmountException;
import com.flagship.payment_settlement.exception.InvalidPaymentStateException;
import com.flagship.payment_settlement.integration.ApiLog;
import com.flagship.payment_settlement.integration.ApiLogService;
import com.flagship.payment_settlement.integration.ApiLogStatus;
import com.flagship.payment_settlement.integration.ApiRequestType;
import com.flagship.payment_settlement.integration.Integration;
import com.flagship.payment_settlement.integration.IntegrationService;
import com.flagship.payment_settlement.ledger.Invoice;
import com.flagship.payment_settlement.ledger.InvoiceService;
import com.flagship.payment_settlement.ledger.InvoiceStatus;
import com.flagship.payment_settlement.ledger.PaymentPlan;
import com.flagship.payment_settlement.ledger.PaymentPlanService;
import com.flagship.payment_settlement.observability.CorrelationContext;
import com.flagship.payment_settlement.observability.SettlementMetrics;
import com.flagship.payment_settlement.organization.Organization;
import com.flagship.payment_settlement.organization.OrganizationService;
import com.flagship.payment_settlement.outbox.OutboxService;
import com.flagship.payment_settlement.payment.event.PaymentCancelledEvent;
import com.flagship.payment_settlement.payment.event.PaymentFailedEvent;
import com.flagship.payment_settlement.payment.event.PaymentInitiatedEvent;
import com.flagship.payment_settlement.payment.event.PaymentReversedEvent;
import com.flagship.payment_settlement.provider.MoneyMovementProvider;
import com.flagship.payment_settlement.provider.ProviderCredentials;
import com.flagship.payment_settlement.provider.ProviderException;
import com.flagship.payment_settlement.provider.ProviderUnavailableException;
import com.flagship.payment_settlement.provider.PushRequest;
import com.flagship.payment_settlement.provider.PushResult;
import com.flagship.payment_settlement.reference.ReferenceGenerator;
import com.flagship.payment_settlement.reference.ReferenceKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Caller-driven side of the payment lifecycle: initiation, dispatch to the provider,
 * cancellation and reversal.
 *
 * <p>Dispatch is split around the network call. The PENDING -> INITIATED claim commits
 * first, the provider is called outside any transaction, and the outcome is written in
 * a second short transaction. A crash in between leaves an INITIATED payment without
 * correlation ids, which {@link PaymentTimeoutSweeper} fails later.
 */
@Service
@Slf4j
public class PaymentService {

    private final PaymentPersistenceService persistenceService;
    private final IdempotencyService idempotencyService;
    private final OrganizationService organizationService;
    private final CustomerService customerService;
    private final InvoiceService invoiceService;
    private final PaymentPlanService paymentPlanService;
    private final IntegrationService integrationService;
    private final MoneyMovementProvider provider;
    private final ApiLogService apiLogService;
    private final OutboxService outboxService;
    private final ReferenceGenerator referenceGenerator;
    private final SettlementMetrics metrics;
    private final ObjectMapper objectMapper;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;
    private final int reversalReasonMaxLength;

    public PaymentService(PaymentPersistenceService persistenceService,
                          IdempotencyService idempotencyService,
                          OrganizationService organizationService,
                          CustomerService customerService,
                          InvoiceService invoiceService,
                          PaymentPlanService paymentPlanService,
                          IntegrationService integrationService,
                          MoneyMovementProvider provider,
                          ApiLogService apiLogService,
                          OutboxService outboxService,
                          ReferenceGenerator referenceGenerator,
                          SettlementMetrics metrics,
                          ObjectMapper objectMapper,
                          PlatformTransactionManager transactionManager,
                          Clock clock,
                          @Value("${reversal.reason-max-length:500}") int reversalReasonMaxLength) {
        this.persistenceService = persistenceService;
        this.idempotencyService = idempotencyService;
        this.organizationService = organizationService;
        this.customerService = customerService;
        this.invoiceService = invoiceService;
        this.paymentPlanService = paymentPlanService;
        this.integrationService = integrationService;
        this.provider = provider;
        this.apiLogService = apiLogService;
        this.outboxService = outboxService;
        this.referenceGenerator = referenceGenerator;
        this.metrics = metrics;
        this.objectMapper = objectMapper;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
        this.reversalReasonMaxLength = reversalReasonMaxLength;
    }

    /**
     * Creates a PENDING payment with its reference.
     *
     * With an idempotency key, a repeated call returns the payment created the first
     * time and {@code replayed = true}; nothing new is written.
     *
     * @throws InvalidAmountException if the amount is not a positive whole number of
     *                                shillings or the fee is out of range
     */
    @Transactional
    public Initiation initiate(UUID organizationId, PaymentRequestDetails request, String idempotencyKey) {
        long startTime = System.currentTimeMillis();
        String scopedKey = idempotencyKey == null || idempotencyKey.isBlank()
                ? null
                : IdempotencyService.scopedKey(organizationId, idempotencyKey);

        if (scopedKey != null) {
            Optional<Payment> existing = idempotencyService.findPaymentId(scopedKey)
                    .flatMap(persistenceService::findById);
            if (existing.isPresent()) {
                metrics.recordIdempotencyHit();
                log.info("Idempotency key already used, returning payment {}", existing.get().getPaymentReference());
                return new Initiation(existing.get(), true);
            }
            metrics.recordIdempotencyMiss();
        }

        validateAmounts(request);
        if (request.getPayerPhone() == null || request.getPayerPhone().isBlank()) {
            throw new IllegalArgumentException("Phone number is required for a push payment");
        }
        if (request.getInvoiceId() != null && request.getPaymentPlanId() != null) {
            throw new IllegalArgumentException("A payment settles either an invoice or a payment plan, not both");
        }

        Organization organization = organizationService.getRequired(organizationId);
        UUID linkedCustomerId = linkedCustomer(organizationId, request);
        UUID customerId = customerService
                .resolve(organizationId, request.getCustomerId(), request.getPayerPhone(), request.getPayerEmail())
                .orElse(linkedCustomerId);
        if (linkedCustomerId != null && request.getCustomerId() != null && !linkedCustomerId.equals(customerId)) {
            throw new IllegalArgumentException("Customer " + customerId + " does not own the linked invoice or plan");
        }

        String reference = referenceGenerator.nextReference(
                organizationId, organization.getName(), ReferenceKind.PAYMENT);
        Payment payment = Payment.createPending(organizationId, reference,
                request.toBuilder().customerId(customerId).build());
        Payment saved = persistenceService.save(payment, scopedKey);

        if (scopedKey != null) {
            rememberAfterCommit(scopedKey, saved.getId());
        }

        metrics.recordPaymentInitiated(saved.getPaymentType().name());
        metrics.recordPaymentLatency("initiate", System.currentTimeMillis() - startTime);
        log.info("Initiated payment {} amount={} {} customer={}",
                saved.getPaymentReference(), saved.getAmount(), saved.getCurrency(), saved.getCustomerId());
        return new Initiation(saved, false);
    }

    /**
     * Sends the push request for a PENDING payment.
     *
     * <p>On acceptance the payment stays INITIATED with the provider's correlation ids
     * recorded. On any provider failure it becomes FAILED and
     * {@link PaymentDispatchException} carries the cause to the caller; nothing is
     * retried here because a second push would prompt the payer twice.
     *
     * @throws AlreadyTerminalException      if the payment already reached a final state
     * @throws InvalidPaymentStateException  if it is not PENDING or another dispatch claimed it
     * @throws com.flagship.payment_settlement.provider.InvalidCredentialsException
     *                                       if the organization has no active integration
     *                                       (the payment stays PENDING)
     */
    public Payment dispatch(UUID paymentId, UUID organizationId) {
        long startTime = System.currentTimeMillis();
        try (CorrelationContext.LogScope ignored = CorrelationContext.forPayment(paymentId)) {
            Payment payment = persistenceService.getForOrganization(paymentId, organizationId);
            if (payment.isTerminal()) {
                throw new AlreadyTerminalException(paymentId, payment.getStatus());
            }
            if (payment.getStatus() != PaymentStatus.PENDING) {
                throw new InvalidPaymentStateException(
                        "Payment " + payment.getPaymentReference() + " is " + payment.getStatus() + ", not PENDING");
            }

            Integration integration = integrationService.getActiveMpesa(organizationId);
            ProviderCredentials credentials = integrationService.credentialsFor(integration);

            if (!persistenceService.claimForDispatch(paymentId, Instant.now(clock))) {
                throw new InvalidPaymentStateException(
                        "Payment " + payment.getPaymentReference() + " is already being dispatched");
            }

            PushRequest pushRequest = PushRequest.builder()
                    .phoneNumber(payment.getPayerPhone())
                    .amount(payment.getAmount())
                    .accountReference(payment.getPaymentReference())
                    .description(payment.getDescription())
                    .build();

            PushResult result;
            try {
                authenticate(integration, credentials, payment);
                result = push(integration, credentials, payment, pushRequest);
            } catch (ProviderException e) {
                throw failDispatch(paymentId, e, startTime);
            } catch (RuntimeException e) {
                log.error("Unexpected error while dispatching payment {}", payment.getPaymentReference(), e);
                throw failDispatch(paymentId,
                        new ProviderUnavailableException("Unexpected dispatch error: " + e.getMessage(), e), startTime);
            }

            Payment dispatched = transactionTemplate.execute(status -> {
                Payment current = persistenceService.lockForUpdate(paymentId);
                if (current.getStatus() == PaymentStatus.FAILED) {
                    log.warn("Payment {} was timed out while its push was in flight, checkout {} not recorded",
                            current.getPaymentReference(), result.getCheckoutRequestId());
                    return current;
                }
                Payment updated = persistenceService.update(
                        current.recordDispatch(result.getCheckoutRequestId(), result.getMerchantRequestId()));
                if (updated.getStatus() == PaymentStatus.INITIATED) {
                    outboxService.savePaymentEvent(PaymentInitiatedEvent.fromPayment(updated));
                } else {
                    log.warn("Payment {} became {} while its push was in flight",
                            updated.getPaymentReference(), updated.getStatus());
                }
                return updated;
            });

            metrics.recordDispatch("accepted");
            metrics.recordPaymentLatency("dispatch", System.currentTimeMillis() - startTime);
            log.info("Dispatched payment {} checkoutRequestId={}",
                    dispatched.getPaymentReference(), dispatched.getCheckoutRequestId());
            return dispatched;
        }
    }

    /**
     * Abandons a payment before the provider confirmed it. A push already sent cannot be
     * recalled; its late callback is ignored.
     */
    @Transactional
    public Payment cancel(UUID paymentId, UUID organizationId) {
        Payment payment = persistenceService.lockForUpdate(paymentId);
        PaymentPersistenceService.requireOrganization(payment, organizationId);
        if (payment.isTerminal()) {
            throw new AlreadyTerminalException(paymentId, payment.getStatus());
        }
        if (!payment.canTransitionTo(PaymentStatus.CANCELLED)) {
            throw new InvalidPaymentStateException(
                    "Payment " + payment.getPaymentReference() + " is " + payment.getStatus()
                            + " and can no longer be cancelled");
        }

        Payment cancelled = persistenceService.update(payment.cancel());
        outboxService.savePaymentEvent(PaymentCancelledEvent.fromPayment(cancelled));
        metrics.recordCancellation();
        log.info("Cancelled payment {}", cancelled.getPaymentReference());
        return cancelled;
    }

    /**
     * Ledger-only reversal of a COMPLETED payment. Linked invoice and plan balances are
     * not rolled back; the reversal is a record for operators.
     *
     * @throws InvalidPaymentStateException if the payment is not COMPLETED or already reversed
     */
    @Transactional
    public Payment reverse(UUID paymentId, UUID organizationId, String reason, String actor) {
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("Reversal reason is required");
        }
        if (reason.length() > reversalReasonMaxLength) {
            throw new IllegalArgumentException(
                    "Reversal reason must be at most " + reversalReasonMaxLength + " characters");
        }

        Payment payment = persistenceService.lockForUpdate(paymentId);
        PaymentPersistenceService.requireOrganization(payment, organizationId);
        if (payment.getStatus() != PaymentStatus.COMPLETED || payment.isReversed()) {
            throw new InvalidPaymentStateException(
                    "Only completed payments can be reversed; " + payment.getPaymentReference()
                            + " is " + payment.getStatus());
        }

        Payment reversed = persistenceService.update(payment.reverse(reason.trim(), actor, Instant.now(clock)));
        outboxService.savePaymentEvent(PaymentReversedEvent.fromPayment(reversed));
        metrics.recordReversal();
        log.info("Reversed payment {} by {}: {}", reversed.getPaymentReference(), actor, reason);
        return reversed;
    }

    @Transactional(readOnly = true)
    public Payment get(UUID paymentId, UUID organizationId) {
        return persistenceService.getForOrganization(paymentId, organizationId);
    }

    @Transactional(readOnly = true)
    public Statistics statistics(UUID organizationId) {
        organizationService.getRequired(organizationId);
        Map<PaymentStatus, Long> counts = new EnumMap<>(PaymentStatus.class);
        Map<PaymentStatus, BigDecimal> totals = new EnumMap<>(PaymentStatus.class);
        for (PaymentStatus status : PaymentStatus.values()) {
            counts.put(status, 0L);
            totals.put(status, BigDecimal.ZERO.setScale(2));
        }
        for (PaymentRepository.StatusTotal row : persistenceService.summarizeByStatus(organizationId)) {
            counts.put(row.getStatus(), row.getCount());
            totals.put(row.getStatus(), Payment.scale(row.getTotal()));
        }
        long total = counts.values().stream().mapToLong(Long::longValue).sum();
        return new Statistics(total, counts, totals);
    }

    // The token itself never reaches the audit row.
    private void authenticate(Integration integration, ProviderCredentials credentials, Payment payment) {
        long started = System.currentTimeMillis();
        ApiLog.ApiLogBuilder audit = ApiLog.builder()
                .integrationId(integration.getId())
                .organizationId(payment.getOrganizationId())
                .paymentId(payment.getId())
                .requestType(ApiRequestType.MPESA_AUTH)
                .endpoint(provider.authenticationEndpoint(credentials))
                .method("GET")
                .correlationId(CorrelationContext.getCorrelationId())
                .requestTimestamp(Instant.now(clock));
        try {
            provider.authenticate(credentials);
        } catch (ProviderException e) {
            apiLogService.recordOutbound(audit
                    .responseStatusCode(e.getHttpStatus())
                    .responseBody(e.getResponseBody())
                    .status(ApiLogStatus.FAILED)
                    .errorMessage(e.getMessage())
                    .durationMs(System.currentTimeMillis() - started));
            throw e;
        }
        apiLogService.recordOutbound(audit
                .responseStatusCode(200)
                .status(ApiLogStatus.SUCCESS)
                .durationMs(System.currentTimeMillis() - started));
    }

    private PushResult push(Integration integration, ProviderCredentials credentials,
                            Payment payment, PushRequest pushRequest) {
        long started = System.currentTimeMillis();
        Instant requestedAt = Instant.now(clock);
        ApiLog.ApiLogBuilder audit = ApiLog.builder()
                .integrationId(integration.getId())
                .organizationId(payment.getOrganizationId())
                .paymentId(payment.getId())
                .requestType(ApiRequestType.MPESA_STK_PUSH)
                .endpoint(provider.pushEndpoint(credentials))
                .method("POST")
                .requestBody(toJson(pushRequest))
                .requestTimestamp(requestedAt);
        try {
            PushResult result = provider.pushPayment(credentials, pushRequest);
            apiLogService.recordOutbound(audit
                    .responseStatusCode(200)
                    .responseBody(result.getRawResponse())
                    .status(ApiLogStatus.SUCCESS)
                    .correlationId(result.getCheckoutRequestId())
                    .externalId(result.getMerchantRequestId())
                    .durationMs(System.currentTimeMillis() - started));
            return result;
        } catch (ProviderException e) {
            apiLogService.recordOutbound(audit
                    .responseStatusCode(e.getHttpStatus())
                    .responseBody(e.getResponseBody())
                    .status(e instanceof ProviderUnavailableException && e.getHttpStatus() == null
                            ? ApiLogStatus.TIMEOUT
                            : ApiLogStatus.FAILED)
                    .errorMessage(e.getMessage())
                    .correlationId(CorrelationContext.getCorrelationId())
                    .durationMs(System.currentTimeMillis() - started));
            throw e;
        }
    }

    private PaymentDispatchException failDispatch(UUID paymentId, ProviderException error, long startTime) {
        Payment failed = transactionTemplate.execute(status -> {
            Payment current = persistenceService.lockForUpdate(paymentId);
            if (current.getStatus() != PaymentStatus.INITIATED) {
                log.warn("Payment {} is {} after failed dispatch, leaving it", current.getPaymentReference(),
                        current.getStatus());
                return current;
            }
            Payment updated = persistenceService.update(current.fail(error.getMessage()));
            outboxService.savePaymentEvent(PaymentFailedEvent.fromPayment(updated));
            return updated;
        });

        metrics.recordDispatch(error.isRetryable() ? "unavailable" : "rejected");
        metrics.recordPaymentLatency("dispatch", System.currentTimeMillis() - startTime);
        log.warn("Dispatch of payment {} failed ({}): {}", failed.getPaymentReference(), error.getCode(),
                error.getMessage());
        return new PaymentDispatchException(failed, error);
    }

    private UUID linkedCustomer(UUID organizationId, PaymentRequestDetails request) {
        if (request.getInvoiceId() != null) {
            Invoice invoice = invoiceService.getForOrganization(request.getInvoiceId(), organizationId);
            if (invoice.getStatus() == InvoiceStatus.CANCELLED) {
                throw new InvalidPaymentStateException("Invoice " + invoice.getInvoiceNumber() + " is cancelled");
            }
            return invoice.getCustomerId();
        }
        if (request.getPaymentPlanId() != null) {
            PaymentPlan plan = paymentPlanService.getForOrganization(request.getPaymentPlanId(), organizationId);
            if (!plan.getStatus().acceptsInstallments()) {
                throw new InvalidPaymentStateException(
                        "Payment plan " + plan.getId() + " is " + plan.getStatus());
            }
            return plan.getCustomerId();
        }
        return null;
    }

    /**
     * STK push charges whole shillings only, so a fractional amount is refused rather
     * than rounded; the payer is never prompted for more than was recorded. Fees are
     * checked after scaling to cents.
     */
    static void validateAmounts(PaymentRequestDetails request) {
        BigDecimal amount = request.getAmount();
        if (amount == null || amount.signum() <= 0) {
            throw InvalidAmountException.notPositive("amount", amount);
        }
        if (amount.stripTrailingZeros().scale() > 0) {
            throw new InvalidAmountException("amount must be a whole number of shillings for M-Pesa, got " + amount);
        }
        BigDecimal fee = request.getTransactionFee();
        if (fee == null) {
            return;
        }
        BigDecimal scaledFee = Payment.scale(fee);
        if (fee.signum() < 0 || scaledFee.compareTo(amount) > 0) {
            throw new InvalidAmountException("transaction_fee must be between 0 and the amount, got " + fee);
        }
    }

    private void rememberAfterCommit(String scopedKey, UUID paymentId) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            idempotencyService.remember(scopedKey, paymentId);
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                idempotencyService.remember(scopedKey, paymentId);
            }
        });
    }

    private String toJson(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            return String.valueOf(value);
        }
    }

    public record Initiation(Payment payment, boolean replayed) {
    }

    public record Statistics(long totalCount,
                             Map<PaymentStatus, Long> countByStatus,
                             Map<PaymentStatus, BigDecimal> amountByStatus) {
    }
}
