package com.flagship.payment_settlement.payment;

import com.flagship.payment_settlement.observability.SettlementMetrics;
import com.flagship.payment_settlement.outbox.OutboxService;
import com.flagship.payment_settlement.payment.event.PaymentFailedEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Fails payments that will never hear back from the provider:
 * <ul>
 *   <li>dispatches interrupted between the claim and the provider answer
 *       (INITIATED without a checkout id)</li>
 *   <li>pushes whose callback did not arrive within the callback timeout</li>
 * </ul>
 * Both get the failure reason {@code timeout}; the stage is kept in the log and the
 * timeout metric. Each payment is re-checked under its row lock, so a callback that
 * lands while the sweep runs wins.
 */
@Component
@ConditionalOnProperty(name = "settlement.sweeper.enabled", havingValue = "true", matchIfMissing = true)
@Slf4j
public class PaymentTimeoutSweeper {

    static final String STAGE_DISPATCH = "dispatch";
    static final String STAGE_CALLBACK = "callback";
    static final String TIMEOUT_REASON = "timeout";

    private final PaymentPersistenceService persistenceService;
    private final OutboxService outboxService;
    private final SettlementMetrics metrics;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;
    private final Duration dispatchTimeout;
    private final Duration callbackTimeout;

    public PaymentTimeoutSweeper(PaymentPersistenceService persistenceService,
                                 OutboxService outboxService,
                                 SettlementMetrics metrics,
                                 PlatformTransactionManager transactionManager,
                                 Clock clock,
                                 @Value("${settlement.dispatch-stale-after-minutes:2}") long dispatchStaleAfterMinutes,
                                 @Value("${settlement.callback-timeout-minutes:10}") long callbackTimeoutMinutes) {
        this.persistenceService = persistenceService;
        this.outboxService = outboxService;
        this.metrics = metrics;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;
        this.dispatchTimeout = Duration.ofMinutes(dispatchStaleAfterMinutes);
        this.callbackTimeout = Duration.ofMinutes(callbackTimeoutMinutes);
    }

    @Scheduled(fixedDelayString = "${settlement.sweeper.interval-ms:60000}")
    public void sweep() {
        Instant now = Instant.now(clock);
        int interrupted = expire(persistenceService.findInterruptedDispatches(now.minus(dispatchTimeout)),
                STAGE_DISPATCH, TIMEOUT_REASON);
        int overdue = expire(persistenceService.findCallbacksOverdue(now.minus(callbackTimeout)),
                STAGE_CALLBACK, TIMEOUT_REASON);
        if (interrupted + overdue > 0) {
            log.info("Timeout sweep failed {} interrupted dispatches and {} overdue callbacks", interrupted, overdue);
        }
    }

    int expire(List<UUID> paymentIds, String stage, String reason) {
        int expired = 0;
        for (UUID paymentId : paymentIds) {
            try {
                Boolean failed = transactionTemplate.execute(status -> expireOne(paymentId, stage, reason));
                if (Boolean.TRUE.equals(failed)) {
                    expired++;
                }
            } catch (RuntimeException e) {
                log.error("Could not expire payment {}", paymentId, e);
            }
        }
        return expired;
    }

    private boolean expireOne(UUID paymentId, String stage, String reason) {
        Payment payment = persistenceService.lockForUpdate(paymentId);
        if (!payment.isAwaitingCallback()) {
            return false;
        }
        if (STAGE_DISPATCH.equals(stage) && payment.getCheckoutRequestId() != null) {
            return false;
        }

        Payment failed = persistenceService.update(payment.fail(reason));
        outboxService.savePaymentEvent(PaymentFailedEvent.fromPayment(failed));
        metrics.recordTimeout(stage);
        log.warn("Payment {} timed out at {} stage", failed.getPaymentReference(), stage);
        return true;
    }
}
