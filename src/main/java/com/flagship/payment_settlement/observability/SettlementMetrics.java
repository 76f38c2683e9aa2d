package com.flagship.payment_settlement.observability;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Micrometer meters for the payment lifecycle and notification delivery.
 *
 * Meters:
 * - payments.initiated{type}
 * - payments.dispatched{outcome}
 * - payments.reconciled{outcome}
 * - payments.reversed / payments.cancelled / payments.timed_out
 * - payments.latency{operation}
 * - notifications.delivered{channel,outcome}
 * - idempotency.cache{result}
 * - payments.awaiting_callback, notifications.pending (gauges, refreshed by {@link MetricsScheduler})
 */
@Component
public class SettlementMetrics {

    private final MeterRegistry registry;
    private final AtomicLong awaitingCallback = new AtomicLong();
    private final AtomicLong pendingNotifications = new AtomicLong();

    public SettlementMetrics(MeterRegistry registry) {
        this.registry = registry;
        Gauge.builder("payments.awaiting_callback", awaitingCallback, AtomicLong::get)
                .description("Dispatched payments with no provider result yet")
                .register(registry);
        Gauge.builder("notifications.pending", pendingNotifications, AtomicLong::get)
                .description("Notifications queued and not yet attempted")
                .register(registry);
    }

    void updateBacklog(long paymentsAwaitingCallback, long notificationsPending) {
        awaitingCallback.set(paymentsAwaitingCallback);
        pendingNotifications.set(notificationsPending);
    }

    public void recordPaymentInitiated(String paymentType) {
        registry.counter("payments.initiated", "type", sanitizeTag(paymentType)).increment();
    }

    public void recordDispatch(String outcome) {
        registry.counter("payments.dispatched", "outcome", sanitizeTag(outcome)).increment();
    }

    /**
     * Outcome is one of completed, failed, duplicate, orphan, organization_mismatch,
     * invalid_signature.
     */
    public void recordReconciliation(String outcome) {
        registry.counter("payments.reconciled", "outcome", sanitizeTag(outcome)).increment();
    }

    public void recordReversal() {
        registry.counter("payments.reversed").increment();
    }

    public void recordCancellation() {
        registry.counter("payments.cancelled").increment();
    }

    public void recordTimeout(String stage) {
        registry.counter("payments.timed_out", "stage", sanitizeTag(stage)).increment();
    }

    public void recordPaymentLatency(String operation, long durationMs) {
        registry.timer("payments.latency", "operation", sanitizeTag(operation))
                .record(Duration.ofMillis(durationMs));
    }

    public void recordNotificationDelivery(String channel, String outcome) {
        registry.counter("notifications.delivered",
                "channel", sanitizeTag(channel),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordIdempotencyHit() {
        registry.counter("idempotency.cache", "result", "hit").increment();
    }

    public void recordIdempotencyMiss() {
        registry.counter("idempotency.cache", "result", "miss").increment();
    }

    // Keeps tag cardinality bounded when free text slips through.
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.toLowerCase().replaceAll("[^a-z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
