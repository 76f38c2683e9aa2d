package com.flagship.payment_settlement.observability;

import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports the cached outbox backlog. A growing backlog means settlement facts and
 * notification wake-ups are not reaching Kafka.
 */
@Component("outboxHealth")
public class OutboxHealthIndicator implements HealthIndicator {

    private static final long BACKLOG_WARNING_THRESHOLD = 1000;
    private static final long BACKLOG_CRITICAL_THRESHOLD = 10000;

    private final OutboxMetrics outboxMetrics;

    public OutboxHealthIndicator(OutboxMetrics outboxMetrics) {
        this.outboxMetrics = outboxMetrics;
    }

    @Override
    public Health health() {
        long backlogSize = outboxMetrics.getBacklogSize();

        Health.Builder builder = backlogSize < BACKLOG_WARNING_THRESHOLD
                ? Health.up()
                : backlogSize < BACKLOG_CRITICAL_THRESHOLD
                ? Health.status("WARNING")
                : Health.down();

        return builder
                .withDetail("backlogSize", backlogSize)
                .withDetail("warningThreshold", BACKLOG_WARNING_THRESHOLD)
                .withDetail("criticalThreshold", BACKLOG_CRITICAL_THRESHOLD)
                .build();
    }
}
