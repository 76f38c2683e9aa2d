package com.flagship.payment_settlement.outbox;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * A domain event waiting in {@code outbox_events} to be published.
 *
 * Written in the same transaction as the state change it describes and published
 * later by {@link OutboxPublisher}.
 */
@Value
public class OutboxEvent {

    public static final String AGGREGATE_PAYMENT = "Payment";
    public static final String AGGREGATE_NOTIFICATION = "Notification";

    UUID id;
    String aggregateType;
    UUID aggregateId;
    String eventType;
    String payload;
    Instant createdAt;
    Instant publishedAt;
    int retryCount;
    String lastError;
    Long sequenceNumber;

    public static OutboxEvent create(String aggregateType, UUID aggregateId,
                                     String eventType, String payload) {
        return new OutboxEvent(
            UUID.randomUUID(),
            aggregateType,
            aggregateId,
            eventType,
            payload,
            Instant.now(),
            null,
            0,
            null,
            null  // assigned by the database
        );
    }

    public boolean isPublished() {
        return publishedAt != null;
    }

    public boolean isDeadLettered(int maxRetries) {
        return !isPublished() && retryCount >= maxRetries;
    }
}
