package com.flagship.payment_settlement.consumer;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Marker that a consumer group has handled an event, so a redelivery is skipped.
 */
@Value
public class ProcessedEvent {
    UUID eventId;
    String eventType;
    String aggregateType;
    UUID aggregateId;
    String consumerGroup;
    Instant processedAt;
    ProcessingResult result;
    String errorMessage;

    public enum ProcessingResult {
        SUCCESS,
        SKIPPED
    }

    public static ProcessedEvent success(UUID eventId, String eventType, String aggregateType,
                                         UUID aggregateId, String consumerGroup) {
        return new ProcessedEvent(eventId, eventType, aggregateType, aggregateId, consumerGroup,
                Instant.now(), ProcessingResult.SUCCESS, null);
    }

    public static ProcessedEvent skipped(UUID eventId, String eventType, String aggregateType,
                                         UUID aggregateId, String consumerGroup, String reason) {
        return new ProcessedEvent(eventId, eventType, aggregateType, aggregateId, consumerGroup,
                Instant.now(), ProcessingResult.SKIPPED, reason);
    }
}
