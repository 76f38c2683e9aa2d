package com.flagship.payment_settlement.consumer;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.payment_settlement.notification.NotificationDispatcher;
import com.flagship.payment_settlement.notification.NotificationEnqueuedEvent;
import com.flagship.payment_settlement.outbox.OutboxEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Delivers a notification as soon as its enqueue event arrives.
 *
 * The worker poll remains the safety net: if this consumer is down or the event is
 * lost, the row is still picked up from the table. Offsets are committed manually
 * after the handler succeeds.
 */
@Component
@ConditionalOnProperty(name = "consumer.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class NotificationEventConsumer {

    static final String CONSUMER_GROUP = "notification-dispatcher";

    private final IdempotentEventProcessor eventProcessor;
    private final NotificationDispatcher dispatcher;
    private final ObjectMapper objectMapper;

    @KafkaListener(
        topics = "${kafka.topic.notifications:notifications}",
        groupId = "${spring.kafka.consumer.group-id:payment-settlement-consumers}"
    )
    public void consume(ConsumerRecord<String, String> record, Acknowledgment ack) {
        log.debug("Received message: topic={}, partition={}, offset={}, key={}",
                record.topic(), record.partition(), record.offset(), record.key());

        EventEnvelope envelope = parseEvent(record.value());
        if (envelope == null) {
            log.warn("Could not parse event, acknowledging to skip: {}", record.value());
            ack.acknowledge();
            return;
        }

        if (!NotificationEnqueuedEvent.EVENT_TYPE.equals(envelope.eventType())) {
            eventProcessor.skipEvent(envelope.eventId(), envelope.eventType(),
                    OutboxEvent.AGGREGATE_NOTIFICATION, envelope.notificationId(),
                    CONSUMER_GROUP, "Unknown event type");
            ack.acknowledge();
            return;
        }

        try {
            boolean processed = eventProcessor.processEvent(
                    envelope.eventId(), envelope.eventType(),
                    OutboxEvent.AGGREGATE_NOTIFICATION, envelope.notificationId(),
                    CONSUMER_GROUP,
                    () -> {
                        NotificationDispatcher.DeliveryOutcome outcome = dispatcher.process(envelope.notificationId());
                        log.info("Notification {} processed from event: {}", envelope.notificationId(), outcome);
                    });
            ack.acknowledge();
            if (!processed) {
                log.debug("Duplicate event {} acknowledged", envelope.eventId());
            }
        } catch (RuntimeException e) {
            // not acknowledged: the record is redelivered
            log.error("Error processing message at offset {}: {}", record.offset(), e.getMessage(), e);
            throw e;
        }
    }

    private EventEnvelope parseEvent(String json) {
        try {
            JsonNode node = objectMapper.readTree(json);
            UUID eventId = UUID.fromString(node.get("eventId").asText());
            UUID notificationId = UUID.fromString(node.get("notificationId").asText());
            String eventType = node.has("eventType") ? node.get("eventType").asText() : "Unknown";
            return new EventEnvelope(eventId, notificationId, eventType);
        } catch (Exception e) {
            log.error("Failed to parse event envelope: {}", e.getMessage());
            return null;
        }
    }

    private record EventEnvelope(UUID eventId, UUID notificationId, String eventType) {}
}
