package com.flagship.payment_settlement.consumer;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Runs an event handler at most once per (event, consumer group).
 *
 * The handler and the processed-event marker commit in one transaction: if the
 * handler throws, neither is kept and Kafka redelivers the record.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class IdempotentEventProcessor {

    private final ProcessedEventRepository repository;

    /**
     * @return true if the handler ran, false if the event was seen before
     */
    @Transactional
    public boolean processEvent(UUID eventId, String eventType,
                                String aggregateType, UUID aggregateId,
                                String consumerGroup, Runnable handler) {
        if (isAlreadyProcessed(eventId, consumerGroup)) {
            log.info("Event {} already processed by consumer group {}, skipping", eventId, consumerGroup);
            return false;
        }

        handler.run();
        repository.save(ProcessedEventEntity.fromDomain(
                ProcessedEvent.success(eventId, eventType, aggregateType, aggregateId, consumerGroup)));

        log.debug("Processed event {} by consumer group {}", eventId, consumerGroup);
        return true;
    }

    /**
     * Records an event this consumer has no use for, so it is not looked at again.
     */
    @Transactional
    public void skipEvent(UUID eventId, String eventType,
                          String aggregateType, UUID aggregateId,
                          String consumerGroup, String reason) {
        if (isAlreadyProcessed(eventId, consumerGroup)) {
            return;
        }
        repository.save(ProcessedEventEntity.fromDomain(
                ProcessedEvent.skipped(eventId, eventType, aggregateType, aggregateId, consumerGroup, reason)));
        log.debug("Skipped event {} by consumer group {}: {}", eventId, consumerGroup, reason);
    }

    @Transactional(readOnly = true)
    public boolean isAlreadyProcessed(UUID eventId, String consumerGroup) {
        return repository.existsByEventIdAndConsumerGroup(eventId, consumerGroup);
    }
}
