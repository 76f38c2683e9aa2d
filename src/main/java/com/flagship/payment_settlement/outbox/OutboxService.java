package com.flagship.payment_settlement.outbox;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.payment_settlement.notification.NotificationEnqueuedEvent;
import com.flagship.payment_settlement.payment.event.PaymentEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Outbox rows for settlement facts and notification wake-ups.
 *
 * Writes join the transaction that changed the payment or queued the notification, so
 * a rolled-back transition never leaves an event behind. Bookkeeping after a publish
 * attempt runs in its own transaction, independent of the batch being published.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OutboxService {

    private final OutboxEventRepository repository;
    private final ObjectMapper objectMapper;

    @Transactional(propagation = Propagation.MANDATORY)
    public OutboxEvent savePaymentEvent(PaymentEvent event) {
        return saveEvent(OutboxEvent.AGGREGATE_PAYMENT, event.getPaymentId(), event.getEventType(), event);
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public OutboxEvent saveNotificationEvent(NotificationEnqueuedEvent event) {
        return saveEvent(OutboxEvent.AGGREGATE_NOTIFICATION, event.getNotificationId(), event.getEventType(), event);
    }

    /**
     * @throws org.springframework.transaction.IllegalTransactionStateException when no
     *         transaction is active
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public OutboxEvent saveEvent(String aggregateType, UUID aggregateId, String eventType, Object payload) {
        OutboxEvent event = OutboxEvent.create(aggregateType, aggregateId, eventType, toJson(payload));
        OutboxEvent saved = repository.save(OutboxEventEntity.fromDomain(event)).toDomain();
        log.debug("Outbox <- {} for {} {}", eventType, aggregateType, aggregateId);
        return saved;
    }

    /**
     * Claims up to {@code limit} rows that are unpublished and below the retry limit,
     * oldest sequence first. Rows locked by another publisher are skipped.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public List<OutboxEvent> findPublishable(int limit, int maxRetries) {
        return repository.findPublishableForUpdate(limit, maxRetries).stream()
                .map(OutboxEventEntity::toDomain)
                .toList();
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markPublished(UUID eventId) {
        repository.findById(eventId).ifPresent(entity -> {
            entity.markPublished();
            repository.save(entity);
        });
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markFailed(UUID eventId, String errorMessage) {
        repository.findById(eventId).ifPresent(entity -> {
            entity.markFailed(errorMessage);
            repository.save(entity);
            log.warn("Publish of {} {} failed (attempt {}): {}", entity.getEventType(), eventId,
                    entity.getRetryCount(), errorMessage);
        });
    }

    @Transactional(readOnly = true)
    public List<OutboxEvent> getEventsForAggregate(String aggregateType, UUID aggregateId) {
        return repository.findByAggregateTypeAndAggregateIdOrderBySequenceNumberAsc(aggregateType, aggregateId)
                .stream()
                .map(OutboxEventEntity::toDomain)
                .toList();
    }

    @Transactional(readOnly = true)
    public long countUnpublished() {
        return repository.countUnpublished();
    }

    private String toJson(Object payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Outbox payload " + payload.getClass().getSimpleName()
                    + " is not serializable", e);
        }
    }
}
