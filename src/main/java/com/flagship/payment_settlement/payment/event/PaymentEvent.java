package com.flagship.payment_settlement.payment.event;

import java.time.Instant;
import java.util.UUID;

/**
 * Settlement fact written to the outbox in the same transaction as the transition it
 * describes. Consumers deduplicate on {@link #getEventId()}.
 */
public interface PaymentEvent {

    UUID getEventId();

    UUID getPaymentId();

    UUID getOrganizationId();

    Instant getOccurredAt();

    String getEventType();
}
