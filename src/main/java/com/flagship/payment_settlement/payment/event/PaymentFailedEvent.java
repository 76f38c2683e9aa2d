package com.flagship.payment_settlement.payment.event;

import com.flagship.payment_settlement.payment.Payment;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Rejected at dispatch, declined by the payer, or timed out waiting for a callback.
 */
@Value
public class PaymentFailedEvent implements PaymentEvent {
    UUID eventId;
    UUID paymentId;
    UUID organizationId;
    String paymentReference;
    String reason;
    Instant occurredAt;

    public static final String EVENT_TYPE = "PaymentFailed";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static PaymentFailedEvent fromPayment(Payment payment) {
        return new PaymentFailedEvent(
            UUID.randomUUID(),
            payment.getId(),
            payment.getOrganizationId(),
            payment.getPaymentReference(),
            payment.getFailureReason(),
            Instant.now()
        );
    }
}
