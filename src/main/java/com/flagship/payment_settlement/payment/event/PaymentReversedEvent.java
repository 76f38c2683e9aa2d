package com.flagship.payment_settlement.payment.event;

import com.flagship.payment_settlement.payment.Payment;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
public class PaymentReversedEvent implements PaymentEvent {
    UUID eventId;
    UUID paymentId;
    UUID organizationId;
    String paymentReference;
    BigDecimal amount;
    String reason;
    String reversedBy;
    Instant occurredAt;

    public static final String EVENT_TYPE = "PaymentReversed";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static PaymentReversedEvent fromPayment(Payment payment) {
        return new PaymentReversedEvent(
            UUID.randomUUID(),
            payment.getId(),
            payment.getOrganizationId(),
            payment.getPaymentReference(),
            payment.getAmount(),
            payment.getReversalReason(),
            payment.getReversedBy(),
            Instant.now()
        );
    }
}
