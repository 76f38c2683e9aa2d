package com.flagship.payment_settlement.payment.event;

import com.flagship.payment_settlement.payment.Payment;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
public class PaymentCancelledEvent implements PaymentEvent {
    UUID eventId;
    UUID paymentId;
    UUID organizationId;
    String paymentReference;
    String checkoutRequestId;
    Instant occurredAt;

    public static final String EVENT_TYPE = "PaymentCancelled";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static PaymentCancelledEvent fromPayment(Payment payment) {
        return new PaymentCancelledEvent(
            UUID.randomUUID(),
            payment.getId(),
            payment.getOrganizationId(),
            payment.getPaymentReference(),
            payment.getCheckoutRequestId(),
            Instant.now()
        );
    }
}
