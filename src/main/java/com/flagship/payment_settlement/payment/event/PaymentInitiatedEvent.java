package com.flagship.payment_settlement.payment.event;

import com.flagship.payment_settlement.payment.Payment;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * The provider accepted the push request; the payer's phone is being prompted.
 */
@Value
public class PaymentInitiatedEvent implements PaymentEvent {
    UUID eventId;
    UUID paymentId;
    UUID organizationId;
    String paymentReference;
    BigDecimal amount;
    String currency;
    String checkoutRequestId;
    Instant occurredAt;

    public static final String EVENT_TYPE = "PaymentInitiated";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static PaymentInitiatedEvent fromPayment(Payment payment) {
        return new PaymentInitiatedEvent(
            UUID.randomUUID(),
            payment.getId(),
            payment.getOrganizationId(),
            payment.getPaymentReference(),
            payment.getAmount(),
            payment.getCurrency().name(),
            payment.getCheckoutRequestId(),
            Instant.now()
        );
    }
}
