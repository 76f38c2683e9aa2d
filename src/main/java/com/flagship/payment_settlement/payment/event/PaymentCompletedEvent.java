package com.flagship.payment_settlement.payment.event;

import com.flagship.payment_settlement.payment.Payment;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
public class PaymentCompletedEvent implements PaymentEvent {
    UUID eventId;
    UUID paymentId;
    UUID organizationId;
    String paymentReference;
    String externalReference;
    BigDecimal amount;
    BigDecimal netAmount;
    String currency;
    UUID customerId;
    UUID invoiceId;
    UUID paymentPlanId;
    String paymentMethod;
    Instant occurredAt;

    public static final String EVENT_TYPE = "PaymentCompleted";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }

    public static PaymentCompletedEvent fromPayment(Payment payment) {
        return new PaymentCompletedEvent(
            UUID.randomUUID(),
            payment.getId(),
            payment.getOrganizationId(),
            payment.getPaymentReference(),
            payment.getExternalReference(),
            payment.getAmount(),
            payment.getNetAmount(),
            payment.getCurrency().name(),
            payment.getCustomerId(),
            payment.getInvoiceId(),
            payment.getPaymentPlanId(),
            payment.getPaymentMethod().name(),
            Instant.now()
        );
    }
}
