package com.flagship.payment_settlement.payment;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Caller-supplied attributes of a new payment, after customer resolution and
 * organization checks.
 */
@Value
@Builder(toBuilder = true)
public class PaymentRequestDetails {
    UUID customerId;
    UUID invoiceId;
    UUID paymentPlanId;
    BigDecimal amount;
    BigDecimal transactionFee;
    CurrencyCode currency;
    PaymentType paymentType;
    String description;
    String payerPhone;
    String payerName;
    String payerEmail;
    String createdBy;
}
