package com.flagship.payment_settlement.payment;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
@Builder
public class ManualPayment {
    BigDecimal amount;
    PaymentMethod paymentMethod;
    String externalReference;
    String description;
    Instant paidAt;
    String recordedBy;
}
