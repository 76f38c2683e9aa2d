package com.flagship.payment_settlement.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.payment_settlement.payment.PaymentMethod;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Money received outside the push flow. Method defaults to CASH.
 */
@Value
public class RecordManualPaymentRequest {

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0.01", message = "Amount must be greater than 0")
    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("payment_method")
    PaymentMethod paymentMethod;

    @JsonProperty("external_reference")
    String externalReference;

    @JsonProperty("description")
    String description;

    @JsonProperty("paid_at")
    Instant paidAt;

    @JsonProperty("recorded_by")
    String recordedBy;
}
