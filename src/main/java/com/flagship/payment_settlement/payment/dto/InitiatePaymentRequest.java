package com.flagship.payment_settlement.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.payment_settlement.payment.CurrencyCode;
import com.flagship.payment_settlement.payment.PaymentType;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Body of {@code POST /api/payments}. Currency defaults to KES and payment type to OTHER.
 */
@Value
public class InitiatePaymentRequest {

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0.01", message = "Amount must be greater than 0")
    @JsonProperty("amount")
    BigDecimal amount;

    @DecimalMin(value = "0.00", message = "Transaction fee cannot be negative")
    @JsonProperty("transaction_fee")
    BigDecimal transactionFee;

    @JsonProperty("currency")
    CurrencyCode currency;

    @NotBlank(message = "Phone number is required")
    @JsonProperty("phone_number")
    String phoneNumber;

    @JsonProperty("payer_name")
    String payerName;

    @Email(message = "Payer email is not a valid address")
    @JsonProperty("payer_email")
    String payerEmail;

    @JsonProperty("customer_id")
    UUID customerId;

    @JsonProperty("invoice_id")
    UUID invoiceId;

    @JsonProperty("payment_plan_id")
    UUID paymentPlanId;

    @JsonProperty("payment_type")
    PaymentType paymentType;

    @Size(max = 255, message = "Description must be at most 255 characters")
    @JsonProperty("description")
    String description;

    @JsonProperty("created_by")
    String createdBy;
}
