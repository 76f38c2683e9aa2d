package com.flagship.payment_settlement.payment.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.payment_settlement.payment.CurrencyCode;
import com.flagship.payment_settlement.payment.Payment;
import com.flagship.payment_settlement.payment.PaymentMethod;
import com.flagship.payment_settlement.payment.PaymentStatus;
import com.flagship.payment_settlement.payment.PaymentType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class PaymentResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("payment_reference")
    String paymentReference;

    @JsonProperty("status")
    PaymentStatus status;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("transaction_fee")
    BigDecimal transactionFee;

    @JsonProperty("net_amount")
    BigDecimal netAmount;

    @JsonProperty("currency")
    CurrencyCode currency;

    @JsonProperty("payment_type")
    PaymentType paymentType;

    @JsonProperty("payment_method")
    PaymentMethod paymentMethod;

    @JsonProperty("customer_id")
    UUID customerId;

    @JsonProperty("invoice_id")
    UUID invoiceId;

    @JsonProperty("payment_plan_id")
    UUID paymentPlanId;

    @JsonProperty("phone_number")
    String payerPhone;

    @JsonProperty("checkout_request_id")
    String checkoutRequestId;

    @JsonProperty("merchant_request_id")
    String merchantRequestId;

    @JsonProperty("external_reference")
    String externalReference;

    @JsonProperty("failure_reason")
    String failureReason;

    @JsonProperty("is_reversed")
    boolean reversed;

    @JsonProperty("reversal_reason")
    String reversalReason;

    @JsonProperty("reversed_by")
    String reversedBy;

    @JsonProperty("initiated_at")
    Instant initiatedAt;

    @JsonProperty("completed_at")
    Instant completedAt;

    @JsonProperty("reversed_at")
    Instant reversedAt;

    @JsonProperty("created_at")
    Instant createdAt;

    public static PaymentResponse from(Payment payment) {
        return PaymentResponse.builder()
                .id(payment.getId())
                .paymentReference(payment.getPaymentReference())
                .status(payment.getStatus())
                .amount(payment.getAmount())
                .transactionFee(payment.getTransactionFee())
                .netAmount(payment.getNetAmount())
                .currency(payment.getCurrency())
                .paymentType(payment.getPaymentType())
                .paymentMethod(payment.getPaymentMethod())
                .customerId(payment.getCustomerId())
                .invoiceId(payment.getInvoiceId())
                .paymentPlanId(payment.getPaymentPlanId())
                .payerPhone(payment.getPayerPhone())
                .checkoutRequestId(payment.getCheckoutRequestId())
                .merchantRequestId(payment.getMerchantRequestId())
                .externalReference(payment.getExternalReference())
                .failureReason(payment.getFailureReason())
                .reversed(payment.isReversed())
                .reversalReason(payment.getReversalReason())
                .reversedBy(payment.getReversedBy())
                .initiatedAt(payment.getInitiatedAt())
                .completedAt(payment.getCompletedAt())
                .reversedAt(payment.getReversedAt())
                .createdAt(payment.getCreatedAt())
                .build();
    }
}
