package com.flagship.payment_settlement.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.payment_settlement.ledger.PaymentPlan;
import com.flagship.payment_settlement.ledger.PaymentPlanStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
public class PaymentPlanResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("customer_id")
    UUID customerId;

    @JsonProperty("name")
    String name;

    @JsonProperty("description")
    String description;

    @JsonProperty("status")
    PaymentPlanStatus status;

    @JsonProperty("total_amount")
    BigDecimal totalAmount;

    @JsonProperty("amount_paid")
    BigDecimal amountPaid;

    @JsonProperty("balance")
    BigDecimal balance;

    @JsonProperty("number_of_installments")
    int numberOfInstallments;

    @JsonProperty("installment_amount")
    BigDecimal installmentAmount;

    @JsonProperty("installments_paid")
    int installmentsPaid;

    @JsonProperty("progress_percentage")
    BigDecimal progressPercentage;

    @JsonProperty("start_date")
    LocalDate startDate;

    @JsonProperty("end_date")
    LocalDate endDate;

    public static PaymentPlanResponse from(PaymentPlan plan) {
        return PaymentPlanResponse.builder()
                .id(plan.getId())
                .customerId(plan.getCustomerId())
                .name(plan.getName())
                .description(plan.getDescription())
                .status(plan.getStatus())
                .totalAmount(plan.getTotalAmount())
                .amountPaid(plan.getAmountPaid())
                .balance(plan.getBalance())
                .numberOfInstallments(plan.getNumberOfInstallments())
                .installmentAmount(plan.getInstallmentAmount())
                .installmentsPaid(plan.getInstallmentsPaid())
                .progressPercentage(plan.progressPercentage())
                .startDate(plan.getStartDate())
                .endDate(plan.getEndDate())
                .build();
    }
}
