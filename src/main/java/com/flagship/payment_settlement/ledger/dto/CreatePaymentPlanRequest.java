package com.flagship.payment_settlement.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

@Value
public class CreatePaymentPlanRequest {

    @NotNull(message = "Customer is required")
    @JsonProperty("customer_id")
    UUID customerId;

    @NotBlank(message = "Name is required")
    @JsonProperty("name")
    String name;

    @JsonProperty("description")
    String description;

    @NotNull(message = "Total amount is required")
    @DecimalMin(value = "0.01", message = "Total amount must be greater than 0")
    @JsonProperty("total_amount")
    BigDecimal totalAmount;

    @Min(value = 1, message = "At least one installment is required")
    @JsonProperty("number_of_installments")
    int numberOfInstallments;

    @JsonProperty("start_date")
    LocalDate startDate;

    @NotNull(message = "End date is required")
    @JsonProperty("end_date")
    LocalDate endDate;
}
