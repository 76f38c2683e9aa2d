package com.flagship.payment_settlement.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.flagship.payment_settlement.payment.CurrencyCode;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Body of {@code POST /api/invoices}. Line items are stored as sent.
 */
@Value
public class CreateInvoiceRequest {

    @NotNull(message = "Customer is required")
    @JsonProperty("customer_id")
    UUID customerId;

    @JsonProperty("currency")
    CurrencyCode currency;

    @JsonProperty("issue_date")
    LocalDate issueDate;

    @NotNull(message = "Due date is required")
    @JsonProperty("due_date")
    LocalDate dueDate;

    @NotNull(message = "Subtotal is required")
    @DecimalMin(value = "0.00", message = "Subtotal cannot be negative")
    @JsonProperty("subtotal")
    BigDecimal subtotal;

    @DecimalMin(value = "0.00", message = "Tax cannot be negative")
    @JsonProperty("tax_amount")
    BigDecimal taxAmount;

    @DecimalMin(value = "0.00", message = "Discount cannot be negative")
    @JsonProperty("discount_amount")
    BigDecimal discountAmount;

    @JsonProperty("items")
    JsonNode items;

    @JsonProperty("reference")
    String reference;

    @JsonProperty("notes")
    String notes;

    @JsonProperty("created_by")
    String createdBy;
}
