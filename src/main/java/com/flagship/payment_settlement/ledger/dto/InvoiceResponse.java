package com.flagship.payment_settlement.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonRawValue;
import com.flagship.payment_settlement.ledger.Invoice;
import com.flagship.payment_settlement.ledger.InvoiceStatus;
import com.flagship.payment_settlement.payment.CurrencyCode;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

@Value
@Builder
public class InvoiceResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("invoice_number")
    String invoiceNumber;

    @JsonProperty("customer_id")
    UUID customerId;

    @JsonProperty("status")
    InvoiceStatus status;

    @JsonProperty("currency")
    CurrencyCode currency;

    @JsonProperty("issue_date")
    LocalDate issueDate;

    @JsonProperty("due_date")
    LocalDate dueDate;

    @JsonProperty("paid_date")
    LocalDate paidDate;

    @JsonProperty("subtotal")
    BigDecimal subtotal;

    @JsonProperty("tax_amount")
    BigDecimal taxAmount;

    @JsonProperty("discount_amount")
    BigDecimal discountAmount;

    @JsonProperty("total_amount")
    BigDecimal totalAmount;

    @JsonProperty("amount_paid")
    BigDecimal amountPaid;

    @JsonProperty("balance_due")
    BigDecimal balanceDue;

    @JsonProperty("progress_percentage")
    BigDecimal progressPercentage;

    @JsonRawValue
    @JsonProperty("items")
    String items;

    @JsonProperty("reference")
    String reference;

    @JsonProperty("notes")
    String notes;

    @JsonProperty("sent_at")
    Instant sentAt;

    @JsonProperty("created_at")
    Instant createdAt;

    public static InvoiceResponse from(Invoice invoice) {
        return InvoiceResponse.builder()
                .id(invoice.getId())
                .invoiceNumber(invoice.getInvoiceNumber())
                .customerId(invoice.getCustomerId())
                .status(invoice.getStatus())
                .currency(invoice.getCurrency())
                .issueDate(invoice.getIssueDate())
                .dueDate(invoice.getDueDate())
                .paidDate(invoice.getPaidDate())
                .subtotal(invoice.getSubtotal())
                .taxAmount(invoice.getTaxAmount())
                .discountAmount(invoice.getDiscountAmount())
                .totalAmount(invoice.getTotalAmount())
                .amountPaid(invoice.getAmountPaid())
                .balanceDue(invoice.balanceDue())
                .progressPercentage(invoice.progressPercentage())
                .items(invoice.getItems())
                .reference(invoice.getReference())
                .notes(invoice.getNotes())
                .sentAt(invoice.getSentAt())
                .createdAt(invoice.getCreatedAt())
                .build();
    }
}
