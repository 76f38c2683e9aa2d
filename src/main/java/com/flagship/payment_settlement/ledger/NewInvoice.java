package com.flagship.payment_settlement.ledger;

import com.flagship.payment_settlement.payment.CurrencyCode;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Input for {@link InvoiceService#create}. {@code items} is the line-item array as JSON.
 */
@Value
@Builder
public class NewInvoice {
    UUID customerId;
    CurrencyCode currency;
    LocalDate issueDate;
    LocalDate dueDate;
    BigDecimal subtotal;
    BigDecimal taxAmount;
    BigDecimal discountAmount;
    String items;
    String reference;
    String notes;
    String createdBy;
}
