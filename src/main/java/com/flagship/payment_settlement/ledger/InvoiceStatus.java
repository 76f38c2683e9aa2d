package com.flagship.payment_settlement.ledger;

public enum InvoiceStatus {
    DRAFT,
    SENT,
    VIEWED,
    PARTIALLY_PAID,
    PAID,
    OVERDUE,
    CANCELLED
}
