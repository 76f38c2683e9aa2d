package com.flagship.payment_settlement.payment;

public enum PaymentType {
    INVOICE,
    SUBSCRIPTION,
    FEE,
    RENT,
    DONATION,
    REFUND,
    OTHER
}
