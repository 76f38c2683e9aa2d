package com.flagship.payment_settlement.payment;

public enum PaymentMethod {
    MPESA,
    CARD,
    BANK,
    CASH,
    WALLET,
    CHEQUE
}
