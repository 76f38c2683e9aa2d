package com.flagship.payment_settlement.exception;

public class InvalidPaymentStateException extends SettlementException {

    public InvalidPaymentStateException(String message) {
        super("INVALID_PAYMENT_STATE", message);
    }
}
