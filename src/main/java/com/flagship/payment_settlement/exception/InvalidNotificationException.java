package com.flagship.payment_settlement.exception;

public class InvalidNotificationException extends SettlementException {

    public InvalidNotificationException(String message) {
        super("INVALID_NOTIFICATION", message);
    }
}
