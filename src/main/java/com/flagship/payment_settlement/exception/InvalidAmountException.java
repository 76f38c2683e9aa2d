package com.flagship.payment_settlement.exception;

import java.math.BigDecimal;

public class InvalidAmountException extends SettlementException {

    public InvalidAmountException(String message) {
        super("INVALID_AMOUNT", message);
    }

    public static InvalidAmountException notPositive(String field, BigDecimal value) {
        return new InvalidAmountException(field + " must be greater than 0, got " + value);
    }
}
