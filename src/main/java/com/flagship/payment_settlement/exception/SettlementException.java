package com.flagship.payment_settlement.exception;

/**
 * Root of the settlement error taxonomy. The code is stable and returned to API
 * callers alongside the HTTP status.
 */
public abstract class SettlementException extends RuntimeException {

    private final String code;

    protected SettlementException(String code, String message) {
        super(message);
        this.code = code;
    }

    protected SettlementException(String code, String message, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
