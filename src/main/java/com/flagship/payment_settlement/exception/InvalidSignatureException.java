package com.flagship.payment_settlement.exception;

/**
 * A callback whose signature does not match the owning integration's webhook secret.
 * Nothing may be mutated once this is raised.
 */
public class InvalidSignatureException extends SettlementException {

    public InvalidSignatureException(String message) {
        super("INVALID_SIGNATURE", message);
    }
}
