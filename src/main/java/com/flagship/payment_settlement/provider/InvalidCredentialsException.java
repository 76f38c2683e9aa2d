package com.flagship.payment_settlement.provider;

/**
 * The integration's consumer key/secret were refused. Operator action is needed, so
 * this is never retried.
 */
public class InvalidCredentialsException extends ProviderException {

    public InvalidCredentialsException(String message, Integer httpStatus, String responseBody) {
        super("INVALID_CREDENTIALS", message, httpStatus, responseBody, null);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
