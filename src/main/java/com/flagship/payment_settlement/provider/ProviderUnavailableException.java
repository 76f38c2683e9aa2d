package com.flagship.payment_settlement.provider;

/**
 * Timeouts, connection failures and 5xx answers. Transient: the caller may retry with a
 * new payment.
 */
public class ProviderUnavailableException extends ProviderException {

    public ProviderUnavailableException(String message, Integer httpStatus, String responseBody, Throwable cause) {
        super("PROVIDER_UNAVAILABLE", message, httpStatus, responseBody, cause);
    }

    public ProviderUnavailableException(String message, Throwable cause) {
        this(message, null, null, cause);
    }

    @Override
    public boolean isRetryable() {
        return true;
    }
}
