package com.flagship.payment_settlement.provider;

/**
 * The provider understood the push request and refused it (bad phone number, amount
 * limits, non-zero ResponseCode).
 */
public class ProviderRejectedException extends ProviderException {

    public ProviderRejectedException(String message, Integer httpStatus, String responseBody) {
        super("PROVIDER_REJECTED", message, httpStatus, responseBody, null);
    }

    @Override
    public boolean isRetryable() {
        return false;
    }
}
