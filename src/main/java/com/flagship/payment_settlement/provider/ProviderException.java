package com.flagship.payment_settlement.provider;

import com.flagship.payment_settlement.exception.SettlementException;

/**
 * Failure reported by (or while talking to) the mobile-money provider.
 * Subclasses tell the settlement engine whether a fresh attempt could succeed.
 */
public abstract class ProviderException extends SettlementException {

    private final Integer httpStatus;
    private final String responseBody;

    protected ProviderException(String code, String message, Integer httpStatus,
                                String responseBody, Throwable cause) {
        super(code, message, cause);
        this.httpStatus = httpStatus;
        this.responseBody = responseBody;
    }

    public abstract boolean isRetryable();

    public Integer getHttpStatus() {
        return httpStatus;
    }

    public String getResponseBody() {
        return responseBody;
    }
}
