package com.flagship.payment_settlement.payment;

import com.flagship.payment_settlement.exception.SettlementException;
import com.flagship.payment_settlement.provider.ProviderException;

import java.util.UUID;

/**
 * Surfaces a provider failure to the caller after the payment has been marked FAILED.
 */
public class PaymentDispatchException extends SettlementException {

    private final UUID paymentId;
    private final String paymentReference;
    private final ProviderException providerError;

    public PaymentDispatchException(Payment payment, ProviderException providerError) {
        super(providerError.getCode(),
                "Dispatch of payment " + payment.getPaymentReference() + " failed: " + providerError.getMessage(),
                providerError);
        this.paymentId = payment.getId();
        this.paymentReference = payment.getPaymentReference();
        this.providerError = providerError;
    }

    public UUID getPaymentId() {
        return paymentId;
    }

    public String getPaymentReference() {
        return paymentReference;
    }

    public ProviderException getProviderError() {
        return providerError;
    }

    public boolean isRetryable() {
        return providerError.isRetryable();
    }
}
