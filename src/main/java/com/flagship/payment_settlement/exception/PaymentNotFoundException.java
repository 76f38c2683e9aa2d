package com.flagship.payment_settlement.exception;

import java.util.UUID;

public class PaymentNotFoundException extends SettlementException {

    public PaymentNotFoundException(String message) {
        super("PAYMENT_NOT_FOUND", message);
    }

    public static PaymentNotFoundException byId(UUID paymentId) {
        return new PaymentNotFoundException("Payment not found: " + paymentId);
    }

    public static PaymentNotFoundException byCheckoutRequestId(String checkoutRequestId) {
        return new PaymentNotFoundException(
                "No payment awaiting a callback for checkout request " + checkoutRequestId);
    }
}
