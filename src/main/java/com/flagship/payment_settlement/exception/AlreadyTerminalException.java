package com.flagship.payment_settlement.exception;

import com.flagship.payment_settlement.payment.PaymentStatus;

import java.util.UUID;

/**
 * Raised when a caller asks for a transition on a payment that already reached a final
 * state. The webhook path treats the same situation as a silent no-op.
 */
public class AlreadyTerminalException extends SettlementException {

    private final PaymentStatus status;

    public AlreadyTerminalException(UUID paymentId, PaymentStatus status) {
        super("ALREADY_TERMINAL", "Payment " + paymentId + " is already " + status);
        this.status = status;
    }

    public PaymentStatus getStatus() {
        return status;
    }
}
