package com.flagship.payment_settlement.payment;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of a single money movement.
 *
 * Partial settlement is not a payment state: it lives on the invoice or plan the
 * payment is linked to.
 */
public enum PaymentStatus {
    /**
     * Created and referenced, not yet sent to the provider.
     */
    PENDING,

    /**
     * Dispatch has begun. Once the provider accepts the push request the checkout and
     * merchant request ids are recorded here.
     */
    INITIATED,

    /**
     * A provider result for the push request is being applied.
     */
    PROCESSING,

    /**
     * Confirmed by the provider (or recorded manually). Only state that can be reversed.
     */
    COMPLETED,

    /**
     * Provider rejected the push, the payer declined, or no callback arrived in time.
     */
    FAILED,

    /**
     * Abandoned by the caller before confirmation.
     */
    CANCELLED,

    /**
     * Ledger-only reversal of a completed payment.
     */
    REVERSED;

    private static final Set<PaymentStatus> TERMINAL = EnumSet.of(COMPLETED, FAILED, CANCELLED, REVERSED);
    private static final Set<PaymentStatus> AWAITING_CALLBACK = EnumSet.of(INITIATED, PROCESSING);

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }

    public static Set<PaymentStatus> awaitingCallback() {
        return EnumSet.copyOf(AWAITING_CALLBACK);
    }
}
