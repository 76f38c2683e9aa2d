package com.flagship.payment_settlement.ledger;

public enum PaymentPlanStatus {
    ACTIVE,
    COMPLETED,
    OVERDUE,
    CANCELLED;

    public boolean acceptsInstallments() {
        return this == ACTIVE || this == OVERDUE;
    }
}
