package com.flagship.payment_settlement.notification;

public enum NotificationStatus {
    PENDING,
    SENT,
    DELIVERED,
    FAILED,
    READ;

    public boolean isTerminal() {
        return this == SENT || this == DELIVERED || this == READ;
    }
}
