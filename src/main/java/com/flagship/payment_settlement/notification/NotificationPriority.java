package com.flagship.payment_settlement.notification;

public enum NotificationPriority {
    LOW,
    NORMAL,
    HIGH,
    URGENT
}
