package com.flagship.payment_settlement.notification;

public enum RecipientType {
    CUSTOMER,
    USER,
    ORGANIZATION,
    GROUP
}
