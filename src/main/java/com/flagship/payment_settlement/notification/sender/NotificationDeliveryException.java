package com.flagship.payment_settlement.notification.sender;

import com.flagship.payment_settlement.exception.SettlementException;

public class NotificationDeliveryException extends SettlementException {

    public NotificationDeliveryException(String message) {
        super("NOTIFICATION_DELIVERY_FAILED", message);
    }

    public NotificationDeliveryException(String message, Throwable cause) {
        super("NOTIFICATION_DELIVERY_FAILED", message, cause);
    }
}
