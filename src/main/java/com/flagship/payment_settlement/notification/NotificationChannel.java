package com.flagship.payment_settlement.notification;

/**
 * Delivery channels. Adding a channel means adding a constant here and a
 * {@link com.flagship.payment_settlement.notification.sender.NotificationSender} for it.
 */
public enum NotificationChannel {
    SMS,
    EMAIL,
    WHATSAPP,
    PUSH,
    IN_APP;

    public boolean requiresPhone() {
        return this == SMS || this == WHATSAPP;
    }

    public boolean requiresEmail() {
        return this == EMAIL;
    }

    /**
     * In-app messages are stored, not transported, so a successful send is already a delivery.
     */
    public boolean deliveredOnSend() {
        return this == IN_APP;
    }
}
