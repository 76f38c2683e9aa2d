package com.flagship.payment_settlement.notification.sender;

import com.flagship.payment_settlement.notification.Notification;
import com.flagship.payment_settlement.notification.NotificationChannel;

/**
 * Transport for one channel. Every sender bean is picked up by the dispatcher and
 * keyed by {@link #channel()}.
 */
public interface NotificationSender {

    NotificationChannel channel();

    /**
     * @return the transport's message id
     * @throws NotificationDeliveryException if the transport refused or could not be reached
     */
    String send(Notification notification);
}
