package com.flagship.payment_settlement.notification.sender;

import com.flagship.payment_settlement.notification.Notification;
import com.flagship.payment_settlement.notification.NotificationChannel;
import lombok.extern.slf4j.Slf4j;

import java.util.Locale;
import java.util.UUID;

/**
 * Stand-in transport that writes the message to the log and hands back a generated
 * message id. Real SMS, e-mail or WhatsApp gateways replace these beans.
 */
@Slf4j
public class LoggingNotificationSender implements NotificationSender {

    private final NotificationChannel channel;

    public LoggingNotificationSender(NotificationChannel channel) {
        this.channel = channel;
    }

    @Override
    public NotificationChannel channel() {
        return channel;
    }

    @Override
    public String send(Notification notification) {
        String address = switch (channel) {
            case SMS, WHATSAPP -> notification.getRecipientPhone();
            case EMAIL -> notification.getRecipientEmail();
            case PUSH, IN_APP -> String.valueOf(notification.getRecipientId());
        };
        if (address == null || address.isBlank() || "null".equals(address)) {
            throw new NotificationDeliveryException(
                    "No " + channel.name().toLowerCase(Locale.ROOT) + " address for notification " + notification.getId());
        }
        String messageId = channel.name().toLowerCase(Locale.ROOT) + "-" + UUID.randomUUID();
        log.info("[{}] to={} type={} subject={} id={}",
                channel, address, notification.getNotificationType(), notification.getSubject(), messageId);
        return messageId;
    }
}
