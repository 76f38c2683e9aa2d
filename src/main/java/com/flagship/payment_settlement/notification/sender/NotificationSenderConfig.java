package com.flagship.payment_settlement.notification.sender;

import com.flagship.payment_settlement.notification.NotificationChannel;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Default senders, one per channel.
 */
@Configuration
public class NotificationSenderConfig {

    @Bean
    public NotificationSender smsSender() {
        return new LoggingNotificationSender(NotificationChannel.SMS);
    }

    @Bean
    public NotificationSender emailSender() {
        return new LoggingNotificationSender(NotificationChannel.EMAIL);
    }

    @Bean
    public NotificationSender whatsappSender() {
        return new LoggingNotificationSender(NotificationChannel.WHATSAPP);
    }

    @Bean
    public NotificationSender pushSender() {
        return new LoggingNotificationSender(NotificationChannel.PUSH);
    }

    @Bean
    public NotificationSender inAppSender() {
        return new LoggingNotificationSender(NotificationChannel.IN_APP);
    }
}
