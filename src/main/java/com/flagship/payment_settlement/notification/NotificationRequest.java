package com.flagship.payment_settlement.notification;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * What a caller asks to send. Contact details may be left out for CUSTOMER recipients;
 * they are then taken from the customer record.
 */
@Value
@Builder(toBuilder = true)
public class NotificationRequest {
    UUID organizationId;
    RecipientType recipientType;
    UUID recipientId;
    String recipientEmail;
    String recipientPhone;
    String notificationType;
    NotificationChannel channel;
    String subject;
    String message;
    NotificationPriority priority;
    Instant scheduledFor;
    UUID paymentId;
    UUID invoiceId;
}
