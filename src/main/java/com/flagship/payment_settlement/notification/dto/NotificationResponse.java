package com.flagship.payment_settlement.notification.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.payment_settlement.notification.Notification;
import com.flagship.payment_settlement.notification.NotificationChannel;
import com.flagship.payment_settlement.notification.NotificationPriority;
import com.flagship.payment_settlement.notification.NotificationStatus;
import com.flagship.payment_settlement.notification.RecipientType;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

@Value
@Builder
public class NotificationResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("recipient_type")
    RecipientType recipientType;

    @JsonProperty("recipient_id")
    UUID recipientId;

    @JsonProperty("notification_type")
    String notificationType;

    @JsonProperty("channel")
    NotificationChannel channel;

    @JsonProperty("subject")
    String subject;

    @JsonProperty("message")
    String message;

    @JsonProperty("priority")
    NotificationPriority priority;

    @JsonProperty("status")
    NotificationStatus status;

    @JsonProperty("scheduled_for")
    Instant scheduledFor;

    @JsonProperty("next_attempt_at")
    Instant nextAttemptAt;

    @JsonProperty("sent_at")
    Instant sentAt;

    @JsonProperty("delivered_at")
    Instant deliveredAt;

    @JsonProperty("read_at")
    Instant readAt;

    @JsonProperty("delivery_attempts")
    int deliveryAttempts;

    @JsonProperty("failure_reason")
    String failureReason;

    @JsonProperty("payment_id")
    UUID paymentId;

    @JsonProperty("invoice_id")
    UUID invoiceId;

    @JsonProperty("created_at")
    Instant createdAt;

    public static NotificationResponse from(Notification notification) {
        return NotificationResponse.builder()
            .id(notification.getId())
            .recipientType(notification.getRecipientType())
            .recipientId(notification.getRecipientId())
            .notificationType(notification.getNotificationType())
            .channel(notification.getChannel())
            .subject(notification.getSubject())
            .message(notification.getMessage())
            .priority(notification.getPriority())
            .status(notification.getStatus())
            .scheduledFor(notification.getScheduledFor())
            .nextAttemptAt(notification.getNextAttemptAt())
            .sentAt(notification.getSentAt())
            .deliveredAt(notification.getDeliveredAt())
            .readAt(notification.getReadAt())
            .deliveryAttempts(notification.getDeliveryAttempts())
            .failureReason(notification.getFailureReason())
            .paymentId(notification.getPaymentId())
            .invoiceId(notification.getInvoiceId())
            .createdAt(notification.getCreatedAt())
            .build();
    }
}
