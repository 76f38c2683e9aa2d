package com.flagship.payment_settlement.notification.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.payment_settlement.notification.NotificationChannel;
import com.flagship.payment_settlement.notification.NotificationPriority;
import com.flagship.payment_settlement.notification.RecipientType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Value
public class BulkNotificationRequest {

    @NotNull(message = "Recipient type is required")
    @JsonProperty("recipient_type")
    RecipientType recipientType;

    @NotEmpty(message = "At least one recipient is required")
    @JsonProperty("recipient_ids")
    List<UUID> recipientIds;

    @NotBlank(message = "Notification type is required")
    @JsonProperty("notification_type")
    String notificationType;

    @NotNull(message = "Channel is required")
    @JsonProperty("channel")
    NotificationChannel channel;

    @JsonProperty("subject")
    String subject;

    @NotBlank(message = "Message is required")
    @JsonProperty("message")
    String message;

    @JsonProperty("priority")
    NotificationPriority priority;

    @JsonProperty("scheduled_for")
    Instant scheduledFor;
}
