package com.flagship.payment_settlement.notification.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.payment_settlement.notification.NotificationChannel;
import com.flagship.payment_settlement.notification.NotificationPriority;
import com.flagship.payment_settlement.notification.RecipientType;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Channel-specific requirements (subject for e-mail, phone for SMS and WhatsApp)
 * are checked by the service once customer contact details are filled in.
 */
@Value
public class SendNotificationRequest {

    @NotNull(message = "Recipient type is required")
    @JsonProperty("recipient_type")
    RecipientType recipientType;

    @JsonProperty("recipient_id")
    UUID recipientId;

    @Email(message = "Recipient email must be a valid address")
    @JsonProperty("recipient_email")
    String recipientEmail;

    @JsonProperty("recipient_phone")
    String recipientPhone;

    @NotBlank(message = "Notification type is required")
    @Size(max = 50)
    @JsonProperty("notification_type")
    String notificationType;

    @NotNull(message = "Channel is required")
    @JsonProperty("channel")
    NotificationChannel channel;

    @Size(max = 200)
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
