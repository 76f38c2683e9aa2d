package com.flagship.payment_settlement.notification.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.payment_settlement.notification.RecipientType;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.time.LocalTime;
import java.util.UUID;

@Value
public class UpdatePreferenceRequest {

    @NotNull(message = "Recipient type is required")
    @JsonProperty("recipient_type")
    RecipientType recipientType;

    @NotNull(message = "Recipient id is required")
    @JsonProperty("recipient_id")
    UUID recipientId;

    @JsonProperty("receive_sms")
    Boolean receiveSms;

    @JsonProperty("receive_email")
    Boolean receiveEmail;

    @JsonProperty("receive_whatsapp")
    Boolean receiveWhatsapp;

    @JsonProperty("receive_push")
    Boolean receivePush;

    @JsonProperty("quiet_hours_start")
    LocalTime quietHoursStart;

    @JsonProperty("quiet_hours_end")
    LocalTime quietHoursEnd;
}
