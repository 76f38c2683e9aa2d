package com.flagship.payment_settlement.notification.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.payment_settlement.notification.NotificationPreference;
import com.flagship.payment_settlement.notification.RecipientType;
import lombok.Value;

import java.time.LocalTime;
import java.util.UUID;

@Value
public class PreferenceResponse {

    @JsonProperty("recipient_type")
    RecipientType recipientType;

    @JsonProperty("recipient_id")
    UUID recipientId;

    @JsonProperty("receive_sms")
    boolean receiveSms;

    @JsonProperty("receive_email")
    boolean receiveEmail;

    @JsonProperty("receive_whatsapp")
    boolean receiveWhatsapp;

    @JsonProperty("receive_push")
    boolean receivePush;

    @JsonProperty("quiet_hours_start")
    LocalTime quietHoursStart;

    @JsonProperty("quiet_hours_end")
    LocalTime quietHoursEnd;

    public static PreferenceResponse from(NotificationPreference preference) {
        return new PreferenceResponse(
            preference.getRecipientType(),
            preference.getRecipientId(),
            preference.isReceiveSms(),
            preference.isReceiveEmail(),
            preference.isReceiveWhatsapp(),
            preference.isReceivePush(),
            preference.getQuietHoursStart(),
            preference.getQuietHoursEnd()
        );
    }
}
