package com.flagship.payment_settlement.notification.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.payment_settlement.notification.NotificationService;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.UUID;

@Value
public class BulkNotificationResponse {

    @JsonProperty("requested")
    int requested;

    @JsonProperty("created")
    int created;

    @JsonProperty("failed")
    int failed;

    @JsonProperty("notification_ids")
    List<UUID> notificationIds;

    @JsonProperty("failures")
    Map<UUID, String> failures;

    public static BulkNotificationResponse from(NotificationService.BulkResult result) {
        return new BulkNotificationResponse(
            result.getRequested(),
            result.getCreated(),
            result.getFailed(),
            result.getNotificationIds(),
            result.getFailures()
        );
    }
}
