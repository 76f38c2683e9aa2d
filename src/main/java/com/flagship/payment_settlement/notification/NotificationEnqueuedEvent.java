package com.flagship.payment_settlement.notification;

import lombok.Value;

import java.time.Instant;
import java.util.UUID;

/**
 * Published through the outbox so a consumer can deliver the notification right away
 * instead of waiting for the next worker poll.
 */
@Value
public class NotificationEnqueuedEvent {

    public static final String EVENT_TYPE = "NotificationEnqueued";

    UUID eventId;
    UUID notificationId;
    UUID organizationId;
    NotificationChannel channel;
    Instant scheduledFor;
    Instant occurredAt;

    public static NotificationEnqueuedEvent fromNotification(Notification notification) {
        return new NotificationEnqueuedEvent(
            UUID.randomUUID(),
            notification.getId(),
            notification.getOrganizationId(),
            notification.getChannel(),
            notification.getScheduledFor(),
            Instant.now()
        );
    }

    public String getEventType() {
        return EVENT_TYPE;
    }
}
