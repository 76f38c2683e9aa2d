package com.flagship.payment_settlement.notification;

import lombok.Value;

import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Daily window in which nothing but in-app messages is sent. The window is
 * [start, end) in local time and may wrap midnight (22:00 to 07:00).
 * Equal start and end means no quiet hours.
 */
@Value
public class QuietHours {
    LocalTime start;
    LocalTime end;

    public static QuietHours of(LocalTime start, LocalTime end) {
        if (start == null || end == null) {
            throw new IllegalArgumentException("Quiet hours need both a start and an end");
        }
        return new QuietHours(start, end);
    }

    public boolean contains(LocalTime time) {
        if (start.equals(end)) {
            return false;
        }
        if (start.isBefore(end)) {
            return !time.isBefore(start) && time.isBefore(end);
        }
        return !time.isBefore(start) || time.isBefore(end);
    }

    public boolean contains(Instant instant, ZoneId zone) {
        return contains(instant.atZone(zone).toLocalTime());
    }

    /**
     * First instant after {@code instant} at which the window closes.
     */
    public Instant windowEnd(Instant instant, ZoneId zone) {
        ZonedDateTime local = instant.atZone(zone);
        ZonedDateTime candidate = local.with(end).withSecond(0).withNano(0);
        if (!candidate.isAfter(local)) {
            candidate = candidate.plusDays(1);
        }
        return candidate.toInstant();
    }
}
