package com.flagship.payment_settlement.notification;

import com.flagship.payment_settlement.notification.sender.NotificationSender;
import com.flagship.payment_settlement.observability.CorrelationContext;
import com.flagship.payment_settlement.observability.SettlementMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Delivers queued notifications.
 *
 * Each call works on one row under a row lock and ends in exactly one outcome:
 * <ul>
 *   <li>already sent/delivered/read, or not due yet: left untouched</li>
 *   <li>channel switched off by the recipient: FAILED, never retried</li>
 *   <li>inside the recipient's quiet hours: rescheduled to the end of the window</li>
 *   <li>otherwise sent; a transport failure is retried after
 *       {@code retry-base-delay * attempts} until {@code max-attempts} is reached</li>
 * </ul>
 * Duplicate wake-ups (worker poll and Kafka event for the same row) are harmless: the
 * second one finds the row terminal or not yet due.
 */
@Component
@Slf4j
public class NotificationDispatcher {

    private final NotificationRepository notificationRepository;
    private final NotificationPreferenceRepository preferenceRepository;
    private final Map<NotificationChannel, NotificationSender> senders;
    private final SettlementMetrics metrics;
    private final Clock clock;
    private final ZoneId zone;
    private final int maxAttempts;
    private final Duration retryBaseDelay;

    public NotificationDispatcher(NotificationRepository notificationRepository,
                                  NotificationPreferenceRepository preferenceRepository,
                                  List<NotificationSender> senderBeans,
                                  SettlementMetrics metrics,
                                  Clock clock,
                                  @Value("${notifications.timezone:Africa/Nairobi}") String timezone,
                                  @Value("${notifications.max-attempts:3}") int maxAttempts,
                                  @Value("${notifications.retry-base-delay-minutes:5}") long retryBaseDelayMinutes) {
        this.notificationRepository = notificationRepository;
        this.preferenceRepository = preferenceRepository;
        this.senders = new EnumMap<>(NotificationChannel.class);
        for (NotificationSender sender : senderBeans) {
            NotificationSender previous = this.senders.put(sender.channel(), sender);
            if (previous != null) {
                throw new IllegalStateException("Two senders registered for channel " + sender.channel());
            }
        }
        this.metrics = metrics;
        this.clock = clock;
        this.zone = ZoneId.of(timezone);
        this.maxAttempts = maxAttempts;
        this.retryBaseDelay = Duration.ofMinutes(retryBaseDelayMinutes);
    }

    /**
     * Processes one specific notification, e.g. after its enqueue event arrived.
     */
    @Transactional
    public DeliveryOutcome process(UUID notificationId) {
        return notificationRepository.findByIdForUpdate(notificationId)
                .map(this::deliver)
                .orElseGet(() -> {
                    log.warn("Notification {} does not exist, nothing to deliver", notificationId);
                    return DeliveryOutcome.SKIPPED;
                });
    }

    /**
     * Claims and processes the most urgent due notification, if any.
     */
    @Transactional
    public Optional<DeliveryOutcome> processNextDue() {
        return notificationRepository.claimNextDue(Instant.now(clock)).map(this::deliver);
    }

    private DeliveryOutcome deliver(Notification notification) {
        try (CorrelationContext.LogScope ignored = CorrelationContext.forNotification(notification.getId())) {
            Instant now = Instant.now(clock);

            if (notification.getStatus().isTerminal()) {
                log.debug("Notification {} already {}, skipping", notification.getId(), notification.getStatus());
                return DeliveryOutcome.SKIPPED;
            }
            if (!notification.isDue(now)) {
                log.debug("Notification {} is not due yet", notification.getId());
                return DeliveryOutcome.DEFERRED;
            }

            Optional<NotificationPreference> preference = findPreference(notification);
            if (preference.isPresent() && !preference.get().allows(notification.getChannel())) {
                notification.markFailed("Recipient has disabled " + notification.getChannel() + " notifications", null);
                notificationRepository.save(notification);
                metrics.recordNotificationDelivery(notification.getChannel().name(), "suppressed");
                log.info("Notification {} suppressed by recipient preference", notification.getId());
                return DeliveryOutcome.SUPPRESSED;
            }

            Optional<QuietHours> quietHours = preference.flatMap(NotificationPreference::quietHours);
            if (notification.getChannel() != NotificationChannel.IN_APP
                    && quietHours.isPresent() && quietHours.get().contains(now, zone)) {
                Instant resumeAt = quietHours.get().windowEnd(now, zone);
                notification.reschedule(resumeAt);
                notificationRepository.save(notification);
                log.info("Notification {} deferred to {} (quiet hours)", notification.getId(), resumeAt);
                return DeliveryOutcome.RESCHEDULED;
            }

            NotificationSender sender = senders.get(notification.getChannel());
            if (sender == null) {
                notification.markFailed("No sender configured for channel " + notification.getChannel(), null);
                notificationRepository.save(notification);
                log.error("No sender for channel {}, notification {} failed",
                        notification.getChannel(), notification.getId());
                return DeliveryOutcome.EXHAUSTED;
            }

            return send(notification, sender, now);
        }
    }

    private DeliveryOutcome send(Notification notification, NotificationSender sender, Instant now) {
        notification.recordAttempt();
        try {
            String providerMessageId = sender.send(notification);
            notification.markSent(providerMessageId, now);
            notificationRepository.save(notification);
            metrics.recordNotificationDelivery(notification.getChannel().name(), "sent");
            log.info("Notification {} {} via {} (attempt {})", notification.getId(),
                    notification.getStatus(), notification.getChannel(), notification.getDeliveryAttempts());
            return notification.getStatus() == NotificationStatus.DELIVERED
                    ? DeliveryOutcome.DELIVERED
                    : DeliveryOutcome.SENT;
        } catch (RuntimeException e) {
            int attempts = notification.getDeliveryAttempts();
            Instant retryAt = attempts < maxAttempts ? now.plus(retryBaseDelay.multipliedBy(attempts)) : null;
            notification.markFailed(e.getMessage(), retryAt);
            notificationRepository.save(notification);
            metrics.recordNotificationDelivery(notification.getChannel().name(), "failed");

            if (retryAt != null) {
                log.warn("Notification {} attempt {} failed, retrying at {}: {}",
                        notification.getId(), attempts, retryAt, e.getMessage());
                return DeliveryOutcome.RETRY_SCHEDULED;
            }
            log.error("Notification {} failed after {} attempts: {}",
                    notification.getId(), attempts, e.getMessage());
            return DeliveryOutcome.EXHAUSTED;
        }
    }

    private Optional<NotificationPreference> findPreference(Notification notification) {
        if (notification.getRecipientId() == null) {
            return Optional.empty();
        }
        return preferenceRepository.findByOrganizationIdAndRecipientTypeAndRecipientId(
                notification.getOrganizationId(), notification.getRecipientType(), notification.getRecipientId());
    }

    public enum DeliveryOutcome {
        SENT,
        DELIVERED,
        SKIPPED,
        DEFERRED,
        SUPPRESSED,
        RESCHEDULED,
        RETRY_SCHEDULED,
        EXHAUSTED
    }
}
