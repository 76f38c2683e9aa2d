package com.flagship.payment_settlement.notification;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Drains due notifications: scheduled sends, quiet-hours deferrals and retries.
 *
 * Every row is claimed and delivered in its own transaction, so one slow or failing
 * transport only costs that row and several instances can poll side by side.
 */
@Component
@ConditionalOnProperty(name = "notifications.worker.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class NotificationWorker {

    private final NotificationDispatcher dispatcher;

    @Value("${notifications.worker.batch-size:50}")
    private int batchSize;

    @Scheduled(fixedDelayString = "${notifications.worker.poll-interval-ms:5000}")
    public void drain() {
        Map<NotificationDispatcher.DeliveryOutcome, Integer> outcomes =
                new EnumMap<>(NotificationDispatcher.DeliveryOutcome.class);
        try {
            for (int i = 0; i < batchSize; i++) {
                Optional<NotificationDispatcher.DeliveryOutcome> outcome = dispatcher.processNextDue();
                if (outcome.isEmpty()) {
                    break;
                }
                outcomes.merge(outcome.get(), 1, Integer::sum);
            }
        } catch (Exception e) {
            log.error("Error in notification worker loop", e);
        }
        if (!outcomes.isEmpty()) {
            log.info("Notification worker processed {}", outcomes);
        }
    }
}
