package com.flagship.payment_settlement.observability;

import com.flagship.payment_settlement.notification.NotificationRepository;
import com.flagship.payment_settlement.notification.NotificationStatus;
import com.flagship.payment_settlement.payment.PaymentPersistenceService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Refreshes the cached backlog gauges so a scrape never queries the database.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MetricsScheduler {

    private final OutboxMetrics outboxMetrics;
    private final SettlementMetrics settlementMetrics;
    private final PaymentPersistenceService paymentPersistenceService;
    private final NotificationRepository notificationRepository;

    @Scheduled(fixedRateString = "${metrics.refresh.interval:15000}")
    public void refreshGauges() {
        outboxMetrics.refreshMetrics();
        try {
            settlementMetrics.updateBacklog(
                    paymentPersistenceService.countAwaitingCallback(),
                    notificationRepository.countByStatus(NotificationStatus.PENDING));
        } catch (DataAccessException e) {
            log.warn("Could not refresh settlement backlog gauges: {}", e.getMessage());
        }
    }
}
