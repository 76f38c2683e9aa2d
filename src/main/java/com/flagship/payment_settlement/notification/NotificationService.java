package com.flagship.payment_settlement.notification;

import com.flagship.payment_settlement.customer.Customer;
import com.flagship.payment_settlement.customer.CustomerService;
import com.flagship.payment_settlement.exception.InvalidNotificationException;
import com.flagship.payment_settlement.exception.OrganizationMismatchException;
import com.flagship.payment_settlement.exception.ResourceNotFoundException;
import com.flagship.payment_settlement.exception.SettlementException;
import com.flagship.payment_settlement.outbox.OutboxService;
import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Accepts notifications into the queue.
 *
 * Enqueueing only persists the row and writes a {@code NotificationEnqueued} outbox
 * event in the same transaction; delivery happens later in {@link NotificationDispatcher},
 * so a slow transport never holds up the caller.
 */
@Service
@Slf4j
public class NotificationService {

    private final NotificationRepository notificationRepository;
    private final NotificationPreferenceRepository preferenceRepository;
    private final CustomerService customerService;
    private final OutboxService outboxService;
    private final TransactionTemplate perRecipientTransaction;
    private final Clock clock;

    public NotificationService(NotificationRepository notificationRepository,
                               NotificationPreferenceRepository preferenceRepository,
                               CustomerService customerService,
                               OutboxService outboxService,
                               PlatformTransactionManager transactionManager,
                               Clock clock) {
        this.notificationRepository = notificationRepository;
        this.preferenceRepository = preferenceRepository;
        this.customerService = customerService;
        this.outboxService = outboxService;
        this.perRecipientTransaction = new TransactionTemplate(transactionManager);
        this.perRecipientTransaction.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.clock = clock;
    }

    /**
     * Validates and queues one notification. Joins the caller's transaction when there
     * is one, so a notification raised by a settlement commits or rolls back with it.
     *
     * @throws InvalidNotificationException if the channel's required fields are missing
     */
    @Transactional
    public Notification enqueue(NotificationRequest request) {
        NotificationRequest resolved = withRecipientContact(request);
        validate(resolved);

        Notification saved = notificationRepository.save(Notification.create(resolved));
        outboxService.saveNotificationEvent(NotificationEnqueuedEvent.fromNotification(saved));

        log.info("Queued {} notification {} type={} scheduledFor={}",
                saved.getChannel(), saved.getId(), saved.getNotificationType(), saved.getScheduledFor());
        return saved;
    }

    /**
     * Queues one notification per recipient, each in its own transaction. A recipient
     * that cannot be resolved or validated is counted and reported; it never aborts
     * the rest of the batch.
     */
    public BulkResult enqueueBulk(BulkNotificationRequest request) {
        if (request.getRecipientIds() == null || request.getRecipientIds().isEmpty()) {
            throw new InvalidNotificationException("At least one recipient is required");
        }

        List<UUID> created = new ArrayList<>();
        Map<UUID, String> failures = new LinkedHashMap<>();

        for (UUID recipientId : request.getRecipientIds()) {
            NotificationRequest single = NotificationRequest.builder()
                    .organizationId(request.getOrganizationId())
                    .recipientType(request.getRecipientType())
                    .recipientId(recipientId)
                    .notificationType(request.getNotificationType())
                    .channel(request.getChannel())
                    .subject(request.getSubject())
                    .message(request.getMessage())
                    .priority(request.getPriority())
                    .scheduledFor(request.getScheduledFor())
                    .build();
            try {
                Notification notification = perRecipientTransaction.execute(status -> enqueue(single));
                created.add(notification.getId());
            } catch (SettlementException | IllegalArgumentException e) {
                log.warn("Bulk notification skipped recipient {}: {}", recipientId, e.getMessage());
                failures.put(recipientId, e.getMessage());
            }
        }

        log.info("Bulk notification: requested={}, queued={}, failed={}",
                request.getRecipientIds().size(), created.size(), failures.size());
        return new BulkResult(request.getRecipientIds().size(), created, failures);
    }

    @Transactional(readOnly = true)
    public Notification getForOrganization(UUID notificationId, UUID organizationId) {
        Notification notification = notificationRepository.findById(notificationId)
                .orElseThrow(() -> new ResourceNotFoundException("Notification", notificationId));
        if (!notification.getOrganizationId().equals(organizationId)) {
            throw new OrganizationMismatchException("Notification", notificationId, organizationId);
        }
        return notification;
    }

    /**
     * Puts an exhausted notification back in the queue with a fresh attempt budget.
     */
    @Transactional
    public Notification resend(UUID notificationId, UUID organizationId) {
        Notification notification = getForOrganization(notificationId, organizationId);
        notification.resetForResend();
        Notification saved = notificationRepository.save(notification);
        outboxService.saveNotificationEvent(NotificationEnqueuedEvent.fromNotification(saved));
        log.info("Notification {} queued for resend", notificationId);
        return saved;
    }

    @Transactional
    public Notification markRead(UUID notificationId, UUID organizationId) {
        Notification notification = getForOrganization(notificationId, organizationId);
        notification.markRead(Instant.now(clock));
        return notificationRepository.save(notification);
    }

    @Transactional(readOnly = true)
    public long countForPayment(UUID paymentId) {
        return notificationRepository.countByPaymentId(paymentId);
    }

    /**
     * Notifications raised for a payment or an invoice, oldest first. Rows of other
     * organizations are filtered out rather than reported.
     */
    @Transactional(readOnly = true)
    public List<Notification> findRelated(UUID organizationId, UUID paymentId, UUID invoiceId) {
        if ((paymentId == null) == (invoiceId == null)) {
            throw new IllegalArgumentException("Exactly one of payment_id and invoice_id is required");
        }
        List<Notification> related = paymentId != null
                ? notificationRepository.findByPaymentIdOrderByCreatedAtAsc(paymentId)
                : notificationRepository.findByInvoiceIdOrderByCreatedAtAsc(invoiceId);
        return related.stream()
                .filter(notification -> notification.getOrganizationId().equals(organizationId))
                .toList();
    }

    @Transactional
    public NotificationPreference updatePreference(UUID organizationId, RecipientType recipientType, UUID recipientId,
                                                   boolean sms, boolean email, boolean whatsapp, boolean push,
                                                   LocalTime quietHoursStart, LocalTime quietHoursEnd) {
        NotificationPreference preference = preferenceRepository
                .findByOrganizationIdAndRecipientTypeAndRecipientId(organizationId, recipientType, recipientId)
                .orElseGet(() -> NotificationPreference.defaults(organizationId, recipientType, recipientId));
        preference.update(sms, email, whatsapp, push, quietHoursStart, quietHoursEnd);
        return preferenceRepository.save(preference);
    }

    private NotificationRequest withRecipientContact(NotificationRequest request) {
        if (request.getRecipientType() != RecipientType.CUSTOMER || request.getRecipientId() == null) {
            return request;
        }
        boolean needsPhone = isBlank(request.getRecipientPhone());
        boolean needsEmail = isBlank(request.getRecipientEmail());
        if (!needsPhone && !needsEmail) {
            return request;
        }
        Customer customer = customerService.getForOrganization(request.getOrganizationId(), request.getRecipientId());
        return request.toBuilder()
                .recipientPhone(needsPhone ? customer.getPhoneNumber() : request.getRecipientPhone())
                .recipientEmail(needsEmail ? customer.getEmail() : request.getRecipientEmail())
                .build();
    }

    private static void validate(NotificationRequest request) {
        if (request.getOrganizationId() == null) {
            throw new InvalidNotificationException("Organization is required");
        }
        if (request.getRecipientType() == null) {
            throw new InvalidNotificationException("Recipient type is required");
        }
        if (request.getChannel() == null) {
            throw new InvalidNotificationException("Channel is required");
        }
        if (isBlank(request.getNotificationType())) {
            throw new InvalidNotificationException("Notification type is required");
        }
        if (isBlank(request.getMessage())) {
            throw new InvalidNotificationException("Message is required");
        }
        if (request.getChannel().requiresEmail()) {
            if (isBlank(request.getSubject())) {
                throw new InvalidNotificationException("Subject is required for email notifications");
            }
            if (isBlank(request.getRecipientEmail())) {
                throw new InvalidNotificationException("Recipient email is required for email notifications");
            }
        }
        if (request.getChannel().requiresPhone() && isBlank(request.getRecipientPhone())) {
            throw new InvalidNotificationException(
                    "Recipient phone is required for " + request.getChannel() + " notifications");
        }
        if (request.getRecipientId() == null
                && isBlank(request.getRecipientEmail()) && isBlank(request.getRecipientPhone())) {
            throw new InvalidNotificationException("A recipient id, email or phone is required");
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    @Value
    @Builder
    public static class BulkNotificationRequest {
        UUID organizationId;
        RecipientType recipientType;
        List<UUID> recipientIds;
        String notificationType;
        NotificationChannel channel;
        String subject;
        String message;
        NotificationPriority priority;
        Instant scheduledFor;
    }

    @Value
    public static class BulkResult {
        int requested;
        List<UUID> notificationIds;
        Map<UUID, String> failures;

        public int getCreated() {
            return notificationIds.size();
        }

        public int getFailed() {
            return failures.size();
        }
    }
}
