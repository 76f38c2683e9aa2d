package com.flagship.payment_settlement.notification;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * A message to one recipient over one channel.
 *
 * The notifications table doubles as the delivery queue: a row is due when it is
 * PENDING and its {@code scheduledFor} has passed, or FAILED with a
 * {@code nextAttemptAt} that has passed. Exhausted rows keep {@code nextAttemptAt}
 * null and stay FAILED until resent by hand.
 */
@Entity
@Table(
    name = "notifications",
    indexes = {
        @Index(name = "idx_notifications_status_scheduled", columnList = "status, scheduled_for"),
        @Index(name = "idx_notifications_status_next_attempt", columnList = "status, next_attempt_at"),
        @Index(name = "idx_notifications_payment_id", columnList = "payment_id")
    }
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Notification {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "organization_id", nullable = false, updatable = false)
    private UUID organizationId;

    @Enumerated(EnumType.STRING)
    @Column(name = "recipient_type", nullable = false, length = 20, updatable = false)
    private RecipientType recipientType;

    @Column(name = "recipient_id", updatable = false)
    private UUID recipientId;

    @Column(name = "recipient_email", length = 254)
    private String recipientEmail;

    @Column(name = "recipient_phone", length = 17)
    private String recipientPhone;

    @Column(name = "notification_type", nullable = false, length = 50, updatable = false)
    private String notificationType;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20, updatable = false)
    private NotificationChannel channel;

    @Column(length = 200)
    private String subject;

    @Column(nullable = false, columnDefinition = "TEXT")
    private String message;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private NotificationPriority priority;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private NotificationStatus status;

    @Column(name = "scheduled_for")
    private Instant scheduledFor;

    @Column(name = "next_attempt_at")
    private Instant nextAttemptAt;

    @Column(name = "sent_at")
    private Instant sentAt;

    @Column(name = "delivered_at")
    private Instant deliveredAt;

    @Column(name = "read_at")
    private Instant readAt;

    @Column(name = "provider_message_id", length = 100)
    private String providerMessageId;

    @Column(name = "failure_reason", columnDefinition = "TEXT")
    private String failureReason;

    @Column(name = "delivery_attempts", nullable = false)
    private int deliveryAttempts;

    @Column(name = "payment_id", updatable = false)
    private UUID paymentId;

    @Column(name = "invoice_id", updatable = false)
    private UUID invoiceId;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    static Notification create(NotificationRequest request) {
        Notification notification = new Notification();
        notification.id = UUID.randomUUID();
        notification.organizationId = request.getOrganizationId();
        notification.recipientType = request.getRecipientType();
        notification.recipientId = request.getRecipientId();
        notification.recipientEmail = request.getRecipientEmail();
        notification.recipientPhone = request.getRecipientPhone();
        notification.notificationType = request.getNotificationType();
        notification.channel = request.getChannel();
        notification.subject = request.getSubject();
        notification.message = request.getMessage();
        notification.priority = request.getPriority() == null ? NotificationPriority.NORMAL : request.getPriority();
        notification.status = NotificationStatus.PENDING;
        notification.scheduledFor = request.getScheduledFor();
        notification.paymentId = request.getPaymentId();
        notification.invoiceId = request.getInvoiceId();
        notification.deliveryAttempts = 0;
        return notification;
    }

    /**
     * @return true if the row may be processed at {@code now}
     */
    public boolean isDue(Instant now) {
        return switch (status) {
            case PENDING -> scheduledFor == null || !scheduledFor.isAfter(now);
            case FAILED -> nextAttemptAt != null && !nextAttemptAt.isAfter(now);
            case SENT, DELIVERED, READ -> false;
        };
    }

    void recordAttempt() {
        this.deliveryAttempts++;
    }

    void markSent(String providerMessageId, Instant at) {
        this.status = channel.deliveredOnSend() ? NotificationStatus.DELIVERED : NotificationStatus.SENT;
        this.providerMessageId = providerMessageId;
        this.sentAt = at;
        if (status == NotificationStatus.DELIVERED) {
            this.deliveredAt = at;
        }
        this.failureReason = null;
        this.nextAttemptAt = null;
    }

    /**
     * @param retryAt when to try again, or null when no retry should happen
     */
    void markFailed(String reason, Instant retryAt) {
        this.status = NotificationStatus.FAILED;
        this.failureReason = reason;
        this.nextAttemptAt = retryAt;
    }

    void reschedule(Instant until) {
        this.status = NotificationStatus.PENDING;
        this.scheduledFor = until;
        this.nextAttemptAt = null;
    }

    void markRead(Instant at) {
        if (status != NotificationStatus.SENT && status != NotificationStatus.DELIVERED
                && status != NotificationStatus.READ) {
            throw new IllegalStateException("Notification " + id + " has not been delivered yet");
        }
        if (readAt == null) {
            this.readAt = at;
        }
        this.status = NotificationStatus.READ;
    }

    void resetForResend() {
        if (status != NotificationStatus.FAILED) {
            throw new IllegalStateException("Only FAILED notifications can be resent; " + id + " is " + status);
        }
        this.status = NotificationStatus.PENDING;
        this.scheduledFor = null;
        this.nextAttemptAt = null;
        this.failureReason = null;
        this.deliveryAttempts = 0;
    }

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }
}
