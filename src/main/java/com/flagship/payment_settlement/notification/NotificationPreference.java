package com.flagship.payment_settlement.notification;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalTime;
import java.util.Optional;
import java.util.UUID;

/**
 * Channel opt-outs and quiet hours of one recipient. A recipient without a row
 * receives everything at any time.
 */
@Entity
@Table(
    name = "notification_preferences",
    uniqueConstraints = @UniqueConstraint(
        name = "uk_notification_preferences_recipient",
        columnNames = {"organization_id", "recipient_type", "recipient_id"}
    )
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class NotificationPreference {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "organization_id", nullable = false, updatable = false)
    private UUID organizationId;

    @Enumerated(EnumType.STRING)
    @Column(name = "recipient_type", nullable = false, length = 20, updatable = false)
    private RecipientType recipientType;

    @Column(name = "recipient_id", nullable = false, updatable = false)
    private UUID recipientId;

    @Column(name = "receive_sms", nullable = false)
    private boolean receiveSms;

    @Column(name = "receive_email", nullable = false)
    private boolean receiveEmail;

    @Column(name = "receive_whatsapp", nullable = false)
    private boolean receiveWhatsapp;

    @Column(name = "receive_push", nullable = false)
    private boolean receivePush;

    @Column(name = "quiet_hours_start")
    private LocalTime quietHoursStart;

    @Column(name = "quiet_hours_end")
    private LocalTime quietHoursEnd;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    static NotificationPreference defaults(UUID organizationId, RecipientType recipientType, UUID recipientId) {
        NotificationPreference preference = new NotificationPreference();
        preference.id = UUID.randomUUID();
        preference.organizationId = organizationId;
        preference.recipientType = recipientType;
        preference.recipientId = recipientId;
        preference.receiveSms = true;
        preference.receiveEmail = true;
        preference.receiveWhatsapp = true;
        preference.receivePush = true;
        return preference;
    }

    void update(boolean sms, boolean email, boolean whatsapp, boolean push,
                LocalTime quietStart, LocalTime quietEnd) {
        if ((quietStart == null) != (quietEnd == null)) {
            throw new IllegalArgumentException("Quiet hours need both a start and an end");
        }
        this.receiveSms = sms;
        this.receiveEmail = email;
        this.receiveWhatsapp = whatsapp;
        this.receivePush = push;
        this.quietHoursStart = quietStart;
        this.quietHoursEnd = quietEnd;
    }

    /**
     * In-app messages cannot be switched off.
     */
    public boolean allows(NotificationChannel channel) {
        return switch (channel) {
            case SMS -> receiveSms;
            case EMAIL -> receiveEmail;
            case WHATSAPP -> receiveWhatsapp;
            case PUSH -> receivePush;
            case IN_APP -> true;
        };
    }

    public Optional<QuietHours> quietHours() {
        if (quietHoursStart == null || quietHoursEnd == null) {
            return Optional.empty();
        }
        return Optional.of(QuietHours.of(quietHoursStart, quietHoursEnd));
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
