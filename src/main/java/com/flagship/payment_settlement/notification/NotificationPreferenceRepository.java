package com.flagship.payment_settlement.notification;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface NotificationPreferenceRepository extends JpaRepository<NotificationPreference, UUID> {

    Optional<NotificationPreference> findByOrganizationIdAndRecipientTypeAndRecipientId(
            UUID organizationId, RecipientType recipientType, UUID recipientId);
}
