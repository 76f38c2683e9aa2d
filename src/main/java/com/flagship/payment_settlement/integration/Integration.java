package com.flagship.payment_settlement.integration;

import com.flagship.payment_settlement.provider.ProviderEnvironment;
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

import java.security.SecureRandom;
import java.time.Instant;
import java.util.Base64;
import java.util.UUID;

/**
 * An organization's M-Pesa account: credentials, environment and the secret its
 * callbacks are signed with. The integration id is part of the registered callback URL,
 * which is how an inbound webhook finds its owner.
 */
@Entity
@Table(
    name = "integrations",
    uniqueConstraints = @UniqueConstraint(
        name = "uk_integrations_org_provider_env",
        columnNames = {"organization_id", "provider", "environment"})
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Integration {

    public static final String PROVIDER_MPESA = "MPESA";

    private static final SecureRandom RANDOM = new SecureRandom();

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "organization_id", nullable = false, updatable = false)
    private UUID organizationId;

    @Column(nullable = false, length = 30, updatable = false)
    private String provider;

    @Column(nullable = false, length = 200)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ProviderEnvironment environment;

    @Column(name = "consumer_key", nullable = false, length = 500)
    private String consumerKey;

    @Column(name = "consumer_secret", nullable = false, length = 500)
    private String consumerSecret;

    @Column(name = "business_short_code", nullable = false, length = 20)
    private String businessShortCode;

    @Column(nullable = false, length = 500)
    private String passkey;

    @Column(name = "webhook_secret", nullable = false, length = 100)
    private String webhookSecret;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private IntegrationStatus status;

    @Column(name = "total_requests", nullable = false)
    private long totalRequests;

    @Column(name = "successful_requests", nullable = false)
    private long successfulRequests;

    @Column(name = "failed_requests", nullable = false)
    private long failedRequests;

    @Column(name = "last_used_at")
    private Instant lastUsedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    static Integration mpesa(UUID organizationId, String name, ProviderEnvironment environment,
                             String consumerKey, String consumerSecret,
                             String businessShortCode, String passkey) {
        Integration integration = new Integration();
        integration.id = UUID.randomUUID();
        integration.organizationId = organizationId;
        integration.provider = PROVIDER_MPESA;
        integration.name = name;
        integration.environment = environment;
        integration.consumerKey = consumerKey;
        integration.consumerSecret = consumerSecret;
        integration.businessShortCode = businessShortCode;
        integration.passkey = passkey;
        integration.webhookSecret = newWebhookSecret();
        integration.status = IntegrationStatus.ACTIVE;
        return integration;
    }

    /**
     * 32 random bytes, URL-safe base64 without padding.
     */
    static String newWebhookSecret() {
        byte[] bytes = new byte[32];
        RANDOM.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    void rotateWebhookSecret() {
        this.webhookSecret = newWebhookSecret();
    }

    void changeStatus(IntegrationStatus status) {
        this.status = status;
    }

    public boolean isActive() {
        return status == IntegrationStatus.ACTIVE;
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
