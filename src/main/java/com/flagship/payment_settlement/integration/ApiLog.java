package com.flagship.payment_settlement.integration;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * One provider interaction: an outbound call or an inbound webhook. Append-only.
 *
 * Bodies are stored as text because rejected callbacks are not guaranteed to be JSON.
 */
@Entity
@Table(
    name = "api_logs",
    indexes = {
        @Index(name = "idx_api_logs_correlation_id", columnList = "correlation_id"),
        @Index(name = "idx_api_logs_external_id", columnList = "external_id"),
        @Index(name = "idx_api_logs_status_ts", columnList = "status, request_timestamp")
    }
)
@Getter
@Builder
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ApiLog {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "integration_id", updatable = false)
    private UUID integrationId;

    @Column(name = "organization_id", updatable = false)
    private UUID organizationId;

    @Column(name = "payment_id", updatable = false)
    private UUID paymentId;

    @Enumerated(EnumType.STRING)
    @Column(name = "request_type", nullable = false, length = 30, updatable = false)
    private ApiRequestType requestType;

    @Column(nullable = false, length = 500, updatable = false)
    private String endpoint;

    @Column(nullable = false, length = 10, updatable = false)
    private String method;

    @Column(name = "request_body", columnDefinition = "TEXT", updatable = false)
    private String requestBody;

    @Column(name = "response_status_code", updatable = false)
    private Integer responseStatusCode;

    @Column(name = "response_body", columnDefinition = "TEXT", updatable = false)
    private String responseBody;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20, updatable = false)
    private ApiLogStatus status;

    @Column(name = "error_message", columnDefinition = "TEXT", updatable = false)
    private String errorMessage;

    @Column(name = "correlation_id", length = 100, updatable = false)
    private String correlationId;

    @Column(name = "external_id", length = 100, updatable = false)
    private String externalId;

    @Column(name = "duration_ms", updatable = false)
    private Long durationMs;

    @Column(name = "request_timestamp", nullable = false, updatable = false)
    private Instant requestTimestamp;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    void onCreate() {
        if (id == null) {
            id = UUID.randomUUID();
        }
        if (requestTimestamp == null) {
            requestTimestamp = Instant.now();
        }
        createdAt = Instant.now();
    }
}
