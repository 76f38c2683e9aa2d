package com.flagship.payment_settlement.payment;

import jakarta.persistence.*;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * JPA entity for payments.
 *
 * No setters: state only changes through {@link #updateFromDomain(Payment)}, which copies
 * the fields a transition may touch. Identity, organization, reference and links are
 * {@code updatable = false}.
 *
 * The idempotency key is a persistence concern and is passed next to the domain object.
 *
 * {@code net_amount} is recomputed in the lifecycle hooks so no write path can store a
 * stale value.
 */
@Entity
@Table(
    name = "payments",
    indexes = {
        @Index(name = "idx_payments_org_status", columnList = "organization_id, status"),
        @Index(name = "idx_payments_checkout_request_id", columnList = "checkout_request_id")
    },
    uniqueConstraints = @UniqueConstraint(name = "uk_payments_org_reference", columnNames = {"organization_id", "payment_reference"})
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PaymentEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "organization_id", nullable = false, updatable = false)
    private UUID organizationId;

    @Column(name = "customer_id", updatable = false)
    private UUID customerId;

    @Column(name = "invoice_id", updatable = false)
    private UUID invoiceId;

    @Column(name = "payment_plan_id", updatable = false)
    private UUID paymentPlanId;

    @Column(name = "payment_reference", nullable = false, updatable = false, length = 50)
    private String paymentReference;

    @Column(name = "external_reference", length = 100)
    private String externalReference;

    @Column(length = 500)
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_type", nullable = false, length = 20)
    private PaymentType paymentType;

    @Enumerated(EnumType.STRING)
    @Column(name = "payment_method", nullable = false, length = 20)
    private PaymentMethod paymentMethod;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 3)
    private CurrencyCode currency;

    @Column(nullable = false, precision = 15, scale = 2)
    private BigDecimal amount;

    @Column(name = "transaction_fee", nullable = false, precision = 15, scale = 2)
    private BigDecimal transactionFee;

    @Column(name = "net_amount", nullable = false, precision = 15, scale = 2)
    private BigDecimal netAmount;

    @Column(name = "checkout_request_id", length = 100)
    private String checkoutRequestId;

    @Column(name = "merchant_request_id", length = 100)
    private String merchantRequestId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private PaymentStatus status;

    @Column(name = "failure_reason", length = 500)
    private String failureReason;

    @Column(name = "payer_phone", length = 17)
    private String payerPhone;

    @Column(name = "payer_name", length = 200)
    private String payerName;

    @Column(name = "payer_email", length = 254)
    private String payerEmail;

    @Column(name = "initiated_at")
    private Instant initiatedAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    @Column(name = "is_reversed", nullable = false)
    private boolean reversed;

    @Column(name = "reversal_reason", length = 500)
    private String reversalReason;

    @Column(name = "reversed_at")
    private Instant reversedAt;

    @Column(name = "reversed_by", length = 100)
    private String reversedBy;

    @Column(name = "created_by", length = 100, updatable = false)
    private String createdBy;

    @Column(name = "idempotency_key", unique = true, updatable = false)
    private String idempotencyKey;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
        recomputeNetAmount();
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
        recomputeNetAmount();
    }

    private void recomputeNetAmount() {
        BigDecimal fee = transactionFee == null ? BigDecimal.ZERO : transactionFee;
        this.transactionFee = fee;
        this.netAmount = amount.subtract(fee);
    }

    /**
     * Only way to create a PaymentEntity.
     *
     * @param idempotencyKey may be null for payments that did not come through the
     *                       initiation API
     */
    static PaymentEntity fromDomain(Payment payment, String idempotencyKey) {
        return new PaymentEntity(
            payment.getId(),
            payment.getOrganizationId(),
            payment.getCustomerId(),
            payment.getInvoiceId(),
            payment.getPaymentPlanId(),
            payment.getPaymentReference(),
            payment.getExternalReference(),
            payment.getDescription(),
            payment.getPaymentType(),
            payment.getPaymentMethod(),
            payment.getCurrency(),
            payment.getAmount(),
            payment.getTransactionFee(),
            payment.getNetAmount(),
            payment.getCheckoutRequestId(),
            payment.getMerchantRequestId(),
            payment.getStatus(),
            payment.getFailureReason(),
            payment.getPayerPhone(),
            payment.getPayerName(),
            payment.getPayerEmail(),
            payment.getInitiatedAt(),
            payment.getCompletedAt(),
            payment.isReversed(),
            payment.getReversalReason(),
            payment.getReversedAt(),
            payment.getReversedBy(),
            payment.getCreatedBy(),
            idempotencyKey,
            null, // createdAt, set by @PrePersist
            null  // updatedAt, set by @PrePersist
        );
    }

    public Payment toDomain() {
        return Payment.builder()
            .id(id)
            .organizationId(organizationId)
            .customerId(customerId)
            .invoiceId(invoiceId)
            .paymentPlanId(paymentPlanId)
            .paymentReference(paymentReference)
            .externalReference(externalReference)
            .description(description)
            .paymentType(paymentType)
            .paymentMethod(paymentMethod)
            .currency(currency)
            .amount(amount)
            .transactionFee(transactionFee)
            .netAmount(netAmount)
            .checkoutRequestId(checkoutRequestId)
            .merchantRequestId(merchantRequestId)
            .status(status)
            .failureReason(failureReason)
            .payerPhone(payerPhone)
            .payerName(payerName)
            .payerEmail(payerEmail)
            .initiatedAt(initiatedAt)
            .completedAt(completedAt)
            .reversed(reversed)
            .reversalReason(reversalReason)
            .reversedAt(reversedAt)
            .reversedBy(reversedBy)
            .createdBy(createdBy)
            .createdAt(createdAt)
            .updatedAt(updatedAt)
            .build();
    }

    /**
     * Copies the fields a state transition may change. Identity, organization, links,
     * reference and fee are fixed once persisted.
     */
    void updateFromDomain(Payment payment) {
        if (!this.id.equals(payment.getId())) {
            throw new IllegalArgumentException("Cannot update payment " + id + " from " + payment.getId());
        }
        this.status = payment.getStatus();
        this.amount = payment.getAmount();
        this.externalReference = payment.getExternalReference();
        this.checkoutRequestId = payment.getCheckoutRequestId();
        this.merchantRequestId = payment.getMerchantRequestId();
        this.failureReason = payment.getFailureReason();
        this.payerPhone = payment.getPayerPhone();
        this.initiatedAt = payment.getInitiatedAt();
        this.completedAt = payment.getCompletedAt();
        this.reversed = payment.isReversed();
        this.reversalReason = payment.getReversalReason();
        this.reversedAt = payment.getReversedAt();
        this.reversedBy = payment.getReversedBy();
        recomputeNetAmount();
    }
}
