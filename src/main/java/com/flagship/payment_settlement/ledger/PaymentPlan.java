package com.flagship.payment_settlement.ledger;

import com.flagship.payment_settlement.exception.InvalidAmountException;
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

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Installment schedule for a customer's obligation.
 *
 * {@code installmentAmount} is fixed at creation; {@code balance} follows every
 * installment. The plan completes once the balance reaches zero.
 */
@Entity
@Table(
    name = "payment_plans",
    indexes = @Index(name = "idx_payment_plans_customer_status", columnList = "customer_id, status")
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class PaymentPlan {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "organization_id", nullable = false, updatable = false)
    private UUID organizationId;

    @Column(name = "customer_id", nullable = false, updatable = false)
    private UUID customerId;

    @Column(nullable = false, length = 200)
    private String name;

    @Column(columnDefinition = "TEXT")
    private String description;

    @Column(name = "total_amount", nullable = false, precision = 15, scale = 2, updatable = false)
    private BigDecimal totalAmount;

    @Column(name = "amount_paid", nullable = false, precision = 15, scale = 2)
    private BigDecimal amountPaid;

    @Column(nullable = false, precision = 15, scale = 2)
    private BigDecimal balance;

    @Column(name = "number_of_installments", nullable = false, updatable = false)
    private int numberOfInstallments;

    @Column(name = "installment_amount", nullable = false, precision = 15, scale = 2, updatable = false)
    private BigDecimal installmentAmount;

    @Column(name = "installments_paid", nullable = false)
    private int installmentsPaid;

    @Column(name = "start_date", nullable = false)
    private LocalDate startDate;

    @Column(name = "end_date", nullable = false)
    private LocalDate endDate;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private PaymentPlanStatus status;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    static PaymentPlan create(UUID organizationId, UUID customerId, String name, String description,
                              BigDecimal totalAmount, int numberOfInstallments,
                              LocalDate startDate, LocalDate endDate) {
        BigDecimal total = totalAmount == null ? null : totalAmount.setScale(2, RoundingMode.HALF_UP);
        if (total == null || total.signum() <= 0) {
            throw InvalidAmountException.notPositive("total_amount", totalAmount);
        }
        if (numberOfInstallments < 1) {
            throw new IllegalArgumentException("A plan needs at least one installment");
        }
        if (endDate.isBefore(startDate)) {
            throw new IllegalArgumentException("End date " + endDate + " is before start date " + startDate);
        }
        PaymentPlan plan = new PaymentPlan();
        plan.id = UUID.randomUUID();
        plan.organizationId = organizationId;
        plan.customerId = customerId;
        plan.name = name;
        plan.description = description;
        plan.totalAmount = total;
        plan.amountPaid = BigDecimal.ZERO.setScale(2);
        plan.balance = total;
        plan.numberOfInstallments = numberOfInstallments;
        plan.installmentAmount = total.divide(BigDecimal.valueOf(numberOfInstallments), 2, RoundingMode.HALF_UP);
        plan.installmentsPaid = 0;
        plan.startDate = startDate;
        plan.endDate = endDate;
        plan.status = PaymentPlanStatus.ACTIVE;
        return plan;
    }

    /**
     * The only mutator of {@code amountPaid}. Paying while OVERDUE brings the plan back
     * to ACTIVE unless it completes it.
     */
    public void recordInstallment(BigDecimal amount) {
        BigDecimal paid = amount == null ? null : amount.setScale(2, RoundingMode.HALF_UP);
        if (paid == null || paid.signum() <= 0) {
            throw InvalidAmountException.notPositive("amount", amount);
        }
        if (!status.acceptsInstallments()) {
            throw new IllegalStateException("Payment plan " + id + " is " + status + " and accepts no installments");
        }
        this.amountPaid = this.amountPaid.add(paid);
        this.balance = totalAmount.subtract(amountPaid);
        this.installmentsPaid++;
        this.status = balance.signum() <= 0 ? PaymentPlanStatus.COMPLETED : PaymentPlanStatus.ACTIVE;
    }

    public void markOverdue() {
        if (status != PaymentPlanStatus.ACTIVE) {
            throw new IllegalStateException("Only ACTIVE plans can become overdue; plan " + id + " is " + status);
        }
        this.status = PaymentPlanStatus.OVERDUE;
    }

    public void cancel() {
        if (!status.acceptsInstallments()) {
            throw new IllegalStateException("Payment plan " + id + " is already " + status);
        }
        this.status = PaymentPlanStatus.CANCELLED;
    }

    public boolean isSettled() {
        return balance.signum() <= 0;
    }

    public BigDecimal progressPercentage() {
        return Invoice.progress(amountPaid, totalAmount);
    }

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
        this.balance = totalAmount.subtract(amountPaid);
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
        this.balance = totalAmount.subtract(amountPaid);
    }
}
