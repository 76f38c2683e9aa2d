package com.flagship.payment_settlement.ledger;

import com.flagship.payment_settlement.exception.InvalidAmountException;
import com.flagship.payment_settlement.payment.CurrencyCode;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * A bill owed by a customer.
 *
 * {@code balanceDue} is stored for querying but always recomputed from
 * {@code totalAmount - amountPaid}; status is re-derived from the amounts and due date
 * after every change:
 * <ul>
 *   <li>PAID once amountPaid reaches totalAmount ({@code paidDate} is stamped on entry)</li>
 *   <li>PARTIALLY_PAID while something but not everything is paid</li>
 *   <li>OVERDUE when nothing is paid and the due date has passed</li>
 *   <li>otherwise DRAFT, SENT or VIEWED as set by the workflow</li>
 * </ul>
 * CANCELLED is sticky.
 */
@Entity
@Table(
    name = "invoices",
    indexes = {
        @Index(name = "idx_invoices_customer_status", columnList = "customer_id, status"),
        @Index(name = "idx_invoices_due_status", columnList = "due_date, status")
    },
    uniqueConstraints = @UniqueConstraint(name = "uk_invoices_org_number", columnNames = {"organization_id", "invoice_number"})
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Invoice {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "organization_id", nullable = false, updatable = false)
    private UUID organizationId;

    @Column(name = "customer_id", nullable = false, updatable = false)
    private UUID customerId;

    @Column(name = "invoice_number", nullable = false, updatable = false, length = 50)
    private String invoiceNumber;

    @Column(length = 100)
    private String reference;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 3)
    private CurrencyCode currency;

    @Column(name = "issue_date", nullable = false)
    private LocalDate issueDate;

    @Column(name = "due_date", nullable = false)
    private LocalDate dueDate;

    @Column(name = "paid_date")
    private LocalDate paidDate;

    @Column(nullable = false, precision = 15, scale = 2)
    private BigDecimal subtotal;

    @Column(name = "tax_amount", nullable = false, precision = 15, scale = 2)
    private BigDecimal taxAmount;

    @Column(name = "discount_amount", nullable = false, precision = 15, scale = 2)
    private BigDecimal discountAmount;

    @Column(name = "total_amount", nullable = false, precision = 15, scale = 2)
    private BigDecimal totalAmount;

    @Column(name = "amount_paid", nullable = false, precision = 15, scale = 2)
    private BigDecimal amountPaid;

    @Column(name = "balance_due", nullable = false, precision = 15, scale = 2)
    private BigDecimal balanceDue;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private InvoiceStatus status;

    @Column(columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    private String items;

    @Column(columnDefinition = "TEXT")
    private String notes;

    @Column(name = "sent_at")
    private Instant sentAt;

    @Column(name = "created_by", length = 100, updatable = false)
    private String createdBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    static Invoice create(UUID organizationId, UUID customerId, String invoiceNumber, CurrencyCode currency,
                          LocalDate issueDate, LocalDate dueDate,
                          BigDecimal subtotal, BigDecimal taxAmount, BigDecimal discountAmount,
                          String items, String reference, String notes, String createdBy) {
        BigDecimal sub = money(subtotal);
        BigDecimal tax = money(taxAmount);
        BigDecimal discount = money(discountAmount);
        if (sub.signum() < 0 || tax.signum() < 0 || discount.signum() < 0) {
            throw new InvalidAmountException("Invoice amounts cannot be negative");
        }
        BigDecimal total = sub.add(tax).subtract(discount);
        if (total.signum() <= 0) {
            throw InvalidAmountException.notPositive("total_amount", total);
        }
        if (dueDate.isBefore(issueDate)) {
            throw new IllegalArgumentException("Due date " + dueDate + " is before issue date " + issueDate);
        }

        Invoice invoice = new Invoice();
        invoice.id = UUID.randomUUID();
        invoice.organizationId = organizationId;
        invoice.customerId = customerId;
        invoice.invoiceNumber = invoiceNumber;
        invoice.currency = currency == null ? CurrencyCode.KES : currency;
        invoice.issueDate = issueDate;
        invoice.dueDate = dueDate;
        invoice.subtotal = sub;
        invoice.taxAmount = tax;
        invoice.discountAmount = discount;
        invoice.totalAmount = total;
        invoice.amountPaid = money(BigDecimal.ZERO);
        invoice.balanceDue = total;
        invoice.status = InvoiceStatus.DRAFT;
        invoice.items = items;
        invoice.reference = reference;
        invoice.notes = notes;
        invoice.createdBy = createdBy;
        return invoice;
    }

    /**
     * The only mutator of {@code amountPaid}.
     */
    public void recordPayment(BigDecimal amount, LocalDate today) {
        BigDecimal paid = amount == null ? null : money(amount);
        if (paid == null || paid.signum() <= 0) {
            throw InvalidAmountException.notPositive("amount", amount);
        }
        if (status == InvoiceStatus.CANCELLED) {
            throw new IllegalStateException("Cannot record a payment on cancelled invoice " + invoiceNumber);
        }
        this.amountPaid = this.amountPaid.add(paid);
        refresh(today);
    }

    public void markSent(Instant at, LocalDate today) {
        if (status != InvoiceStatus.DRAFT) {
            throw new IllegalStateException("Only DRAFT invoices can be sent; " + invoiceNumber + " is " + status);
        }
        this.status = InvoiceStatus.SENT;
        this.sentAt = at;
        refresh(today);
    }

    public void markViewed(LocalDate today) {
        if (status == InvoiceStatus.SENT) {
            this.status = InvoiceStatus.VIEWED;
        }
        refresh(today);
    }

    public void cancel() {
        if (status == InvoiceStatus.PAID || status == InvoiceStatus.PARTIALLY_PAID) {
            throw new IllegalStateException("Invoice " + invoiceNumber + " has payments and cannot be cancelled");
        }
        this.status = InvoiceStatus.CANCELLED;
    }

    /**
     * Re-derives balance and status. Safe to call at any time.
     */
    public void refresh(LocalDate today) {
        this.balanceDue = totalAmount.subtract(amountPaid);
        if (status == InvoiceStatus.CANCELLED) {
            return;
        }
        if (amountPaid.compareTo(totalAmount) >= 0) {
            if (status != InvoiceStatus.PAID) {
                this.paidDate = today;
            }
            this.status = InvoiceStatus.PAID;
        } else if (amountPaid.signum() > 0) {
            this.status = InvoiceStatus.PARTIALLY_PAID;
        } else if (dueDate.isBefore(today)) {
            this.status = InvoiceStatus.OVERDUE;
        }
    }

    public BigDecimal balanceDue() {
        return totalAmount.subtract(amountPaid);
    }

    public boolean isSettled() {
        return amountPaid.compareTo(totalAmount) >= 0;
    }

    public BigDecimal progressPercentage() {
        return progress(amountPaid, totalAmount);
    }

    @PrePersist
    void onCreate() {
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
        this.balanceDue = totalAmount.subtract(amountPaid);
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
        this.balanceDue = totalAmount.subtract(amountPaid);
    }

    static BigDecimal money(BigDecimal value) {
        return (value == null ? BigDecimal.ZERO : value).setScale(2, RoundingMode.HALF_UP);
    }

    static BigDecimal progress(BigDecimal paid, BigDecimal total) {
        if (total.signum() <= 0) {
            return HUNDRED.setScale(2, RoundingMode.HALF_UP);
        }
        BigDecimal percentage = paid.multiply(HUNDRED).divide(total, 2, RoundingMode.HALF_UP);
        return percentage.min(HUNDRED.setScale(2, RoundingMode.HALF_UP));
    }
}
