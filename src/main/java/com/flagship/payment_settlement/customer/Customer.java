package com.flagship.payment_settlement.customer;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * End payer of an organization. The settlement core only links payments to customers
 * and stamps {@code lastPaymentDate}; profile management is handled elsewhere.
 */
@Entity
@Table(
    name = "customers",
    indexes = {
        @Index(name = "idx_customers_org_phone", columnList = "organization_id, phone_number"),
        @Index(name = "idx_customers_org_email", columnList = "organization_id, email")
    },
    uniqueConstraints = @UniqueConstraint(name = "uk_customers_org_code", columnNames = {"organization_id", "customer_code"})
)
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Customer {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "organization_id", nullable = false, updatable = false)
    private UUID organizationId;

    @Column(name = "customer_code", nullable = false, updatable = false, length = 50)
    private String customerCode;

    @Column(name = "first_name", nullable = false, length = 100)
    private String firstName;

    @Column(name = "last_name", nullable = false, length = 100)
    private String lastName;

    @Column(name = "phone_number", nullable = false, length = 17)
    private String phoneNumber;

    @Column(length = 254)
    private String email;

    @Column(name = "last_payment_date")
    private Instant lastPaymentDate;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    static Customer create(UUID organizationId, String customerCode, String firstName,
                           String lastName, String phoneNumber, String email) {
        Customer customer = new Customer();
        customer.id = UUID.randomUUID();
        customer.organizationId = organizationId;
        customer.customerCode = customerCode;
        customer.firstName = firstName;
        customer.lastName = lastName;
        customer.phoneNumber = phoneNumber;
        customer.email = email;
        return customer;
    }

    public String getFullName() {
        return firstName + " " + lastName;
    }

    /**
     * Only moves forward: a late callback for an older payment does not rewind the date.
     */
    public void recordPayment(Instant paidAt) {
        if (lastPaymentDate == null || paidAt.isAfter(lastPaymentDate)) {
            this.lastPaymentDate = paidAt;
        }
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
