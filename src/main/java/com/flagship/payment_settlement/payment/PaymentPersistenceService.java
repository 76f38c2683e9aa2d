package com.flagship.payment_settlement.payment;

import com.flagship.payment_settlement.exception.OrganizationMismatchException;
import com.flagship.payment_settlement.exception.PaymentNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Bridges the {@link Payment} domain object and {@link PaymentEntity}.
 *
 * The {@code ...ForUpdate} methods take a row lock and therefore only make sense
 * inside the caller's transaction; they use MANDATORY propagation so a call outside one
 * fails fast instead of silently locking nothing.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentPersistenceService {

    private final PaymentRepository paymentRepository;

    @Transactional
    public Payment save(Payment payment, String idempotencyKey) {
        PaymentEntity saved = paymentRepository.save(PaymentEntity.fromDomain(payment, idempotencyKey));
        log.debug("Saved payment {} ({})", saved.getId(), saved.getPaymentReference());
        return saved.toDomain();
    }

    @Transactional
    public Payment update(Payment payment) {
        PaymentEntity existing = paymentRepository.findById(payment.getId())
            .orElseThrow(() -> PaymentNotFoundException.byId(payment.getId()));
        existing.updateFromDomain(payment);
        PaymentEntity updated = paymentRepository.saveAndFlush(existing);
        log.debug("Updated payment {} to {}", updated.getId(), updated.getStatus());
        return updated.toDomain();
    }

    @Transactional(readOnly = true)
    public Optional<Payment> findById(UUID paymentId) {
        return paymentRepository.findById(paymentId).map(PaymentEntity::toDomain);
    }

    /**
     * Loads a payment on behalf of an organization.
     *
     * @throws PaymentNotFoundException      if no such payment exists
     * @throws OrganizationMismatchException if it belongs to another organization
     */
    @Transactional(readOnly = true)
    public Payment getForOrganization(UUID paymentId, UUID organizationId) {
        Payment payment = findById(paymentId).orElseThrow(() -> PaymentNotFoundException.byId(paymentId));
        requireOrganization(payment, organizationId);
        return payment;
    }

    @Transactional(readOnly = true)
    public Optional<Payment> findByIdempotencyKey(String idempotencyKey) {
        return paymentRepository.findByIdempotencyKey(idempotencyKey).map(PaymentEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public List<Payment> findByInvoice(UUID invoiceId) {
        return paymentRepository.findByInvoiceIdOrderByCreatedAtAsc(invoiceId).stream()
            .map(PaymentEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public List<Payment> findByPaymentPlan(UUID paymentPlanId) {
        return paymentRepository.findByPaymentPlanIdOrderByCreatedAtAsc(paymentPlanId).stream()
            .map(PaymentEntity::toDomain)
            .toList();
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public Payment lockForUpdate(UUID paymentId) {
        return paymentRepository.findByIdForUpdate(paymentId)
            .map(PaymentEntity::toDomain)
            .orElseThrow(() -> PaymentNotFoundException.byId(paymentId));
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public Optional<Payment> lockAwaitingCallback(String checkoutRequestId) {
        return paymentRepository
            .findByCheckoutRequestIdForUpdate(checkoutRequestId, PaymentStatus.awaitingCallback())
            .map(PaymentEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public Optional<Payment> findLatestByCheckoutRequestId(String checkoutRequestId) {
        return paymentRepository.findFirstByCheckoutRequestIdOrderByCreatedAtDesc(checkoutRequestId)
            .map(PaymentEntity::toDomain);
    }

    /**
     * PENDING -> INITIATED as a single conditional update.
     *
     * @return true if this caller won the claim
     */
    @Transactional
    public boolean claimForDispatch(UUID paymentId, Instant now) {
        int updated = paymentRepository.claimForDispatch(
            paymentId, PaymentStatus.PENDING, PaymentStatus.INITIATED, now);
        return updated == 1;
    }

    /**
     * INITIATED payments that never got provider ids, claimed before the cutoff.
     */
    @Transactional(readOnly = true)
    public List<UUID> findInterruptedDispatches(Instant cutoff) {
        return paymentRepository.findInterruptedDispatches(PaymentStatus.INITIATED, cutoff);
    }

    @Transactional(readOnly = true)
    public List<UUID> findCallbacksOverdue(Instant cutoff) {
        return paymentRepository.findCallbacksOverdue(PaymentStatus.awaitingCallback(), cutoff);
    }

    @Transactional(readOnly = true)
    public long countAwaitingCallback() {
        return paymentRepository.countByStatusIn(PaymentStatus.awaitingCallback());
    }

    @Transactional(readOnly = true)
    public List<PaymentRepository.StatusTotal> summarizeByStatus(UUID organizationId) {
        return paymentRepository.summarizeByStatus(organizationId);
    }

    static void requireOrganization(Payment payment, UUID organizationId) {
        if (!payment.getOrganizationId().equals(organizationId)) {
            throw new OrganizationMismatchException("Payment", payment.getId(), organizationId);
        }
    }
}
