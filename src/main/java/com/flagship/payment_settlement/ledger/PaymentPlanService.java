package com.flagship.payment_settlement.ledger;

import com.flagship.payment_settlement.customer.CustomerService;
import com.flagship.payment_settlement.exception.OrganizationMismatchException;
import com.flagship.payment_settlement.exception.ResourceNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentPlanService {

    private final PaymentPlanRepository paymentPlanRepository;
    private final CustomerService customerService;
    private final Clock clock;

    @Transactional
    public PaymentPlan create(UUID organizationId, UUID customerId, String name, String description,
                              BigDecimal totalAmount, int numberOfInstallments,
                              LocalDate startDate, LocalDate endDate) {
        customerService.getForOrganization(organizationId, customerId);
        PaymentPlan plan = PaymentPlan.create(organizationId, customerId, name, description,
                totalAmount, numberOfInstallments,
                startDate == null ? LocalDate.now(clock) : startDate, endDate);
        PaymentPlan saved = paymentPlanRepository.save(plan);
        log.info("Created payment plan {} for customer {}: {} x {}",
                saved.getId(), customerId, saved.getNumberOfInstallments(), saved.getInstallmentAmount());
        return saved;
    }

    @Transactional(readOnly = true)
    public PaymentPlan getForOrganization(UUID planId, UUID organizationId) {
        PaymentPlan plan = paymentPlanRepository.findById(planId)
                .orElseThrow(() -> new ResourceNotFoundException("Payment plan", planId));
        if (!plan.getOrganizationId().equals(organizationId)) {
            throw new OrganizationMismatchException("Payment plan", planId, organizationId);
        }
        return plan;
    }

    @Transactional
    public PaymentPlan cancel(UUID planId, UUID organizationId) {
        PaymentPlan plan = lockForOrganization(planId, organizationId);
        plan.cancel();
        log.info("Payment plan {} cancelled", planId);
        return paymentPlanRepository.save(plan);
    }

    @Transactional
    public PaymentPlan markOverdue(UUID planId, UUID organizationId) {
        PaymentPlan plan = lockForOrganization(planId, organizationId);
        plan.markOverdue();
        log.info("Payment plan {} marked overdue", planId);
        return paymentPlanRepository.save(plan);
    }

    /**
     * Active plans whose end date has passed with a balance left become OVERDUE.
     */
    @Transactional
    public int markOverduePlans() {
        List<UUID> candidates = paymentPlanRepository.findOverdueCandidates(LocalDate.now(clock));
        int changed = 0;
        for (UUID id : candidates) {
            PaymentPlan plan = paymentPlanRepository.findByIdForUpdate(id).orElse(null);
            if (plan != null && plan.getStatus() == PaymentPlanStatus.ACTIVE && !plan.isSettled()) {
                plan.markOverdue();
                paymentPlanRepository.save(plan);
                changed++;
            }
        }
        if (changed > 0) {
            log.info("Marked {} payment plans overdue", changed);
        }
        return changed;
    }

    /**
     * Adds a settled installment. Same transaction as the payment's completion; a plan
     * that no longer accepts installments is left unchanged.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public PaymentPlan applyInstallment(UUID planId, BigDecimal amount) {
        PaymentPlan plan = paymentPlanRepository.findByIdForUpdate(planId)
                .orElseThrow(() -> new ResourceNotFoundException("Payment plan", planId));
        if (!plan.getStatus().acceptsInstallments()) {
            log.warn("Installment of {} arrived for payment plan {} in status {}; balance left unchanged",
                    amount, planId, plan.getStatus());
            return plan;
        }
        plan.recordInstallment(amount);
        PaymentPlan saved = paymentPlanRepository.save(plan);
        log.info("Payment plan {} installment {} -> amountPaid={}, balance={}, status={}",
                planId, amount, saved.getAmountPaid(), saved.getBalance(), saved.getStatus());
        return saved;
    }

    private PaymentPlan lockForOrganization(UUID planId, UUID organizationId) {
        PaymentPlan plan = paymentPlanRepository.findByIdForUpdate(planId)
                .orElseThrow(() -> new ResourceNotFoundException("Payment plan", planId));
        if (!plan.getOrganizationId().equals(organizationId)) {
            throw new OrganizationMismatchException("Payment plan", planId, organizationId);
        }
        return plan;
    }
}
