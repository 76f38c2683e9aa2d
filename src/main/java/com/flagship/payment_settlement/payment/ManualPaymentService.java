package com.flagship.payment_settlement.payment;

import com.flagship.payment_settlement.customer.Customer;
import com.flagship.payment_settlement.customer.CustomerService;
import com.flagship.payment_settlement.exception.InvalidAmountException;
import com.flagship.payment_settlement.exception.InvalidPaymentStateException;
import com.flagship.payment_settlement.ledger.Invoice;
import com.flagship.payment_settlement.ledger.InvoiceService;
import com.flagship.payment_settlement.ledger.InvoiceStatus;
import com.flagship.payment_settlement.ledger.PaymentPlan;
import com.flagship.payment_settlement.ledger.PaymentPlanService;
import com.flagship.payment_settlement.observability.SettlementMetrics;
import com.flagship.payment_settlement.organization.Organization;
import com.flagship.payment_settlement.organization.OrganizationService;
import com.flagship.payment_settlement.reference.ReferenceGenerator;
import com.flagship.payment_settlement.reference.ReferenceKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Money received outside the push flow (cash, bank transfer, cheque) against an
 * invoice or a payment plan.
 *
 * The COMPLETED payment row and the ledger update commit together, exactly as they do
 * for a provider callback.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ManualPaymentService {

    private final OrganizationService organizationService;
    private final CustomerService customerService;
    private final InvoiceService invoiceService;
    private final PaymentPlanService paymentPlanService;
    private final ReferenceGenerator referenceGenerator;
    private final PaymentPersistenceService persistenceService;
    private final SettlementEffects settlementEffects;
    private final SettlementMetrics metrics;
    private final Clock clock;

    @Transactional
    public Payment recordInvoicePayment(UUID organizationId, UUID invoiceId, ManualPayment request) {
        Invoice invoice = invoiceService.getForOrganization(invoiceId, organizationId);
        if (invoice.getStatus() == InvoiceStatus.CANCELLED) {
            throw new InvalidPaymentStateException("Invoice " + invoice.getInvoiceNumber() + " is cancelled");
        }
        PaymentRequestDetails details = details(organizationId, invoice.getCustomerId(), request)
                .invoiceId(invoiceId)
                .currency(invoice.getCurrency())
                .paymentType(PaymentType.INVOICE)
                .description(request.getDescription() != null
                        ? request.getDescription()
                        : "Payment for invoice " + invoice.getInvoiceNumber())
                .build();
        return record(organizationId, details, request);
    }

    @Transactional
    public Payment recordInstallment(UUID organizationId, UUID paymentPlanId, ManualPayment request) {
        PaymentPlan plan = paymentPlanService.getForOrganization(paymentPlanId, organizationId);
        if (!plan.getStatus().acceptsInstallments()) {
            throw new InvalidPaymentStateException("Payment plan " + paymentPlanId + " is " + plan.getStatus());
        }
        PaymentRequestDetails details = details(organizationId, plan.getCustomerId(), request)
                .paymentPlanId(paymentPlanId)
                .paymentType(PaymentType.OTHER)
                .description(request.getDescription() != null
                        ? request.getDescription()
                        : "Installment for " + plan.getName())
                .build();
        return record(organizationId, details, request);
    }

    @Transactional(readOnly = true)
    public List<Payment> findForInvoice(UUID organizationId, UUID invoiceId) {
        invoiceService.getForOrganization(invoiceId, organizationId);
        return persistenceService.findByInvoice(invoiceId);
    }

    @Transactional(readOnly = true)
    public List<Payment> findForPaymentPlan(UUID organizationId, UUID paymentPlanId) {
        paymentPlanService.getForOrganization(paymentPlanId, organizationId);
        return persistenceService.findByPaymentPlan(paymentPlanId);
    }

    private Payment record(UUID organizationId, PaymentRequestDetails details, ManualPayment request) {
        Organization organization = organizationService.getRequired(organizationId);
        String reference = referenceGenerator.nextReference(
                organizationId, organization.getName(), ReferenceKind.PAYMENT);
        Instant paidAt = request.getPaidAt() != null ? request.getPaidAt() : Instant.now(clock);

        Payment payment = Payment.recordedManually(organizationId, reference, details,
                request.getPaymentMethod() == null ? PaymentMethod.CASH : request.getPaymentMethod(),
                request.getExternalReference(), paidAt);
        Payment saved = persistenceService.save(payment, null);
        settlementEffects.applyCompleted(saved);

        metrics.recordPaymentInitiated(saved.getPaymentType().name());
        log.info("Recorded {} payment {} of {} {}", saved.getPaymentMethod(), saved.getPaymentReference(),
                saved.getCurrency(), saved.getAmount());
        return saved;
    }

    private PaymentRequestDetails.PaymentRequestDetailsBuilder details(UUID organizationId, UUID customerId,
                                                                      ManualPayment request) {
        BigDecimal amount = request.getAmount();
        if (amount == null || amount.signum() <= 0) {
            throw InvalidAmountException.notPositive("amount", amount);
        }
        Customer customer = customerService.getForOrganization(organizationId, customerId);
        return PaymentRequestDetails.builder()
                .customerId(customerId)
                .amount(amount)
                .transactionFee(BigDecimal.ZERO)
                .payerName(customer.getFullName())
                .payerPhone(customer.getPhoneNumber())
                .payerEmail(customer.getEmail())
                .createdBy(request.getRecordedBy());
    }
}
