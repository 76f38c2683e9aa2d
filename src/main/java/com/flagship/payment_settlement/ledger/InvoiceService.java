package com.flagship.payment_settlement.ledger;

import com.flagship.payment_settlement.customer.Customer;
import com.flagship.payment_settlement.customer.CustomerService;
import com.flagship.payment_settlement.exception.OrganizationMismatchException;
import com.flagship.payment_settlement.exception.ResourceNotFoundException;
import com.flagship.payment_settlement.notification.NotificationChannel;
import com.flagship.payment_settlement.notification.NotificationRequest;
import com.flagship.payment_settlement.notification.NotificationService;
import com.flagship.payment_settlement.notification.RecipientType;
import com.flagship.payment_settlement.organization.Organization;
import com.flagship.payment_settlement.organization.OrganizationService;
import com.flagship.payment_settlement.reference.ReferenceGenerator;
import com.flagship.payment_settlement.reference.ReferenceKind;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.EnumSet;
import java.util.List;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class InvoiceService {

    static final String INVOICE_SENT = "invoice_sent";

    private final InvoiceRepository invoiceRepository;
    private final OrganizationService organizationService;
    private final CustomerService customerService;
    private final ReferenceGenerator referenceGenerator;
    private final NotificationService notificationService;
    private final Clock clock;

    @Transactional
    public Invoice create(UUID organizationId, NewInvoice request) {
        Organization organization = organizationService.getRequired(organizationId);
        customerService.getForOrganization(organizationId, request.getCustomerId());

        LocalDate today = LocalDate.now(clock);
        String invoiceNumber = referenceGenerator.nextReference(
                organizationId, organization.getName(), ReferenceKind.INVOICE);

        Invoice invoice = Invoice.create(
                organizationId,
                request.getCustomerId(),
                invoiceNumber,
                request.getCurrency(),
                request.getIssueDate() == null ? today : request.getIssueDate(),
                request.getDueDate(),
                request.getSubtotal(),
                request.getTaxAmount(),
                request.getDiscountAmount(),
                request.getItems(),
                request.getReference(),
                request.getNotes(),
                request.getCreatedBy());
        Invoice saved = invoiceRepository.save(invoice);
        log.info("Created invoice {} for customer {} total={}",
                saved.getInvoiceNumber(), saved.getCustomerId(), saved.getTotalAmount());
        return saved;
    }

    @Transactional(readOnly = true)
    public Invoice getForOrganization(UUID invoiceId, UUID organizationId) {
        Invoice invoice = invoiceRepository.findById(invoiceId)
                .orElseThrow(() -> new ResourceNotFoundException("Invoice", invoiceId));
        if (!invoice.getOrganizationId().equals(organizationId)) {
            throw new OrganizationMismatchException("Invoice", invoiceId, organizationId);
        }
        return invoice;
    }

    /**
     * DRAFT -> SENT and tells the customer by e-mail and SMS, for whichever contact
     * details the customer has.
     */
    @Transactional
    public Invoice send(UUID invoiceId, UUID organizationId) {
        Invoice invoice = lockForOrganization(invoiceId, organizationId);
        invoice.markSent(Instant.now(clock), LocalDate.now(clock));
        Invoice saved = invoiceRepository.save(invoice);

        Customer customer = customerService.getForOrganization(organizationId, invoice.getCustomerId());
        String summary = String.format("Invoice %s for %s %s is due on %s.",
                saved.getInvoiceNumber(), saved.getCurrency(), saved.getTotalAmount().toPlainString(),
                saved.getDueDate());

        if (customer.getEmail() != null && !customer.getEmail().isBlank()) {
            notificationService.enqueue(invoiceNotification(saved, NotificationChannel.EMAIL)
                    .subject("Invoice " + saved.getInvoiceNumber())
                    .message("Dear " + customer.getFullName() + ", " + summary)
                    .build());
        }
        if (customer.getPhoneNumber() != null && !customer.getPhoneNumber().isBlank()) {
            notificationService.enqueue(invoiceNotification(saved, NotificationChannel.SMS)
                    .message(summary)
                    .build());
        }
        if (customer.getEmail() == null && customer.getPhoneNumber() == null) {
            log.warn("Invoice {} sent but customer {} has no contact details", saved.getInvoiceNumber(), customer.getId());
        }

        log.info("Invoice {} sent", saved.getInvoiceNumber());
        return saved;
    }

    @Transactional
    public Invoice cancel(UUID invoiceId, UUID organizationId) {
        Invoice invoice = lockForOrganization(invoiceId, organizationId);
        invoice.cancel();
        Invoice saved = invoiceRepository.save(invoice);
        log.info("Invoice {} cancelled", saved.getInvoiceNumber());
        return saved;
    }

    /**
     * Adds a settled payment to the invoice. Runs inside the transaction that completed
     * the payment so both commit together.
     *
     * A cancelled invoice is left as it is: the money has moved regardless, and
     * refusing here would undo the payment's own completion.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Invoice applyPayment(UUID invoiceId, BigDecimal amount) {
        Invoice invoice = invoiceRepository.findByIdForUpdate(invoiceId)
                .orElseThrow(() -> new ResourceNotFoundException("Invoice", invoiceId));
        if (invoice.getStatus() == InvoiceStatus.CANCELLED) {
            log.warn("Payment of {} arrived for cancelled invoice {}; balance left unchanged",
                    amount, invoice.getInvoiceNumber());
            return invoice;
        }
        invoice.recordPayment(amount, LocalDate.now(clock));
        Invoice saved = invoiceRepository.save(invoice);
        log.info("Invoice {} paid {} -> amountPaid={}, balanceDue={}, status={}",
                saved.getInvoiceNumber(), amount, saved.getAmountPaid(), saved.balanceDue(), saved.getStatus());
        return saved;
    }

    /**
     * Moves unpaid invoices past their due date to OVERDUE.
     *
     * @return number of invoices changed
     */
    @Transactional
    public int markOverdueInvoices() {
        LocalDate today = LocalDate.now(clock);
        List<UUID> candidates = invoiceRepository.findOverdueCandidates(
                today, EnumSet.of(InvoiceStatus.DRAFT, InvoiceStatus.SENT, InvoiceStatus.VIEWED));
        int changed = 0;
        for (UUID id : candidates) {
            Invoice invoice = invoiceRepository.findByIdForUpdate(id).orElse(null);
            if (invoice == null) {
                continue;
            }
            InvoiceStatus before = invoice.getStatus();
            invoice.refresh(today);
            if (invoice.getStatus() != before) {
                invoiceRepository.save(invoice);
                changed++;
            }
        }
        if (changed > 0) {
            log.info("Marked {} invoices overdue", changed);
        }
        return changed;
    }

    private Invoice lockForOrganization(UUID invoiceId, UUID organizationId) {
        Invoice invoice = invoiceRepository.findByIdForUpdate(invoiceId)
                .orElseThrow(() -> new ResourceNotFoundException("Invoice", invoiceId));
        if (!invoice.getOrganizationId().equals(organizationId)) {
            throw new OrganizationMismatchException("Invoice", invoiceId, organizationId);
        }
        return invoice;
    }

    private static NotificationRequest.NotificationRequestBuilder invoiceNotification(Invoice invoice,
                                                                                      NotificationChannel channel) {
        return NotificationRequest.builder()
                .organizationId(invoice.getOrganizationId())
                .recipientType(RecipientType.CUSTOMER)
                .recipientId(invoice.getCustomerId())
                .notificationType(INVOICE_SENT)
                .channel(channel)
                .invoiceId(invoice.getId());
    }
}
