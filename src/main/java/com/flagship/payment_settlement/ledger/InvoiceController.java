package com.flagship.payment_settlement.ledger;

import com.flagship.payment_settlement.ledger.dto.CreateInvoiceRequest;
import com.flagship.payment_settlement.ledger.dto.InvoiceResponse;
import com.flagship.payment_settlement.ledger.dto.RecordManualPaymentRequest;
import com.flagship.payment_settlement.payment.ManualPayment;
import com.flagship.payment_settlement.payment.ManualPaymentService;
import com.flagship.payment_settlement.payment.dto.PaymentResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/api/invoices")
@RequiredArgsConstructor
public class InvoiceController {

    private static final String ORGANIZATION_HEADER = "X-Organization-ID";

    private final InvoiceService invoiceService;
    private final ManualPaymentService manualPaymentService;

    @PostMapping
    public ResponseEntity<InvoiceResponse> create(
            @RequestHeader(ORGANIZATION_HEADER) UUID organizationId,
            @Valid @RequestBody CreateInvoiceRequest request) {
        Invoice invoice = invoiceService.create(organizationId, NewInvoice.builder()
                .customerId(request.getCustomerId())
                .currency(request.getCurrency())
                .issueDate(request.getIssueDate())
                .dueDate(request.getDueDate())
                .subtotal(request.getSubtotal())
                .taxAmount(request.getTaxAmount())
                .discountAmount(request.getDiscountAmount())
                .items(request.getItems() == null ? null : request.getItems().toString())
                .reference(request.getReference())
                .notes(request.getNotes())
                .createdBy(request.getCreatedBy())
                .build());
        return ResponseEntity.status(HttpStatus.CREATED).body(InvoiceResponse.from(invoice));
    }

    @GetMapping("/{id}")
    public ResponseEntity<InvoiceResponse> get(
            @RequestHeader(ORGANIZATION_HEADER) UUID organizationId,
            @PathVariable("id") UUID id) {
        return ResponseEntity.ok(InvoiceResponse.from(invoiceService.getForOrganization(id, organizationId)));
    }

    @PostMapping("/{id}/send")
    public ResponseEntity<InvoiceResponse> send(
            @RequestHeader(ORGANIZATION_HEADER) UUID organizationId,
            @PathVariable("id") UUID id) {
        return ResponseEntity.ok(InvoiceResponse.from(invoiceService.send(id, organizationId)));
    }

    /**
     * Records money received outside the push flow against the invoice.
     */
    @PostMapping("/{id}/payments")
    public ResponseEntity<PaymentResponse> recordPayment(
            @RequestHeader(ORGANIZATION_HEADER) UUID organizationId,
            @PathVariable("id") UUID id,
            @Valid @RequestBody RecordManualPaymentRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(PaymentResponse.from(
                manualPaymentService.recordInvoicePayment(organizationId, id, toManualPayment(request))));
    }

    @GetMapping("/{id}/payments")
    public ResponseEntity<List<PaymentResponse>> payments(
            @RequestHeader(ORGANIZATION_HEADER) UUID organizationId,
            @PathVariable("id") UUID id) {
        return ResponseEntity.ok(manualPaymentService.findForInvoice(organizationId, id).stream()
                .map(PaymentResponse::from)
                .toList());
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<InvoiceResponse> cancel(
            @RequestHeader(ORGANIZATION_HEADER) UUID organizationId,
            @PathVariable("id") UUID id) {
        return ResponseEntity.ok(InvoiceResponse.from(invoiceService.cancel(id, organizationId)));
    }

    static ManualPayment toManualPayment(RecordManualPaymentRequest request) {
        return ManualPayment.builder()
                .amount(request.getAmount())
                .paymentMethod(request.getPaymentMethod())
                .externalReference(request.getExternalReference())
                .description(request.getDescription())
                .paidAt(request.getPaidAt())
                .recordedBy(request.getRecordedBy())
                .build();
    }
}
