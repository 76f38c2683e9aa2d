package com.flagship.payment_settlement.ledger;

import com.flagship.payment_settlement.ledger.dto.CreatePaymentPlanRequest;
import com.flagship.payment_settlement.ledger.dto.PaymentPlanResponse;
import com.flagship.payment_settlement.ledger.dto.RecordManualPaymentRequest;
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
@RequestMapping("/api/payment-plans")
@RequiredArgsConstructor
public class PaymentPlanController {

    private static final String ORGANIZATION_HEADER = "X-Organization-ID";

    private final PaymentPlanService paymentPlanService;
    private final ManualPaymentService manualPaymentService;

    @PostMapping
    public ResponseEntity<PaymentPlanResponse> create(
            @RequestHeader(ORGANIZATION_HEADER) UUID organizationId,
            @Valid @RequestBody CreatePaymentPlanRequest request) {
        PaymentPlan plan = paymentPlanService.create(organizationId, request.getCustomerId(), request.getName(),
                request.getDescription(), request.getTotalAmount(), request.getNumberOfInstallments(),
                request.getStartDate(), request.getEndDate());
        return ResponseEntity.status(HttpStatus.CREATED).body(PaymentPlanResponse.from(plan));
    }

    @GetMapping("/{id}")
    public ResponseEntity<PaymentPlanResponse> get(
            @RequestHeader(ORGANIZATION_HEADER) UUID organizationId,
            @PathVariable("id") UUID id) {
        return ResponseEntity.ok(PaymentPlanResponse.from(paymentPlanService.getForOrganization(id, organizationId)));
    }

    @PostMapping("/{id}/installments")
    public ResponseEntity<PaymentResponse> recordInstallment(
            @RequestHeader(ORGANIZATION_HEADER) UUID organizationId,
            @PathVariable("id") UUID id,
            @Valid @RequestBody RecordManualPaymentRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(PaymentResponse.from(
                manualPaymentService.recordInstallment(organizationId, id, InvoiceController.toManualPayment(request))));
    }

    @GetMapping("/{id}/installments")
    public ResponseEntity<List<PaymentResponse>> installments(
            @RequestHeader(ORGANIZATION_HEADER) UUID organizationId,
            @PathVariable("id") UUID id) {
        return ResponseEntity.ok(manualPaymentService.findForPaymentPlan(organizationId, id).stream()
                .map(PaymentResponse::from)
                .toList());
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<PaymentPlanResponse> cancel(
            @RequestHeader(ORGANIZATION_HEADER) UUID organizationId,
            @PathVariable("id") UUID id) {
        return ResponseEntity.ok(PaymentPlanResponse.from(paymentPlanService.cancel(id, organizationId)));
    }

    @PostMapping("/{id}/overdue")
    public ResponseEntity<PaymentPlanResponse> markOverdue(
            @RequestHeader(ORGANIZATION_HEADER) UUID organizationId,
            @PathVariable("id") UUID id) {
        return ResponseEntity.ok(PaymentPlanResponse.from(paymentPlanService.markOverdue(id, organizationId)));
    }
}
