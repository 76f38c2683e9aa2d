package com.flagship.payment_settlement.payment;

import com.flagship.payment_settlement.payment.dto.InitiatePaymentRequest;
import com.flagship.payment_settlement.payment.dto.PaymentResponse;
import com.flagship.payment_settlement.payment.dto.PaymentStatisticsResponse;
import com.flagship.payment_settlement.payment.dto.ReversePaymentRequest;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.UUID;

/**
 * Payment endpoints. The organization comes from the {@code X-Organization-ID} header.
 *
 * {@code POST /api/payments} creates and dispatches in one call. The payment is
 * committed before the provider is contacted, so a failed dispatch still returns a
 * payment id the caller can look up.
 */
@RestController
@RequestMapping("/api/payments")
@RequiredArgsConstructor
@Slf4j
public class PaymentController {

    private static final String ORGANIZATION_HEADER = "X-Organization-ID";
    private static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";
    private static final String DEFAULT_ACTOR = "api";

    private final PaymentService paymentService;

    /**
     * Initiates a push payment.
     *
     * @return 201 with the dispatched payment, or 200 with the original payment when the
     *         Idempotency-Key was seen before
     */
    @PostMapping
    public ResponseEntity<PaymentResponse> initiate(
            @RequestHeader(ORGANIZATION_HEADER) UUID organizationId,
            @RequestHeader(value = IDEMPOTENCY_KEY_HEADER, required = false) String idempotencyKey,
            @Valid @RequestBody InitiatePaymentRequest request) {

        log.info("Payment initiation requested: amount={}, invoiceId={}, paymentPlanId={}",
                request.getAmount(), request.getInvoiceId(), request.getPaymentPlanId());

        PaymentService.Initiation initiation = paymentService.initiate(organizationId, PaymentRequestDetails.builder()
                .customerId(request.getCustomerId())
                .invoiceId(request.getInvoiceId())
                .paymentPlanId(request.getPaymentPlanId())
                .amount(request.getAmount())
                .transactionFee(request.getTransactionFee())
                .currency(request.getCurrency())
                .paymentType(request.getPaymentType())
                .description(request.getDescription())
                .payerPhone(request.getPhoneNumber())
                .payerName(request.getPayerName())
                .payerEmail(request.getPayerEmail())
                .createdBy(request.getCreatedBy())
                .build(), idempotencyKey);

        if (initiation.replayed()) {
            return ResponseEntity.ok(PaymentResponse.from(initiation.payment()));
        }

        Payment dispatched = paymentService.dispatch(initiation.payment().getId(), organizationId);
        return ResponseEntity.status(HttpStatus.CREATED).body(PaymentResponse.from(dispatched));
    }

    @GetMapping("/statistics")
    public ResponseEntity<PaymentStatisticsResponse> statistics(
            @RequestHeader(ORGANIZATION_HEADER) UUID organizationId) {
        return ResponseEntity.ok(PaymentStatisticsResponse.from(paymentService.statistics(organizationId)));
    }

    @GetMapping("/{id}")
    public ResponseEntity<PaymentResponse> get(
            @RequestHeader(ORGANIZATION_HEADER) UUID organizationId,
            @PathVariable("id") UUID id) {
        return ResponseEntity.ok(PaymentResponse.from(paymentService.get(id, organizationId)));
    }

    /**
     * Dispatches a payment left PENDING, e.g. because the organization had no active
     * integration when it was created.
     */
    @PostMapping("/{id}/dispatch")
    public ResponseEntity<PaymentResponse> dispatch(
            @RequestHeader(ORGANIZATION_HEADER) UUID organizationId,
            @PathVariable("id") UUID id) {
        return ResponseEntity.ok(PaymentResponse.from(paymentService.dispatch(id, organizationId)));
    }

    @PostMapping("/{id}/cancel")
    public ResponseEntity<PaymentResponse> cancel(
            @RequestHeader(ORGANIZATION_HEADER) UUID organizationId,
            @PathVariable("id") UUID id) {
        return ResponseEntity.ok(PaymentResponse.from(paymentService.cancel(id, organizationId)));
    }

    @PostMapping("/{id}/reverse")
    public ResponseEntity<PaymentResponse> reverse(
            @RequestHeader(ORGANIZATION_HEADER) UUID organizationId,
            @PathVariable("id") UUID id,
            @Valid @RequestBody ReversePaymentRequest request) {
        String actor = request.getReversedBy() != null && !request.getReversedBy().isBlank()
                ? request.getReversedBy()
                : DEFAULT_ACTOR;
        return ResponseEntity.ok(PaymentResponse.from(
                paymentService.reverse(id, organizationId, request.getReason(), actor)));
    }
}
