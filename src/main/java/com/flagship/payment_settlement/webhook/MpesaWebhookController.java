package com.flagship.payment_settlement.webhook;

import com.flagship.payment_settlement.payment.PaymentSettlementService;
import com.flagship.payment_settlement.payment.PaymentSettlementService.ReconciliationResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.UUID;

/**
 * Receives STK push results from Daraja.
 *
 * The body is taken as a raw string because the signature covers the exact bytes sent.
 * Anything that passed signature verification is answered with 200, including
 * duplicates and callbacks that match no payment, so the provider stops redelivering.
 * A bad or missing signature is answered with 401 by the exception handler.
 */
@RestController
@RequestMapping("/webhooks/mpesa")
@RequiredArgsConstructor
@Slf4j
public class MpesaWebhookController {

    static final String SIGNATURE_HEADER = "X-Mpesa-Signature";

    private final PaymentSettlementService settlementService;

    @PostMapping(value = "/{integrationId}", consumes = MediaType.ALL_VALUE)
    public ResponseEntity<Map<String, String>> callback(
            @PathVariable("integrationId") UUID integrationId,
            @RequestHeader(value = SIGNATURE_HEADER, required = false) String signature,
            @RequestBody(required = false) String body) {

        ReconciliationResult result = settlementService.reconcileCallback(
                integrationId, body == null ? "" : body, signature);

        log.info("Callback on integration {} handled: {}", integrationId, result.getOutcome());
        return ResponseEntity.ok(Map.of(
                "status", "ok",
                "outcome", result.getOutcome().name()));
    }
}
