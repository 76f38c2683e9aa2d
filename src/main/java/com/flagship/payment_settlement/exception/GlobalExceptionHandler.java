package com.flagship.payment_settlement.exception;

import com.flagship.payment_settlement.payment.PaymentDispatchException;
import com.flagship.payment_settlement.provider.ProviderException;
import com.flagship.payment_settlement.provider.ProviderUnavailableException;
import lombok.Builder;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingRequestHeaderException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps the settlement error taxonomy onto HTTP statuses with one response shape.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(MissingRequestHeaderException.class)
    public ResponseEntity<ErrorResponse> handleMissingHeader(MissingRequestHeaderException e) {
        log.warn("Missing required header: {}", e.getHeaderName());
        return respond(HttpStatus.BAD_REQUEST, "Missing Required Header", "MISSING_HEADER",
                "Required header '" + e.getHeaderName() + "' is missing", null);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationException(MethodArgumentNotValidException e) {
        Map<String, String> errors = e.getBindingResult()
                .getFieldErrors()
                .stream()
                .collect(Collectors.toMap(
                        error -> error.getField(),
                        error -> error.getDefaultMessage() != null ? error.getDefaultMessage() : "Invalid value",
                        (existing, replacement) -> existing,
                        LinkedHashMap::new
                ));
        log.warn("Validation failed: {}", errors);
        return respond(HttpStatus.BAD_REQUEST, "Validation Failed", "VALIDATION_FAILED",
                "Request validation failed", errors);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class})
    public ResponseEntity<ErrorResponse> handleUnreadable(Exception e) {
        log.warn("Unreadable request: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Invalid Request", "MALFORMED_REQUEST",
                "Request body or parameter could not be read", null);
    }

    @ExceptionHandler({InvalidAmountException.class, InvalidPaymentStateException.class,
            InvalidNotificationException.class})
    public ResponseEntity<ErrorResponse> handleBadRequest(SettlementException e) {
        log.warn("Rejected request: code={}, message={}", e.getCode(), e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Invalid Request", e.getCode(), e.getMessage(), null);
    }

    @ExceptionHandler(InvalidSignatureException.class)
    public ResponseEntity<ErrorResponse> handleInvalidSignature(InvalidSignatureException e) {
        log.warn("Signature verification failed: {}", e.getMessage());
        return respond(HttpStatus.UNAUTHORIZED, "Invalid Signature", e.getCode(), e.getMessage(), null);
    }

    @ExceptionHandler(OrganizationMismatchException.class)
    public ResponseEntity<ErrorResponse> handleOrganizationMismatch(OrganizationMismatchException e) {
        log.warn("Cross-tenant access rejected: {}", e.getMessage());
        return respond(HttpStatus.FORBIDDEN, "Forbidden", e.getCode(), e.getMessage(), null);
    }

    @ExceptionHandler({PaymentNotFoundException.class, ResourceNotFoundException.class})
    public ResponseEntity<ErrorResponse> handleNotFound(SettlementException e) {
        log.info("Not found: {}", e.getMessage());
        return respond(HttpStatus.NOT_FOUND, "Not Found", e.getCode(), e.getMessage(), null);
    }

    @ExceptionHandler({AlreadyTerminalException.class, AmbiguousCustomerException.class})
    public ResponseEntity<ErrorResponse> handleConflict(SettlementException e) {
        log.warn("Conflict: code={}, message={}", e.getCode(), e.getMessage());
        return respond(HttpStatus.CONFLICT, "Conflict", e.getCode(), e.getMessage(), null);
    }

    // Two requests racing on the same idempotency key or checkout id; the loser gets this.
    @ExceptionHandler(DataIntegrityViolationException.class)
    public ResponseEntity<ErrorResponse> handleDataIntegrity(DataIntegrityViolationException e) {
        log.warn("Constraint violation: {}", e.getMostSpecificCause().getMessage());
        return respond(HttpStatus.CONFLICT, "Conflict", "DUPLICATE_REQUEST",
                "The request conflicts with one processed concurrently", null);
    }

    @ExceptionHandler(PaymentDispatchException.class)
    public ResponseEntity<ErrorResponse> handleDispatchFailure(PaymentDispatchException e) {
        log.warn("Dispatch failed: paymentId={}, code={}, retryable={}",
                e.getPaymentId(), e.getCode(), e.isRetryable());
        Map<String, String> details = new LinkedHashMap<>();
        details.put("payment_id", e.getPaymentId().toString());
        details.put("payment_reference", e.getPaymentReference());
        details.put("retryable", String.valueOf(e.isRetryable()));
        return respond(statusFor(e.getProviderError()), "Provider Error", e.getCode(), e.getMessage(), details);
    }

    @ExceptionHandler(ProviderException.class)
    public ResponseEntity<ErrorResponse> handleProviderException(ProviderException e) {
        log.warn("Provider call failed: code={}, message={}", e.getCode(), e.getMessage());
        return respond(statusFor(e), "Provider Error", e.getCode(), e.getMessage(),
                Map.of("retryable", String.valueOf(e.isRetryable())));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException e) {
        log.warn("Invalid argument: {}", e.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Invalid Request", "INVALID_ARGUMENT", e.getMessage(), null);
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<ErrorResponse> handleIllegalState(IllegalStateException e) {
        log.warn("Invalid state transition: {}", e.getMessage());
        return respond(HttpStatus.CONFLICT, "Invalid State", "INVALID_STATE", e.getMessage(), null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception e) {
        log.error("Unexpected error", e);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error", "INTERNAL_ERROR",
                "An unexpected error occurred", null);
    }

    // Rejections and credential problems are upstream answers; only outages are 503.
    private static HttpStatus statusFor(ProviderException e) {
        return e instanceof ProviderUnavailableException
                ? HttpStatus.SERVICE_UNAVAILABLE
                : HttpStatus.BAD_GATEWAY;
    }

    private static ResponseEntity<ErrorResponse> respond(HttpStatus status, String error, String code,
                                                         String message, Map<String, String> details) {
        ErrorResponse body = ErrorResponse.builder()
                .error(error)
                .code(code)
                .message(message)
                .details(details)
                .timestamp(Instant.now())
                .build();
        return ResponseEntity.status(status).body(body);
    }

    @Value
    @Builder
    public static class ErrorResponse {
        String error;
        String code;
        String message;
        Map<String, String> details;
        Instant timestamp;
    }
}
