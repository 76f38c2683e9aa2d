package com.flagship.payment_settlement.payment;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.UUID;

/**
 * Payment domain object.
 *
 * Immutable: every transition returns a new instance and rejects moves the state
 * machine does not allow.
 *
 * <pre>
 * PENDING    -> INITIATED                 dispatch begins
 * INITIATED  -> PROCESSING | FAILED       provider result arrives / push rejected
 * PROCESSING -> COMPLETED | FAILED        result applied
 * COMPLETED  -> REVERSED                  admin reversal
 * PENDING | INITIATED -> CANCELLED        caller abandons before confirmation
 * </pre>
 *
 * {@code netAmount} is always {@code amount - transactionFee}; it is never taken from
 * the caller.
 */
@Value
@Builder(toBuilder = true)
public class Payment {
    UUID id;
    UUID organizationId;
    UUID customerId;
    UUID invoiceId;
    UUID paymentPlanId;
    String paymentReference;
    String externalReference;
    String description;
    PaymentType paymentType;
    PaymentMethod paymentMethod;
    CurrencyCode currency;
    BigDecimal amount;
    BigDecimal transactionFee;
    BigDecimal netAmount;
    String checkoutRequestId;
    String merchantRequestId;
    PaymentStatus status;
    String failureReason;
    String payerPhone;
    String payerName;
    String payerEmail;
    Instant initiatedAt;
    Instant completedAt;
    boolean reversed;
    String reversalReason;
    Instant reversedAt;
    String reversedBy;
    String createdBy;
    Instant createdAt;
    Instant updatedAt;

    /**
     * New payment awaiting dispatch to the provider.
     */
    public static Payment createPending(UUID organizationId, String paymentReference,
                                        PaymentRequestDetails details) {
        BigDecimal fee = scale(details.getTransactionFee() == null ? BigDecimal.ZERO : details.getTransactionFee());
        BigDecimal amount = scale(details.getAmount());
        return Payment.builder()
                .id(UUID.randomUUID())
                .organizationId(organizationId)
                .customerId(details.getCustomerId())
                .invoiceId(details.getInvoiceId())
                .paymentPlanId(details.getPaymentPlanId())
                .paymentReference(paymentReference)
                .description(details.getDescription())
                .paymentType(details.getPaymentType() == null ? PaymentType.OTHER : details.getPaymentType())
                .paymentMethod(PaymentMethod.MPESA)
                .currency(details.getCurrency() == null ? CurrencyCode.KES : details.getCurrency())
                .amount(amount)
                .transactionFee(fee)
                .netAmount(amount.subtract(fee))
                .status(PaymentStatus.PENDING)
                .payerPhone(details.getPayerPhone())
                .payerName(details.getPayerName())
                .payerEmail(details.getPayerEmail())
                .createdBy(details.getCreatedBy())
                .createdAt(Instant.now())
                .updatedAt(Instant.now())
                .build();
    }

    /**
     * Money that already moved outside the push flow (cash at the counter, bank
     * transfer). It is born COMPLETED and never dispatched.
     */
    public static Payment recordedManually(UUID organizationId, String paymentReference,
                                           PaymentRequestDetails details, PaymentMethod method,
                                           String externalReference, Instant paidAt) {
        Payment pending = createPending(organizationId, paymentReference, details);
        return pending.toBuilder()
                .paymentMethod(method)
                .externalReference(externalReference)
                .status(PaymentStatus.COMPLETED)
                .completedAt(paidAt)
                .build();
    }

    /**
     * PENDING -> INITIATED. The claim taken before calling the provider.
     */
    public Payment markInitiated(Instant at) {
        requireStatus(PaymentStatus.INITIATED, PaymentStatus.PENDING);
        return toBuilder()
                .status(PaymentStatus.INITIATED)
                .initiatedAt(at)
                .updatedAt(Instant.now())
                .build();
    }

    /**
     * Records the provider's correlation ids once it accepted the push request.
     * A payment cancelled while the push was in flight keeps its status but still
     * records the ids, so the late callback is recognized instead of treated as orphan.
     */
    public Payment recordDispatch(String checkoutRequestId, String merchantRequestId) {
        if (this.status != PaymentStatus.INITIATED && this.status != PaymentStatus.CANCELLED) {
            throw new IllegalStateException(String.format(
                    "Cannot record dispatch for payment in %s status. Only INITIATED payments carry provider ids.",
                    this.status));
        }
        if (this.checkoutRequestId != null) {
            throw new IllegalStateException("Payment " + id + " was already dispatched as " + this.checkoutRequestId);
        }
        if (checkoutRequestId == null || checkoutRequestId.isBlank()) {
            throw new IllegalArgumentException("Provider did not return a checkout request id");
        }
        return toBuilder()
                .checkoutRequestId(checkoutRequestId)
                .merchantRequestId(merchantRequestId)
                .updatedAt(Instant.now())
                .build();
    }

    public Payment markProcessing() {
        requireStatus(PaymentStatus.PROCESSING, PaymentStatus.INITIATED);
        return toBuilder()
                .status(PaymentStatus.PROCESSING)
                .updatedAt(Instant.now())
                .build();
    }

    /**
     * PROCESSING -> COMPLETED with the provider's receipt. A confirmed amount that
     * differs from the requested one replaces it and the net amount follows.
     */
    public Payment complete(String receiptNumber, BigDecimal confirmedAmount, String confirmedPhone, Instant at) {
        requireStatus(PaymentStatus.COMPLETED, PaymentStatus.PROCESSING);
        BigDecimal finalAmount = confirmedAmount != null && confirmedAmount.signum() > 0
                ? scale(confirmedAmount)
                : this.amount;
        return toBuilder()
                .status(PaymentStatus.COMPLETED)
                .externalReference(receiptNumber)
                .amount(finalAmount)
                .netAmount(finalAmount.subtract(this.transactionFee))
                .payerPhone(confirmedPhone != null && !confirmedPhone.isBlank() ? confirmedPhone : this.payerPhone)
                .completedAt(at)
                .failureReason(null)
                .updatedAt(Instant.now())
                .build();
    }

    public Payment fail(String reason) {
        requireStatus(PaymentStatus.FAILED, PaymentStatus.INITIATED, PaymentStatus.PROCESSING);
        return toBuilder()
                .status(PaymentStatus.FAILED)
                .failureReason(reason)
                .updatedAt(Instant.now())
                .build();
    }

    public Payment cancel() {
        requireStatus(PaymentStatus.CANCELLED, PaymentStatus.PENDING, PaymentStatus.INITIATED);
        return toBuilder()
                .status(PaymentStatus.CANCELLED)
                .updatedAt(Instant.now())
                .build();
    }

    /**
     * COMPLETED -> REVERSED. Ledger only; nothing is sent back to the provider.
     * {@code completedAt} is kept so the history still shows when the money arrived.
     */
    public Payment reverse(String reason, String actor, Instant at) {
        if (this.reversed) {
            throw new IllegalStateException("Payment " + id + " is already reversed");
        }
        requireStatus(PaymentStatus.REVERSED, PaymentStatus.COMPLETED);
        return toBuilder()
                .status(PaymentStatus.REVERSED)
                .reversed(true)
                .reversalReason(reason)
                .reversedBy(actor)
                .reversedAt(at)
                .updatedAt(Instant.now())
                .build();
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }

    public boolean isAwaitingCallback() {
        return status == PaymentStatus.INITIATED || status == PaymentStatus.PROCESSING;
    }

    public boolean canTransitionTo(PaymentStatus target) {
        if (this.status == target) {
            return true;
        }
        return switch (this.status) {
            case PENDING -> target == PaymentStatus.INITIATED || target == PaymentStatus.CANCELLED;
            case INITIATED -> target == PaymentStatus.PROCESSING
                    || target == PaymentStatus.FAILED
                    || target == PaymentStatus.CANCELLED;
            case PROCESSING -> target == PaymentStatus.COMPLETED || target == PaymentStatus.FAILED;
            case COMPLETED -> target == PaymentStatus.REVERSED && !reversed;
            case FAILED, CANCELLED, REVERSED -> false;
        };
    }

    private void requireStatus(PaymentStatus target, PaymentStatus... allowedFrom) {
        for (PaymentStatus allowed : allowedFrom) {
            if (this.status == allowed) {
                return;
            }
        }
        throw new IllegalStateException(String.format(
                "Cannot move payment %s from %s to %s", id, this.status, target));
    }

    static BigDecimal scale(BigDecimal value) {
        return value.setScale(2, RoundingMode.HALF_UP);
    }
}
