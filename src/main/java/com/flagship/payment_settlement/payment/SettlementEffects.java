package com.flagship.payment_settlement.payment;

import com.flagship.payment_settlement.customer.CustomerService;
import com.flagship.payment_settlement.ledger.InvoiceService;
import com.flagship.payment_settlement.ledger.PaymentPlanService;
import com.flagship.payment_settlement.notification.NotificationChannel;
import com.flagship.payment_settlement.notification.NotificationPriority;
import com.flagship.payment_settlement.notification.NotificationRequest;
import com.flagship.payment_settlement.notification.NotificationService;
import com.flagship.payment_settlement.notification.RecipientType;
import com.flagship.payment_settlement.outbox.OutboxService;
import com.flagship.payment_settlement.payment.event.PaymentCompletedEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Everything that must happen when money is confirmed, in the same transaction as the
 * payment's move to COMPLETED:
 * <ol>
 *   <li>the customer's last payment date</li>
 *   <li>the linked invoice or payment plan balance</li>
 *   <li>one payment-received notification</li>
 *   <li>the PaymentCompleted outbox event</li>
 * </ol>
 * If any step fails the whole settlement rolls back.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class SettlementEffects {

    static final String PAYMENT_RECEIVED = "payment_received";

    private final CustomerService customerService;
    private final InvoiceService invoiceService;
    private final PaymentPlanService paymentPlanService;
    private final NotificationService notificationService;
    private final OutboxService outboxService;

    @Transactional(propagation = Propagation.MANDATORY)
    public void applyCompleted(Payment payment) {
        if (payment.getStatus() != PaymentStatus.COMPLETED) {
            throw new IllegalStateException("Payment " + payment.getId() + " is " + payment.getStatus() + ", not COMPLETED");
        }

        if (payment.getCustomerId() != null) {
            customerService.recordPayment(payment.getCustomerId(), payment.getCompletedAt());
        }
        if (payment.getInvoiceId() != null) {
            invoiceService.applyPayment(payment.getInvoiceId(), payment.getAmount());
        }
        if (payment.getPaymentPlanId() != null) {
            paymentPlanService.applyInstallment(payment.getPaymentPlanId(), payment.getAmount());
        }

        notifyPayer(payment);

        outboxService.savePaymentEvent(PaymentCompletedEvent.fromPayment(payment));
    }

    static String receiptMessage(Payment payment) {
        return String.format("Payment of %s %s received successfully. Ref: %s",
                payment.getCurrency(), payment.getAmount().toPlainString(), payment.getPaymentReference());
    }

    private void notifyPayer(Payment payment) {
        NotificationChannel channel;
        if (hasText(payment.getPayerPhone())) {
            channel = NotificationChannel.SMS;
        } else if (hasText(payment.getPayerEmail())) {
            channel = NotificationChannel.EMAIL;
        } else if (payment.getCustomerId() != null) {
            channel = NotificationChannel.IN_APP;
        } else {
            log.info("Payment {} has no payer contact, no receipt sent", payment.getPaymentReference());
            return;
        }

        notificationService.enqueue(NotificationRequest.builder()
                .organizationId(payment.getOrganizationId())
                .recipientType(RecipientType.CUSTOMER)
                .recipientId(payment.getCustomerId())
                .recipientPhone(payment.getPayerPhone())
                .recipientEmail(payment.getPayerEmail())
                .notificationType(PAYMENT_RECEIVED)
                .channel(channel)
                .subject(channel == NotificationChannel.EMAIL ? "Payment received" : null)
                .message(receiptMessage(payment))
                .priority(NotificationPriority.HIGH)
                .paymentId(payment.getId())
                .invoiceId(payment.getInvoiceId())
                .build());
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
