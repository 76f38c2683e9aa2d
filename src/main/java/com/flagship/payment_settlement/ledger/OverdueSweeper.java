package com.flagship.payment_settlement.ledger;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "ledger.overdue-sweep.enabled", havingValue = "true", matchIfMissing = true)
@RequiredArgsConstructor
@Slf4j
public class OverdueSweeper {

    private final InvoiceService invoiceService;
    private final PaymentPlanService paymentPlanService;

    @Scheduled(fixedDelayString = "${ledger.overdue-sweep.interval-ms:3600000}")
    public void sweep() {
        try {
            invoiceService.markOverdueInvoices();
            paymentPlanService.markOverduePlans();
        } catch (Exception e) {
            log.error("Overdue sweep failed", e);
        }
    }
}
