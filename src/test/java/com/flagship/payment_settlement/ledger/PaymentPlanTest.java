package com.flagship.payment_settlement.ledger;

import com.flagship.payment_settlement.exception.InvalidAmountException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class PaymentPlanTest {

    private static final LocalDate START = LocalDate.of(2026, 10, 1);

    private static PaymentPlan plan(String total, int installments) {
        return PaymentPlan.create(UUID.randomUUID(), UUID.randomUUID(), "School fees", null,
                new BigDecimal(total), installments, START, START.plusMonths(installments));
    }

    @Test
    @DisplayName("Installment amount is total / n rounded HALF_UP to cents")
    void testCreate_InstallmentAmount() {
        assertEquals(new BigDecimal("333.33"), plan("1000", 3).getInstallmentAmount());
        assertEquals(new BigDecimal("166.67"), plan("1000", 6).getInstallmentAmount());
        assertEquals(PaymentPlanStatus.ACTIVE, plan("1000", 3).getStatus());
    }

    @Test
    @DisplayName("Installments reduce the balance and complete the plan")
    void testRecordInstallment_Completes() {
        PaymentPlan plan = plan("900", 3);
        plan.recordInstallment(new BigDecimal("300"));
        plan.recordInstallment(new BigDecimal("300"));
        assertEquals(new BigDecimal("300.00"), plan.getBalance());
        assertEquals(2, plan.getInstallmentsPaid());
        assertEquals(new BigDecimal("66.67"), plan.progressPercentage());

        plan.recordInstallment(new BigDecimal("300"));
        assertEquals(PaymentPlanStatus.COMPLETED, plan.getStatus());
        assertTrue(plan.isSettled());
        assertThrows(IllegalStateException.class, () -> plan.recordInstallment(BigDecimal.ONE));
    }

    @Test
    @DisplayName("Paying an overdue plan brings it back to ACTIVE")
    void testOverdue_ThenPaid() {
        PaymentPlan plan = plan("900", 3);
        plan.markOverdue();
        assertEquals(PaymentPlanStatus.OVERDUE, plan.getStatus());

        plan.recordInstallment(new BigDecimal("300"));
        assertEquals(PaymentPlanStatus.ACTIVE, plan.getStatus());
    }

    @Test
    @DisplayName("Cancelled plan takes no installments and cannot go overdue")
    void testCancel() {
        PaymentPlan plan = plan("900", 3);
        plan.cancel();
        assertEquals(PaymentPlanStatus.CANCELLED, plan.getStatus());
        assertThrows(IllegalStateException.class, () -> plan.recordInstallment(BigDecimal.ONE));
        assertThrows(IllegalStateException.class, plan::markOverdue);
        assertThrows(IllegalStateException.class, plan::cancel);
    }

    @Test
    @DisplayName("Zero installments or end before start are rejected")
    void testCreate_Invalid() {
        assertThrows(IllegalArgumentException.class, () -> plan("900", 0));
        assertThrows(IllegalArgumentException.class, () -> PaymentPlan.create(UUID.randomUUID(), UUID.randomUUID(),
                "x", null, BigDecimal.TEN, 1, START, START.minusDays(1)));
    }

    @Test
    @DisplayName("Totals and installments that round to zero cents are rejected")
    void testSubCentAmounts() {
        assertThrows(InvalidAmountException.class, () -> plan("0.004", 1));

        PaymentPlan plan = plan("300", 3);
        assertThrows(InvalidAmountException.class, () -> plan.recordInstallment(new BigDecimal("0.004")));
        assertEquals(new BigDecimal("0.00"), plan.getAmountPaid());
        assertEquals(0, plan.getInstallmentsPaid());
        assertEquals(new BigDecimal("300.00"), plan.getBalance());
    }
}
