package com.flagship.payment_settlement.reference;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class ReferenceFormatterTest {

    private static final LocalDate DATE = LocalDate.of(2026, 10, 19);

    @Test
    @DisplayName("Formats each kind with its prefix and period")
    void testFormat_PerKind() {
        assertEquals("PAY-ACM-20261019-00042", ReferenceFormatter.format(ReferenceKind.PAYMENT, "Acme Ltd", DATE, 42));
        assertEquals("INV-ACM-202610-00001", ReferenceFormatter.format(ReferenceKind.INVOICE, "Acme Ltd", DATE, 1));
        assertEquals("CUS-ACM-202610-00007", ReferenceFormatter.format(ReferenceKind.CUSTOMER, "Acme Ltd", DATE, 7));
    }

    @Test
    @DisplayName("Organization prefix strips symbols, upper-cases and pads with X")
    void testOrganizationPrefix() {
        assertEquals("ACM", ReferenceFormatter.organizationPrefix("acme"));
        assertEquals("K1S", ReferenceFormatter.organizationPrefix("k-1 Shop"));
        assertEquals("ABX", ReferenceFormatter.organizationPrefix("A.B"));
        assertEquals("XXX", ReferenceFormatter.organizationPrefix(""));
        assertEquals("XXX", ReferenceFormatter.organizationPrefix(null));
    }

    @Test
    @DisplayName("Sequence wider than five digits is not truncated")
    void testFormat_WideSequence() {
        assertEquals("PAY-ACM-20261019-123456",
                ReferenceFormatter.format(ReferenceKind.PAYMENT, "Acme", DATE, 123456));
    }

    @Test
    @DisplayName("Sequence must start at 1")
    void testFormat_RejectsZero() {
        assertThrows(IllegalArgumentException.class,
                () -> ReferenceFormatter.format(ReferenceKind.PAYMENT, "Acme", DATE, 0));
    }
}
