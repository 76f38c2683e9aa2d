package com.flagship.payment_settlement.reference;

import java.time.format.DateTimeFormatter;

/**
 * Entity kinds that receive an organization-scoped human-readable code. Each kind has
 * its own counter row per organization.
 */
public enum ReferenceKind {

    PAYMENT("PAY", "yyyyMMdd"),
    INVOICE("INV", "yyyyMM"),
    CUSTOMER("CUS", "yyyyMM");

    private final String prefix;
    private final DateTimeFormatter periodFormat;

    ReferenceKind(String prefix, String periodPattern) {
        this.prefix = prefix;
        this.periodFormat = DateTimeFormatter.ofPattern(periodPattern);
    }

    public String getPrefix() {
        return prefix;
    }

    public DateTimeFormatter getPeriodFormat() {
        return periodFormat;
    }
}
