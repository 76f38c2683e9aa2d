package com.flagship.payment_settlement.reference;

import java.time.LocalDate;
import java.util.Locale;

/**
 * Pure formatting half of reference generation:
 * {@code {PREFIX}-{ORG3}-{period}-{sequence}}, e.g. {@code PAY-ACM-20261019-00042}.
 */
public final class ReferenceFormatter {

    static final int SEQUENCE_WIDTH = 5;
    private static final int ORG_PREFIX_LENGTH = 3;

    private ReferenceFormatter() {
    }

    public static String format(ReferenceKind kind, String organizationName, LocalDate date, long sequence) {
        if (sequence < 1) {
            throw new IllegalArgumentException("Sequence must start at 1, got " + sequence);
        }
        return String.join("-",
                kind.getPrefix(),
                organizationPrefix(organizationName),
                date.format(kind.getPeriodFormat()),
                padSequence(sequence));
    }

    /**
     * First three letters or digits of the organization name, upper-cased. Short names
     * are padded with X so every reference keeps the same shape.
     */
    public static String organizationPrefix(String organizationName) {
        String cleaned = organizationName == null
                ? ""
                : organizationName.replaceAll("[^A-Za-z0-9]", "").toUpperCase(Locale.ROOT);
        StringBuilder prefix = new StringBuilder(
                cleaned.substring(0, Math.min(ORG_PREFIX_LENGTH, cleaned.length())));
        while (prefix.length() < ORG_PREFIX_LENGTH) {
            prefix.append('X');
        }
        return prefix.toString();
    }

    // Numbers past 99999 simply grow wider.
    private static String padSequence(long sequence) {
        return String.format("%0" + SEQUENCE_WIDTH + "d", sequence);
    }
}
