package com.flagship.payment_settlement.exception;

/**
 * More than one customer of the organization matches the payer's phone or e-mail.
 * The caller has to name the customer explicitly.
 */
public class AmbiguousCustomerException extends SettlementException {

    private final int matches;

    public AmbiguousCustomerException(String phone, String email, int matches) {
        super("AMBIGUOUS_CUSTOMER",
                String.format("%d customers match phone=%s email=%s; pass customer_id explicitly",
                        matches, phone, email));
        this.matches = matches;
    }

    public int getMatches() {
        return matches;
    }
}
