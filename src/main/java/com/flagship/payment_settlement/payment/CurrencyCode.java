package com.flagship.payment_settlement.payment;

/**
 * ISO-4217 codes accepted on a payment. Stored only; no conversion happens anywhere.
 */
public enum CurrencyCode {
    KES, // Kenyan Shilling
    UGX, // Ugandan Shilling
    TZS, // Tanzanian Shilling
    USD,
    EUR,
    GBP
}
