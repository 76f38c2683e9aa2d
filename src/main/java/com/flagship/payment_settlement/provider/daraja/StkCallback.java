package com.flagship.payment_settlement.provider.daraja;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * The parts of an STK push result callback the settlement engine acts on.
 */
@Value
@Builder
public class StkCallback {

    static final int RESULT_SUCCESS = 0;

    String checkoutRequestId;
    String merchantRequestId;
    int resultCode;
    String resultDescription;
    String receiptNumber;
    BigDecimal amount;
    String phoneNumber;

    public boolean isSuccessful() {
        return resultCode == RESULT_SUCCESS;
    }
}
