package com.flagship.payment_settlement.provider;

import lombok.Value;

/**
 * Accepted push request. The checkout request id is what the provider echoes in its
 * callback; the raw response is kept for the audit log.
 */
@Value
public class PushResult {
    String checkoutRequestId;
    String merchantRequestId;
    String customerMessage;
    String rawResponse;
}
