package com.flagship.payment_settlement.provider;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class WebhookSignatureVerifierTest {

    private static final String SECRET = "whsec-test-secret";
    private static final String BODY = "{\"Body\":{\"stkCallback\":{\"CheckoutRequestID\":\"ws_CO_1\",\"ResultCode\":0}}}";

    @Test
    @DisplayName("Signature computed over the exact body verifies")
    void testVerify_ValidSignature() {
        String signature = WebhookSignatureVerifier.sign(BODY, SECRET);

        assertEquals(64, signature.length());
        assertTrue(WebhookSignatureVerifier.verify(BODY, signature, SECRET));
        assertTrue(WebhookSignatureVerifier.verify(BODY, signature.toUpperCase(), SECRET));
    }

    @Test
    @DisplayName("Any change to body, secret or signature fails verification")
    void testVerify_Tampered() {
        String signature = WebhookSignatureVerifier.sign(BODY, SECRET);

        assertFalse(WebhookSignatureVerifier.verify(BODY + " ", signature, SECRET));
        assertFalse(WebhookSignatureVerifier.verify(BODY, signature, "other-secret"));
        assertFalse(WebhookSignatureVerifier.verify(BODY, signature.substring(1) + "0", SECRET));
    }

    @Test
    @DisplayName("Missing signature or secret never verifies")
    void testVerify_Missing() {
        assertFalse(WebhookSignatureVerifier.verify(BODY, null, SECRET));
        assertFalse(WebhookSignatureVerifier.verify(BODY, "", SECRET));
        assertFalse(WebhookSignatureVerifier.verify(BODY, WebhookSignatureVerifier.sign(BODY, SECRET), null));
    }
}
