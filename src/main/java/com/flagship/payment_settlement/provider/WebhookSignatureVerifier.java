package com.flagship.payment_settlement.provider;

import lombok.extern.slf4j.Slf4j;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.util.HexFormat;

/**
 * HMAC-SHA256 over the raw callback body, hex encoded, keyed by the integration's
 * webhook secret. Comparison is constant-time.
 */
@Slf4j
public final class WebhookSignatureVerifier {

    private static final String ALGORITHM = "HmacSHA256";

    private WebhookSignatureVerifier() {
    }

    public static boolean verify(String payload, String signature, String secret) {
        if (payload == null || signature == null || signature.isBlank() || secret == null || secret.isBlank()) {
            return false;
        }
        try {
            byte[] expected = sign(payload, secret).getBytes(StandardCharsets.US_ASCII);
            byte[] given = signature.trim().toLowerCase().getBytes(StandardCharsets.US_ASCII);
            return MessageDigest.isEqual(expected, given);
        } catch (Exception e) {
            log.warn("Webhook signature verification failed", e);
            return false;
        }
    }

    public static String sign(String payload, String secret) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM));
            return HexFormat.of().formatHex(mac.doFinal(payload.getBytes(StandardCharsets.UTF_8)));
        } catch (Exception e) {
            throw new IllegalStateException("Cannot compute " + ALGORITHM, e);
        }
    }
}
