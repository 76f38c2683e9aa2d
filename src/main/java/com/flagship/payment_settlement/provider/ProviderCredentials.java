package com.flagship.payment_settlement.provider;

import lombok.Builder;
import lombok.Value;

/**
 * Per-organization credentials taken from its Integration record. Passed on every call
 * so a single adapter instance serves every tenant.
 */
@Value
@Builder
public class ProviderCredentials {
    ProviderEnvironment environment;
    String consumerKey;
    String consumerSecret;
    String businessShortCode;
    String passkey;
    String callbackUrl;

    @Override
    public String toString() {
        return "ProviderCredentials(environment=" + environment + ", shortCode=" + businessShortCode + ")";
    }
}
