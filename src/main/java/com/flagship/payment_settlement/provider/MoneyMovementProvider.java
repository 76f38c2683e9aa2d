package com.flagship.payment_settlement.provider;

/**
 * Mobile-money push capability.
 *
 * Implementations translate every failure into {@link ProviderUnavailableException},
 * {@link ProviderRejectedException} or {@link InvalidCredentialsException}; nothing else
 * may escape.
 */
public interface MoneyMovementProvider {

    /**
     * @return a short-lived access token for the given credentials
     */
    String authenticate(ProviderCredentials credentials);

    /**
     * Sends a payment prompt to the payer's phone. Not idempotent on the provider side:
     * calling it twice prompts the payer twice.
     */
    PushResult pushPayment(ProviderCredentials credentials, PushRequest request);

    boolean verifyWebhookSignature(String payload, String signature, String secret);

    /**
     * URL of the token endpoint for the credentials' environment, for the audit log.
     */
    String authenticationEndpoint(ProviderCredentials credentials);

    String pushEndpoint(ProviderCredentials credentials);
}
