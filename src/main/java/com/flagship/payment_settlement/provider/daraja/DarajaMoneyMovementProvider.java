package com.flagship.payment_settlement.provider.daraja;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.payment_settlement.provider.InvalidCredentialsException;
import com.flagship.payment_settlement.provider.MoneyMovementProvider;
import com.flagship.payment_settlement.provider.ProviderCredentials;
import com.flagship.payment_settlement.provider.ProviderEnvironment;
import com.flagship.payment_settlement.provider.ProviderException;
import com.flagship.payment_settlement.provider.ProviderRejectedException;
import com.flagship.payment_settlement.provider.ProviderUnavailableException;
import com.flagship.payment_settlement.provider.PushRequest;
import com.flagship.payment_settlement.provider.PushResult;
import com.flagship.payment_settlement.provider.WebhookSignatureVerifier;
import io.netty.channel.ChannelOption;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.netty.http.client.HttpClient;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Safaricom Daraja client: OAuth client-credentials token plus Lipa na M-Pesa Online
 * (STK push).
 *
 * Calls block on a WebClient with an explicit response timeout, so a slow provider
 * cannot hold a request thread for longer than {@code mpesa.request-timeout-ms}.
 * Tokens are cached per consumer key until shortly before they expire.
 */
@Component
@Slf4j
public class DarajaMoneyMovementProvider implements MoneyMovementProvider {

    static final String OAUTH_PATH = "/oauth/v1/generate?grant_type=client_credentials";
    static final String STK_PUSH_PATH = "/mpesa/stkpush/v1/processrequest";
    static final String TRANSACTION_TYPE = "CustomerPayBillOnline";
    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMddHHmmss");
    private static final Duration TOKEN_EXPIRY_MARGIN = Duration.ofSeconds(60);

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final String sandboxUrl;
    private final String productionUrl;
    private final Duration requestTimeout;
    private final Map<String, CachedToken> tokens = new ConcurrentHashMap<>();

    public DarajaMoneyMovementProvider(ObjectMapper objectMapper,
                                       Clock clock,
                                       @Value("${mpesa.sandbox-url:https://sandbox.safaricom.co.ke}") String sandboxUrl,
                                       @Value("${mpesa.production-url:https://api.safaricom.co.ke}") String productionUrl,
                                       @Value("${mpesa.request-timeout-ms:30000}") long requestTimeoutMs) {
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.sandboxUrl = sandboxUrl;
        this.productionUrl = productionUrl;
        this.requestTimeout = Duration.ofMillis(requestTimeoutMs);

        HttpClient http = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, (int) Math.min(requestTimeoutMs, 10_000))
                .responseTimeout(requestTimeout);
        this.webClient = WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(http))
                .build();
    }

    @Override
    public String authenticate(ProviderCredentials credentials) {
        CachedToken cached = tokens.get(credentials.getConsumerKey());
        if (cached != null && cached.isValidAt(Instant.now())) {
            return cached.value();
        }

        String basic = Base64.getEncoder().encodeToString(
                (credentials.getConsumerKey() + ":" + credentials.getConsumerSecret())
                        .getBytes(StandardCharsets.UTF_8));
        String body;
        try {
            body = webClient.get()
                    .uri(authenticationEndpoint(credentials))
                    .header("Authorization", "Basic " + basic)
                    .accept(MediaType.APPLICATION_JSON)
                    .retrieve()
                    .bodyToMono(String.class)
                    .block(blockTimeout());
        } catch (WebClientResponseException e) {
            int status = e.getStatusCode().value();
            if (status == 400 || status == 401 || status == 403) {
                throw new InvalidCredentialsException(
                        "Provider refused consumer credentials (HTTP " + status + ")",
                        status, e.getResponseBodyAsString());
            }
            throw translate("authenticate", e);
        } catch (RuntimeException e) {
            throw translate("authenticate", e);
        }

        JsonNode json = readJson(body, "authenticate");
        String token = json.path("access_token").asText(null);
        if (token == null || token.isBlank()) {
            throw new InvalidCredentialsException("Provider returned no access token", 200, body);
        }
        long expiresIn = json.path("expires_in").asLong(3599);
        tokens.put(credentials.getConsumerKey(),
                new CachedToken(token, Instant.now().plusSeconds(expiresIn).minus(TOKEN_EXPIRY_MARGIN)));
        log.debug("Obtained provider token for short code {}", credentials.getBusinessShortCode());
        return token;
    }

    @Override
    public PushResult pushPayment(ProviderCredentials credentials, PushRequest request) {
        String token = authenticate(credentials);
        Map<String, Object> payload = stkPushPayload(credentials, request, LocalDateTime.now(clock));

        String body;
        try {
            body = webClient.post()
                    .uri(pushEndpoint(credentials))
                    .header("Authorization", "Bearer " + token)
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON)
                    .bodyValue(payload)
                    .retrieve()
                    .bodyToMono(String.class)
                    .block(blockTimeout());
        } catch (WebClientResponseException e) {
            int status = e.getStatusCode().value();
            if (status == 401 || status == 403) {
                tokens.remove(credentials.getConsumerKey());
                throw new InvalidCredentialsException(
                        "Provider refused access token (HTTP " + status + ")", status, e.getResponseBodyAsString());
            }
            throw translate("push", e);
        } catch (RuntimeException e) {
            throw translate("push", e);
        }

        JsonNode json = readJson(body, "push");
        String responseCode = json.path("ResponseCode").asText("");
        if (!"0".equals(responseCode)) {
            throw new ProviderRejectedException(
                    "Push request rejected: " + json.path("ResponseDescription").asText("code " + responseCode),
                    200, body);
        }
        String checkoutRequestId = json.path("CheckoutRequestID").asText(null);
        if (checkoutRequestId == null || checkoutRequestId.isBlank()) {
            throw new ProviderRejectedException("Push accepted without a CheckoutRequestID", 200, body);
        }
        log.info("Push accepted: checkoutRequestId={}, reference={}", checkoutRequestId, request.getAccountReference());
        return new PushResult(
                checkoutRequestId,
                json.path("MerchantRequestID").asText(null),
                json.path("CustomerMessage").asText(null),
                body);
    }

    @Override
    public boolean verifyWebhookSignature(String payload, String signature, String secret) {
        return WebhookSignatureVerifier.verify(payload, signature, secret);
    }

    @Override
    public String authenticationEndpoint(ProviderCredentials credentials) {
        return baseUrl(credentials) + OAUTH_PATH;
    }

    @Override
    public String pushEndpoint(ProviderCredentials credentials) {
        return baseUrl(credentials) + STK_PUSH_PATH;
    }

    Map<String, Object> stkPushPayload(ProviderCredentials credentials, PushRequest request, LocalDateTime now) {
        String timestamp = now.format(TIMESTAMP);
        String password = Base64.getEncoder().encodeToString(
                (credentials.getBusinessShortCode() + credentials.getPasskey() + timestamp)
                        .getBytes(StandardCharsets.UTF_8));
        String phone = normalizePhone(request.getPhoneNumber());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("BusinessShortCode", credentials.getBusinessShortCode());
        payload.put("Password", password);
        payload.put("Timestamp", timestamp);
        payload.put("TransactionType", TRANSACTION_TYPE);
        payload.put("Amount", wholeShillings(request.getAmount()));
        payload.put("PartyA", phone);
        payload.put("PartyB", credentials.getBusinessShortCode());
        payload.put("PhoneNumber", phone);
        payload.put("CallBackURL", credentials.getCallbackUrl());
        payload.put("AccountReference", request.getAccountReference());
        payload.put("TransactionDesc", request.getDescription() == null || request.getDescription().isBlank()
                ? request.getAccountReference()
                : request.getDescription());
        return payload;
    }

    /**
     * 07XXXXXXXX, +2547XXXXXXXX and 2547XXXXXXXX all become 2547XXXXXXXX.
     */
    static String normalizePhone(String phone) {
        if (phone == null) {
            throw new IllegalArgumentException("Phone number is required for a push payment");
        }
        String digits = phone.replaceAll("[^0-9]", "");
        if (digits.startsWith("0") && digits.length() == 10) {
            return "254" + digits.substring(1);
        }
        if ((digits.startsWith("7") || digits.startsWith("1")) && digits.length() == 9) {
            return "254" + digits;
        }
        return digits;
    }

    /**
     * STK push only takes whole units. Amounts are never rounded, so the payer cannot be
     * prompted for more or less than the recorded amount.
     *
     * @throws IllegalArgumentException if the amount has cents or is below 1
     */
    static long wholeShillings(BigDecimal amount) {
        long shillings;
        try {
            shillings = amount.setScale(0, RoundingMode.UNNECESSARY).longValueExact();
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("STK push amount must be whole shillings, got " + amount, e);
        }
        if (shillings < 1) {
            throw new IllegalArgumentException("STK push amount must be at least 1, got " + amount);
        }
        return shillings;
    }

    private String baseUrl(ProviderCredentials credentials) {
        return credentials.getEnvironment() == ProviderEnvironment.PRODUCTION ? productionUrl : sandboxUrl;
    }

    private Duration blockTimeout() {
        return requestTimeout.plusSeconds(5);
    }

    private JsonNode readJson(String body, String operation) {
        if (body == null || body.isBlank()) {
            throw new ProviderUnavailableException("Empty response from provider during " + operation, 200, body, null);
        }
        try {
            return objectMapper.readTree(body);
        } catch (Exception e) {
            throw new ProviderUnavailableException(
                    "Unreadable response from provider during " + operation, 200, body, e);
        }
    }

    private ProviderException translate(String operation, RuntimeException e) {
        if (e instanceof ProviderException providerException) {
            return providerException;
        }
        if (e instanceof WebClientResponseException responseException) {
            int status = responseException.getStatusCode().value();
            String body = responseException.getResponseBodyAsString();
            if (status >= 500 || status == 429) {
                return new ProviderUnavailableException(
                        "Provider unavailable during " + operation + " (HTTP " + status + ")", status, body, e);
            }
            return new ProviderRejectedException(
                    "Provider rejected " + operation + " (HTTP " + status + "): " + errorMessage(body), status, body);
        }
        log.warn("Provider call failed during {}: {}", operation, e.getMessage());
        return new ProviderUnavailableException("Provider unreachable during " + operation + ": " + e.getMessage(), e);
    }

    private String errorMessage(String body) {
        try {
            JsonNode json = objectMapper.readTree(body);
            return json.path("errorMessage").asText(body);
        } catch (Exception e) {
            return body;
        }
    }

    private record CachedToken(String value, Instant expiresAt) {
        boolean isValidAt(Instant now) {
            return now.isBefore(expiresAt);
        }
    }
}
