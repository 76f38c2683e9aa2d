package com.flagship.payment_settlement.payment;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.payment_settlement.integration.ApiLog;
import com.flagship.payment_settlement.integration.ApiLogService;
import com.flagship.payment_settlement.integration.ApiLogStatus;
import com.flagship.payment_settlement.integration.ApiRequestType;
import com.flagship.payment_settlement.integration.IntegrationService;
import com.flagship.payment_settlement.organization.OrganizationService;
import com.flagship.payment_settlement.provider.MoneyMovementProvider;
import com.flagship.payment_settlement.provider.ProviderEnvironment;
import com.flagship.payment_settlement.provider.ProviderRejectedException;
import com.flagship.payment_settlement.provider.PushResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.testcontainers.containers.GenericContainer;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;
import org.testcontainers.utility.DockerImageName;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * HTTP surface of the payment lifecycle: initiation with idempotent replay,
 * dispatch failures, cancellation, reversal validation and statistics.
 */
@SpringBootTest
@AutoConfigureMockMvc
@Testcontainers
class PaymentControllerTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("payment_settlement_test")
            .withUsername("test")
            .withPassword("test");

    @Container
    static GenericContainer<?> redis = new GenericContainer<>(DockerImageName.parse("redis:7-alpine"))
            .withExposedPorts(6379);

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("spring.data.redis.host", redis::getHost);
        registry.add("spring.data.redis.port", () -> redis.getMappedPort(6379).toString());
        // No broker, no background workers
        registry.add("spring.kafka.bootstrap-servers", () -> "localhost:9999");
        registry.add("spring.kafka.admin.auto-create", () -> "false");
        registry.add("consumer.enabled", () -> "false");
        registry.add("outbox.publisher.enabled", () -> "false");
        registry.add("notifications.worker.enabled", () -> "false");
        registry.add("ledger.overdue-sweep.enabled", () -> "false");
        registry.add("settlement.sweeper.enabled", () -> "false");
    }

    @MockBean
    private MoneyMovementProvider provider;

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private OrganizationService organizationService;

    @Autowired
    private IntegrationService integrationService;

    @Autowired
    private PaymentPersistenceService persistenceService;

    @Autowired
    private ApiLogService apiLogService;

    private UUID organizationId;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @BeforeEach
    void setUp() {
        organizationId = organizationService.register("Beta Traders " + UUID.randomUUID().toString().substring(0, 6)).getId();
        integrationService.registerMpesa(organizationId, "Paybill", ProviderEnvironment.SANDBOX,
                "key", "secret", "600000", "passkey");

        when(provider.authenticate(any())).thenReturn("token");
        when(provider.authenticationEndpoint(any())).thenReturn("https://sandbox.example/oauth");
        when(provider.pushEndpoint(any())).thenReturn("https://sandbox.example/stkpush");
        when(provider.pushPayment(any(), any())).thenAnswer(invocation -> new PushResult(
                "ws_CO_" + UUID.randomUUID(), "mr-" + UUID.randomUUID(), "Success. Request accepted", "{}"));
    }

    private String paymentBody(String amount) throws Exception {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("amount", amount);
        body.put("phone_number", "0712345678");
        body.put("payer_name", "John Kamau");
        body.put("description", "School fees");
        return objectMapper.writeValueAsString(body);
    }

    private JsonNode createPayment(String idempotencyKey, String amount, int expectedStatus) throws Exception {
        var request = post("/api/payments")
                .header("X-Organization-ID", organizationId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(paymentBody(amount));
        if (idempotencyKey != null) {
            request.header("Idempotency-Key", idempotencyKey);
        }
        String json = mockMvc.perform(request)
                .andExpect(status().is(expectedStatus))
                .andReturn()
                .getResponse()
                .getContentAsString();
        return objectMapper.readTree(json);
    }

    @Test
    @DisplayName("POST /api/payments creates and dispatches the payment")
    void testInitiate_Returns201() throws Exception {
        printTestHeader("Initiate - Created and dispatched");

        JsonNode payment = createPayment(null, "1500.00", 201);
        printOutput("Response", payment);

        assertEquals("INITIATED", payment.get("status").asText());
        assertTrue(payment.get("payment_reference").asText().startsWith("PAY-BET-"));
        assertTrue(payment.get("checkout_request_id").asText().startsWith("ws_CO_"));
        assertEquals(0, payment.get("amount").decimalValue().compareTo(new BigDecimal("1500.00")));
        assertFalse(payment.get("is_reversed").asBoolean());

        printSuccess("Payment dispatched");
    }

    @Test
    @DisplayName("Dispatch writes an audit row for the token request and for the push")
    void testInitiate_AuditsAuthenticationAndPush() throws Exception {
        printTestHeader("Initiate - Provider calls audited");

        JsonNode payment = createPayment(null, "300.00", 201);
        List<ApiLog> logs = apiLogService.findByPayment(UUID.fromString(payment.get("id").asText()));
        logs.forEach(entry -> printOutput("Audit", entry.getRequestType() + " " + entry.getStatus()));

        ApiLog auth = logs.stream()
                .filter(entry -> entry.getRequestType() == ApiRequestType.MPESA_AUTH)
                .findFirst()
                .orElseThrow(() -> new AssertionError("No MPESA_AUTH audit row"));
        assertEquals(ApiLogStatus.SUCCESS, auth.getStatus());
        assertEquals("https://sandbox.example/oauth", auth.getEndpoint());
        assertNotNull(auth.getCorrelationId());
        assertNotNull(auth.getDurationMs());

        assertEquals(1, logs.stream()
                .filter(entry -> entry.getRequestType() == ApiRequestType.MPESA_STK_PUSH)
                .count());
        printSuccess("Both provider calls audited");
    }

    @Test
    @DisplayName("Amounts with cents are refused before anything is pushed")
    void testInitiate_FractionalShillingsRejected() throws Exception {
        printTestHeader("Initiate - Fractional amount");

        for (String amount : List.of("500.50", "0.40")) {
            mockMvc.perform(post("/api/payments")
                            .header("X-Organization-ID", organizationId)
                            .contentType(MediaType.APPLICATION_JSON)
                            .content(paymentBody(amount)))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.code").value("INVALID_AMOUNT"));
        }

        verify(provider, never()).pushPayment(any(), any());
        printSuccess("No push for fractional amounts");
    }

    @Test
    @DisplayName("Same Idempotency-Key returns the original payment with 200 and pushes once")
    void testInitiate_IdempotentReplay() throws Exception {
        printTestHeader("Initiate - Idempotent replay");

        String key = "order-" + UUID.randomUUID();
        JsonNode first = createPayment(key, "200.00", 201);
        JsonNode second = createPayment(key, "200.00", 200);
        printOutput("First", first.get("id"));
        printOutput("Second", second.get("id"));

        assertEquals(first.get("id").asText(), second.get("id").asText());
        assertEquals(first.get("payment_reference").asText(), second.get("payment_reference").asText());
        verify(provider, times(1)).pushPayment(any(), any());

        printSuccess("Replay returned the same payment");
    }

    @Test
    @DisplayName("Idempotency keys are scoped to the organization")
    void testInitiate_KeyScopedPerOrganization() throws Exception {
        String key = "shared-key-" + UUID.randomUUID();
        JsonNode first = createPayment(key, "50.00", 201);

        organizationId = organizationService.register("Gamma " + UUID.randomUUID().toString().substring(0, 6)).getId();
        integrationService.registerMpesa(organizationId, "Till", ProviderEnvironment.SANDBOX,
                "key", "secret", "600001", "passkey");
        JsonNode other = createPayment(key, "50.00", 201);

        assertNotEquals(first.get("id").asText(), other.get("id").asText());
    }

    @Test
    @DisplayName("Invalid amounts are rejected with 400")
    void testInitiate_InvalidAmount() throws Exception {
        mockMvc.perform(post("/api/payments")
                        .header("X-Organization-ID", organizationId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(paymentBody("0")))
                .andExpect(status().isBadRequest());

        mockMvc.perform(post("/api/payments")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(paymentBody("10.00")))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("MISSING_HEADER"));
    }

    @Test
    @DisplayName("Provider rejection fails the payment and answers 502")
    void testInitiate_ProviderRejects() throws Exception {
        printTestHeader("Initiate - Provider rejects");

        when(provider.pushPayment(any(), any()))
                .thenThrow(new ProviderRejectedException("Invalid BusinessShortCode", 400, "{\"errorCode\":\"400.002.02\"}"));

        String json = mockMvc.perform(post("/api/payments")
                        .header("X-Organization-ID", organizationId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(paymentBody("75.00")))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.details.retryable").value("false"))
                .andReturn()
                .getResponse()
                .getContentAsString();
        printOutput("Error", json);

        UUID paymentId = UUID.fromString(objectMapper.readTree(json).get("details").get("payment_id").asText());
        Payment failed = persistenceService.findById(paymentId).orElseThrow();
        assertEquals(PaymentStatus.FAILED, failed.getStatus());
        assertEquals("Invalid BusinessShortCode", failed.getFailureReason());
        printSuccess("Rejected push surfaced as 502");
    }

    @Test
    @DisplayName("Cancel an initiated payment, then cancelling again conflicts")
    void testCancel() throws Exception {
        JsonNode payment = createPayment(null, "80.00", 201);
        String id = payment.get("id").asText();

        mockMvc.perform(post("/api/payments/{id}/cancel", id).header("X-Organization-ID", organizationId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("CANCELLED"));

        mockMvc.perform(post("/api/payments/{id}/cancel", id).header("X-Organization-ID", organizationId))
                .andExpect(status().isConflict());
    }

    @Test
    @DisplayName("Reversal needs a completed payment and a reason")
    void testReverse_Validation() throws Exception {
        JsonNode payment = createPayment(null, "90.00", 201);
        String id = payment.get("id").asText();

        mockMvc.perform(post("/api/payments/{id}/reverse", id)
                        .header("X-Organization-ID", organizationId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reason\":\"\"}"))
                .andExpect(status().isBadRequest());

        mockMvc.perform(post("/api/payments/{id}/reverse", id)
                        .header("X-Organization-ID", organizationId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"reason\":\"Duplicate charge\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").exists());
    }

    @Test
    @DisplayName("Payments of another organization are not visible")
    void testGet_OtherOrganization() throws Exception {
        JsonNode payment = createPayment(null, "60.00", 201);
        UUID stranger = organizationService.register("Delta").getId();

        mockMvc.perform(get("/api/payments/{id}", payment.get("id").asText()).header("X-Organization-ID", stranger))
                .andExpect(status().is4xxClientError());

        mockMvc.perform(get("/api/payments/{id}", UUID.randomUUID()).header("X-Organization-ID", organizationId))
                .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("Statistics count every status, zero included")
    void testStatistics() throws Exception {
        createPayment(null, "100.00", 201);
        createPayment(null, "250.00", 201);

        mockMvc.perform(get("/api/payments/statistics").header("X-Organization-ID", organizationId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.total_count").value(2))
                .andExpect(jsonPath("$.count_by_status.INITIATED").value(2))
                .andExpect(jsonPath("$.count_by_status.COMPLETED").value(0))
                .andExpect(jsonPath("$.amount_by_status.INITIATED").value(350.00));
    }
}
