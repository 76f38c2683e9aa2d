package com.flagship.payment_settlement.payment;

import com.flagship.payment_settlement.customer.Customer;
import com.flagship.payment_settlement.customer.CustomerService;
import com.flagship.payment_settlement.integration.Integration;
import com.flagship.payment_settlement.integration.IntegrationService;
import com.flagship.payment_settlement.observability.SettlementMetrics;
import com.flagship.payment_settlement.organization.OrganizationService;
import com.flagship.payment_settlement.outbox.OutboxEvent;
import com.flagship.payment_settlement.outbox.OutboxService;
import com.flagship.payment_settlement.payment.PaymentSettlementService.Outcome;
import com.flagship.payment_settlement.payment.event.PaymentFailedEvent;
import com.flagship.payment_settlement.provider.MoneyMovementProvider;
import com.flagship.payment_settlement.provider.ProviderEnvironment;
import com.flagship.payment_settlement.provider.PushResult;
import com.flagship.payment_settlement.provider.WebhookSignatureVerifier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.transaction.PlatformTransactionManager;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

/**
 * Expiry of payments the provider never answered. The sweeper runs on a clock one hour
 * ahead, so everything dispatched in the test is past both timeouts.
 */
@SpringBootTest
@Testcontainers
class PaymentTimeoutSweeperTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("payment_settlement_test")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
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
    private PaymentService paymentService;

    @Autowired
    private PaymentPersistenceService persistenceService;

    @Autowired
    private PaymentSettlementService settlementService;

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private SettlementMetrics metrics;

    @Autowired
    private PlatformTransactionManager transactionManager;

    @Autowired
    private OrganizationService organizationService;

    @Autowired
    private CustomerService customerService;

    @Autowired
    private IntegrationService integrationService;

    private PaymentTimeoutSweeper sweeper;
    private UUID organizationId;
    private Customer customer;
    private Integration integration;

    @BeforeEach
    void setUp() {
        organizationId = organizationService.register("Sweep " + UUID.randomUUID().toString().substring(0, 6)).getId();
        customer = customerService.register(organizationId, "Otieno", "Ouma", "254711000999", null);
        integration = integrationService.registerMpesa(organizationId, "Paybill", ProviderEnvironment.SANDBOX,
                "key", "secret", "600000", "passkey");

        when(provider.authenticate(any())).thenReturn("token");
        when(provider.authenticationEndpoint(any())).thenReturn("https://sandbox.example/oauth");
        when(provider.pushEndpoint(any())).thenReturn("https://sandbox.example/stkpush");
        when(provider.pushPayment(any(), any())).thenAnswer(invocation -> new PushResult(
                "ws_CO_" + UUID.randomUUID(), "mr-" + UUID.randomUUID(), "Success. Request accepted", "{}"));
        when(provider.verifyWebhookSignature(anyString(), any(), any())).thenAnswer(invocation ->
                WebhookSignatureVerifier.verify(invocation.getArgument(0), invocation.getArgument(1),
                        invocation.getArgument(2)));

        Clock anHourLater = Clock.offset(Clock.systemUTC(), Duration.ofHours(1));
        sweeper = new PaymentTimeoutSweeper(persistenceService, outboxService, metrics,
                transactionManager, anHourLater, 2, 10);
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private Payment pendingPayment() {
        return paymentService.initiate(organizationId, PaymentRequestDetails.builder()
                .customerId(customer.getId())
                .amount(new BigDecimal("750.00"))
                .payerPhone(customer.getPhoneNumber())
                .build(), null).payment();
    }

    @Test
    @DisplayName("A push with no callback is failed and a late callback is then ignored")
    void testSweep_FailsOverdueCallback() {
        printTestHeader("Sweep - Overdue Callback");

        Payment dispatched = paymentService.dispatch(pendingPayment().getId(), organizationId);
        assertEquals(PaymentStatus.INITIATED, dispatched.getStatus());

        sweeper.sweep();

        Payment expired = paymentService.get(dispatched.getId(), organizationId);
        System.out.println("Status: " + expired.getStatus() + ", reason: " + expired.getFailureReason());

        assertEquals(PaymentStatus.FAILED, expired.getStatus());
        assertEquals(PaymentTimeoutSweeper.TIMEOUT_REASON, expired.getFailureReason());
        assertTrue(outboxService.getEventsForAggregate(OutboxEvent.AGGREGATE_PAYMENT, dispatched.getId()).stream()
                .anyMatch(event -> PaymentFailedEvent.EVENT_TYPE.equals(event.getEventType())));

        String late = "{\"Body\":{\"stkCallback\":{\"MerchantRequestID\":\"mr-1\",\"CheckoutRequestID\":\""
                + dispatched.getCheckoutRequestId() + "\",\"ResultCode\":0,\"ResultDesc\":\"ok\"}}}";
        PaymentSettlementService.ReconciliationResult result = settlementService.reconcileCallback(
                integration.getId(), late, WebhookSignatureVerifier.sign(late, integration.getWebhookSecret()));

        assertEquals(Outcome.DUPLICATE, result.getOutcome());
        assertEquals(PaymentStatus.FAILED, paymentService.get(dispatched.getId(), organizationId).getStatus());

        printSuccess("Overdue push failed and late callback ignored");
    }

    @Test
    @DisplayName("A claim that never reached the provider is failed as an interrupted dispatch")
    void testSweep_FailsInterruptedDispatch() {
        printTestHeader("Sweep - Interrupted Dispatch");

        Payment pending = pendingPayment();
        assertTrue(persistenceService.claimForDispatch(pending.getId(), Instant.now()));

        sweeper.sweep();

        Payment expired = paymentService.get(pending.getId(), organizationId);
        System.out.println("Status: " + expired.getStatus() + ", reason: " + expired.getFailureReason());

        assertEquals(PaymentStatus.FAILED, expired.getStatus());
        assertEquals("timeout", expired.getFailureReason());

        printSuccess("Interrupted dispatch failed");
    }

    @Test
    @DisplayName("Payments not yet dispatched or already settled are left alone")
    void testSweep_IgnoresOtherPayments() {
        printTestHeader("Sweep - Ignores Other Payments");

        Payment pending = pendingPayment();
        Payment cancelled = paymentService.cancel(pendingPayment().getId(), organizationId);

        int expired = sweeper.expire(List.of(pending.getId(), cancelled.getId()),
                PaymentTimeoutSweeper.STAGE_CALLBACK, "test");
        sweeper.sweep();

        assertEquals(0, expired);
        assertEquals(PaymentStatus.PENDING, paymentService.get(pending.getId(), organizationId).getStatus());
        assertEquals(PaymentStatus.CANCELLED, paymentService.get(cancelled.getId(), organizationId).getStatus());

        printSuccess("Only awaiting payments are expired");
    }
}
