package com.flagship.payment_settlement.payment;

import com.flagship.payment_settlement.customer.Customer;
import com.flagship.payment_settlement.customer.CustomerService;
import com.flagship.payment_settlement.exception.InvalidSignatureException;
import com.flagship.payment_settlement.integration.ApiLog;
import com.flagship.payment_settlement.integration.ApiLogService;
import com.flagship.payment_settlement.integration.ApiLogStatus;
import com.flagship.payment_settlement.integration.ApiRequestType;
import com.flagship.payment_settlement.integration.Integration;
import com.flagship.payment_settlement.integration.IntegrationService;
import com.flagship.payment_settlement.ledger.Invoice;
import com.flagship.payment_settlement.ledger.InvoiceService;
import com.flagship.payment_settlement.ledger.InvoiceStatus;
import com.flagship.payment_settlement.ledger.NewInvoice;
import com.flagship.payment_settlement.ledger.PaymentPlan;
import com.flagship.payment_settlement.ledger.PaymentPlanService;
import com.flagship.payment_settlement.ledger.PaymentPlanStatus;
import com.flagship.payment_settlement.notification.NotificationService;
import com.flagship.payment_settlement.organization.OrganizationService;
import com.flagship.payment_settlement.outbox.OutboxEvent;
import com.flagship.payment_settlement.outbox.OutboxService;
import com.flagship.payment_settlement.payment.PaymentSettlementService.Outcome;
import com.flagship.payment_settlement.payment.PaymentSettlementService.ReconciliationResult;
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
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

/**
 * Callback reconciliation against a real database.
 *
 * The provider is mocked: every push is accepted with a fresh checkout id, and
 * signatures are checked with the real HMAC verifier.
 */
@SpringBootTest
@Testcontainers
class PaymentSettlementServiceTest {

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
    private PaymentSettlementService settlementService;

    @Autowired
    private PaymentService paymentService;

    @Autowired
    private PaymentPersistenceService persistenceService;

    @Autowired
    private OrganizationService organizationService;

    @Autowired
    private CustomerService customerService;

    @Autowired
    private IntegrationService integrationService;

    @Autowired
    private InvoiceService invoiceService;

    @Autowired
    private PaymentPlanService paymentPlanService;

    @Autowired
    private NotificationService notificationService;

    @Autowired
    private OutboxService outboxService;

    @Autowired
    private ApiLogService apiLogService;

    private UUID organizationId;
    private Customer customer;
    private Integration integration;

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printInput(String label, Object value) {
        System.out.println("INPUT  - " + label + ": " + value);
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    @BeforeEach
    void setUp() {
        organizationId = organizationService.register("Acme " + UUID.randomUUID().toString().substring(0, 6)).getId();
        customer = customerService.register(organizationId, "Jane", "Wanjiru",
                "254712345678", null);
        integration = integrationService.registerMpesa(organizationId, "Till", ProviderEnvironment.SANDBOX,
                "key", "secret", "174379", "passkey");

        when(provider.authenticate(any())).thenReturn("token");
        when(provider.authenticationEndpoint(any())).thenReturn("https://sandbox.example/oauth");
        when(provider.pushEndpoint(any())).thenReturn("https://sandbox.example/stkpush");
        when(provider.pushPayment(any(), any())).thenAnswer(invocation -> new PushResult(
                "ws_CO_" + UUID.randomUUID(), "mr-" + UUID.randomUUID(), "Success. Request accepted", "{}"));
        when(provider.verifyWebhookSignature(anyString(), any(), any())).thenAnswer(invocation ->
                WebhookSignatureVerifier.verify(invocation.getArgument(0), invocation.getArgument(1),
                        invocation.getArgument(2)));

        printInput("Organization", organizationId);
        printInput("Integration", integration.getId());
    }

    private Payment dispatchedPayment(BigDecimal amount, UUID invoiceId) {
        return dispatch(PaymentRequestDetails.builder()
                .invoiceId(invoiceId)
                .amount(amount)
                .paymentType(invoiceId == null ? PaymentType.OTHER : PaymentType.INVOICE));
    }

    private Payment dispatchedInstallment(BigDecimal amount, UUID paymentPlanId) {
        return dispatch(PaymentRequestDetails.builder()
                .paymentPlanId(paymentPlanId)
                .amount(amount)
                .paymentType(PaymentType.SUBSCRIPTION));
    }

    private Payment dispatch(PaymentRequestDetails.PaymentRequestDetailsBuilder request) {
        Payment pending = paymentService.initiate(organizationId, request
                .customerId(customer.getId())
                .payerPhone(customer.getPhoneNumber())
                .build(), null).payment();
        return paymentService.dispatch(pending.getId(), organizationId);
    }

    private static String successBody(String checkoutRequestId, String receipt, String amount) {
        return "{\"Body\":{\"stkCallback\":{\"MerchantRequestID\":\"mr-1\",\"CheckoutRequestID\":\""
                + checkoutRequestId + "\",\"ResultCode\":0,\"ResultDesc\":\"The service request is processed successfully.\","
                + "\"CallbackMetadata\":{\"Item\":[{\"Name\":\"Amount\",\"Value\":" + amount + "},"
                + "{\"Name\":\"MpesaReceiptNumber\",\"Value\":\"" + receipt + "\"},"
                + "{\"Name\":\"PhoneNumber\",\"Value\":254712345678}]}}}}";
    }

    private static String failureBody(String checkoutRequestId, int resultCode, String description) {
        return "{\"Body\":{\"stkCallback\":{\"MerchantRequestID\":\"mr-1\",\"CheckoutRequestID\":\""
                + checkoutRequestId + "\",\"ResultCode\":" + resultCode + ",\"ResultDesc\":\"" + description + "\"}}}";
    }

    private ReconciliationResult deliver(String body) {
        return settlementService.reconcileCallback(integration.getId(), body,
                WebhookSignatureVerifier.sign(body, integration.getWebhookSecret()));
    }

    private List<String> eventTypes(UUID paymentId) {
        return outboxService.getEventsForAggregate(OutboxEvent.AGGREGATE_PAYMENT, paymentId).stream()
                .map(OutboxEvent::getEventType)
                .toList();
    }

    @Test
    @DisplayName("Successful callback completes the payment and raises one receipt")
    void testReconcile_SuccessCompletesPayment() {
        printTestHeader("Reconcile - Success");

        Payment payment = dispatchedPayment(new BigDecimal("500.00"), null);
        assertEquals(PaymentStatus.INITIATED, payment.getStatus());
        assertNotNull(payment.getCheckoutRequestId());
        printInput("Checkout Request ID", payment.getCheckoutRequestId());

        ReconciliationResult result = deliver(successBody(payment.getCheckoutRequestId(), "NLJ7RT61SV", "500.00"));
        printOutput("Outcome", result.getOutcome());

        assertEquals(Outcome.COMPLETED, result.getOutcome());
        Payment completed = persistenceService.findById(payment.getId()).orElseThrow();
        assertEquals(PaymentStatus.COMPLETED, completed.getStatus());
        assertEquals("NLJ7RT61SV", completed.getExternalReference());
        assertNotNull(completed.getCompletedAt());
        assertEquals(1, notificationService.countForPayment(payment.getId()));
        assertTrue(eventTypes(payment.getId()).contains("PaymentCompleted"));

        List<ApiLog> webhookLogs = apiLogService.findByCorrelationId(payment.getCheckoutRequestId()).stream()
                .filter(entry -> entry.getRequestType() == ApiRequestType.WEBHOOK)
                .toList();
        assertEquals(1, webhookLogs.size());
        assertEquals(ApiLogStatus.SUCCESS, webhookLogs.get(0).getStatus());
        assertEquals(payment.getId(), webhookLogs.get(0).getPaymentId());

        printSuccess("Payment completed with receipt and audit row");
    }

    @Test
    @DisplayName("Redelivered callback changes nothing and raises no second receipt")
    void testReconcile_DuplicateIsNoOp() {
        printTestHeader("Reconcile - Duplicate");

        Payment payment = dispatchedPayment(new BigDecimal("250.00"), null);
        String body = successBody(payment.getCheckoutRequestId(), "QWE123RTY", "250.00");

        assertEquals(Outcome.COMPLETED, deliver(body).getOutcome());
        Payment afterFirst = persistenceService.findById(payment.getId()).orElseThrow();

        ReconciliationResult second = deliver(body);
        printOutput("Second Outcome", second.getOutcome());

        assertEquals(Outcome.DUPLICATE, second.getOutcome());
        assertEquals(payment.getId(), second.getPaymentId());
        Payment afterSecond = persistenceService.findById(payment.getId()).orElseThrow();
        assertEquals(afterFirst.getCompletedAt(), afterSecond.getCompletedAt());
        assertEquals(1, notificationService.countForPayment(payment.getId()));
        assertEquals(1, eventTypes(payment.getId()).stream().filter("PaymentCompleted"::equals).count());

        printSuccess("Duplicate callback acknowledged without effects");
    }

    @Test
    @DisplayName("Invoice reaches PARTIALLY_PAID then PAID through two callbacks")
    void testReconcile_InvoiceSettlement() {
        printTestHeader("Reconcile - Invoice Settlement");

        Invoice invoice = invoiceService.create(organizationId, NewInvoice.builder()
                .customerId(customer.getId())
                .issueDate(LocalDate.now())
                .dueDate(LocalDate.now().plusDays(30))
                .subtotal(new BigDecimal("1000.00"))
                .build());
        printInput("Invoice", invoice.getInvoiceNumber());

        Payment first = dispatchedPayment(new BigDecimal("400.00"), invoice.getId());
        deliver(successBody(first.getCheckoutRequestId(), "AAA111", "400.00"));
        Invoice partial = invoiceService.getForOrganization(invoice.getId(), organizationId);
        printOutput("After first payment", partial.getStatus() + " balance " + partial.getBalanceDue());
        assertEquals(InvoiceStatus.PARTIALLY_PAID, partial.getStatus());
        assertEquals(0, new BigDecimal("600.00").compareTo(partial.getBalanceDue()));

        Payment second = dispatchedPayment(new BigDecimal("600.00"), invoice.getId());
        deliver(successBody(second.getCheckoutRequestId(), "BBB222", "600.00"));
        Invoice paid = invoiceService.getForOrganization(invoice.getId(), organizationId);
        printOutput("After second payment", paid.getStatus() + " balance " + paid.getBalanceDue());
        assertEquals(InvoiceStatus.PAID, paid.getStatus());
        assertEquals(0, BigDecimal.ZERO.compareTo(paid.getBalanceDue()));
        assertNotNull(paid.getPaidDate());

        printSuccess("Invoice settled in two installments");
    }

    @Test
    @DisplayName("Non-zero result code fails the payment with the provider's description")
    void testReconcile_ResultCodeFails() {
        printTestHeader("Reconcile - Cancelled by payer");

        Payment payment = dispatchedPayment(new BigDecimal("100.00"), null);
        ReconciliationResult result = deliver(failureBody(payment.getCheckoutRequestId(), 1032, "Request cancelled by user"));

        assertEquals(Outcome.FAILED, result.getOutcome());
        Payment failed = persistenceService.findById(payment.getId()).orElseThrow();
        assertEquals(PaymentStatus.FAILED, failed.getStatus());
        assertEquals("Request cancelled by user", failed.getFailureReason());
        assertEquals(0, notificationService.countForPayment(payment.getId()));
        assertTrue(eventTypes(payment.getId()).contains("PaymentFailed"));

        printSuccess("Payment failed, no receipt");
    }

    @Test
    @DisplayName("Bad signature is rejected and leaves the payment untouched")
    void testReconcile_InvalidSignature() {
        printTestHeader("Reconcile - Invalid signature");

        Payment payment = dispatchedPayment(new BigDecimal("100.00"), null);
        String body = successBody(payment.getCheckoutRequestId(), "FAKE999", "100.00");

        assertThrows(InvalidSignatureException.class,
                () -> settlementService.reconcileCallback(integration.getId(), body, "deadbeef"));
        assertThrows(InvalidSignatureException.class,
                () -> settlementService.reconcileCallback(integration.getId(), body, null));

        Payment unchanged = persistenceService.findById(payment.getId()).orElseThrow();
        assertEquals(PaymentStatus.INITIATED, unchanged.getStatus());
        assertEquals(0, notificationService.countForPayment(payment.getId()));

        printSuccess("Forged callback rejected");
    }

    @Test
    @DisplayName("Callback for a cancelled payment is acknowledged without reviving it")
    void testReconcile_CancelledPaymentIgnored() {
        printTestHeader("Reconcile - Cancelled payment");

        Payment payment = dispatchedPayment(new BigDecimal("100.00"), null);
        paymentService.cancel(payment.getId(), organizationId);

        ReconciliationResult result = deliver(successBody(payment.getCheckoutRequestId(), "LATE001", "100.00"));

        assertEquals(Outcome.DUPLICATE, result.getOutcome());
        assertEquals(PaymentStatus.CANCELLED,
                persistenceService.findById(payment.getId()).orElseThrow().getStatus());

        printSuccess("Cancelled payment stayed cancelled");
    }

    @Test
    @DisplayName("Unknown checkout id is an orphan and is audited as failed")
    void testReconcile_Orphan() {
        printTestHeader("Reconcile - Orphan");

        String checkoutRequestId = "ws_CO_unknown_" + UUID.randomUUID();
        ReconciliationResult result = deliver(successBody(checkoutRequestId, "ORPHAN1", "10.00"));

        assertEquals(Outcome.ORPHAN, result.getOutcome());
        assertNull(result.getPaymentId());
        List<ApiLog> logs = apiLogService.findByCorrelationId(checkoutRequestId);
        assertEquals(1, logs.size());
        assertEquals(ApiLogStatus.FAILED, logs.get(0).getStatus());

        printSuccess("Orphan callback logged");
    }

    @Test
    @DisplayName("Signed but unparseable body is acknowledged as malformed")
    void testReconcile_Malformed() {
        assertEquals(Outcome.MALFORMED, deliver("{\"unexpected\":true}").getOutcome());
    }

    @Test
    @DisplayName("Two simultaneous deliveries of one callback settle the payment once")
    void testReconcile_ConcurrentDeliveriesApplyOnce() throws Exception {
        printTestHeader("Reconcile - Concurrent deliveries");

        Invoice invoice = invoiceService.create(organizationId, NewInvoice.builder()
                .customerId(customer.getId())
                .issueDate(LocalDate.now())
                .dueDate(LocalDate.now().plusDays(30))
                .subtotal(new BigDecimal("1000.00"))
                .build());
        Payment payment = dispatchedPayment(new BigDecimal("400.00"), invoice.getId());
        String body = successBody(payment.getCheckoutRequestId(), "RACE001", "400.00");

        ExecutorService executor = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<ReconciliationResult>> futures = new ArrayList<>();
        try {
            for (int i = 0; i < 2; i++) {
                Callable<ReconciliationResult> task = () -> {
                    start.await();
                    return deliver(body);
                };
                futures.add(executor.submit(task));
            }
            start.countDown();

            List<Outcome> outcomes = new ArrayList<>();
            for (Future<ReconciliationResult> future : futures) {
                outcomes.add(future.get(60, TimeUnit.SECONDS).getOutcome());
            }
            printOutput("Outcomes", outcomes);

            assertEquals(EnumSet.of(Outcome.COMPLETED, Outcome.DUPLICATE), EnumSet.copyOf(outcomes));
        } finally {
            executor.shutdownNow();
        }

        Invoice afterRace = invoiceService.getForOrganization(invoice.getId(), organizationId);
        assertEquals(0, new BigDecimal("400.00").compareTo(afterRace.getAmountPaid()));
        assertEquals(0, new BigDecimal("600.00").compareTo(afterRace.getBalanceDue()));
        assertEquals(1, notificationService.countForPayment(payment.getId()));
        assertEquals(1, eventTypes(payment.getId()).stream().filter("PaymentCompleted"::equals).count());

        printSuccess("One settlement, one receipt");
    }

    @Test
    @DisplayName("Callback for an installment payment updates the plan in the same settlement")
    void testReconcile_PaymentPlanInstallment() {
        printTestHeader("Reconcile - Payment plan installment");

        PaymentPlan plan = paymentPlanService.create(organizationId, customer.getId(), "School fees", null,
                new BigDecimal("900.00"), 3, LocalDate.now(), LocalDate.now().plusMonths(3));
        printInput("Plan", plan.getId() + " installment " + plan.getInstallmentAmount());

        Payment first = dispatchedInstallment(new BigDecimal("300.00"), plan.getId());
        assertEquals(Outcome.COMPLETED, deliver(successBody(first.getCheckoutRequestId(), "PLN001", "300.00")).getOutcome());

        PaymentPlan afterFirst = paymentPlanService.getForOrganization(plan.getId(), organizationId);
        printOutput("After first installment", afterFirst.getStatus() + " balance " + afterFirst.getBalance());
        assertEquals(0, new BigDecimal("300.00").compareTo(afterFirst.getAmountPaid()));
        assertEquals(0, new BigDecimal("600.00").compareTo(afterFirst.getBalance()));
        assertEquals(1, afterFirst.getInstallmentsPaid());
        assertEquals(PaymentPlanStatus.ACTIVE, afterFirst.getStatus());

        Payment declined = dispatchedInstallment(new BigDecimal("300.00"), plan.getId());
        assertEquals(Outcome.FAILED,
                deliver(failureBody(declined.getCheckoutRequestId(), 2001, "Wrong PIN")).getOutcome());
        PaymentPlan afterDecline = paymentPlanService.getForOrganization(plan.getId(), organizationId);
        assertEquals(1, afterDecline.getInstallmentsPaid());
        assertEquals(0, new BigDecimal("600.00").compareTo(afterDecline.getBalance()));

        printSuccess("Plan credited once, declined push left it alone");
    }

    @Test
    @DisplayName("Callback on another organization's integration is refused and audited as failed")
    void testReconcile_OrganizationMismatch() {
        printTestHeader("Reconcile - Organization mismatch");

        Payment payment = dispatchedPayment(new BigDecimal("100.00"), null);
        UUID otherOrganizationId = organizationService
                .register("Other " + UUID.randomUUID().toString().substring(0, 6)).getId();
        Integration otherIntegration = integrationService.registerMpesa(otherOrganizationId, "Till",
                ProviderEnvironment.SANDBOX, "key2", "secret2", "174380", "passkey2");

        String body = successBody(payment.getCheckoutRequestId(), "XTEN001", "100.00");
        ReconciliationResult result = settlementService.reconcileCallback(otherIntegration.getId(), body,
                WebhookSignatureVerifier.sign(body, otherIntegration.getWebhookSecret()));
        printOutput("Outcome", result.getOutcome());

        assertEquals(Outcome.ORGANIZATION_MISMATCH, result.getOutcome());
        assertEquals(PaymentStatus.INITIATED,
                persistenceService.findById(payment.getId()).orElseThrow().getStatus());
        assertEquals(0, notificationService.countForPayment(payment.getId()));

        List<ApiLog> webhookLogs = apiLogService.findByCorrelationId(payment.getCheckoutRequestId()).stream()
                .filter(entry -> entry.getRequestType() == ApiRequestType.WEBHOOK)
                .toList();
        assertEquals(1, webhookLogs.size());
        assertEquals(ApiLogStatus.FAILED, webhookLogs.get(0).getStatus());
        assertEquals(otherOrganizationId, webhookLogs.get(0).getOrganizationId());

        printSuccess("Cross-tenant callback rejected");
    }
}
