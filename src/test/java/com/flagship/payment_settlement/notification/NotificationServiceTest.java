package com.flagship.payment_settlement.notification;

import com.flagship.payment_settlement.customer.Customer;
import com.flagship.payment_settlement.customer.CustomerService;
import com.flagship.payment_settlement.exception.InvalidNotificationException;
import com.flagship.payment_settlement.exception.OrganizationMismatchException;
import com.flagship.payment_settlement.organization.OrganizationService;
import com.flagship.payment_settlement.outbox.OutboxEvent;
import com.flagship.payment_settlement.outbox.OutboxService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.LocalTime;
import java.util.List;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Queueing rules: channel validation, contact lookup, bulk isolation, resend and
 * read receipts.
 */
@SpringBootTest
@Testcontainers
class NotificationServiceTest {

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

    @Autowired
    private NotificationService notificationService;

    @Autowired
    private NotificationDispatcher dispatcher;

    @Autowired
    private OrganizationService organizationService;

    @Autowired
    private CustomerService customerService;

    @Autowired
    private OutboxService outboxService;

    private UUID organizationId;
    private Customer customer;

    @BeforeEach
    void setUp() {
        organizationId = organizationService.register("Mama Mboga " + UUID.randomUUID()).getId();
        customer = customerService.register(organizationId, "Akinyi", "Otieno", "254722111222", "akinyi@example.com");
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private NotificationRequest.NotificationRequestBuilder toCustomer(NotificationChannel channel) {
        return NotificationRequest.builder()
                .organizationId(organizationId)
                .recipientType(RecipientType.CUSTOMER)
                .recipientId(customer.getId())
                .notificationType("payment_reminder")
                .channel(channel)
                .message("Your payment of KES 1,200 is due on Friday");
    }

    @Test
    @DisplayName("Customer contact details are filled in from the customer record")
    void testEnqueue_ResolvesCustomerContact() {
        printTestHeader("Enqueue - Resolves Customer Contact");

        Notification sms = notificationService.enqueue(toCustomer(NotificationChannel.SMS).build());
        Notification email = notificationService.enqueue(toCustomer(NotificationChannel.EMAIL)
                .subject("Payment reminder")
                .build());

        System.out.println("SMS recipient: " + sms.getRecipientPhone());
        System.out.println("Email recipient: " + email.getRecipientEmail());

        assertEquals("254722111222", sms.getRecipientPhone());
        assertEquals("akinyi@example.com", email.getRecipientEmail());
        assertEquals(NotificationStatus.PENDING, sms.getStatus());
        assertEquals(NotificationPriority.NORMAL, sms.getPriority());
        assertEquals(0, sms.getDeliveryAttempts());

        List<OutboxEvent> events = outboxService.getEventsForAggregate(OutboxEvent.AGGREGATE_NOTIFICATION, sms.getId());
        assertEquals(1, events.size());
        assertEquals(NotificationEnqueuedEvent.EVENT_TYPE, events.get(0).getEventType());

        printSuccess("Contact resolved and enqueue event written");
    }

    @Test
    @DisplayName("Channel requirements are enforced before anything is stored")
    void testEnqueue_ValidatesChannelRequirements() {
        printTestHeader("Enqueue - Validation");

        InvalidNotificationException noSubject = assertThrows(InvalidNotificationException.class, () ->
                notificationService.enqueue(toCustomer(NotificationChannel.EMAIL).build()));
        System.out.println("Missing subject: " + noSubject.getMessage());

        assertThrows(InvalidNotificationException.class, () ->
                notificationService.enqueue(NotificationRequest.builder()
                        .organizationId(organizationId)
                        .recipientType(RecipientType.USER)
                        .notificationType("system_alert")
                        .channel(NotificationChannel.SMS)
                        .message("Settlement batch finished")
                        .build()));

        assertThrows(InvalidNotificationException.class, () ->
                notificationService.enqueue(toCustomer(NotificationChannel.SMS).message("  ").build()));

        assertThrows(InvalidNotificationException.class, () ->
                notificationService.enqueue(toCustomer(NotificationChannel.SMS).notificationType(null).build()));

        printSuccess("Invalid requests rejected");
    }

    @Test
    @DisplayName("One bad recipient in a bulk request does not stop the others")
    void testEnqueueBulk_IsolatesFailures() {
        printTestHeader("Bulk Enqueue - Isolates Failures");

        Customer second = customerService.register(organizationId, "Baraka", "Kiptoo", "254733222333", null);
        UUID unknown = UUID.randomUUID();

        NotificationService.BulkResult result = notificationService.enqueueBulk(
                NotificationService.BulkNotificationRequest.builder()
                        .organizationId(organizationId)
                        .recipientType(RecipientType.CUSTOMER)
                        .recipientIds(List.of(customer.getId(), unknown, second.getId()))
                        .notificationType("promotion")
                        .channel(NotificationChannel.SMS)
                        .message("Pay before month end and get 5% off")
                        .build());

        System.out.println("Requested: " + result.getRequested() + ", created: " + result.getCreated()
                + ", failed: " + result.getFailed());

        assertEquals(3, result.getRequested());
        assertEquals(2, result.getCreated());
        assertEquals(1, result.getFailed());
        assertTrue(result.getFailures().containsKey(unknown));

        assertThrows(InvalidNotificationException.class, () -> notificationService.enqueueBulk(
                NotificationService.BulkNotificationRequest.builder()
                        .organizationId(organizationId)
                        .recipientType(RecipientType.CUSTOMER)
                        .recipientIds(List.of())
                        .notificationType("promotion")
                        .channel(NotificationChannel.SMS)
                        .message("Nobody")
                        .build()));

        printSuccess("Bulk request queued the valid recipients");
    }

    @Test
    @DisplayName("A suppressed notification can be resent once the preference allows it")
    void testResend_AfterPreferenceChange() {
        printTestHeader("Resend - After Preference Change");

        notificationService.updatePreference(organizationId, RecipientType.CUSTOMER, customer.getId(),
                false, true, true, true, null, null);
        Notification sms = notificationService.enqueue(toCustomer(NotificationChannel.SMS).build());

        assertEquals(NotificationDispatcher.DeliveryOutcome.SUPPRESSED, dispatcher.process(sms.getId()));
        Notification suppressed = notificationService.getForOrganization(sms.getId(), organizationId);
        assertEquals(NotificationStatus.FAILED, suppressed.getStatus());
        assertNotNull(suppressed.getFailureReason());

        notificationService.updatePreference(organizationId, RecipientType.CUSTOMER, customer.getId(),
                true, true, true, true, LocalTime.of(22, 0), LocalTime.of(6, 0));
        Notification resent = notificationService.resend(sms.getId(), organizationId);

        System.out.println("Status after resend: " + resent.getStatus());

        assertEquals(NotificationStatus.PENDING, resent.getStatus());
        assertEquals(0, resent.getDeliveryAttempts());
        assertNull(resent.getFailureReason());
        assertEquals(2, outboxService.getEventsForAggregate(OutboxEvent.AGGREGATE_NOTIFICATION, sms.getId()).size());

        assertThrows(IllegalStateException.class, () -> notificationService.resend(sms.getId(), organizationId));

        printSuccess("Resend re-queued the notification");
    }

    @Test
    @DisplayName("Quiet hours need both ends")
    void testUpdatePreference_RejectsHalfQuietWindow() {
        printTestHeader("Preference - Half Quiet Window");

        assertThrows(IllegalArgumentException.class, () ->
                notificationService.updatePreference(organizationId, RecipientType.CUSTOMER, customer.getId(),
                        true, true, true, true, LocalTime.of(22, 0), null));

        printSuccess("Half-open quiet window rejected");
    }

    @Test
    @DisplayName("In-app notifications are delivered on send and can be marked read")
    void testMarkRead_AfterInAppDelivery() {
        printTestHeader("Mark Read - In-App");

        Notification inApp = notificationService.enqueue(toCustomer(NotificationChannel.IN_APP).build());
        assertThrows(IllegalStateException.class, () -> notificationService.markRead(inApp.getId(), organizationId));

        assertEquals(NotificationDispatcher.DeliveryOutcome.DELIVERED, dispatcher.process(inApp.getId()));
        Notification read = notificationService.markRead(inApp.getId(), organizationId);

        System.out.println("Status: " + read.getStatus() + ", readAt: " + read.getReadAt());

        assertEquals(NotificationStatus.READ, read.getStatus());
        assertNotNull(read.getDeliveredAt());
        assertNotNull(read.getReadAt());

        printSuccess("Delivered notification marked read");
    }

    @Test
    @DisplayName("Another organization cannot see or change a notification")
    void testOrganizationScoping() {
        printTestHeader("Organization Scoping");

        Notification sms = notificationService.enqueue(toCustomer(NotificationChannel.SMS).build());
        UUID otherOrganization = organizationService.register("Other " + UUID.randomUUID()).getId();

        assertThrows(OrganizationMismatchException.class,
                () -> notificationService.getForOrganization(sms.getId(), otherOrganization));
        assertThrows(IllegalArgumentException.class,
                () -> notificationService.findRelated(organizationId, null, null));
        assertThrows(IllegalArgumentException.class,
                () -> notificationService.findRelated(organizationId, UUID.randomUUID(), UUID.randomUUID()));

        printSuccess("Cross-organization access rejected");
    }
}
