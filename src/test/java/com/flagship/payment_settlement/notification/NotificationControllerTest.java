package com.flagship.payment_settlement.notification;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flagship.payment_settlement.customer.Customer;
import com.flagship.payment_settlement.customer.CustomerService;
import com.flagship.payment_settlement.organization.OrganizationService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;

/**
 * HTTP surface of the notification queue and recipient preferences.
 */
@SpringBootTest
@AutoConfigureMockMvc
@Testcontainers
class NotificationControllerTest {

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

    private static final String ORGANIZATION_HEADER = "X-Organization-ID";

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private OrganizationService organizationService;

    @Autowired
    private CustomerService customerService;

    private UUID organizationId;
    private Customer customer;

    @BeforeEach
    void setUp() {
        organizationId = organizationService.register("Duka " + UUID.randomUUID()).getId();
        customer = customerService.register(organizationId, "Wairimu", "Njoroge", "254700123456", null);
    }

    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private JsonNode body(MvcResult result) throws Exception {
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }

    private String smsRequest() {
        return """
            {
              "recipient_type": "CUSTOMER",
              "recipient_id": "%s",
              "notification_type": "payment_reminder",
              "channel": "SMS",
              "message": "Your installment of KES 300 is due tomorrow",
              "priority": "HIGH"
            }
            """.formatted(customer.getId());
    }

    @Test
    @DisplayName("POST /api/notifications queues the notification and returns 202")
    void testSend_Returns202() throws Exception {
        printTestHeader("Send Notification - 202");

        MvcResult result = mockMvc.perform(post("/api/notifications")
                        .header(ORGANIZATION_HEADER, organizationId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(smsRequest()))
                .andReturn();

        System.out.println("Response: " + result.getResponse().getContentAsString());

        assertEquals(202, result.getResponse().getStatus());
        JsonNode json = body(result);
        assertEquals("PENDING", json.get("status").asText());
        assertEquals("HIGH", json.get("priority").asText());
        assertEquals(0, json.get("delivery_attempts").asInt());

        MvcResult fetched = mockMvc.perform(get("/api/notifications/" + json.get("id").asText())
                        .header(ORGANIZATION_HEADER, organizationId))
                .andReturn();
        assertEquals(200, fetched.getResponse().getStatus());

        MvcResult foreign = mockMvc.perform(get("/api/notifications/" + json.get("id").asText())
                        .header(ORGANIZATION_HEADER, UUID.randomUUID()))
                .andReturn();
        assertEquals(403, foreign.getResponse().getStatus());

        printSuccess("Notification queued and readable by its organization only");
    }

    @Test
    @DisplayName("Email without a subject is rejected with INVALID_NOTIFICATION")
    void testSend_EmailWithoutSubject() throws Exception {
        printTestHeader("Send Notification - Email Without Subject");

        String request = """
            {
              "recipient_type": "USER",
              "recipient_email": "ops@example.com",
              "notification_type": "system_alert",
              "channel": "EMAIL",
              "message": "Daily settlement report is ready"
            }
            """;

        MvcResult result = mockMvc.perform(post("/api/notifications")
                        .header(ORGANIZATION_HEADER, organizationId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(request))
                .andReturn();

        assertEquals(400, result.getResponse().getStatus());
        assertEquals("INVALID_NOTIFICATION", body(result).get("code").asText());

        printSuccess("Invalid email rejected");
    }

    @Test
    @DisplayName("Bulk send reports created and failed recipients")
    void testSendBulk_ReportsFailures() throws Exception {
        printTestHeader("Bulk Send");

        UUID unknown = UUID.randomUUID();
        String request = """
            {
              "recipient_type": "CUSTOMER",
              "recipient_ids": ["%s", "%s"],
              "notification_type": "promotion",
              "channel": "SMS",
              "message": "Clear your balance this week"
            }
            """.formatted(customer.getId(), unknown);

        MvcResult result = mockMvc.perform(post("/api/notifications/bulk")
                        .header(ORGANIZATION_HEADER, organizationId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(request))
                .andReturn();

        System.out.println("Response: " + result.getResponse().getContentAsString());

        assertEquals(202, result.getResponse().getStatus());
        JsonNode json = body(result);
        assertEquals(2, json.get("requested").asInt());
        assertEquals(1, json.get("created").asInt());
        assertEquals(1, json.get("failed").asInt());
        assertTrue(json.get("failures").has(unknown.toString()));

        printSuccess("Bulk result reported per recipient");
    }

    @Test
    @DisplayName("Listing requires exactly one of payment_id and invoice_id")
    void testList_RequiresOneFilter() throws Exception {
        printTestHeader("List Notifications - Filter Required");

        MvcResult none = mockMvc.perform(get("/api/notifications")
                        .header(ORGANIZATION_HEADER, organizationId))
                .andReturn();
        assertEquals(400, none.getResponse().getStatus());

        MvcResult empty = mockMvc.perform(get("/api/notifications")
                        .header(ORGANIZATION_HEADER, organizationId)
                        .param("payment_id", UUID.randomUUID().toString()))
                .andReturn();
        assertEquals(200, empty.getResponse().getStatus());
        assertEquals(0, body(empty).size());

        printSuccess("Filter validation enforced");
    }

    @Test
    @DisplayName("Resending a notification that has not failed is a conflict")
    void testResend_PendingIsConflict() throws Exception {
        printTestHeader("Resend - Conflict");

        MvcResult created = mockMvc.perform(post("/api/notifications")
                        .header(ORGANIZATION_HEADER, organizationId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(smsRequest()))
                .andReturn();
        String id = body(created).get("id").asText();

        MvcResult resend = mockMvc.perform(post("/api/notifications/" + id + "/resend")
                        .header(ORGANIZATION_HEADER, organizationId))
                .andReturn();
        assertEquals(409, resend.getResponse().getStatus());

        MvcResult read = mockMvc.perform(post("/api/notifications/" + id + "/read")
                        .header(ORGANIZATION_HEADER, organizationId))
                .andReturn();
        assertEquals(409, read.getResponse().getStatus());

        printSuccess("Invalid state transitions rejected");
    }

    @Test
    @DisplayName("PUT /api/notification-preferences stores flags and quiet hours")
    void testUpdatePreferences() throws Exception {
        printTestHeader("Update Preferences");

        String request = """
            {
              "recipient_type": "CUSTOMER",
              "recipient_id": "%s",
              "receive_sms": false,
              "quiet_hours_start": "21:30",
              "quiet_hours_end": "07:00"
            }
            """.formatted(customer.getId());

        MvcResult result = mockMvc.perform(put("/api/notification-preferences")
                        .header(ORGANIZATION_HEADER, organizationId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(request))
                .andReturn();

        System.out.println("Response: " + result.getResponse().getContentAsString());

        assertEquals(200, result.getResponse().getStatus());
        JsonNode json = body(result);
        assertFalse(json.get("receive_sms").asBoolean());
        assertTrue(json.get("receive_email").asBoolean());
        assertTrue(json.get("quiet_hours_start").asText().startsWith("21:30"));

        String halfWindow = """
            {
              "recipient_type": "CUSTOMER",
              "recipient_id": "%s",
              "quiet_hours_start": "21:30"
            }
            """.formatted(customer.getId());
        MvcResult rejected = mockMvc.perform(put("/api/notification-preferences")
                        .header(ORGANIZATION_HEADER, organizationId)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(halfWindow))
                .andReturn();
        assertEquals(400, rejected.getResponse().getStatus());

        printSuccess("Preferences stored");
    }
}
