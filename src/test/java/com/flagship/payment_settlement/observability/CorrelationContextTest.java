package com.flagship.payment_settlement.observability;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class CorrelationContextTest {

    @AfterEach
    void tearDown() {
        CorrelationContext.end();
    }

    @Test
    @DisplayName("A well-formed incoming id is kept and mirrored into the MDC")
    void testBegin_KeepsValidId() {
        String id = CorrelationContext.begin("req-42_abc");

        assertEquals("req-42_abc", id);
        assertEquals("req-42_abc", CorrelationContext.getCorrelationId());
        assertEquals("req-42_abc", MDC.get(CorrelationContext.CORRELATION_ID_MDC_KEY));
    }

    @Test
    @DisplayName("Ids with unsafe characters or excessive length are replaced")
    void testBegin_ReplacesUnusableId() {
        String injected = CorrelationContext.begin("a b\nforged log line");
        assertNotEquals("a b\nforged log line", injected);
        assertTrue(injected.matches("[A-Za-z0-9_-]{1,64}"));

        String tooLong = CorrelationContext.begin("x".repeat(65));
        assertEquals(8, tooLong.length());
    }

    @Test
    @DisplayName("Threads without a request get a generated id on first use")
    void testGetCorrelationId_GeneratesWhenUnset() {
        String first = CorrelationContext.getCorrelationId();

        assertNotNull(first);
        assertEquals(first, CorrelationContext.getCorrelationId());
    }

    @Test
    @DisplayName("Payment scope adds the id to the MDC and restores the outer value on close")
    void testForPayment_RestoresPreviousValue() {
        UUID outer = UUID.randomUUID();
        UUID inner = UUID.randomUUID();

        try (CorrelationContext.LogScope ignored = CorrelationContext.forPayment(outer)) {
            try (CorrelationContext.LogScope nested = CorrelationContext.forPayment(inner)) {
                assertEquals(inner.toString(), MDC.get(CorrelationContext.PAYMENT_ID_MDC_KEY));
            }
            assertEquals(outer.toString(), MDC.get(CorrelationContext.PAYMENT_ID_MDC_KEY));
        }
        assertNull(MDC.get(CorrelationContext.PAYMENT_ID_MDC_KEY));
    }

    @Test
    @DisplayName("end() clears the correlation id and every scoped MDC entry")
    void testEnd_ClearsEverything() {
        CorrelationContext.begin("batch-7");
        CorrelationContext.forNotification(UUID.randomUUID());

        CorrelationContext.end();

        assertNull(MDC.get(CorrelationContext.CORRELATION_ID_MDC_KEY));
        assertNull(MDC.get(CorrelationContext.NOTIFICATION_ID_MDC_KEY));
        assertNotEquals("batch-7", CorrelationContext.getCorrelationId());
    }
}
