package com.flagship.payment_settlement.observability;

import org.slf4j.MDC;

import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Correlation id of the current thread, mirrored into the MDC.
 *
 * The id is copied onto each provider audit row, so one STK push can be traced from
 * the initiating request to the callback that settles it. Payment and notification
 * ids are added to the MDC for the duration of a {@link LogScope}.
 */
public final class CorrelationContext {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";

    static final String CORRELATION_ID_MDC_KEY = "correlationId";
    static final String PAYMENT_ID_MDC_KEY = "paymentId";
    static final String NOTIFICATION_ID_MDC_KEY = "notificationId";

    // caller-supplied ids end up in logs and audit rows
    private static final Pattern ACCEPTED_ID = Pattern.compile("[A-Za-z0-9_-]{1,64}");

    private static final ThreadLocal<String> current = new ThreadLocal<>();

    private CorrelationContext() {
    }

    /**
     * Returns the current correlation id. Threads not started by an HTTP request
     * (schedulers, Kafka listeners) get a generated one.
     */
    public static String getCorrelationId() {
        String id = current.get();
        return id != null ? id : begin(null);
    }

    /**
     * Starts a correlation scope, keeping {@code incoming} when it is a usable id.
     *
     * @return the id now in effect
     */
    static String begin(String incoming) {
        String id = incoming != null && ACCEPTED_ID.matcher(incoming).matches()
                ? incoming
                : UUID.randomUUID().toString().substring(0, 8);
        current.set(id);
        MDC.put(CORRELATION_ID_MDC_KEY, id);
        return id;
    }

    static void end() {
        current.remove();
        MDC.remove(CORRELATION_ID_MDC_KEY);
        MDC.remove(PAYMENT_ID_MDC_KEY);
        MDC.remove(NOTIFICATION_ID_MDC_KEY);
    }

    public static LogScope forPayment(UUID paymentId) {
        return scoped(PAYMENT_ID_MDC_KEY, paymentId);
    }

    public static LogScope forNotification(UUID notificationId) {
        return scoped(NOTIFICATION_ID_MDC_KEY, notificationId);
    }

    private static LogScope scoped(String key, UUID id) {
        String previous = MDC.get(key);
        MDC.put(key, id.toString());
        return () -> {
            if (previous != null) {
                MDC.put(key, previous);
            } else {
                MDC.remove(key);
            }
        };
    }

    /**
     * MDC entry that is removed again on close.
     */
    @FunctionalInterface
    public interface LogScope extends AutoCloseable {
        @Override
        void close();
    }
}
