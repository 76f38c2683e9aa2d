package com.flagship.payment_settlement.health;

import com.flagship.payment_settlement.observability.OutboxMetrics;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness/readiness probe that needs no credentials. The provider callback path only
 * depends on the database, so that is the only hard dependency checked here.
 */
@RestController
public class HealthController {

    private final DataSource dataSource;
    private final OutboxMetrics outboxMetrics;

    public HealthController(DataSource dataSource, OutboxMetrics outboxMetrics) {
        this.dataSource = dataSource;
        this.outboxMetrics = outboxMetrics;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        boolean databaseUp = databaseReachable();

        body.put("status", databaseUp ? "UP" : "DOWN");
        body.put("service", "payment-settlement");
        body.put("timestamp", Instant.now().toString());
        body.put("database", databaseUp ? "UP" : "DOWN");
        body.put("outboxBacklog", outboxMetrics.getBacklogSize());

        return databaseUp ? ResponseEntity.ok(body) : ResponseEntity.status(503).body(body);
    }

    private boolean databaseReachable() {
        try (Connection connection = dataSource.getConnection()) {
            return connection.isValid(2);
        } catch (SQLException e) {
            return false;
        }
    }
}
