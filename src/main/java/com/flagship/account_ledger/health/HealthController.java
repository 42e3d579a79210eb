package com.flagship.account_ledger.health;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Liveness/readiness endpoint. Checks the database in jdbc mode; the in-memory store
 * has nothing to check.
 */
@RestController
@Slf4j
public class HealthController {

    private final Optional<DataSource> dataSource;
    private final String storeType;

    public HealthController(Optional<DataSource> dataSource,
                            @Value("${ledger.store.type:jdbc}") String storeType) {
        this.dataSource = dataSource;
        this.storeType = storeType;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("timestamp", Instant.now().toString());
        response.put("store", storeType);

        if (dataSource.isEmpty()) {
            return ResponseEntity.ok(response);
        }

        boolean dbHealthy = checkDatabase(dataSource.get());
        response.put("database", dbHealthy ? "UP" : "DOWN");

        if (!dbHealthy) {
            response.put("status", "DOWN");
            return ResponseEntity.status(503).body(response);
        }

        return ResponseEntity.ok(response);
    }

    private boolean checkDatabase(DataSource source) {
        try (Connection connection = source.getConnection()) {
            return connection.isValid(2);
        } catch (SQLException e) {
            log.warn("Database health check failed: {}", e.getMessage());
            return false;
        }
    }
}
