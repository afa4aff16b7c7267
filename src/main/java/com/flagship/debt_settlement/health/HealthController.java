package com.flagship.debt_settlement.health;

import com.flagship.debt_settlement.observability.SettlementWorkersHealthIndicator;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Simple health check endpoint for liveness/readiness probes.
 * Unlike the Actuator health endpoint, this does not require authorization.
 */
@RestController
public class HealthController {

    private final SettlementWorkersHealthIndicator workersHealth;

    public HealthController(SettlementWorkersHealthIndicator workersHealth) {
        this.workersHealth = workersHealth;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("timestamp", Instant.now().toString());

        Health workers = workersHealth.health();
        boolean workersHealthy = !Status.DOWN.equals(workers.getStatus());
        response.put("workers", workers.getStatus().getCode());

        if (!workersHealthy) {
            response.put("status", "DOWN");
            return ResponseEntity.status(503).body(response);
        }

        return ResponseEntity.ok(response);
    }
}
