package com.flagship.ledger_service.health;

import com.flagship.ledger_service.diagnostics.DiagnosticsService;
import com.flagship.ledger_service.diagnostics.StoreHealth;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Simple health check endpoint for liveness and readiness checks.
 * Unlike the Actuator health endpoint, this does not require authorization.
 */
@RestController
public class HealthController {

    private final DiagnosticsService diagnosticsService;

    public HealthController(DiagnosticsService diagnosticsService) {
        this.diagnosticsService = diagnosticsService;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        StoreHealth store = diagnosticsService.checkStoreHealth();

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", store.isHealthy() ? "UP" : "DOWN");
        response.put("timestamp", store.getCheckedAt().toString());
        response.put("database", store.isHealthy() ? "UP" : "DOWN");

        if (!store.isHealthy()) {
            response.put("error", store.getError());
            return ResponseEntity.status(503).body(response);
        }

        return ResponseEntity.ok(response);
    }
}
