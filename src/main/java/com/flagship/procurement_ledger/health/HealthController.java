package com.flagship.procurement_ledger.health;

import com.flagship.procurement_ledger.store.LedgerStore;
import lombok.extern.slf4j.Slf4j;
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
@Slf4j
public class HealthController {

    private final LedgerStore ledgerStore;

    public HealthController(LedgerStore ledgerStore) {
        this.ledgerStore = ledgerStore;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("timestamp", Instant.now().toString());

        boolean ledgerHealthy = checkLedger();
        response.put("ledger", ledgerHealthy ? "UP" : "DOWN");

        if (!ledgerHealthy) {
            response.put("status", "DOWN");
            return ResponseEntity.status(503).body(response);
        }

        return ResponseEntity.ok(response);
    }

    private boolean checkLedger() {
        try {
            ledgerStore.verifyConnection();
            return true;
        } catch (RuntimeException e) {
            log.warn("Ledger health check failed: {}", e.getMessage());
            return false;
        }
    }
}
