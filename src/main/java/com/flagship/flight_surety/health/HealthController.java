package com.flagship.flight_surety.health;

import com.flagship.flight_surety.access.AccessControl;
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

    private final AccessControl accessControl;

    public HealthController(AccessControl accessControl) {
        this.accessControl = accessControl;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", "UP");
        response.put("timestamp", Instant.now().toString());

        boolean operational = accessControl.isOperational();
        response.put("registry", operational ? "OPERATIONAL" : "PAUSED");

        if (!operational) {
            response.put("status", "OUT_OF_SERVICE");
            return ResponseEntity.status(503).body(response);
        }
        return ResponseEntity.ok(response);
    }
}
