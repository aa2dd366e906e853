package com.mailbridge.smtpapp.api;

import com.mailbridge.observability.HealthCheckRegistry;
import com.mailbridge.observability.HealthResult;
import com.mailbridge.observability.HealthStatus;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Aggregated health of the service's dependencies. Unhealthy answers 503 so load balancers
 * take the instance out of rotation; degraded still answers 200.
 */
@RestController
@RequestMapping("/api/v1")
public class HealthController {

    private final HealthCheckRegistry registry;

    public HealthController(HealthCheckRegistry registry) {
        this.registry = registry;
    }

    @GetMapping("/health")
    public ResponseEntity<HealthResult> health() {
        HealthResult result = registry.checkAll();
        HttpStatus status = result.status() == HealthStatus.UNHEALTHY ? HttpStatus.SERVICE_UNAVAILABLE : HttpStatus.OK;
        return ResponseEntity.status(status).body(result);
    }
}
