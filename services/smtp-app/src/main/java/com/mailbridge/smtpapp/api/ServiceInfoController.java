package com.mailbridge.smtpapp.api;

import com.mailbridge.smtpapp.config.SmtpAppProperties;
import java.time.Instant;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Lightweight runtime information about this service.
 */
@RestController
@RequestMapping("/api/v1")
public class ServiceInfoController {

    private final SmtpAppProperties properties;

    public ServiceInfoController(SmtpAppProperties properties) {
        this.properties = properties;
    }

    @GetMapping("/info")
    public Map<String, Object> serviceInfo() {
        return Map.of(
                "name", properties.name(),
                "environment", properties.environment(),
                "requiredApiVersion", properties.requiredApiVersion(),
                "status", "running",
                "timestamp", Instant.now().toString());
    }
}
