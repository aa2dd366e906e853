package com.mailbridge.smtpapp.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.mailbridge.security.AuthRecord;
import com.mailbridge.smtpapp.infrastructure.web.ProtectedProcedureInterceptor;
import com.mailbridge.smtpapp.registration.RegistrationService;
import java.util.Map;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Installation endpoint called by the tenant when the app is installed.
 */
@RestController
@RequestMapping("/api")
public class RegistrationController {

    public static final String DASHBOARD_URL_HEADER = "X-Dashboard-Url";

    private final RegistrationService registration;

    public RegistrationController(RegistrationService registration) {
        this.registration = registration;
    }

    @PostMapping("/register")
    public Map<String, Object> register(
            @RequestHeader(name = ProtectedProcedureInterceptor.TENANT_API_URL_HEADER, required = false)
                    String tenantApiUrl,
            @RequestHeader(name = DASHBOARD_URL_HEADER, required = false) String dashboardUrl,
            @RequestBody RegisterRequest request) {
        AuthRecord record = registration.register(tenantApiUrl, dashboardUrl, request.authToken());
        return Map.of("success", true, "appId", record.appId());
    }

    public record RegisterRequest(@JsonProperty("auth_token") String authToken) {}
}
