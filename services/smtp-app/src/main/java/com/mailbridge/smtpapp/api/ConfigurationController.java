package com.mailbridge.smtpapp.api;

import com.mailbridge.smtpapp.pipeline.ProcedureContext;
import com.mailbridge.smtpapp.pipeline.ProtectedProcedure;
import com.mailbridge.smtpapp.smtp.EmailEvent;
import com.mailbridge.smtpapp.smtp.EventConfigurationInput;
import com.mailbridge.smtpapp.smtp.SmtpConfigurationInput;
import com.mailbridge.smtpapp.smtp.TenantServicesFactory;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * SMTP configuration operations of the calling tenant. Every operation is a protected
 * procedure; the mutating ones reconcile the tenant's webhooks afterwards.
 */
@RestController
@RequestMapping("/api/v1/configurations")
public class ConfigurationController {

    private final TenantServicesFactory services;

    public ConfigurationController(TenantServicesFactory services) {
        this.services = services;
    }

    @GetMapping
    @ProtectedProcedure
    public List<ConfigurationResponse> list(ProcedureContext context) {
        return services.configurationService(context).list().stream()
                .map(ConfigurationResponse::from)
                .toList();
    }

    @GetMapping("/{id}")
    @ProtectedProcedure
    public ConfigurationResponse get(ProcedureContext context, @PathVariable String id) {
        return ConfigurationResponse.from(services.configurationService(context).get(id));
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    @ProtectedProcedure(updatesWebhooks = true)
    public ConfigurationResponse create(
            ProcedureContext context, @Valid @RequestBody SmtpConfigurationInput input) {
        return ConfigurationResponse.from(services.configurationService(context).create(input));
    }

    @PutMapping("/{id}")
    @ProtectedProcedure(updatesWebhooks = true)
    public ConfigurationResponse update(
            ProcedureContext context,
            @PathVariable String id,
            @Valid @RequestBody SmtpConfigurationInput input) {
        return ConfigurationResponse.from(services.configurationService(context).update(id, input));
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    @ProtectedProcedure(updatesWebhooks = true)
    public void delete(ProcedureContext context, @PathVariable String id) {
        services.configurationService(context).delete(id);
    }

    @PutMapping("/{id}/events/{event}")
    @ProtectedProcedure(updatesWebhooks = true)
    public ConfigurationResponse updateEvent(
            ProcedureContext context,
            @PathVariable String id,
            @PathVariable String event,
            @RequestBody EventConfigurationInput input) {
        return ConfigurationResponse.from(
                services.configurationService(context).updateEvent(id, EmailEvent.fromPath(event), input));
    }
}
