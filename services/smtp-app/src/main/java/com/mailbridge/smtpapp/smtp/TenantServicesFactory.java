package com.mailbridge.smtpapp.smtp;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mailbridge.smtpapp.config.SmtpAppProperties;
import com.mailbridge.smtpapp.pipeline.ProcedureContext;
import com.mailbridge.tenantapi.metadata.AppPrivateMetadata;
import com.mailbridge.tenantapi.version.FeatureFlagService;
import org.springframework.stereotype.Component;
import org.springframework.web.context.request.RequestAttributes;
import org.springframework.web.context.request.RequestContextHolder;

/**
 * Builds the request-scoped services of a tenant from a completed {@link ProcedureContext}.
 *
 * <p>Within one web request all services of a tenant share a single {@link FeatureFlagService},
 * so the tenant API version is fetched at most once per request.
 */
@Component
public class TenantServicesFactory {

    static final String FEATURE_FLAGS_ATTRIBUTE = FeatureFlagService.class.getName();

    private final ObjectMapper mapper;
    private final SmtpAppProperties properties;

    public TenantServicesFactory(ObjectMapper mapper, SmtpAppProperties properties) {
        this.mapper = mapper;
        this.properties = properties;
    }

    public SmtpConfigurationRepository configurationRepository(ProcedureContext context) {
        requireClient(context);
        return new MetadataSmtpConfigurationRepository(
                new AppPrivateMetadata(context.apiClient(), context.appId()), mapper);
    }

    /** Feature flags of the tenant, shared by everything built during the current request. */
    public FeatureFlagService featureFlags(ProcedureContext context) {
        requireClient(context);
        RequestAttributes request = RequestContextHolder.getRequestAttributes();
        if (request == null) {
            return new FeatureFlagService(context.apiClient());
        }
        String attribute = FEATURE_FLAGS_ATTRIBUTE + ":" + context.tenantApiUrl();
        Object shared = request.getAttribute(attribute, RequestAttributes.SCOPE_REQUEST);
        if (shared instanceof FeatureFlagService flags) {
            return flags;
        }
        FeatureFlagService flags = new FeatureFlagService(context.apiClient());
        request.setAttribute(attribute, flags, RequestAttributes.SCOPE_REQUEST);
        return flags;
    }

    public SmtpConfigurationService configurationService(ProcedureContext context) {
        return new SmtpConfigurationService(configurationRepository(context), featureFlags(context));
    }

    public SmtpWebhookManifest webhookManifest(ProcedureContext context) {
        return new SmtpWebhookManifest(
                configurationRepository(context),
                featureFlags(context),
                properties.baseUrl(),
                properties.webhooks().namePrefix());
    }

    private static void requireClient(ProcedureContext context) {
        if (context.apiClient() == null) {
            throw new IllegalStateException("Procedure context has no tenant client: " + context);
        }
    }
}
