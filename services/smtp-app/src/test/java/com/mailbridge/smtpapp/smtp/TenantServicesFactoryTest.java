package com.mailbridge.smtpapp.smtp;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mailbridge.smtpapp.config.SmtpAppProperties;
import com.mailbridge.smtpapp.pipeline.ProcedureContext;
import com.mailbridge.tenantapi.TenantApiClient;
import com.mailbridge.tenantapi.version.FeatureFlagService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.web.context.request.RequestContextHolder;
import org.springframework.web.context.request.ServletRequestAttributes;

@DisplayName("TenantServicesFactory")
class TenantServicesFactoryTest {

    private static final String TENANT = "https://shop.example.com/graphql/";

    private TenantApiClient client;
    private ProcedureContext context;
    private TenantServicesFactory factory;

    @BeforeEach
    void setUp() {
        client = mock(TenantApiClient.class);
        when(client.tenantApiUrl()).thenReturn(TENANT);
        when(client.fetchApiVersion()).thenReturn("3.20.0");
        context = ProcedureContext.serverOriginated(TENANT, "app-1").withApiClient(client);
        var properties = new SmtpAppProperties(
                "smtp-app", null, "https://smtp.example.com", null, null, null, null, null);
        factory = new TenantServicesFactory(new ObjectMapper(), properties);
    }

    @AfterEach
    void tearDown() {
        RequestContextHolder.resetRequestAttributes();
    }

    private static void bindRequest() {
        RequestContextHolder.setRequestAttributes(new ServletRequestAttributes(new MockHttpServletRequest()));
    }

    @Test
    @DisplayName("fetches the tenant API version once per request")
    void versionFetchedOncePerRequest() {
        bindRequest();

        factory.featureFlags(context).getFeatureFlags();
        factory.configurationService(context);
        factory.webhookManifest(context);
        factory.featureFlags(context).getFeatureFlags();

        verify(client, times(1)).fetchApiVersion();
    }

    @Test
    @DisplayName("does not share feature flags across requests")
    void newRequestNewFlags() {
        bindRequest();
        FeatureFlagService first = factory.featureFlags(context);
        bindRequest();
        FeatureFlagService second = factory.featureFlags(context);

        assertThat(second).isNotSameAs(first);
    }

    @Test
    @DisplayName("builds fresh feature flags outside a web request")
    void noRequestBound() {
        assertThat(factory.featureFlags(context)).isNotSameAs(factory.featureFlags(context));
    }
}
