package com.mailbridge.smtpapp;

import static com.mailbridge.security.testing.TestTokenFactory.DEFAULT_APP_ID;
import static com.mailbridge.security.testing.TestTokenFactory.DEFAULT_TENANT_API_URL;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.mailbridge.security.AuthRecord;
import com.mailbridge.security.store.AuthDataStore;
import com.mailbridge.security.testing.TestTokenFactory;
import com.mailbridge.smtpapp.config.SmtpAppProperties;
import com.mailbridge.smtpapp.pipeline.ProcedureContext;
import com.mailbridge.smtpapp.smtp.EmailEvent;
import com.mailbridge.smtpapp.smtp.EventConfiguration;
import com.mailbridge.smtpapp.smtp.SmtpConfiguration;
import com.mailbridge.smtpapp.smtp.SmtpConfigurationService;
import com.mailbridge.smtpapp.smtp.SmtpEncryption;
import com.mailbridge.smtpapp.smtp.TenantServicesFactory;
import com.mailbridge.smtpapp.sync.WebhookSyncHook;
import com.nimbusds.jose.jwk.RSAKey;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.MockHttpServletRequestBuilder;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("SMTP app")
class SmtpAppApplicationTest {

    private static final RSAKey SIGNING_KEY = TestTokenFactory.generateKey("kid-app-test");

    @Autowired private MockMvc mockMvc;
    @Autowired private AuthDataStore store;
    @Autowired private SmtpAppProperties properties;

    @MockBean private TenantServicesFactory services;
    @MockBean private WebhookSyncHook webhookSyncHook;

    private SmtpConfigurationService configurationService;

    @BeforeEach
    void setUp() {
        store.set(new AuthRecord(
                DEFAULT_TENANT_API_URL,
                TestTokenFactory.DEFAULT_APP_TOKEN,
                DEFAULT_APP_ID,
                TestTokenFactory.DEFAULT_DASHBOARD_URL,
                TestTokenFactory.jwks(SIGNING_KEY)));
        configurationService = mock(SmtpConfigurationService.class);
        when(services.configurationService(any())).thenReturn(configurationService);
    }

    private static String validToken() {
        return TestTokenFactory.sign(SIGNING_KEY, TestTokenFactory.claims().build());
    }

    private static MockHttpServletRequestBuilder tenantRequest(MockHttpServletRequestBuilder builder, String token) {
        builder.header("X-Tenant-Api-Url", DEFAULT_TENANT_API_URL).header("X-App-Id", DEFAULT_APP_ID);
        if (token != null) {
            builder.header("Authorization", "Bearer " + token);
        }
        return builder;
    }

    private static SmtpConfiguration configuration() {
        return new SmtpConfiguration("cfg-1", "Main", true, "Shop", "shop@example.com", "smtp.example.com", 587,
                "user", "secret", SmtpEncryption.TLS,
                List.of(new EventConfiguration(EmailEvent.ORDER_CREATED, true, null, null)));
    }

    @Test
    @DisplayName("binds the test profile configuration")
    void bindsProperties() {
        assertThat(properties.name()).isEqualTo("smtp-app-test");
        assertThat(properties.baseUrl()).isEqualTo("https://smtp.test.example.com");
        assertThat(properties.authStore().type()).isEqualTo(SmtpAppProperties.AuthStoreType.MEMORY);
    }

    @Test
    @DisplayName("service info endpoint answers with the service name and a correlation id")
    void serviceInfo() throws Exception {
        mockMvc.perform(get("/api/v1/info"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("smtp-app-test"))
                .andExpect(jsonPath("$.status").value("running"))
                .andExpect(header().exists("X-Correlation-ID"));
    }

    @Test
    @DisplayName("health endpoint reports the auth store")
    void health() throws Exception {
        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("HEALTHY"))
                .andExpect(jsonPath("$.checks['auth-store'].status").value("HEALTHY"));
    }

    @Nested
    @DisplayName("protected procedures")
    class ProtectedProcedures {

        @Test
        @DisplayName("run the handler with the verified tenant context")
        void authorisedRead() throws Exception {
            when(configurationService.list()).thenReturn(List.of(configuration()));

            mockMvc.perform(tenantRequest(get("/api/v1/configurations"), validToken()))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$[0].id").value("cfg-1"))
                    .andExpect(jsonPath("$[0].passwordSet").value(true))
                    .andExpect(jsonPath("$[0].smtpPassword").doesNotExist());

            ArgumentCaptor<ProcedureContext> context = ArgumentCaptor.forClass(ProcedureContext.class);
            verify(services).configurationService(context.capture());
            assertThat(context.getValue().claims().appId()).isEqualTo(DEFAULT_APP_ID);
            assertThat(context.getValue().apiClient().tenantApiUrl()).isEqualTo(DEFAULT_TENANT_API_URL);
            verify(webhookSyncHook, never()).afterMutation(any());
        }

        @Test
        @DisplayName("reconcile webhooks after a successful mutation")
        void mutationTriggersReconciliation() throws Exception {
            when(configurationService.create(any())).thenReturn(configuration());

            mockMvc.perform(tenantRequest(post("/api/v1/configurations"), validToken())
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"name\":\"Main\",\"active\":true,\"senderEmail\":\"shop@example.com\","
                                    + "\"smtpHost\":\"smtp.example.com\",\"smtpPort\":587}"))
                    .andExpect(status().isCreated());

            verify(webhookSyncHook).afterMutation(any(ProcedureContext.class));
        }

        @Test
        @DisplayName("do not reconcile when the mutation is invalid")
        void invalidMutationSkipsReconciliation() throws Exception {
            mockMvc.perform(tenantRequest(post("/api/v1/configurations"), validToken())
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"name\":\"\",\"smtpHost\":\"smtp.example.com\",\"smtpPort\":587}"))
                    .andExpect(status().isBadRequest());

            verify(webhookSyncHook, never()).afterMutation(any());
        }

        @Test
        @DisplayName("answer 400 without a tenant API URL")
        void missingTenantUrl() throws Exception {
            mockMvc.perform(get("/api/v1/configurations").header("Authorization", "Bearer " + validToken()))
                    .andExpect(status().isBadRequest())
                    .andExpect(jsonPath("$.detail").value("Missing tenant API URL in request"));
        }

        @Test
        @DisplayName("answer 401 for an app that is not installed")
        void unknownApp() throws Exception {
            mockMvc.perform(get("/api/v1/configurations")
                            .header("X-Tenant-Api-Url", DEFAULT_TENANT_API_URL)
                            .header("X-App-Id", "not-installed")
                            .header("Authorization", "Bearer " + validToken()))
                    .andExpect(status().isUnauthorized())
                    .andExpect(jsonPath("$.detail").value("Missing auth data"));
        }

        @Test
        @DisplayName("answer 403 with an opaque detail for a forged token")
        void forgedToken() throws Exception {
            RSAKey attacker = TestTokenFactory.generateKey("kid-app-test");
            String forged = TestTokenFactory.sign(attacker, TestTokenFactory.claims().build());

            mockMvc.perform(tenantRequest(get("/api/v1/configurations"), forged))
                    .andExpect(status().isForbidden())
                    .andExpect(jsonPath("$.detail").value("JWT verification failed"))
                    .andExpect(jsonPath("$.correlationId").exists());
        }

        @Test
        @DisplayName("answer 403 for a token issued to another app")
        void otherAppToken() throws Exception {
            String token = TestTokenFactory.sign(
                    SIGNING_KEY, TestTokenFactory.claims("another-app", List.of("MANAGE_APPS")).build());

            mockMvc.perform(tenantRequest(get("/api/v1/configurations"), token))
                    .andExpect(status().isForbidden())
                    .andExpect(jsonPath("$.detail").value("JWT verification failed"));
        }

        @Test
        @DisplayName("answer 403 without a token")
        void missingToken() throws Exception {
            mockMvc.perform(tenantRequest(get("/api/v1/configurations"), null))
                    .andExpect(status().isForbidden());

            verify(services, never()).configurationService(any());
        }
    }

    @Test
    @DisplayName("registration refuses tenant URLs outside the allowed pattern")
    void registrationRefusesDisallowedUrl() throws Exception {
        mockMvc.perform(post("/api/register")
                        .header("X-Tenant-Api-Url", "https://evil.test/graphql/")
                        .header("X-Dashboard-Url", "https://evil.test/dashboard/")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"auth_token\":\"app-token\"}"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.detail").value("Tenant API URL is not allowed"));
    }
}
