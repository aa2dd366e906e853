package com.mailbridge.smtpapp.config;

import com.mailbridge.observability.HealthCheckRegistry;
import com.mailbridge.observability.SpanHelper;
import com.mailbridge.observability.TenantMetrics;
import com.mailbridge.security.store.AuthDataStore;
import com.mailbridge.security.token.TokenVerifier;
import com.mailbridge.smtpapp.infrastructure.health.AuthDataStoreHealthCheck;
import com.mailbridge.smtpapp.pipeline.AttachTenantClientStage;
import com.mailbridge.smtpapp.pipeline.AttachTenantIdentityStage;
import com.mailbridge.smtpapp.pipeline.ProcedurePipeline;
import com.mailbridge.smtpapp.pipeline.ValidateBearerTokenStage;
import com.mailbridge.smtpapp.smtp.TenantServicesFactory;
import com.mailbridge.smtpapp.sync.WebhookSyncHook;
import com.mailbridge.tenantapi.TenantApiClientFactory;
import com.mailbridge.webhooks.registry.GraphQlWebhookRegistry;
import com.mailbridge.webhooks.sync.WebhookSynchronizer;
import io.micrometer.core.instrument.MeterRegistry;
import io.opentelemetry.api.GlobalOpenTelemetry;
import java.util.List;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * The protected procedure pipeline, the webhook reconciliation it triggers, and the metrics,
 * tracing and health plumbing they report through.
 */
@Configuration
public class PipelineConfig {

    static final String INSTRUMENTATION_SCOPE = "com.mailbridge.smtpapp";

    static final int WEBHOOK_QUEUE_CAPACITY = 200;

    @Bean
    public TenantMetrics tenantMetrics(MeterRegistry meterRegistry, SmtpAppProperties properties) {
        return new TenantMetrics(meterRegistry, properties.name());
    }

    @Bean
    public SpanHelper spanHelper() {
        return new SpanHelper(GlobalOpenTelemetry.getTracer(INSTRUMENTATION_SCOPE));
    }

    @Bean
    public HealthCheckRegistry healthCheckRegistry(AuthDataStore store) {
        HealthCheckRegistry registry = new HealthCheckRegistry();
        registry.register(AuthDataStoreHealthCheck.NAME, new AuthDataStoreHealthCheck(store));
        return registry;
    }

    /** Stages run in this order: identity, token, client. */
    @Bean
    public ProcedurePipeline procedurePipeline(
            AuthDataStore store,
            TokenVerifier verifier,
            TenantApiClientFactory clients,
            TenantMetrics metrics) {
        return new ProcedurePipeline(List.of(
                new AttachTenantIdentityStage(store),
                new ValidateBearerTokenStage(verifier, metrics),
                new AttachTenantClientStage(clients)));
    }

    /** Shared pool for remote webhook mutations, sized to the per-batch concurrency limit. */
    @Bean
    public ThreadPoolTaskExecutor webhookExecutor(SmtpAppProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.webhooks().maxConcurrency());
        executor.setMaxPoolSize(properties.webhooks().maxConcurrency());
        executor.setQueueCapacity(WEBHOOK_QUEUE_CAPACITY);
        executor.setThreadNamePrefix("webhook-sync-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.initialize();
        return executor;
    }

    @Bean
    public RetryTemplate webhookRetryTemplate(SmtpAppProperties properties) {
        SmtpAppProperties.Webhooks webhooks = properties.webhooks();
        return WebhookSynchronizer.retryTemplate(webhooks.maxAttempts(), webhooks.retryBackoff());
    }

    @Bean
    public WebhookSynchronizer webhookSynchronizer(
            TenantMetrics metrics,
            ThreadPoolTaskExecutor webhookExecutor,
            RetryTemplate webhookRetryTemplate,
            SmtpAppProperties properties) {
        return new WebhookSynchronizer(GraphQlWebhookRegistry::new, metrics, webhookExecutor,
                webhookRetryTemplate, properties.webhooks().maxConcurrency());
    }

    @Bean
    public WebhookSyncHook webhookSyncHook(
            WebhookSynchronizer synchronizer, TenantServicesFactory services, SpanHelper spans) {
        return new WebhookSyncHook(synchronizer, services, spans);
    }
}
