package com.mailbridge.smtpapp.sync;

import com.mailbridge.observability.SpanHelper;
import com.mailbridge.smtpapp.pipeline.ProcedureContext;
import com.mailbridge.smtpapp.smtp.TenantServicesFactory;
import com.mailbridge.webhooks.sync.ReconciliationReport;
import com.mailbridge.webhooks.sync.WebhookReconciliationException;
import com.mailbridge.webhooks.sync.WebhookSynchronizer;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reconciles a tenant's webhooks after a successful mutating operation.
 *
 * <p>Never throws: the operation has already succeeded and its response stands. Failures are
 * logged and the next mutating operation retries the reconciliation.
 */
public class WebhookSyncHook {

    private static final Logger log = LoggerFactory.getLogger(WebhookSyncHook.class);

    static final String SPAN_NAME = "webhooks.reconcile";

    private final WebhookSynchronizer synchronizer;
    private final TenantServicesFactory services;
    private final SpanHelper spans;

    public WebhookSyncHook(
            WebhookSynchronizer synchronizer, TenantServicesFactory services, SpanHelper spans) {
        this.synchronizer = synchronizer;
        this.services = services;
        this.spans = spans;
    }

    public void afterMutation(ProcedureContext context) {
        spans.runInSpan(
                SPAN_NAME,
                Map.of("tenant.api_url", String.valueOf(context.tenantApiUrl())),
                () -> reconcile(context));
    }

    private void reconcile(ProcedureContext context) {
        try {
            ReconciliationReport report =
                    synchronizer.reconcile(services.webhookManifest(context), context.apiClient());
            if (report.mutations() == 0) {
                log.debug("Webhooks of {} already match the manifest", context.tenantApiUrl());
            } else {
                log.info(
                        "Reconciled webhooks of {}: {} created, {} updated, {} deleted",
                        context.tenantApiUrl(),
                        report.created(),
                        report.updated(),
                        report.deleted());
            }
        } catch (WebhookReconciliationException e) {
            log.error(
                    "Webhook reconciliation of {} left {} failed mutation(s): {}",
                    context.tenantApiUrl(),
                    e.failedEntries().size(),
                    e.getMessage());
        } catch (RuntimeException e) {
            log.error("Webhook reconciliation of {} failed", context.tenantApiUrl(), e);
        }
    }
}
