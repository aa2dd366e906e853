package com.mailbridge.webhooks.sync;

import java.util.List;

/**
 * Some webhook mutations failed. Every other mutation of the run was still attempted; the
 * report tells which ones went through.
 */
public class WebhookReconciliationException extends RuntimeException {

    private final ReconciliationReport report;

    public WebhookReconciliationException(ReconciliationReport report) {
        super(report.failures().size() + " webhook operation(s) failed on " + report.tenantApiUrl()
                + ": " + report.failures());
        this.report = report;
    }

    public List<FailedWebhookOperation> failedEntries() {
        return report.failures();
    }

    public ReconciliationReport report() {
        return report;
    }
}
