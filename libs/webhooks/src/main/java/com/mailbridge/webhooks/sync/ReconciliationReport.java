package com.mailbridge.webhooks.sync;

import java.util.List;

/**
 * Outcome of one reconciliation run.
 */
public record ReconciliationReport(
        String tenantApiUrl,
        int created,
        int updated,
        int deleted,
        List<FailedWebhookOperation> failures
) {

    public ReconciliationReport {
        failures = List.copyOf(failures);
    }

    public static ReconciliationReport unchanged(String tenantApiUrl) {
        return new ReconciliationReport(tenantApiUrl, 0, 0, 0, List.of());
    }

    /** Successful remote mutations. */
    public int mutations() {
        return created + updated + deleted;
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
