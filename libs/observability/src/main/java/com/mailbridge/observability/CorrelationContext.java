package com.mailbridge.observability;

/**
 * Immutable correlation data carried through one inbound request.
 * <p>
 * A request starts with only a correlation id; the tenant fields are filled in once
 * the caller's installation has been resolved, so log lines emitted after tenant
 * resolution can be grouped per tenant.
 *
 * @param correlationId id echoed to the caller and used to join log lines (never blank)
 * @param tenantApiUrl  tenant API URL of the resolved installation (nullable until resolved)
 * @param appId         application id of the resolved installation (nullable until resolved)
 * @param requestId     id of this particular HTTP request (nullable)
 * @param spanId        current OpenTelemetry span id (nullable)
 * @param traceId       current OpenTelemetry trace id (nullable)
 */
public record CorrelationContext(
        String correlationId,
        String tenantApiUrl,
        String appId,
        String requestId,
        String spanId,
        String traceId
) {

    /** MDC key for the correlation id. */
    public static final String MDC_CORRELATION_ID = "correlationId";

    /** MDC key for the tenant API URL. */
    public static final String MDC_TENANT_API_URL = "tenantApiUrl";

    /** MDC key for the application id. */
    public static final String MDC_APP_ID = "appId";

    /** MDC key for the request id. */
    public static final String MDC_REQUEST_ID = "requestId";

    /** MDC key for the span id. */
    public static final String MDC_SPAN_ID = "spanId";

    /** MDC key for the trace id. */
    public static final String MDC_TRACE_ID = "traceId";

    public CorrelationContext {
        if (correlationId == null || correlationId.isBlank()) {
            throw new IllegalArgumentException("correlationId must not be null or blank");
        }
    }

    /**
     * Creates a context that only knows its correlation id.
     */
    public static CorrelationContext of(String correlationId) {
        return new CorrelationContext(correlationId, null, null, null, null, null);
    }

    /**
     * Returns a copy bound to the given tenant installation.
     */
    public CorrelationContext withTenant(String tenantApiUrl, String appId) {
        return new CorrelationContext(correlationId, tenantApiUrl, appId, requestId, spanId, traceId);
    }
}
