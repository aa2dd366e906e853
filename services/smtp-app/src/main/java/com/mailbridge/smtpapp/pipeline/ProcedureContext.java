package com.mailbridge.smtpapp.pipeline;

import com.mailbridge.security.AuthRecord;
import com.mailbridge.security.token.VerifiedClaims;
import com.mailbridge.tenantapi.TenantApiClient;
import java.util.Set;

/**
 * Request state accumulated by the pipeline stages. Immutable; each stage returns a copy with
 * the fields it adds.
 *
 * <p>Starts with what the caller claims (raw token, tenant API URL, app id). After the pipeline
 * it also holds the stored installation, the verified claims (absent for server-originated
 * calls) and a client bound to the tenant.
 *
 * @param rawToken bearer token from the request, may be null
 * @param claimedTenantApiUrl tenant API URL sent by the caller
 * @param claimedAppId app id sent by the caller
 * @param serverOriginated true for trusted calls made by this service itself
 * @param requiredPermissions permissions the operation needs beyond the baseline
 * @param authRecord stored installation, set by the tenant identity stage
 * @param claims verified token claims, set by the token stage
 * @param apiClient tenant-bound client, set by the last stage
 */
public record ProcedureContext(
        String rawToken,
        String claimedTenantApiUrl,
        String claimedAppId,
        boolean serverOriginated,
        Set<String> requiredPermissions,
        AuthRecord authRecord,
        VerifiedClaims claims,
        TenantApiClient apiClient) {

    /** Request attribute under which the completed context is stored. */
    public static final String REQUEST_ATTRIBUTE = ProcedureContext.class.getName();

    public ProcedureContext {
        requiredPermissions = requiredPermissions == null ? Set.of() : Set.copyOf(requiredPermissions);
    }

    /** Context of a browser-originated call, which always has its token verified. */
    public static ProcedureContext fromBrowser(
            String rawToken, String tenantApiUrl, String appId, Set<String> requiredPermissions) {
        return new ProcedureContext(
                rawToken, tenantApiUrl, appId, false, requiredPermissions, null, null, null);
    }

    /** Context of a call this service makes on its own behalf; the token stage is skipped. */
    public static ProcedureContext serverOriginated(String tenantApiUrl, String appId) {
        return new ProcedureContext(null, tenantApiUrl, appId, true, Set.of(), null, null, null);
    }

    public ProcedureContext withAuthRecord(AuthRecord record) {
        return new ProcedureContext(
                rawToken, claimedTenantApiUrl, claimedAppId, serverOriginated,
                requiredPermissions, record, claims, apiClient);
    }

    public ProcedureContext withClaims(VerifiedClaims verified) {
        return new ProcedureContext(
                rawToken, claimedTenantApiUrl, claimedAppId, serverOriginated,
                requiredPermissions, authRecord, verified, apiClient);
    }

    public ProcedureContext withApiClient(TenantApiClient client) {
        return new ProcedureContext(
                rawToken, claimedTenantApiUrl, claimedAppId, serverOriginated,
                requiredPermissions, authRecord, claims, client);
    }

    /** Tenant API URL of the stored installation, falling back to the claimed one. */
    public String tenantApiUrl() {
        return authRecord != null ? authRecord.tenantApiUrl() : claimedTenantApiUrl;
    }

    /** App id of the stored installation, falling back to the claimed one. */
    public String appId() {
        return authRecord != null ? authRecord.appId() : claimedAppId;
    }

    @Override
    public String toString() {
        return "ProcedureContext[tenantApiUrl=" + tenantApiUrl() + ", appId=" + appId()
                + ", serverOriginated=" + serverOriginated + ", token="
                + (rawToken == null ? "absent" : "present") + "]";
    }
}
