package com.mailbridge.smtpapp.pipeline;

import com.mailbridge.tenantapi.TenantApiClientFactory;

/**
 * Binds a tenant API client to the stored installation. No call is made here; tenant errors
 * surface on first use.
 */
public class AttachTenantClientStage implements ProcedureStage {

    private final TenantApiClientFactory clientFactory;

    public AttachTenantClientStage(TenantApiClientFactory clientFactory) {
        this.clientFactory = clientFactory;
    }

    @Override
    public StageResult apply(ProcedureContext context) {
        if (context.authRecord() == null) {
            return StageResult.fail(FailureKind.INTERNAL, "Tenant client requires the tenant identity");
        }
        return StageResult.proceed(context.withApiClient(clientFactory.create(context.authRecord())));
    }

    @Override
    public String name() {
        return "attach-tenant-client";
    }
}
