package com.mailbridge.smtpapp.pipeline;

import com.mailbridge.observability.CorrelationContextHolder;
import com.mailbridge.security.AuthRecord;
import com.mailbridge.security.store.AuthDataStore;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Looks up the stored installation of the claimed app. From here on the context carries the
 * stored tenant API URL, app id and app token.
 */
public class AttachTenantIdentityStage implements ProcedureStage {

    private static final Logger log = LoggerFactory.getLogger(AttachTenantIdentityStage.class);

    private final AuthDataStore authDataStore;

    public AttachTenantIdentityStage(AuthDataStore authDataStore) {
        this.authDataStore = authDataStore;
    }

    @Override
    public StageResult apply(ProcedureContext context) {
        if (context.claimedTenantApiUrl() == null || context.claimedTenantApiUrl().isBlank()) {
            return StageResult.fail(FailureKind.BAD_REQUEST, "Missing tenant API URL in request");
        }

        Optional<AuthRecord> record =
                authDataStore.get(context.claimedAppId() == null ? "" : context.claimedAppId());
        if (record.isEmpty()) {
            log.debug("No auth data for app {} of {}", context.claimedAppId(), context.claimedTenantApiUrl());
            return StageResult.fail(FailureKind.UNAUTHENTICATED, "Missing auth data");
        }

        AuthRecord found = record.get();
        if (!found.tenantApiUrl().equals(context.claimedTenantApiUrl())) {
            log.debug("Claimed tenant {} differs from stored {}, using stored",
                    context.claimedTenantApiUrl(), found.tenantApiUrl());
        }
        CorrelationContextHolder.update(c -> c.withTenant(found.tenantApiUrl(), found.appId()));
        return StageResult.proceed(context.withAuthRecord(found));
    }

    @Override
    public String name() {
        return "attach-tenant-identity";
    }
}
