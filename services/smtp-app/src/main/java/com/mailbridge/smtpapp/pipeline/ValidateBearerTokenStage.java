package com.mailbridge.smtpapp.pipeline;

import com.mailbridge.observability.SensitiveDataRedactor;
import com.mailbridge.observability.TenantMetrics;
import com.mailbridge.security.keyset.KeySetUnavailableException;
import com.mailbridge.security.token.AppPermissions;
import com.mailbridge.security.token.TokenVerificationException;
import com.mailbridge.security.token.TokenVerifier;
import com.mailbridge.security.token.VerifiedClaims;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Verifies the dashboard token of browser-originated calls against the stored installation.
 * Server-originated calls pass through untouched.
 *
 * <p>Every verification failure is reported to the caller as the same
 * {@link FailureKind#AUTHORIZATION_DENIED}; the specific reason is logged and counted.
 */
public class ValidateBearerTokenStage implements ProcedureStage {

    private static final Logger log = LoggerFactory.getLogger(ValidateBearerTokenStage.class);

    static final String DENIED_MESSAGE = "JWT verification failed";
    static final String REJECTED_METRIC = "mailbridge.tokens.rejected";

    private final TokenVerifier verifier;
    private final TenantMetrics metrics;

    public ValidateBearerTokenStage(TokenVerifier verifier, TenantMetrics metrics) {
        this.verifier = verifier;
        this.metrics = metrics;
    }

    @Override
    public StageResult apply(ProcedureContext context) {
        if (context.serverOriginated()) {
            return StageResult.proceed(context);
        }
        if (context.authRecord() == null) {
            return StageResult.fail(FailureKind.INTERNAL, "Token validation requires the tenant identity");
        }
        if (context.rawToken() == null || context.rawToken().isBlank()) {
            log.warn("Rejected request for {}: missing bearer token", context.tenantApiUrl());
            countRejection("missing");
            return StageResult.fail(FailureKind.AUTHORIZATION_DENIED, DENIED_MESSAGE);
        }

        try {
            VerifiedClaims claims = verifier.verify(
                    context.rawToken(),
                    context.authRecord(),
                    AppPermissions.required(context.requiredPermissions()));
            return StageResult.proceed(context.withClaims(claims));
        } catch (TokenVerificationException e) {
            log.warn("Rejected token {} for {}: {}",
                    SensitiveDataRedactor.preview(context.rawToken()), context.tenantApiUrl(), e.getMessage());
            countRejection(e.reason().code());
            return StageResult.fail(FailureKind.AUTHORIZATION_DENIED, DENIED_MESSAGE);
        } catch (KeySetUnavailableException e) {
            log.warn("Cannot verify token for {}: {}", context.tenantApiUrl(), e.getMessage());
            return StageResult.fail(FailureKind.KEY_SET_UNAVAILABLE,
                    "Key set of the tenant is unavailable at " + e.endpoint());
        }
    }

    private void countRejection(String reason) {
        metrics.counter(REJECTED_METRIC, "Dashboard tokens rejected by reason", "reason", reason).increment();
    }

    @Override
    public String name() {
        return "validate-bearer-token";
    }
}
