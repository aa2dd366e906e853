package com.mailbridge.security;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Optional;

/**
 * Credentials of one installation of the app on one tenant.
 * <p>
 * {@code tenantApiUrl} identifies the record in the store. {@code appId} does not change
 * for the lifetime of an installation, while {@code token} is replaced when the tenant
 * re-installs the app.
 *
 * @param tenantApiUrl   GraphQL endpoint of the tenant, e.g. {@code https://shop.example.com/graphql/}
 * @param token          app token used as bearer credential against the tenant API
 * @param appId          id the tenant assigned to this installation
 * @param dashboardUrl   host of the dashboard front-end that embeds the app (no scheme)
 * @param keySetOverride optional JWKS document stored at install time; nullable
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AuthRecord(
        String tenantApiUrl,
        String token,
        String appId,
        String dashboardUrl,
        String keySetOverride
) {

    @JsonCreator
    public AuthRecord {
        requireText(tenantApiUrl, "tenantApiUrl");
        requireText(token, "token");
        requireText(appId, "appId");
        requireText(dashboardUrl, "dashboardUrl");
    }

    public AuthRecord(String tenantApiUrl, String token, String appId, String dashboardUrl) {
        this(tenantApiUrl, token, appId, dashboardUrl, null);
    }

    /** The stored JWKS document, when present and non-blank. */
    public Optional<String> storedKeySet() {
        return Optional.ofNullable(keySetOverride).filter(s -> !s.isBlank());
    }

    /** Copy with a rotated token, as produced by a re-installation. */
    public AuthRecord withToken(String newToken) {
        return new AuthRecord(tenantApiUrl, newToken, appId, dashboardUrl, keySetOverride);
    }

    @Override
    public String toString() {
        return "AuthRecord[tenantApiUrl=" + tenantApiUrl + ", appId=" + appId
                + ", dashboardUrl=" + dashboardUrl + "]";
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(field + " must not be null or blank");
        }
    }
}
