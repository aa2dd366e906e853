package com.mailbridge.tenantapi.version;

import com.mailbridge.tenantapi.TenantApiClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Feature flags of one tenant. The API version is fetched on first use and kept for the
 * lifetime of the instance, which is one request.
 */
public class FeatureFlagService {

    private static final Logger log = LoggerFactory.getLogger(FeatureFlagService.class);

    private final TenantApiClient client;
    private volatile FeatureFlags flags;

    public FeatureFlagService(TenantApiClient client) {
        this.client = client;
    }

    /** Service with a known version, no API call needed. */
    public static FeatureFlagService forVersion(TenantApiClient client, ApiVersion version) {
        FeatureFlagService service = new FeatureFlagService(client);
        service.flags = FeatureFlags.forVersion(version);
        return service;
    }

    /**
     * @throws com.mailbridge.tenantapi.TenantApiException if the version cannot be fetched
     */
    public FeatureFlags getFeatureFlags() {
        FeatureFlags current = flags;
        if (current == null) {
            String version = client.fetchApiVersion();
            current = FeatureFlags.forVersion(parseOrNull(version));
            log.debug("Tenant {} runs API version {}, flags {}", client.tenantApiUrl(), version, current);
            flags = current;
        }
        return current;
    }

    private static ApiVersion parseOrNull(String version) {
        if (version == null) {
            return null;
        }
        try {
            return ApiVersion.parse(version);
        } catch (IllegalArgumentException e) {
            log.warn("Unparsable tenant API version '{}', disabling version-gated features", version);
            return null;
        }
    }
}
