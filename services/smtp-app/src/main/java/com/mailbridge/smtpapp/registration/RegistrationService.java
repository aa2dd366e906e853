package com.mailbridge.smtpapp.registration;

import com.mailbridge.security.AuthRecord;
import com.mailbridge.security.keyset.KeySet;
import com.mailbridge.security.keyset.KeySetFetcher;
import com.mailbridge.security.keyset.KeySetUnavailableException;
import com.mailbridge.security.store.AuthDataStore;
import com.mailbridge.tenantapi.AppInfo;
import com.mailbridge.tenantapi.TenantApiClient;
import com.mailbridge.tenantapi.TenantApiClientFactory;
import com.mailbridge.tenantapi.TenantApiException;
import com.mailbridge.tenantapi.version.VersionCompatibilityValidator;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;

/**
 * Stores the credentials a tenant hands over when it installs the app.
 *
 * <p>The tenant API URL must match the allowed pattern, the token must identify an app on that
 * tenant and the tenant must run a supported API version. The key set is fetched once so that
 * later token checks can start from the stored copy; a failure there does not block the
 * installation.
 */
public class RegistrationService {

    private static final Logger log = LoggerFactory.getLogger(RegistrationService.class);

    static final String API_UNREACHABLE = "Couldn't communicate with the tenant API";
    static final String VERSION_UNKNOWN = "Tenant API version couldn't be fetched from the API";
    static final String NOT_AN_APP_TOKEN = "The token does not belong to an app";

    private final AuthDataStore store;
    private final TenantApiClientFactory clients;
    private final KeySetFetcher keySetFetcher;
    private final VersionCompatibilityValidator versionValidator;
    private final Pattern allowedApiUrl;

    /**
     * @param allowedApiUrl pattern tenant API URLs must match; null allows every URL
     */
    public RegistrationService(
            AuthDataStore store,
            TenantApiClientFactory clients,
            KeySetFetcher keySetFetcher,
            VersionCompatibilityValidator versionValidator,
            Pattern allowedApiUrl) {
        this.store = store;
        this.clients = clients;
        this.keySetFetcher = keySetFetcher;
        this.versionValidator = versionValidator;
        this.allowedApiUrl = allowedApiUrl;
    }

    /**
     * @throws RegistrationRejectedException when the installation is refused
     */
    public AuthRecord register(String tenantApiUrl, String dashboardUrl, String appToken) {
        if (isBlank(tenantApiUrl) || isBlank(dashboardUrl) || isBlank(appToken)) {
            throw new RegistrationRejectedException(
                    HttpStatus.BAD_REQUEST, "Tenant API URL, dashboard URL and auth token are required");
        }
        if (allowedApiUrl != null && !allowedApiUrl.matcher(tenantApiUrl).matches()) {
            log.warn("Refused installation from {}: URL not allowed", tenantApiUrl);
            throw new RegistrationRejectedException(HttpStatus.FORBIDDEN, "Tenant API URL is not allowed");
        }

        AppInfo info = fetchAppInfo(clients.create(tenantApiUrl, appToken, dashboardUrl));
        if (info.apiVersion() == null) {
            throw new RegistrationRejectedException(HttpStatus.BAD_REQUEST, VERSION_UNKNOWN);
        }
        if (!versionValidator.isValid(info.apiVersion())) {
            log.warn("Refused installation from {}: version {} outside {}",
                    tenantApiUrl, info.apiVersion(), versionValidator.required());
            throw new RegistrationRejectedException(HttpStatus.BAD_REQUEST,
                    "Tenant API version (" + info.apiVersion() + ") is not compatible with this app version ("
                            + versionValidator.required() + ")");
        }
        if (info.appId() == null) {
            throw new RegistrationRejectedException(HttpStatus.BAD_REQUEST, NOT_AN_APP_TOKEN);
        }

        AuthRecord record = new AuthRecord(
                tenantApiUrl, appToken, info.appId(), dashboardUrl, fetchKeySet(tenantApiUrl, dashboardUrl));
        store.set(record);
        log.info("Registered app {} for {} (API version {})", info.appId(), tenantApiUrl, info.apiVersion());
        return record;
    }

    private AppInfo fetchAppInfo(TenantApiClient client) {
        try {
            return client.fetchAppInfo();
        } catch (TenantApiException e) {
            log.warn("Installation check against {} failed: {}", client.tenantApiUrl(), e.getMessage());
            throw new RegistrationRejectedException(HttpStatus.BAD_REQUEST, API_UNREACHABLE, e);
        }
    }

    private String fetchKeySet(String tenantApiUrl, String dashboardUrl) {
        try {
            KeySet keySet = keySetFetcher.refresh(tenantApiUrl, dashboardUrl);
            return keySet.keys().toString(true);
        } catch (KeySetUnavailableException e) {
            log.warn("Could not fetch key set of {} during installation: {}", tenantApiUrl, e.getMessage());
            return null;
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
