package com.mailbridge.tenantapi;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mailbridge.security.AuthRecord;
import com.mailbridge.security.DashboardOrigin;
import org.springframework.web.client.RestClient;

/**
 * Creates {@link TenantApiClient}s that share one underlying {@link RestClient}.
 */
public class TenantApiClientFactory {

    private final RestClient restClient;
    private final ObjectMapper mapper;

    public TenantApiClientFactory(RestClient.Builder builder, ObjectMapper mapper) {
        this.restClient = builder.build();
        this.mapper = mapper;
    }

    /**
     * @throws IllegalArgumentException if any argument is blank
     */
    public TenantApiClient create(String tenantApiUrl, String appToken, String dashboardUrl) {
        if (tenantApiUrl == null || tenantApiUrl.isBlank()) {
            throw new IllegalArgumentException("tenantApiUrl must not be null or blank");
        }
        if (appToken == null || appToken.isBlank()) {
            throw new IllegalArgumentException("appToken must not be null or blank");
        }
        return new TenantApiClient(restClient, mapper, tenantApiUrl, appToken, DashboardOrigin.of(dashboardUrl));
    }

    /** Client acting as the installation described by the record. */
    public TenantApiClient create(AuthRecord record) {
        return create(record.tenantApiUrl(), record.token(), record.dashboardUrl());
    }
}
