package com.mailbridge.security;

import org.springframework.http.HttpHeaders;

/**
 * {@code Origin}/{@code Referer} header value derived from a tenant's dashboard host.
 * <p>
 * The tenant API and its key-set endpoint only answer requests that appear to come from the
 * dashboard, so every outbound call to them must carry both headers. The value is always
 * {@code https://<host>}; a scheme already present on the configured dashboard URL is dropped.
 */
public final class DashboardOrigin {

    private final String value;

    private DashboardOrigin(String value) {
        this.value = value;
    }

    /**
     * @param dashboardUrl dashboard host as stored on the {@link AuthRecord}
     * @throws IllegalArgumentException if the dashboard URL is missing
     */
    public static DashboardOrigin of(String dashboardUrl) {
        if (dashboardUrl == null || dashboardUrl.isBlank()) {
            throw new IllegalArgumentException("dashboardUrl must not be null or blank");
        }
        String host = dashboardUrl.strip().replaceFirst("(?i)^https?://", "");
        while (host.endsWith("/")) {
            host = host.substring(0, host.length() - 1);
        }
        return new DashboardOrigin("https://" + host);
    }

    public String value() {
        return value;
    }

    /** Sets both headers, overwriting earlier values. */
    public void applyTo(HttpHeaders headers) {
        headers.set(HttpHeaders.ORIGIN, value);
        headers.set(HttpHeaders.REFERER, value);
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof DashboardOrigin other && value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
