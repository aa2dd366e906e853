package com.mailbridge.tenantapi;

/**
 * Identity of the installed app and the API version of the tenant, as reported by the tenant.
 *
 * @param appId      id of this installation; null when the token is not an app token
 * @param apiVersion version string of the tenant API, e.g. {@code 3.20.1}; may be null
 */
public record AppInfo(String appId, String apiVersion) {
}
