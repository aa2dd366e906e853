package com.mailbridge.smtpapp.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration bound from {@code mailbridge.app.*}, validated at start-up.
 *
 * <pre>
 * mailbridge:
 *   app:
 *     name: smtp-app
 *     base-url: https://smtp.example.com
 *     auth-store:
 *       type: file
 *       file-path: .auth-data.json
 *     allowed-api-url-pattern: ^https://.*\.example\.com/graphql/$
 *     required-api-version: "&gt;=3.11.7 &lt;4"
 *     key-set:
 *       cache-ttl: PT1H
 *     webhooks:
 *       max-concurrency: 4
 *       max-attempts: 2
 *       retry-backoff: PT0.5S
 * </pre>
 *
 * @param name service name used in logs, metrics and traces
 * @param environment deployment environment, defaults to {@code development}
 * @param baseUrl public URL of this app, used to build webhook target URLs
 * @param authStore where installation credentials live
 * @param allowedApiUrlPattern regular expression tenant API URLs must match to install; empty
 *     allows every URL
 * @param requiredApiVersion tenant API versions this app supports
 * @param keySet tenant key-set fetching
 * @param webhooks webhook reconciliation
 */
@ConfigurationProperties(prefix = "mailbridge.app")
@Validated
public record SmtpAppProperties(
        @NotBlank String name,
        String environment,
        @NotBlank String baseUrl,
        @Valid AuthStore authStore,
        String allowedApiUrlPattern,
        String requiredApiVersion,
        @Valid KeySet keySet,
        @Valid Webhooks webhooks) {

    public static final String DEFAULT_REQUIRED_API_VERSION = ">=3.11.7 <4";

    public SmtpAppProperties {
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
        while (baseUrl != null && baseUrl.endsWith("/")) {
            baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
        }
        if (authStore == null) {
            authStore = new AuthStore(null, null);
        }
        if (requiredApiVersion == null || requiredApiVersion.isBlank()) {
            requiredApiVersion = DEFAULT_REQUIRED_API_VERSION;
        }
        if (keySet == null) {
            keySet = new KeySet(null, null, null);
        }
        if (webhooks == null) {
            webhooks = new Webhooks(null, 0, 0, null);
        }
    }

    /** Auth data store selection. */
    public record AuthStore(AuthStoreType type, String filePath) {

        public AuthStore {
            if (type == null) {
                type = AuthStoreType.FILE;
            }
            if (filePath == null || filePath.isBlank()) {
                filePath = ".auth-data.json";
            }
        }
    }

    public enum AuthStoreType {
        MEMORY,
        FILE
    }

    /**
     * @param cacheTtl how long a fetched key set is trusted; zero keeps it until a token names an
     *     unknown key
     */
    public record KeySet(Duration cacheTtl, Duration connectTimeout, Duration readTimeout) {

        public KeySet {
            if (cacheTtl == null) {
                cacheTtl = Duration.ofHours(1);
            }
            if (connectTimeout == null) {
                connectTimeout = Duration.ofSeconds(5);
            }
            if (readTimeout == null) {
                readTimeout = Duration.ofSeconds(10);
            }
        }
    }

    /**
     * @param namePrefix optional prefix marking webhooks as owned by this app
     * @param maxConcurrency parallel remote mutations per reconciliation batch
     * @param maxAttempts attempts per remote mutation
     * @param retryBackoff wait before the second attempt, doubled for each further one
     */
    public record Webhooks(String namePrefix, int maxConcurrency, int maxAttempts, Duration retryBackoff) {

        public Webhooks {
            if (maxConcurrency <= 0) {
                maxConcurrency = 4;
            }
            if (maxAttempts <= 0) {
                maxAttempts = 2;
            }
            if (retryBackoff == null) {
                retryBackoff = Duration.ofMillis(500);
            }
        }
    }
}
