package com.mailbridge.smtpapp.smtp;

import com.mailbridge.tenantapi.version.FeatureFlagService;
import com.mailbridge.tenantapi.version.FeatureFlags;
import com.mailbridge.webhooks.manifest.DeliveryMode;
import com.mailbridge.webhooks.manifest.WebhookManifestEntry;
import com.mailbridge.webhooks.manifest.WebhookManifestSource;
import com.mailbridge.webhooks.manifest.WebhookOwnership;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Webhooks the SMTP app needs on a tenant: one per e-mail event that at least one active
 * configuration sends and the tenant's API version supports. Events sharing a webhook name
 * collapse into one entry.
 * <p>
 * Configuration and feature flags are read when the manifest is requested, so the manifest
 * reflects a change made earlier in the same request.
 */
public class SmtpWebhookManifest implements WebhookManifestSource {

    static final String WEBHOOK_PATH = "/api/webhooks/";

    private final SmtpConfigurationRepository repository;
    private final FeatureFlagService featureFlags;
    private final String baseUrl;
    private final WebhookOwnership ownership;

    public SmtpWebhookManifest(SmtpConfigurationRepository repository, FeatureFlagService featureFlags,
                               String baseUrl, String namePrefix) {
        this.repository = repository;
        this.featureFlags = featureFlags;
        this.baseUrl = baseUrl;
        this.ownership = WebhookOwnership.of(EmailEvent.webhookNames(), namePrefix);
    }

    @Override
    public List<WebhookManifestEntry> desiredManifest() {
        List<SmtpConfiguration> configurations = repository.findAll();
        FeatureFlags flags = featureFlags.getFeatureFlags();

        Map<String, TreeSet<String>> eventsByWebhook = new LinkedHashMap<>();
        for (EmailEvent event : EmailEvent.values()) {
            if (!event.isAvailable(flags)) {
                continue;
            }
            boolean sent = configurations.stream().anyMatch(c -> c.sends(event));
            if (sent) {
                eventsByWebhook.computeIfAbsent(event.webhookName(), k -> new TreeSet<>())
                        .add(event.webhookEvent());
            }
        }

        List<WebhookManifestEntry> entries = new ArrayList<>();
        eventsByWebhook.forEach((name, events) -> entries.add(new WebhookManifestEntry(
                name, targetUrl(name), List.copyOf(events), true, DeliveryMode.ASYNC)));
        return entries;
    }

    @Override
    public WebhookOwnership ownership() {
        return ownership;
    }

    String targetUrl(String webhookName) {
        return baseUrl + WEBHOOK_PATH + webhookName;
    }
}
