package com.mailbridge.webhooks.manifest;

import java.util.List;
import java.util.TreeSet;

/**
 * A webhook subscription as registered on the tenant.
 */
public record RemoteWebhook(
        String remoteId,
        String name,
        String targetUrl,
        List<String> eventTypes,
        boolean isActive,
        DeliveryMode delivery
) {

    public RemoteWebhook {
        if (remoteId == null || remoteId.isBlank()) {
            throw new IllegalArgumentException("remoteId must not be null or blank");
        }
        eventTypes = eventTypes == null ? List.of() : List.copyOf(new TreeSet<>(eventTypes));
    }

    public static RemoteWebhook of(String remoteId, WebhookManifestEntry entry) {
        return new RemoteWebhook(remoteId, entry.name(), entry.targetUrl(), entry.eventTypes(),
                entry.isActive(), entry.delivery());
    }

    public WebhookKey key() {
        return new WebhookKey(name, targetUrl);
    }

    /** True when nothing but the remote id differs from the entry. */
    public boolean matches(WebhookManifestEntry entry) {
        return key().equals(entry.key())
                && eventTypes.equals(entry.eventTypes())
                && isActive == entry.isActive()
                && delivery == entry.delivery();
    }
}
