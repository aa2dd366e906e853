package com.mailbridge.webhooks.manifest;

import java.util.List;
import java.util.TreeSet;

/**
 * A webhook subscription the app wants on the tenant.
 *
 * @param name       webhook name, also the ownership marker
 * @param targetUrl  endpoint of this app receiving the events
 * @param eventTypes subscribed event types; stored sorted and without duplicates
 * @param isActive   whether the tenant should deliver events
 * @param delivery   sync or async delivery
 */
public record WebhookManifestEntry(
        String name,
        String targetUrl,
        List<String> eventTypes,
        boolean isActive,
        DeliveryMode delivery
) {

    public WebhookManifestEntry {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        if (targetUrl == null || targetUrl.isBlank()) {
            throw new IllegalArgumentException("targetUrl must not be null or blank");
        }
        if (eventTypes == null || eventTypes.isEmpty()) {
            throw new IllegalArgumentException("eventTypes must not be empty");
        }
        if (delivery == null) {
            throw new IllegalArgumentException("delivery must not be null");
        }
        eventTypes = List.copyOf(new TreeSet<>(eventTypes));
    }

    public WebhookKey key() {
        return new WebhookKey(name, targetUrl);
    }
}
