package com.mailbridge.webhooks.registry;

import com.mailbridge.webhooks.manifest.RemoteWebhook;
import com.mailbridge.webhooks.manifest.WebhookManifestEntry;

import java.util.List;

/**
 * Webhooks registered for this app on one tenant. Each method is one remote call; failures
 * surface as unchecked exceptions.
 */
public interface WebhookRegistry {

    List<RemoteWebhook> list();

    RemoteWebhook create(WebhookManifestEntry entry);

    /** Replaces every attribute of the remote webhook with the entry. */
    RemoteWebhook update(String remoteId, WebhookManifestEntry entry);

    void delete(String remoteId);
}
