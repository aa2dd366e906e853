package com.mailbridge.webhooks.manifest;

/**
 * Replace the remote webhook with the desired entry.
 */
public record WebhookUpdate(RemoteWebhook current, WebhookManifestEntry desired) {

    public String remoteId() {
        return current.remoteId();
    }
}
