package com.mailbridge.webhooks.manifest;

import java.util.List;

/**
 * Remote mutations that bring the tenant in line with the manifest. The three lists target
 * disjoint webhooks.
 */
public record WebhookDiff(
        List<WebhookManifestEntry> toCreate,
        List<WebhookUpdate> toUpdate,
        List<RemoteWebhook> toDelete
) {

    public WebhookDiff {
        toCreate = List.copyOf(toCreate);
        toUpdate = List.copyOf(toUpdate);
        toDelete = List.copyOf(toDelete);
    }

    public boolean isEmpty() {
        return toCreate.isEmpty() && toUpdate.isEmpty() && toDelete.isEmpty();
    }

    public int mutationCount() {
        return toCreate.size() + toUpdate.size() + toDelete.size();
    }
}
