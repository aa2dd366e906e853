package com.mailbridge.webhooks.sync;

import com.mailbridge.webhooks.manifest.RemoteWebhook;
import com.mailbridge.webhooks.manifest.WebhookManifestEntry;
import com.mailbridge.webhooks.registry.WebhookRegistry;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory tenant webhook registry that records every mutation and can be told to fail.
 */
class RecordingWebhookRegistry implements WebhookRegistry {

    private final Map<String, RemoteWebhook> webhooks = new LinkedHashMap<>();
    private final List<String> mutations = new ArrayList<>();
    private final Map<String, Integer> failuresLeft = new HashMap<>();
    private final AtomicInteger ids = new AtomicInteger(100);

    synchronized RecordingWebhookRegistry with(RemoteWebhook webhook) {
        webhooks.put(webhook.remoteId(), webhook);
        return this;
    }

    /** The next {@code times} mutations of the named webhook throw. */
    synchronized void failFor(String name, int times) {
        failuresLeft.put(name, times);
    }

    synchronized List<String> mutations() {
        return List.copyOf(mutations);
    }

    synchronized void clearMutations() {
        mutations.clear();
    }

    @Override
    public synchronized List<RemoteWebhook> list() {
        return List.copyOf(webhooks.values());
    }

    @Override
    public synchronized RemoteWebhook create(WebhookManifestEntry entry) {
        mutations.add("create " + entry.name());
        maybeFail(entry.name());
        RemoteWebhook created = RemoteWebhook.of(String.valueOf(ids.incrementAndGet()), entry);
        webhooks.put(created.remoteId(), created);
        return created;
    }

    @Override
    public synchronized RemoteWebhook update(String remoteId, WebhookManifestEntry entry) {
        mutations.add("update " + entry.name());
        maybeFail(entry.name());
        RemoteWebhook updated = RemoteWebhook.of(remoteId, entry);
        webhooks.put(remoteId, updated);
        return updated;
    }

    @Override
    public synchronized void delete(String remoteId) {
        RemoteWebhook existing = webhooks.get(remoteId);
        String name = existing == null ? remoteId : existing.name();
        mutations.add("delete " + name);
        maybeFail(name);
        webhooks.remove(remoteId);
    }

    private void maybeFail(String name) {
        Integer left = failuresLeft.get(name);
        if (left != null && left > 0) {
            failuresLeft.put(name, left - 1);
            throw new IllegalStateException("remote rejected " + name);
        }
    }
}
