package com.mailbridge.webhooks.manifest;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Compares desired webhooks with the ones registered on the tenant.
 * <ul>
 *   <li>desired only: create</li>
 *   <li>both, with different event types, activity or delivery mode: update (full replace)</li>
 *   <li>remote only: delete, if owned</li>
 * </ul>
 * Entries are matched on {@link WebhookKey}. When the tenant has several webhooks with the same
 * key, the first one is matched and the others are surplus: deleted when owned, left alone
 * otherwise. Pure function; holds no state besides the ownership rule.
 */
public class WebhookManifestDiffer {

    private final WebhookOwnership ownership;

    public WebhookManifestDiffer(WebhookOwnership ownership) {
        this.ownership = ownership;
    }

    /**
     * @throws IllegalArgumentException if the desired manifest contains a key twice
     */
    public WebhookDiff diff(List<WebhookManifestEntry> desired, List<RemoteWebhook> actual) {
        Map<WebhookKey, WebhookManifestEntry> wanted = new LinkedHashMap<>();
        for (WebhookManifestEntry entry : desired) {
            if (wanted.putIfAbsent(entry.key(), entry) != null) {
                throw new IllegalArgumentException("Duplicate webhook in manifest: " + entry.key());
            }
        }

        List<WebhookUpdate> toUpdate = new ArrayList<>();
        List<RemoteWebhook> toDelete = new ArrayList<>();
        Set<WebhookKey> matched = new HashSet<>();

        for (RemoteWebhook remote : actual) {
            WebhookManifestEntry entry = wanted.get(remote.key());
            if (entry != null && matched.add(remote.key())) {
                if (!remote.matches(entry)) {
                    toUpdate.add(new WebhookUpdate(remote, entry));
                }
            } else if (ownership.owns(remote.name())) {
                toDelete.add(remote);
            }
        }

        List<WebhookManifestEntry> toCreate = wanted.values().stream()
                .filter(entry -> !matched.contains(entry.key()))
                .toList();
        return new WebhookDiff(toCreate, toUpdate, toDelete);
    }
}
