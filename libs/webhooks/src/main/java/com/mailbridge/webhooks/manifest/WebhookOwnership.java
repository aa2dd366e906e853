package com.mailbridge.webhooks.manifest;

import java.util.Set;

/**
 * Decides which remote webhooks this app created and may therefore delete.
 * <p>
 * A webhook is owned when its name is one the app can produce (regardless of which features
 * or configurations are currently enabled), or when it starts with the configured prefix.
 * Webhooks installed on the same app by anyone else are never owned.
 */
public final class WebhookOwnership {

    private final Set<String> names;
    private final String prefix;

    private WebhookOwnership(Set<String> names, String prefix) {
        this.names = Set.copyOf(names);
        this.prefix = prefix == null || prefix.isBlank() ? null : prefix;
    }

    public static WebhookOwnership ofNames(Set<String> names) {
        return new WebhookOwnership(names, null);
    }

    /**
     * @param prefix optional name prefix; null or blank disables prefix matching
     */
    public static WebhookOwnership of(Set<String> names, String prefix) {
        return new WebhookOwnership(names, prefix);
    }

    public boolean owns(String webhookName) {
        if (webhookName == null) {
            return false;
        }
        return names.contains(webhookName) || (prefix != null && webhookName.startsWith(prefix));
    }
}
