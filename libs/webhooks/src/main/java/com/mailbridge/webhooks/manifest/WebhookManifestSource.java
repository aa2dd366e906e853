package com.mailbridge.webhooks.manifest;

import java.util.List;

/**
 * Supplies the webhooks the app wants on one tenant, computed from its current configuration
 * and feature flags. Entries left out because a feature is disabled are simply absent.
 */
public interface WebhookManifestSource {

    List<WebhookManifestEntry> desiredManifest();

    /** Which remote webhooks the reconciliation may delete. */
    WebhookOwnership ownership();
}
