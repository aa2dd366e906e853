package com.mailbridge.webhooks.manifest;

/**
 * Identity of a webhook subscription across desired and remote state.
 */
public record WebhookKey(String name, String targetUrl) {

    @Override
    public String toString() {
        return name + " -> " + targetUrl;
    }
}
