package com.mailbridge.webhooks.manifest;

/**
 * Whether the tenant calls the webhook inside the triggering operation or from its queue.
 */
public enum DeliveryMode {
    SYNC,
    ASYNC
}
