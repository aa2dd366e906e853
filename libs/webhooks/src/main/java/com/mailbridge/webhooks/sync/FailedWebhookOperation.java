package com.mailbridge.webhooks.sync;

import com.mailbridge.webhooks.manifest.WebhookKey;

/**
 * A mutation that still failed after all attempts.
 *
 * @param operation what was attempted
 * @param key       webhook the mutation targeted
 * @param remoteId  remote id for updates and deletes, null for creates
 * @param attempts  number of attempts made
 * @param error     message of the last failure
 */
public record FailedWebhookOperation(
        WebhookOperation operation,
        WebhookKey key,
        String remoteId,
        int attempts,
        String error
) {
}
