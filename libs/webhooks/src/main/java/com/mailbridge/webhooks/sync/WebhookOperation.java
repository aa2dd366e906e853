package com.mailbridge.webhooks.sync;

import java.util.Locale;

/** Kind of remote mutation performed during reconciliation. */
public enum WebhookOperation {
    CREATE,
    UPDATE,
    DELETE;

    /** Lower-case name used as metric tag. */
    public String tag() {
        return name().toLowerCase(Locale.ROOT);
    }
}
