package com.mailbridge.security.token;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Permission names found in the {@value #CLAIM} claim of dashboard tokens.
 */
public final class AppPermissions {

    /** Claim listing the permissions of the dashboard user. */
    public static final String CLAIM = "user_permissions";

    public static final String MANAGE_APPS = "MANAGE_APPS";

    /** Required for every protected operation of the app. */
    public static final Set<String> BASELINE = Set.of(MANAGE_APPS);

    private AppPermissions() {
        // utility class
    }

    /**
     * The baseline plus the operation-specific permissions.
     */
    public static Set<String> required(Collection<String> operationPermissions) {
        Set<String> all = new LinkedHashSet<>(BASELINE);
        if (operationPermissions != null) {
            all.addAll(operationPermissions);
        }
        return Set.copyOf(all);
    }
}
