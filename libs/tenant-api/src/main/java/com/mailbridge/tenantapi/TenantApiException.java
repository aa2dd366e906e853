package com.mailbridge.tenantapi;

import java.util.List;
import java.util.Optional;

/**
 * A call to a tenant's GraphQL API failed: transport error, non-2xx status, or a response
 * carrying GraphQL errors.
 */
public class TenantApiException extends RuntimeException {

    private final Integer status;
    private final List<String> errors;

    public TenantApiException(String message, Integer status, List<String> errors, Throwable cause) {
        super(message, cause);
        this.status = status;
        this.errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public TenantApiException(String message, List<String> errors) {
        this(message, null, errors, null);
    }

    /** HTTP status of the failed call, when the tenant answered at all. */
    public Optional<Integer> status() {
        return Optional.ofNullable(status);
    }

    /** GraphQL error messages, or mutation error messages; empty for transport failures. */
    public List<String> errors() {
        return errors;
    }
}
