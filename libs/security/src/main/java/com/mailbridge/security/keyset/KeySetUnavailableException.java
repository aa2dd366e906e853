package com.mailbridge.security.keyset;

import java.net.URI;

/**
 * The key-set endpoint of a tenant could not be reached, answered with an error status, or
 * returned something that is not a key-set document. Usually transient; it is not retried here.
 */
public class KeySetUnavailableException extends RuntimeException {

    private final URI endpoint;

    public KeySetUnavailableException(URI endpoint, String reason, Throwable cause) {
        super("Key set unavailable at " + endpoint + ": " + reason, cause);
        this.endpoint = endpoint;
    }

    public URI endpoint() {
        return endpoint;
    }
}
