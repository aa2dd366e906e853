package com.mailbridge.security.store;

/**
 * The auth data store could not read or write its backing storage.
 */
public class AuthDataStoreException extends RuntimeException {

    public AuthDataStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
