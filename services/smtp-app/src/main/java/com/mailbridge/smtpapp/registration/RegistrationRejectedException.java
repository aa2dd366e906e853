package com.mailbridge.smtpapp.registration;

import org.springframework.http.HttpStatus;

/** An installation attempt that this app refuses. */
public class RegistrationRejectedException extends RuntimeException {

    private final HttpStatus status;

    public RegistrationRejectedException(HttpStatus status, String message) {
        super(message);
        this.status = status;
    }

    public RegistrationRejectedException(HttpStatus status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    public HttpStatus status() {
        return status;
    }
}
