package com.mailbridge.security.token;

/**
 * A bearer token failed one of the verification steps of {@link TokenVerifier}.
 */
public class TokenVerificationException extends RuntimeException {

    private final VerificationFailureReason reason;

    public TokenVerificationException(VerificationFailureReason reason, String message) {
        this(reason, message, null);
    }

    public TokenVerificationException(VerificationFailureReason reason, String message, Throwable cause) {
        super("JWT verification failed (" + reason.code() + "): " + message, cause);
        this.reason = reason;
    }

    public VerificationFailureReason reason() {
        return reason;
    }
}
