package com.mailbridge.security.token;

/**
 * Why a bearer token was rejected. Kept for logs and metrics; callers outside the service see a
 * single denial.
 */
public enum VerificationFailureReason {

    /** The token could not be decoded as a signed JWT. */
    MALFORMED("malformed"),

    /** No key of the tenant verifies the signature, or the token is outside its validity window. */
    BAD_SIGNATURE("bad-signature"),

    /** The token was issued for another application. */
    APP_MISMATCH("app-mismatch"),

    /** The token lacks a required permission. */
    INSUFFICIENT_PERMISSION("insufficient-permission");

    private final String code;

    VerificationFailureReason(String code) {
        this.code = code;
    }

    /** Stable lower-case code used in logs and metric tags. */
    public String code() {
        return code;
    }
}
