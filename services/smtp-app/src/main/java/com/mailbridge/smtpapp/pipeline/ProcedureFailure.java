package com.mailbridge.smtpapp.pipeline;

/**
 * Why a stage terminated the request.
 *
 * @param kind what the caller is told
 * @param message detail safe to return to the caller
 */
public record ProcedureFailure(FailureKind kind, String message) {

    public ProcedureFailure {
        if (kind == null) {
            throw new IllegalArgumentException("kind must not be null");
        }
    }
}
