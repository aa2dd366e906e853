package com.mailbridge.smtpapp.pipeline;

/**
 * Thrown by the HTTP adapter when the pipeline refuses a request.
 */
public class ProcedureRejectedException extends RuntimeException {

    private final ProcedureFailure failure;

    public ProcedureRejectedException(ProcedureFailure failure) {
        super(failure.kind() + ": " + failure.message());
        this.failure = failure;
    }

    public ProcedureFailure failure() {
        return failure;
    }
}
