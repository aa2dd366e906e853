package com.mailbridge.smtpapp.pipeline;

/**
 * Outcome of a {@link ProcedureStage}: exactly one of the extended context or a failure.
 */
public record StageResult(ProcedureContext context, ProcedureFailure failure) {

    public StageResult {
        if ((context == null) == (failure == null)) {
            throw new IllegalArgumentException("exactly one of context and failure must be set");
        }
    }

    public static StageResult proceed(ProcedureContext context) {
        return new StageResult(context, null);
    }

    public static StageResult fail(FailureKind kind, String message) {
        return new StageResult(null, new ProcedureFailure(kind, message));
    }

    public boolean isFailure() {
        return failure != null;
    }
}
