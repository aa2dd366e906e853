package com.mailbridge.smtpapp.pipeline;

/**
 * One step of the protected procedure pipeline. Stages return a failure instead of throwing for
 * every expected rejection; an exception means something unexpected broke.
 */
@FunctionalInterface
public interface ProcedureStage {

    StageResult apply(ProcedureContext context);

    /** Name used in logs. */
    default String name() {
        return getClass().getSimpleName();
    }
}
