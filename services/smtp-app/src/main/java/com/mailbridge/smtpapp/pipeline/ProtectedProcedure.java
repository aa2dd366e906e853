package com.mailbridge.smtpapp.pipeline;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a handler method (or every handler of a controller) as a protected procedure: the
 * request runs through the {@link ProcedurePipeline} before the handler is invoked.
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target({ElementType.METHOD, ElementType.TYPE})
public @interface ProtectedProcedure {

    /** Permissions the caller's token must grant on top of {@code MANAGE_APPS}. */
    String[] requiredPermissions() default {};

    /** Reconcile the tenant's webhooks after the handler completes successfully. */
    boolean updatesWebhooks() default false;
}
