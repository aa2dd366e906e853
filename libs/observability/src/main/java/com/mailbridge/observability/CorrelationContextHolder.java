package com.mailbridge.observability;

import org.slf4j.MDC;

import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Thread-local holder for the current {@link CorrelationContext}, mirrored into SLF4J MDC.
 * <p>
 * Work handed to another thread (for example the webhook reconciliation pool) does not
 * inherit the context; wrap it with {@link #wrap(Runnable)} to carry it over.
 */
public final class CorrelationContextHolder {

    private static final ThreadLocal<CorrelationContext> CONTEXT = new ThreadLocal<>();

    private CorrelationContextHolder() {
        // utility class
    }

    /**
     * Sets the context for the current thread and populates MDC.
     *
     * @throws IllegalArgumentException if context is null
     */
    public static void set(CorrelationContext context) {
        if (context == null) {
            throw new IllegalArgumentException("context must not be null");
        }
        CONTEXT.set(context);
        populateMdc(context);
    }

    /** Returns the current thread's context, if any. */
    public static Optional<CorrelationContext> get() {
        return Optional.ofNullable(CONTEXT.get());
    }

    /**
     * Replaces the current context with an updated copy. Does nothing when no context is set.
     */
    public static void update(UnaryOperator<CorrelationContext> change) {
        CorrelationContext current = CONTEXT.get();
        if (current != null) {
            set(change.apply(current));
        }
    }

    /** Clears the context and every MDC key owned by this holder. */
    public static void clear() {
        CONTEXT.remove();
        MDC.remove(CorrelationContext.MDC_CORRELATION_ID);
        MDC.remove(CorrelationContext.MDC_TENANT_API_URL);
        MDC.remove(CorrelationContext.MDC_APP_ID);
        MDC.remove(CorrelationContext.MDC_REQUEST_ID);
        MDC.remove(CorrelationContext.MDC_SPAN_ID);
        MDC.remove(CorrelationContext.MDC_TRACE_ID);
    }

    /**
     * Runs the task with the given context and restores the previous one afterwards.
     */
    public static void runWithContext(CorrelationContext context, Runnable task) {
        CorrelationContext previous = CONTEXT.get();
        try {
            set(context);
            task.run();
        } finally {
            if (previous != null) {
                set(previous);
            } else {
                clear();
            }
        }
    }

    /**
     * Captures the calling thread's context so the task sees it on whichever thread runs it.
     * Returns the task unchanged when there is nothing to capture.
     */
    public static Runnable wrap(Runnable task) {
        CorrelationContext captured = CONTEXT.get();
        if (captured == null) {
            return task;
        }
        return () -> runWithContext(captured, task);
    }

    private static void populateMdc(CorrelationContext ctx) {
        putOrRemove(CorrelationContext.MDC_CORRELATION_ID, ctx.correlationId());
        putOrRemove(CorrelationContext.MDC_TENANT_API_URL, ctx.tenantApiUrl());
        putOrRemove(CorrelationContext.MDC_APP_ID, ctx.appId());
        putOrRemove(CorrelationContext.MDC_REQUEST_ID, ctx.requestId());
        putOrRemove(CorrelationContext.MDC_SPAN_ID, ctx.spanId());
        putOrRemove(CorrelationContext.MDC_TRACE_ID, ctx.traceId());
    }

    private static void putOrRemove(String key, String value) {
        if (value != null) {
            MDC.put(key, value);
        } else {
            MDC.remove(key);
        }
    }
}
