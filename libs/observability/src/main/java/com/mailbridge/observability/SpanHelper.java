package com.mailbridge.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanKind;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.util.Map;
import java.util.function.Supplier;

/**
 * Runs work inside an OpenTelemetry span tagged with the current correlation and tenant.
 * <p>
 * Only the API is used here; exporter and sampler set-up belong to the hosting service.
 * With the no-op tracer every call simply runs the work.
 */
public final class SpanHelper {

    private final Tracer tracer;

    public SpanHelper(Tracer tracer) {
        if (tracer == null) {
            throw new IllegalArgumentException("tracer must not be null");
        }
        this.tracer = tracer;
    }

    /**
     * Runs {@code work} in an internal span named {@code spanName}. Exceptions are recorded on
     * the span and rethrown unchanged.
     */
    public <T> T inSpan(String spanName, Map<String, String> attributes, Supplier<T> work) {
        var builder = tracer.spanBuilder(spanName).setSpanKind(SpanKind.INTERNAL);
        attributes.forEach(builder::setAttribute);
        Span span = builder.startSpan();

        CorrelationContextHolder.get().ifPresent(ctx -> {
            span.setAttribute("correlation.id", ctx.correlationId());
            if (ctx.tenantApiUrl() != null) {
                span.setAttribute("tenant.api_url", ctx.tenantApiUrl());
            }
            if (ctx.appId() != null) {
                span.setAttribute("app.id", ctx.appId());
            }
        });

        try (Scope ignored = span.makeCurrent()) {
            T result = work.get();
            span.setStatus(StatusCode.OK);
            return result;
        } catch (RuntimeException e) {
            span.setStatus(StatusCode.ERROR, e.getMessage());
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    /** Void variant of {@link #inSpan(String, Map, Supplier)}. */
    public void runInSpan(String spanName, Map<String, String> attributes, Runnable work) {
        inSpan(spanName, attributes, () -> {
            work.run();
            return null;
        });
    }
}
