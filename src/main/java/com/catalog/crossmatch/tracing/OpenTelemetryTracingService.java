package com.catalog.crossmatch.tracing;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;

import java.util.Map;

/**
 * Exports the stages of a cross-match run as OpenTelemetry spans.
 *
 * <p>One run produces a {@value TracingService#RUN} span, an optional
 * {@value TracingService#FLUX_CALIBRATION} span, one {@value TracingService#ROUND}
 * span per round (the forced round carries {@link Span#FORCED}) and one
 * {@value TracingService#OFFSET_FIT} span per refit. Parent links follow the
 * current OpenTelemetry context of the calling thread.
 *
 * <p>A span that recorded an exception and is then marked as errored carries
 * the exception message as its status description.
 */
public class OpenTelemetryTracingService implements TracingService {

    public static final String INSTRUMENTATION_SCOPE = "com.catalog.crossmatch";

    private final Tracer tracer;

    public OpenTelemetryTracingService(Tracer tracer) {
        this.tracer = tracer;
    }

    /**
     * Uses the tracer registered under {@link #INSTRUMENTATION_SCOPE}.
     */
    public OpenTelemetryTracingService(OpenTelemetry openTelemetry) {
        this(openTelemetry.getTracer(INSTRUMENTATION_SCOPE));
    }

    @Override
    public Span startSpan(String operationName) {
        return startSpan(operationName, null);
    }

    @Override
    public Span startSpan(String operationName, Map<String, String> attributes) {
        SpanBuilder builder = tracer.spanBuilder(operationName);
        if (attributes != null) {
            attributes.forEach(builder::setAttribute);
        }
        return new StageSpan(builder.startSpan());
    }

    private static final class StageSpan implements Span {

        private final io.opentelemetry.api.trace.Span delegate;
        private String failure;

        StageSpan(io.opentelemetry.api.trace.Span delegate) {
            this.delegate = delegate;
        }

        @Override
        public void setAttribute(String key, String value) {
            delegate.setAttribute(key, value);
        }

        @Override
        public void setAttribute(String key, long value) {
            delegate.setAttribute(key, value);
        }

        @Override
        public void setAttribute(String key, double value) {
            delegate.setAttribute(key, value);
        }

        @Override
        public void setStatus(SpanStatus status) {
            if (status == SpanStatus.OK) {
                delegate.setStatus(StatusCode.OK);
            } else if (failure != null) {
                delegate.setStatus(StatusCode.ERROR, failure);
            } else {
                delegate.setStatus(StatusCode.ERROR);
            }
        }

        @Override
        public void recordException(Throwable t) {
            delegate.recordException(t);
            failure = t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
        }

        @Override
        public void close() {
            delegate.end();
        }
    }
}
