package com.catalog.crossmatch.tracing;

import java.util.Map;

/**
 * Tracing disabled. Every stage shares one inert span.
 */
public class NoOpTracingService implements TracingService {

    static final Span INERT = new InertSpan();

    @Override
    public Span startSpan(String operationName) {
        return INERT;
    }

    @Override
    public Span startSpan(String operationName, Map<String, String> attributes) {
        return INERT;
    }

    private static final class InertSpan implements Span {
        @Override
        public void setAttribute(String key, String value) {
        }

        @Override
        public void setAttribute(String key, long value) {
        }

        @Override
        public void setAttribute(String key, double value) {
        }

        @Override
        public void setStatus(SpanStatus status) {
        }

        @Override
        public void recordException(Throwable t) {
        }

        @Override
        public void close() {
        }
    }
}
