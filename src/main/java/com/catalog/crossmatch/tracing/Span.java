package com.catalog.crossmatch.tracing;

/**
 * A traced stage of a cross-match run. Closing the span ends it.
 *
 * <p>Attribute keys used by the run loop are declared here so that exporters
 * and dashboards see one vocabulary. A round span typically carries:
 *
 * <pre>
 * try (Span span = tracingService.startSpan(TracingService.ROUND)) {
 *     span.setAttribute(Span.ROUND, 3);
 *     span.setAttribute(Span.ACCEPTED, 41);
 *     span.setAttribute(Span.RMS_RESIDUAL_ARCSEC, 0.82);
 *     span.setStatus(SpanStatus.OK);
 * }
 * </pre>
 */
public interface Span extends AutoCloseable {

    String RUN_ID = "crossmatch.run.id";
    String TARGETS = "crossmatch.targets";
    String REFERENCES = "crossmatch.references";
    String MATCHES = "crossmatch.matches";
    String ROUNDS = "crossmatch.rounds";
    String FINAL_STATE = "crossmatch.final_state";
    String ROUND = "crossmatch.round";
    String FORCED = "crossmatch.round.forced";
    String ACCEPTED = "crossmatch.round.accepted";
    String RMS_RESIDUAL_ARCSEC = "crossmatch.offset.rms_residual_arcsec";
    String FLUX_DEGREE = "crossmatch.flux.degree";
    String FLUX_FITTED_DEGREE = "crossmatch.flux.fitted_degree";
    String FLUX_POINTS = "crossmatch.flux.points";

    void setAttribute(String key, String value);

    void setAttribute(String key, long value);

    void setAttribute(String key, double value);

    void setStatus(SpanStatus status);

    void recordException(Throwable t);

    /**
     * Records the failure of the stage and marks the span as errored.
     */
    default void fail(Throwable t) {
        recordException(t);
        setStatus(SpanStatus.ERROR);
    }

    @Override
    void close();

    enum SpanStatus { OK, ERROR }
}
