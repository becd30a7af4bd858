package com.catalog.crossmatch.metrics;

import com.catalog.crossmatch.core.model.MatchDecision;

import java.time.Duration;

/**
 * Records cross-match metrics.
 * The default {@link NoOpMetricsService} does nothing, so the library runs without a
 * metrics backend.
 */
public interface MetricsService {

    void recordRoundDuration(boolean forced, Duration duration);

    void incrementAccepted(MatchDecision decision, long count);

    void recordLikelihood(double rawLikelihood);

    void recordCandidateCount(int candidates);

    void recordSurfaceFit(String model, Duration duration);

    void recordLeftovers(int targets, int references);

    void incrementRunCompleted(String finalState);
}
