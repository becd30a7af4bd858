package com.catalog.crossmatch.metrics;

import com.catalog.crossmatch.core.model.MatchDecision;

import java.time.Duration;

/**
 * No-op implementation of {@link MetricsService}.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordRoundDuration(boolean forced, Duration duration) {
    }

    @Override
    public void incrementAccepted(MatchDecision decision, long count) {
    }

    @Override
    public void recordLikelihood(double rawLikelihood) {
    }

    @Override
    public void recordCandidateCount(int candidates) {
    }

    @Override
    public void recordSurfaceFit(String model, Duration duration) {
    }

    @Override
    public void recordLeftovers(int targets, int references) {
    }

    @Override
    public void incrementRunCompleted(String finalState) {
    }
}
