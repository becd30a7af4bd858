package com.catalog.crossmatch.metrics;

import com.catalog.crossmatch.core.model.MatchDecision;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code crossmatch.round.duration}: Timer (tag: forced)</li>
 *   <li>{@code crossmatch.matches.accepted}: Counter (tag: decision)</li>
 *   <li>{@code crossmatch.likelihood.raw}: DistributionSummary of accepted raw likelihoods</li>
 *   <li>{@code crossmatch.candidates}: DistributionSummary of candidate-set sizes</li>
 *   <li>{@code crossmatch.surface.fit.duration}: Timer (tag: model)</li>
 *   <li>{@code crossmatch.leftover.targets}, {@code crossmatch.leftover.references}: Gauges</li>
 *   <li>{@code crossmatch.runs}: Counter (tag: state)</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Timer> timerCache = new ConcurrentHashMap<>();
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final DistributionSummary likelihoodSummary;
    private final DistributionSummary candidateSummary;
    private final AtomicInteger leftoverTargets = new AtomicInteger();
    private final AtomicInteger leftoverReferences = new AtomicInteger();

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.likelihoodSummary = DistributionSummary.builder("crossmatch.likelihood.raw")
                .description("Raw likelihood of accepted matches")
                .register(registry);
        this.candidateSummary = DistributionSummary.builder("crossmatch.candidates")
                .description("Candidate-set size per evaluated target source")
                .register(registry);
        Gauge.builder("crossmatch.leftover.targets", leftoverTargets, AtomicInteger::get)
                .description("Unmatched target sources after the latest round")
                .register(registry);
        Gauge.builder("crossmatch.leftover.references", leftoverReferences, AtomicInteger::get)
                .description("Unmatched reference sources after the latest round")
                .register(registry);
    }

    @Override
    public void recordRoundDuration(boolean forced, Duration duration) {
        String key = "round:" + forced;
        Timer timer = timerCache.computeIfAbsent(key, k ->
                Timer.builder("crossmatch.round.duration")
                        .description("Duration of one matching round")
                        .tag("forced", Boolean.toString(forced))
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void incrementAccepted(MatchDecision decision, long count) {
        String key = "accepted:" + decision.name();
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("crossmatch.matches.accepted")
                        .description("Number of accepted matches")
                        .tag("decision", decision.name())
                        .register(registry));
        counter.increment(count);
    }

    @Override
    public void recordLikelihood(double rawLikelihood) {
        likelihoodSummary.record(rawLikelihood);
    }

    @Override
    public void recordCandidateCount(int candidates) {
        candidateSummary.record(candidates);
    }

    @Override
    public void recordSurfaceFit(String model, Duration duration) {
        String key = "fit:" + model;
        Timer timer = timerCache.computeIfAbsent(key, k ->
                Timer.builder("crossmatch.surface.fit.duration")
                        .description("Duration of surface model fits")
                        .tag("model", model)
                        .register(registry));
        timer.record(duration);
    }

    @Override
    public void recordLeftovers(int targets, int references) {
        leftoverTargets.set(targets);
        leftoverReferences.set(references);
    }

    @Override
    public void incrementRunCompleted(String finalState) {
        String key = "runs:" + finalState;
        Counter counter = counterCache.computeIfAbsent(key, k ->
                Counter.builder("crossmatch.runs")
                        .description("Completed cross-match runs by final state")
                        .tag("state", finalState)
                        .register(registry));
        counter.increment();
    }
}
