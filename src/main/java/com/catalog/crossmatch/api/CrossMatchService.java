package com.catalog.crossmatch.api;

import com.catalog.crossmatch.core.model.AcceptedMatch;
import com.catalog.crossmatch.core.model.Catalogue;
import com.catalog.crossmatch.core.model.MatchDecision;
import com.catalog.crossmatch.core.model.SourceRecord;
import com.catalog.crossmatch.correction.FluxCalibrationModel;
import com.catalog.crossmatch.correction.FluxCalibrationModeler;
import com.catalog.crossmatch.correction.OffsetCorrectionModel;
import com.catalog.crossmatch.correction.OffsetCorrectionModeler;
import com.catalog.crossmatch.correction.OffsetDiagnostics;
import com.catalog.crossmatch.decision.AcceptanceRule;
import com.catalog.crossmatch.decision.DecisionLedger;
import com.catalog.crossmatch.decision.DecisionOutcome;
import com.catalog.crossmatch.likelihood.GaussianLikelihoodScorer;
import com.catalog.crossmatch.likelihood.UncertaintyCombiner;
import com.catalog.crossmatch.logging.LogContext;
import com.catalog.crossmatch.matching.MatchingRound;
import com.catalog.crossmatch.matching.RoundOutcome;
import com.catalog.crossmatch.matching.SourcePool;
import com.catalog.crossmatch.metrics.MetricsService;
import com.catalog.crossmatch.normalize.RaWrapNormalizer;
import com.catalog.crossmatch.normalize.ReferencePreFilter;
import com.catalog.crossmatch.normalize.UncertaintyValidator;
import com.catalog.crossmatch.tracing.Span;
import com.catalog.crossmatch.tracing.TracingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.function.IntPredicate;

/**
 * Runs the cross-match convergence loop.
 *
 * <ol>
 *   <li>validate uncertainties, make the field contiguous across RA 0/360, pre-filter the
 *       reference catalogue</li>
 *   <li>optionally fit the flux-calibration model and rescale target fluxes</li>
 *   <li>match round after round, refitting the offset model on all matches so far and
 *       repositioning the unmatched target sources, until a round accepts nothing</li>
 *   <li>optionally run one forced round with zero thresholds</li>
 * </ol>
 *
 * <p>Pools only change between rounds, so a run interrupted between rounds stops with a
 * consistent partial result.</p>
 */
public class CrossMatchService {
    private static final Logger log = LoggerFactory.getLogger(CrossMatchService.class);

    private final MetricsService metricsService;
    private final TracingService tracingService;
    private final ExecutorService executor;

    /**
     * @param executor executor for parallel scoring, or null to score on the calling thread
     */
    public CrossMatchService(MetricsService metricsService, TracingService tracingService, ExecutorService executor) {
        this.metricsService = metricsService;
        this.tracingService = tracingService;
        this.executor = executor;
    }

    public CrossMatchResult run(Catalogue target, Catalogue reference, CrossMatchOptions options,
                                RoundListener listener) {
        String runId = LogContext.generateRunId();
        RoundListener rl = listener != null ? listener : RoundListener.NOOP;
        long started = System.nanoTime();

        try (LogContext ctx = LogContext.forRun(runId);
             Span span = tracingService.startSpan(TracingService.RUN, Map.of(Span.RUN_ID, runId))) {
            span.setAttribute(Span.TARGETS, target.size());
            span.setAttribute(Span.REFERENCES, reference.size());
            log.info("crossmatch.run.started targets={} references={} options={}",
                    target.size(), reference.size(), options);
            try {
                CrossMatchResult result = execute(runId, target, reference, options, rl, started);
                span.setAttribute(Span.MATCHES, result.getMatches().size());
                span.setAttribute(Span.ROUNDS, result.getRoundCount());
                span.setAttribute(Span.FINAL_STATE, result.getFinalState().name());
                span.setStatus(Span.SpanStatus.OK);
                metricsService.incrementRunCompleted(result.getFinalState().name());
                log.info("crossmatch.run.completed result={}", result);
                return result;
            } catch (RuntimeException e) {
                span.fail(e);
                log.error("crossmatch.run.failed reason={}", e.getMessage());
                throw e;
            }
        }
    }

    private CrossMatchResult execute(String runId, Catalogue target, Catalogue reference,
                                     CrossMatchOptions options, RoundListener listener, long started) {
        UncertaintyValidator.validate(target, reference, options.isFluxMatching());

        RaWrapNormalizer.Result wrapped = RaWrapNormalizer.normalize(target, reference);
        Catalogue targets = wrapped.target();
        Catalogue references = wrapped.reference();
        if (options.isReferencePreFilter()) {
            references = ReferencePreFilter.filter(targets, references, options.searchRadiusDeg());
        }

        FluxCalibrationModel fluxModel = null;
        List<SourceRecord> targetSources = targets.getSources();
        if (options.isFluxModel()) {
            fluxModel = calibrateFluxes(targetSources, references.getSources(), options);
            targetSources = fluxModel.apply(targetSources);
        }

        SourcePool targetPool = SourcePool.of(targetSources);
        SourcePool referencePool = SourcePool.of(references.getSources());
        MatchingRound matchingRound = new MatchingRound(
                new GaussianLikelihoodScorer(options.isFluxMatching()), options.searchRadiusDeg(),
                executor, options.getParallelism());
        AcceptanceRule rule = new AcceptanceRule(options.getSingleMatchThreshold(),
                options.getMultipleMatchThreshold(), options.getNegligibleLikelihood());
        OffsetCorrectionModeler offsetModeler = new OffsetCorrectionModeler(options.getOffsetSmoothing());

        DecisionLedger ledger = new DecisionLedger();
        List<AcceptedMatch> matches = new ArrayList<>();
        List<RoundSummary> summaries = new ArrayList<>();
        ConvergenceState state = ConvergenceState.SEEDING;
        listener.onStateChanged(null, state);

        int round = 1;
        while (!state.isTerminal()) {
            if (targetPool.isEmpty() || referencePool.isEmpty()) {
                state = transition(listener, state, ConvergenceState.CONVERGED);
                break;
            }
            if (round > options.getMaxRounds()) {
                log.warn("crossmatch.run.maxRounds rounds={} leftoverTargets={}; returning partial results",
                        options.getMaxRounds(), targetPool.size());
                state = transition(listener, state, ConvergenceState.MAX_ROUNDS_REACHED);
                break;
            }
            if (Thread.currentThread().isInterrupted()) {
                log.warn("crossmatch.run.cancelled afterRounds={}", round - 1);
                state = transition(listener, state, ConvergenceState.CANCELLED);
                break;
            }

            IntPredicate eligible = state == ConvergenceState.SEEDING && options.isSnrRestriction()
                    ? seedingFilter(targetPool, options.getSnrCutoff())
                    : i -> true;
            state = transition(listener, state, ConvergenceState.MATCHING);

            long roundStarted = System.nanoTime();
            try (LogContext rc = LogContext.forRound(round);
                 Span span = tracingService.startSpan(TracingService.ROUND)) {
                span.setAttribute(Span.ROUND, round);
                RoundOutcome outcome = matchingRound.execute(round, targetPool, referencePool, eligible, rule);
                record(outcome, ledger, matches);
                targetPool = targetPool.without(outcome.acceptedTargetIndices());
                referencePool = referencePool.without(outcome.acceptedReferenceIndices());
                span.setAttribute(Span.ACCEPTED, outcome.acceptedCount());

                state = transition(listener, state, ConvergenceState.CORRECTING);
                OffsetDiagnostics diagnostics = null;
                if (!outcome.hasAcceptances()) {
                    if (round == 1) {
                        log.warn("crossmatch.seeding.empty; no target source matched in the first round");
                    }
                    state = transition(listener, state, ConvergenceState.CONVERGED);
                } else {
                    OffsetCorrectionModel model = fitOffsets(offsetModeler, matches);
                    diagnostics = OffsetDiagnostics.of(round, model, matches);
                    targetPool = targetPool.withPositions(model.correctAll(targetPool.sources()));
                    span.setAttribute(Span.RMS_RESIDUAL_ARCSEC, diagnostics.rmsResidualArcsec());
                }
                summaries.add(summarize(outcome, false, targetPool, referencePool, roundStarted, diagnostics,
                        listener));
                span.setStatus(Span.SpanStatus.OK);
            }
            round++;
        }

        if (state == ConvergenceState.CONVERGED && options.isForceFinalRound()
                && !targetPool.isEmpty() && !referencePool.isEmpty()) {
            long roundStarted = System.nanoTime();
            try (LogContext rc = LogContext.forRound(round).with(LogContext.STAGE, "forced");
                 Span span = tracingService.startSpan(TracingService.ROUND, Map.of(Span.FORCED, "true"))) {
                span.setAttribute(Span.ROUND, round);
                RoundOutcome outcome = matchingRound.execute(round, targetPool, referencePool, i -> true,
                        AcceptanceRule.forced(options.getNegligibleLikelihood()));
                record(outcome, ledger, matches);
                targetPool = targetPool.without(outcome.acceptedTargetIndices());
                referencePool = referencePool.without(outcome.acceptedReferenceIndices());
                span.setAttribute(Span.ACCEPTED, outcome.acceptedCount());
                summaries.add(summarize(outcome, true, targetPool, referencePool, roundStarted, null, listener));
                log.info("crossmatch.round.forced round={} accepted={}", round, outcome.acceptedCount());
            }
        }

        return CrossMatchResult.builder()
                .runId(runId)
                .matches(matches)
                .leftoverReferences(referencePool.sources())
                .leftoverTargetsCorrected(targetPool.workingSources())
                .leftoverTargetsOriginal(targetPool.sources())
                .rounds(summaries)
                .finalState(state)
                .raWrapped(wrapped.wrapped())
                .fluxCalibration(fluxModel)
                .ledger(ledger)
                .duration(Duration.ofNanos(System.nanoTime() - started))
                .build();
    }

    private FluxCalibrationModel calibrateFluxes(List<SourceRecord> targets, List<SourceRecord> references,
                                                 CrossMatchOptions options) {
        FluxCalibrationModeler modeler = new FluxCalibrationModeler(options.getFluxModelDegree(),
                options.getSnrCutoff(), options.fluxCalibrationRadiusDeg(), options.getFluxModelFallback());
        long fitStarted = System.nanoTime();
        try (LogContext ctx = LogContext.forStage("flux-calibration");
             Span span = tracingService.startSpan(TracingService.FLUX_CALIBRATION)) {
            span.setAttribute(Span.FLUX_DEGREE, options.getFluxModelDegree());
            try {
                FluxCalibrationModel model = modeler.fit(targets, references);
                span.setAttribute(Span.FLUX_POINTS, model.getPoints().size());
                span.setAttribute(Span.FLUX_FITTED_DEGREE, model.getDegree());
                span.setStatus(Span.SpanStatus.OK);
                return model;
            } catch (RuntimeException e) {
                span.fail(e);
                throw e;
            }
        } finally {
            metricsService.recordSurfaceFit("flux-polynomial", Duration.ofNanos(System.nanoTime() - fitStarted));
        }
    }

    private OffsetCorrectionModel fitOffsets(OffsetCorrectionModeler modeler, List<AcceptedMatch> matches) {
        long fitStarted = System.nanoTime();
        try (Span span = tracingService.startSpan(TracingService.OFFSET_FIT)) {
            span.setAttribute(Span.MATCHES, matches.size());
            OffsetCorrectionModel model = modeler.fit(matches);
            span.setStatus(Span.SpanStatus.OK);
            return model;
        } finally {
            metricsService.recordSurfaceFit(modeler.getFitter().getName(),
                    Duration.ofNanos(System.nanoTime() - fitStarted));
        }
    }

    private void record(RoundOutcome outcome, DecisionLedger ledger, List<AcceptedMatch> matches) {
        ledger.recordAll(outcome.decisions());
        matches.addAll(outcome.accepted());
        Map<MatchDecision, Long> byDecision = new EnumMap<>(MatchDecision.class);
        for (AcceptedMatch m : outcome.accepted()) {
            byDecision.merge(m.getDecision(), 1L, Long::sum);
            metricsService.recordLikelihood(m.getRawLikelihood());
        }
        byDecision.forEach(metricsService::incrementAccepted);
        outcome.candidateSetSizes().forEach((size, count) -> {
            for (long i = 0; i < count; i++) {
                metricsService.recordCandidateCount(size);
            }
        });
    }

    private RoundSummary summarize(RoundOutcome outcome, boolean forced, SourcePool targets, SourcePool references,
                                   long roundStarted, OffsetDiagnostics diagnostics, RoundListener listener) {
        Duration duration = Duration.ofNanos(System.nanoTime() - roundStarted);
        int conflicts = (int) outcome.decisions().stream()
                .filter(d -> d.getOutcome() == DecisionOutcome.CONFLICT_DEFERRED)
                .count();
        RoundSummary summary = new RoundSummary(outcome.round(), forced, outcome.evaluated(),
                outcome.acceptedCount(), conflicts, targets.size(), references.size(),
                outcome.candidateSetSizes(), duration, diagnostics);
        metricsService.recordRoundDuration(forced, duration);
        metricsService.recordLeftovers(targets.size(), references.size());
        log.info("crossmatch.round.completed round={} evaluated={} accepted={} leftoverTargets={} leftoverReferences={}",
                summary.round(), summary.evaluated(), summary.accepted(),
                summary.leftoverTargets(), summary.leftoverReferences());
        listener.onRoundCompleted(summary);
        return summary;
    }

    private static IntPredicate seedingFilter(SourcePool targets, double cutoff) {
        boolean[] eligible = new boolean[targets.size()];
        int count = 0;
        for (int i = 0; i < eligible.length; i++) {
            eligible[i] = UncertaintyCombiner.signalToNoise(targets.source(i)) >= cutoff;
            if (eligible[i]) {
                count++;
            }
        }
        log.info("crossmatch.seeding eligible={} of {} snrCutoff={}", count, eligible.length, cutoff);
        return i -> eligible[i];
    }

    private static ConvergenceState transition(RoundListener listener, ConvergenceState from, ConvergenceState to) {
        if (from != to) {
            log.debug("crossmatch.state {} -> {}", from, to);
            listener.onStateChanged(from, to);
        }
        return to;
    }
}
