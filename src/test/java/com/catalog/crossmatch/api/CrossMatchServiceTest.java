package com.catalog.crossmatch.api;

import com.catalog.crossmatch.core.model.AcceptedMatch;
import com.catalog.crossmatch.core.model.Catalogue;
import com.catalog.crossmatch.core.model.MatchDecision;
import com.catalog.crossmatch.core.model.SourceRecord;
import com.catalog.crossmatch.decision.DecisionOutcome;
import com.catalog.crossmatch.error.CatalogueValidationException;
import com.catalog.crossmatch.error.InsufficientCalibrationDataException;
import com.catalog.crossmatch.metrics.NoOpMetricsService;
import com.catalog.crossmatch.tracing.NoOpTracingService;
import com.catalog.crossmatch.tracing.Span;
import com.catalog.crossmatch.tracing.TracingService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static com.catalog.crossmatch.SourceFixtures.reference;
import static com.catalog.crossmatch.SourceFixtures.source;
import static com.catalog.crossmatch.SourceFixtures.target;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@DisplayName("CrossMatchService Tests")
class CrossMatchServiceTest {

    private CrossMatchService service;

    @BeforeEach
    void setUp() {
        service = new CrossMatchService(new NoOpMetricsService(), new NoOpTracingService(), null);
    }

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    static Map<String, String> pairs(CrossMatchResult result) {
        return result.getMatches().stream()
                .collect(Collectors.toMap(m -> m.getTarget().getUuid(), m -> m.getReference().getUuid()));
    }

    static SourceRecord noisy(String uuid, double ra, double dec, double peakFlux, double rms) {
        return SourceRecord.builder(source(uuid, ra, dec, peakFlux))
                .errPeakFlux(rms)
                .localRms(rms)
                .build();
    }

    /**
     * One wide-beam seed pair plus two narrow-beam targets sitting exactly between their
     * counterpart and a decoy, all displaced by +0.008 degrees in declination.
     */
    static Catalogue[] displacedField() {
        SourceRecord seedTarget = SourceRecord.builder(source("t-seed", 20.0, 0.008)).psfA(360.0).build();
        SourceRecord seedReference = SourceRecord.builder(source("r-seed", 20.0, 0.0)).psfA(360.0).build();
        Catalogue targets = target(List.of(
                seedTarget,
                source("t-1", 21.0, 0.008),
                source("t-2", 21.5, 0.008)));
        Catalogue references = reference(List.of(
                seedReference,
                source("r-1", 21.0, 0.0),
                source("d-1", 21.0, 0.016),
                source("r-2", 21.5, 0.0),
                source("d-2", 21.5, 0.016)));
        return new Catalogue[]{targets, references};
    }

    @Nested
    @DisplayName("Convergence")
    class ConvergenceTests {

        @Test
        @DisplayName("Identical catalogues should converge in one round with every source matched")
        void identicalCataloguesConvergeInOneRound() {
            Catalogue targets = target(List.of(
                    source("t-1", 20.0, 0.0),
                    source("t-2", 20.5, 0.5),
                    source("t-3", 21.0, -0.5)));
            Catalogue references = reference(List.of(
                    source("r-1", 20.0, 0.00001),
                    source("r-2", 20.50001, 0.5),
                    source("r-3", 21.0, -0.5)));

            CrossMatchResult result = service.run(targets, references, CrossMatchOptions.defaults(), null);

            assertEquals(ConvergenceState.CONVERGED, result.getFinalState());
            assertTrue(result.isConverged());
            assertEquals(1, result.getRoundCount());
            assertEquals(Map.of("t-1", "r-1", "t-2", "r-2", "t-3", "r-3"), pairs(result));
            for (AcceptedMatch match : result.getMatches()) {
                assertEquals(1.0, match.getRawLikelihood(), 1e-3);
                assertEquals(MatchDecision.SINGLE_CANDIDATE, match.getDecision());
                assertEquals(1, match.getRound());
            }
            assertTrue(result.getLeftoverTargetsOriginal().isEmpty());
            assertTrue(result.getLeftoverTargetsCorrected().isEmpty());
            assertTrue(result.getLeftoverReferences().isEmpty());
            assertFalse(result.isRaWrapped());
        }

        @Test
        @DisplayName("The better of two candidates should be accepted on its normalized likelihood")
        void twoCandidatesNormalizedAcceptance() {
            double marginal = Math.sqrt(0.0004 * Math.log(9.0));
            Catalogue targets = target(List.of(source("t-1", 20.0, 0.0)));
            Catalogue references = reference(List.of(
                    source("r-close", 20.0, 0.0),
                    source("r-marginal", 20.0, marginal)));

            CrossMatchResult result = service.run(targets, references, CrossMatchOptions.defaults(), null);

            assertEquals(1, result.getMatches().size());
            AcceptedMatch match = result.getMatches().get(0);
            assertEquals("r-close", match.getReference().getUuid());
            assertEquals(MatchDecision.MULTIPLE_CANDIDATES, match.getDecision());
            assertEquals(2, match.getCandidateCount());
            assertEquals(0.9, match.getNormalizedLikelihood().doubleValue(), 1e-6);
            assertEquals(List.of("r-marginal"),
                    result.getLeftoverReferences().stream().map(SourceRecord::getUuid).toList());
        }

        @Test
        @DisplayName("A displaced field should be recovered over several rounds")
        void displacedFieldRecoveredOverRounds() {
            Catalogue[] field = displacedField();

            CrossMatchResult result = service.run(field[0], field[1], CrossMatchOptions.defaults(), null);

            assertEquals(ConvergenceState.CONVERGED, result.getFinalState());
            assertEquals(2, result.getRoundCount());
            assertEquals(Map.of("t-seed", "r-seed", "t-1", "r-1", "t-2", "r-2"), pairs(result));

            AcceptedMatch recovered = result.getMatches().stream()
                    .filter(m -> m.getTarget().getUuid().equals("t-1"))
                    .findFirst().orElseThrow();
            assertEquals(2, recovered.getRound());
            assertEquals(MatchDecision.MULTIPLE_CANDIDATES, recovered.getDecision());
            assertEquals(0.0, recovered.getCorrectedTargetPosition().dec(), 1e-9);
            assertEquals(0.008, recovered.getTarget().getDec(), 1e-12);

            List<String> decoys = result.getLeftoverReferences().stream().map(SourceRecord::getUuid).sorted().toList();
            assertEquals(List.of("d-1", "d-2"), decoys);
            assertEquals(2, result.getOffsetDiagnostics().size());
        }

        @Test
        @DisplayName("Unmatched pools should only shrink and no source should be matched twice")
        void poolsShrinkMonotonically() {
            Catalogue[] field = displacedField();

            CrossMatchResult result = service.run(field[0], field[1], CrossMatchOptions.defaults(), null);

            int previousTargets = field[0].size();
            int previousReferences = field[1].size();
            for (RoundSummary round : result.getRounds()) {
                assertTrue(round.leftoverTargets() <= previousTargets);
                assertTrue(round.leftoverReferences() <= previousReferences);
                assertEquals(previousTargets - round.accepted(), round.leftoverTargets());
                previousTargets = round.leftoverTargets();
                previousReferences = round.leftoverReferences();
            }
            long distinctReferences = result.getMatches().stream()
                    .map(m -> m.getReference().getUuid()).distinct().count();
            assertEquals(result.getMatches().size(), distinctReferences);
            assertEquals(field[1].size(), result.getMatches().size() + result.getLeftoverReferences().size());
        }

        @Test
        @DisplayName("No acceptance in the first round should converge with nothing matched")
        void nothingMatchedConverges() {
            Catalogue targets = target(List.of(source("t-1", 20.0, 0.0)));
            Catalogue references = reference(List.of(source("r-1", 20.0, 0.015)));

            CrossMatchResult result = service.run(targets, references, CrossMatchOptions.defaults(), null);

            assertEquals(ConvergenceState.CONVERGED, result.getFinalState());
            assertTrue(result.getMatches().isEmpty());
            assertEquals(1, result.getRoundCount());
            assertEquals(1, result.getLeftoverTargetsOriginal().size());
            assertEquals(List.of(DecisionOutcome.BELOW_THRESHOLD),
                    result.getLedger().getAll().stream().map(d -> d.getOutcome()).toList());
        }

        @Test
        @DisplayName("An empty reference catalogue should converge without rounds")
        void emptyReferenceConverges() {
            CrossMatchResult result = service.run(target(List.of(source("t-1", 20.0, 0.0))),
                    reference(List.of()), CrossMatchOptions.builder().referencePreFilter(false).build(), null);

            assertEquals(ConvergenceState.CONVERGED, result.getFinalState());
            assertEquals(0, result.getRoundCount());
            assertEquals(1, result.getLeftoverTargetsOriginal().size());
        }
    }

    @Nested
    @DisplayName("Seeding")
    class SeedingTests {

        private final Catalogue targets = target(List.of(
                source("t-bright", 20.0, 0.0),
                noisy("t-faint", 21.0, 0.0, 1.0, 0.5)));
        private final Catalogue references = reference(List.of(
                source("r-bright", 20.0, 0.0),
                noisy("r-faint", 21.0, 0.0, 1.0, 0.5)));

        @Test
        @DisplayName("Low-SNR targets should wait until the second round")
        void lowSnrTargetsDeferred() {
            CrossMatchResult result = service.run(targets, references, CrossMatchOptions.defaults(), null);

            Map<String, Integer> roundByTarget = result.getMatches().stream()
                    .collect(Collectors.toMap(m -> m.getTarget().getUuid(), AcceptedMatch::getRound));
            assertEquals(Map.of("t-bright", 1, "t-faint", 2), roundByTarget);
            assertEquals(1, result.getRounds().get(0).evaluated());
        }

        @Test
        @DisplayName("Without the SNR restriction every target is eligible in the first round")
        void restrictionDisabled() {
            CrossMatchOptions options = CrossMatchOptions.builder().snrRestriction(false).build();

            CrossMatchResult result = service.run(targets, references, options, null);

            assertTrue(result.getMatches().stream().allMatch(m -> m.getRound() == 1));
            assertEquals(2, result.getMatches().size());
        }

        @Test
        @DisplayName("The round limit should return partial results")
        void maxRoundsReached() {
            CrossMatchOptions options = CrossMatchOptions.builder().maxRounds(1).build();

            CrossMatchResult result = service.run(targets, references, options, null);

            assertEquals(ConvergenceState.MAX_ROUNDS_REACHED, result.getFinalState());
            assertFalse(result.isConverged());
            assertEquals(Map.of("t-bright", "r-bright"), pairs(result));
            assertEquals(List.of("t-faint"),
                    result.getLeftoverTargetsOriginal().stream().map(SourceRecord::getUuid).toList());
        }

        @Test
        @DisplayName("An interrupt between rounds should cancel with a consistent partial result")
        void interruptCancelsBetweenRounds() {
            RoundListener interrupting = summary -> Thread.currentThread().interrupt();

            CrossMatchResult result = service.run(targets, references, CrossMatchOptions.defaults(), interrupting);

            assertEquals(ConvergenceState.CANCELLED, result.getFinalState());
            assertEquals(1, result.getRoundCount());
            assertEquals(Map.of("t-bright", "r-bright"), pairs(result));
            assertEquals(1, result.getLeftoverTargetsOriginal().size());
            assertEquals(1, result.getLeftoverReferences().size());
        }
    }

    @Nested
    @DisplayName("Flux handling")
    class FluxTests {

        @Test
        @DisplayName("Slightly mismatched fluxes should give the same pairing with flux matching on or off")
        void sameNearestNeighbourPairing() {
            Catalogue targets = target(List.of(source("t-1", 20.0, 0.0, 1.004), source("t-2", 21.0, 0.0, 2.008)));
            Catalogue references = reference(List.of(source("r-1", 20.0, 0.0, 1.0), source("r-2", 21.0, 0.0, 2.0)));

            CrossMatchResult withFlux = service.run(targets, references, CrossMatchOptions.defaults(), null);
            CrossMatchResult positional = service.run(targets, references, CrossMatchOptions.positionalOnly(), null);

            assertEquals(pairs(withFlux), pairs(positional));
            assertEquals(2, pairs(positional).size());
            for (AcceptedMatch match : withFlux.getMatches()) {
                assertTrue(match.getRawLikelihood() < 1.0);
            }
            for (AcceptedMatch match : positional.getMatches()) {
                assertEquals(1.0, match.getRawLikelihood(), 1e-12);
            }
        }

        @Test
        @DisplayName("Flux matching should rule out a coincident source of very different flux")
        void fluxMismatchRulesOutCandidate() {
            Catalogue targets = target(List.of(source("t-1", 20.0, 0.0, 1.0)));
            Catalogue references = reference(List.of(
                    source("r-bright", 20.0, 0.0, 2.0),
                    source("r-same", 20.0, 0.003, 1.0)));

            CrossMatchResult withFlux = service.run(targets, references, CrossMatchOptions.defaults(), null);
            CrossMatchResult positional = service.run(targets, references, CrossMatchOptions.positionalOnly(), null);

            assertEquals(Map.of("t-1", "r-same"), pairs(withFlux));
            assertEquals(MatchDecision.SINGLE_CANDIDATE, withFlux.getMatches().get(0).getDecision());
            assertTrue(positional.getMatches().isEmpty());
        }

        @Test
        @DisplayName("The flux-calibration model should rescale target fluxes before matching")
        void fluxCalibrationRescalesTargets() {
            List<SourceRecord> targetSources = new ArrayList<>();
            List<SourceRecord> referenceSources = new ArrayList<>();
            for (int i = 0; i < 3; i++) {
                for (int j = 0; j < 3; j++) {
                    double ra = 20.0 + 0.5 * i;
                    double dec = 0.5 * j;
                    targetSources.add(source("t-" + i + j, ra, dec, 0.8));
                    referenceSources.add(source("r-" + i + j, ra, dec, 1.0));
                }
            }
            Catalogue targets = target(targetSources);
            Catalogue references = reference(referenceSources);

            CrossMatchResult uncalibrated = service.run(targets, references, CrossMatchOptions.defaults(), null);
            CrossMatchResult calibrated = service.run(targets, references,
                    CrossMatchOptions.builder().fluxModel(true).fluxModelDegree(1).build(), null);

            assertTrue(uncalibrated.getMatches().isEmpty());
            assertTrue(uncalibrated.getFluxCalibration().isEmpty());
            assertEquals(9, calibrated.getMatches().size());
            assertEquals(1, calibrated.getFluxCalibration().orElseThrow().getDegree());
            assertEquals(1.0, calibrated.getMatches().get(0).getTarget().getPeakFlux(), 1e-9);
        }

        @Test
        @DisplayName("Too few calibration points should abort the run unless a fallback is configured")
        void insufficientCalibrationPoints() {
            Catalogue targets = target(List.of(source("t-1", 20.0, 0.0, 0.8)));
            Catalogue references = reference(List.of(source("r-1", 20.0, 0.0, 1.0)));
            CrossMatchOptions options = CrossMatchOptions.builder().fluxModel(true).fluxModelDegree(2).build();

            assertThrows(InsufficientCalibrationDataException.class,
                    () -> service.run(targets, references, options, null));
        }

        @Test
        @DisplayName("Catalogues without uncertainties should be rejected")
        void missingUncertaintiesRejected() {
            SourceRecord bare = SourceRecord.builder().uuid("t-1").ra(20.0).dec(0.0).peakFlux(1.0).build();
            SourceRecord bareRef = SourceRecord.builder().uuid("r-1").ra(20.0).dec(0.0).peakFlux(1.0).build();

            assertThrows(CatalogueValidationException.class,
                    () -> service.run(target(List.of(bare)), reference(List.of(bareRef)),
                            CrossMatchOptions.defaults(), null));
        }
    }

    @Nested
    @DisplayName("Forced final round")
    class ForcedRoundTests {

        private final Catalogue targets = target(List.of(source("t-1", 20.0, 0.0)));
        private final Catalogue references = reference(List.of(source("r-1", 20.0, 0.015)));

        @Test
        @DisplayName("Should accept the leftover best candidate as FORCED")
        void forcedRoundAcceptsLeftovers() {
            CrossMatchOptions options = CrossMatchOptions.builder().forceFinalRound(true).build();

            CrossMatchResult result = service.run(targets, references, options, null);

            assertEquals(ConvergenceState.CONVERGED, result.getFinalState());
            assertEquals(2, result.getRoundCount());
            assertTrue(result.getRounds().get(1).forced());
            assertEquals(1, result.getMatches().size());
            assertEquals(MatchDecision.FORCED, result.getMatches().get(0).getDecision());
            assertTrue(result.getMatches().get(0).getRawLikelihood() < 0.95);
            assertTrue(result.getLeftoverTargetsOriginal().isEmpty());
        }

        @Test
        @DisplayName("Should not run when the loop stopped on the round limit")
        void noForcedRoundAfterMaxRounds() {
            Catalogue more = target(List.of(source("t-1", 20.0, 0.0), source("t-2", 21.0, 0.0)));
            Catalogue refs = reference(List.of(source("r-1", 20.0, 0.0), source("r-2", 21.0, 0.015)));
            CrossMatchOptions options = CrossMatchOptions.builder().forceFinalRound(true).maxRounds(1).build();

            CrossMatchResult result = service.run(more, refs, options, null);

            assertEquals(ConvergenceState.MAX_ROUNDS_REACHED, result.getFinalState());
            assertTrue(result.getRounds().stream().noneMatch(RoundSummary::forced));
        }
    }

    @Nested
    @DisplayName("Observers")
    class ObserverTests {

        @Test
        @DisplayName("Listener should see every state change and round in order")
        void listenerSeesStatesAndRounds() {
            RoundListener listener = mock(RoundListener.class);
            Catalogue targets = target(List.of(source("t-1", 20.0, 0.0)));
            Catalogue references = reference(List.of(source("r-1", 20.0, 0.0)));

            service.run(targets, references, CrossMatchOptions.defaults(), listener);

            InOrder inOrder = inOrder(listener);
            inOrder.verify(listener).onStateChanged(null, ConvergenceState.SEEDING);
            inOrder.verify(listener).onStateChanged(ConvergenceState.SEEDING, ConvergenceState.MATCHING);
            inOrder.verify(listener).onStateChanged(ConvergenceState.MATCHING, ConvergenceState.CORRECTING);
            inOrder.verify(listener).onRoundCompleted(any(RoundSummary.class));
            inOrder.verify(listener).onStateChanged(ConvergenceState.CORRECTING, ConvergenceState.CONVERGED);
            verify(listener, times(1)).onRoundCompleted(any(RoundSummary.class));
        }

        @Test
        @DisplayName("Run and round spans should be opened and closed")
        void spansOpenedAndClosed() {
            TracingService tracing = mock(TracingService.class);
            Span span = mock(Span.class);
            when(tracing.startSpan(anyString())).thenReturn(span);
            when(tracing.startSpan(anyString(), anyMap())).thenReturn(span);
            CrossMatchService traced = new CrossMatchService(new NoOpMetricsService(), tracing, null);

            traced.run(target(List.of(source("t-1", 20.0, 0.0))), reference(List.of(source("r-1", 20.0, 0.0))),
                    CrossMatchOptions.defaults(), null);

            verify(tracing).startSpan(eq(TracingService.RUN), anyMap());
            verify(tracing).startSpan(TracingService.ROUND);
            verify(tracing).startSpan(TracingService.OFFSET_FIT);
            verify(span).setAttribute(Span.FINAL_STATE, "CONVERGED");
            verify(span, atLeast(3)).close();
        }
    }
}
