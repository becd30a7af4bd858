package com.catalog.crossmatch.api;

import com.catalog.crossmatch.correction.OffsetDiagnostics;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Per-round figures reported to listeners and kept in the result.
 *
 * @param round              round number, starting at 1
 * @param forced             whether this was the forced final round
 * @param evaluated          target sources scored
 * @param accepted           new matches
 * @param conflictsDeferred  acceptances lost to a stronger claim on the same reference source
 * @param leftoverTargets    unmatched target sources after the round
 * @param leftoverReferences unmatched reference sources after the round
 * @param candidateSetSizes  evaluated target sources per candidate-set size
 * @param duration           wall time of scoring plus refit
 * @param diagnostics        offset-model diagnostics when the round led to a refit, else null
 */
public record RoundSummary(
        int round,
        boolean forced,
        int evaluated,
        int accepted,
        int conflictsDeferred,
        int leftoverTargets,
        int leftoverReferences,
        Map<Integer, Long> candidateSetSizes,
        Duration duration,
        OffsetDiagnostics diagnostics
) {
    public RoundSummary {
        candidateSetSizes = Map.copyOf(candidateSetSizes);
    }

    public Optional<OffsetDiagnostics> offsetDiagnostics() {
        return Optional.ofNullable(diagnostics);
    }
}
