package com.catalog.crossmatch.api;

import com.catalog.crossmatch.core.model.AcceptedMatch;
import com.catalog.crossmatch.core.model.SourceRecord;
import com.catalog.crossmatch.correction.FluxCalibrationModel;
import com.catalog.crossmatch.correction.OffsetDiagnostics;
import com.catalog.crossmatch.decision.DecisionLedger;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Everything a run produced.
 *
 * <p>Positions are in the run's working frame: when {@link #isRaWrapped()} is true, right
 * ascensions above 180 degrees were shifted by -360 before matching. Exporters map them
 * back into [0, 360).</p>
 */
public final class CrossMatchResult {

    private final String runId;
    private final List<AcceptedMatch> matches;
    private final List<SourceRecord> leftoverReferences;
    private final List<SourceRecord> leftoverTargetsCorrected;
    private final List<SourceRecord> leftoverTargetsOriginal;
    private final List<RoundSummary> rounds;
    private final ConvergenceState finalState;
    private final boolean raWrapped;
    private final FluxCalibrationModel fluxCalibration;
    private final DecisionLedger ledger;
    private final Duration duration;

    private CrossMatchResult(Builder builder) {
        this.runId = Objects.requireNonNull(builder.runId, "runId is required");
        this.matches = List.copyOf(builder.matches);
        this.leftoverReferences = List.copyOf(builder.leftoverReferences);
        this.leftoverTargetsCorrected = List.copyOf(builder.leftoverTargetsCorrected);
        this.leftoverTargetsOriginal = List.copyOf(builder.leftoverTargetsOriginal);
        this.rounds = List.copyOf(builder.rounds);
        this.finalState = Objects.requireNonNull(builder.finalState, "finalState is required");
        this.raWrapped = builder.raWrapped;
        this.fluxCalibration = builder.fluxCalibration;
        this.ledger = builder.ledger != null ? builder.ledger : new DecisionLedger();
        this.duration = builder.duration != null ? builder.duration : Duration.ZERO;
    }

    public String getRunId() { return runId; }
    public List<AcceptedMatch> getMatches() { return matches; }
    public List<SourceRecord> getLeftoverReferences() { return leftoverReferences; }

    /**
     * Unmatched target sources at their offset-corrected positions.
     */
    public List<SourceRecord> getLeftoverTargetsCorrected() { return leftoverTargetsCorrected; }

    /**
     * Unmatched target sources at their original positions.
     */
    public List<SourceRecord> getLeftoverTargetsOriginal() { return leftoverTargetsOriginal; }

    public List<RoundSummary> getRounds() { return rounds; }
    public ConvergenceState getFinalState() { return finalState; }
    public boolean isRaWrapped() { return raWrapped; }
    public DecisionLedger getLedger() { return ledger; }
    public Duration getDuration() { return duration; }

    public Optional<FluxCalibrationModel> getFluxCalibration() {
        return Optional.ofNullable(fluxCalibration);
    }

    public boolean isConverged() {
        return finalState == ConvergenceState.CONVERGED;
    }

    public int getRoundCount() {
        return rounds.size();
    }

    /**
     * Diagnostics of every offset-model refit, in round order.
     */
    public List<OffsetDiagnostics> getOffsetDiagnostics() {
        return rounds.stream()
                .map(RoundSummary::diagnostics)
                .filter(Objects::nonNull)
                .toList();
    }

    @Override
    public String toString() {
        return "CrossMatchResult{" +
                "runId='" + runId + '\'' +
                ", matches=" + matches.size() +
                ", leftoverTargets=" + leftoverTargetsOriginal.size() +
                ", leftoverReferences=" + leftoverReferences.size() +
                ", rounds=" + rounds.size() +
                ", finalState=" + finalState +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String runId;
        private List<AcceptedMatch> matches = List.of();
        private List<SourceRecord> leftoverReferences = List.of();
        private List<SourceRecord> leftoverTargetsCorrected = List.of();
        private List<SourceRecord> leftoverTargetsOriginal = List.of();
        private List<RoundSummary> rounds = List.of();
        private ConvergenceState finalState;
        private boolean raWrapped;
        private FluxCalibrationModel fluxCalibration;
        private DecisionLedger ledger;
        private Duration duration;

        private Builder() {}

        public Builder runId(String runId) { this.runId = runId; return this; }
        public Builder matches(List<AcceptedMatch> matches) { this.matches = matches; return this; }
        public Builder leftoverReferences(List<SourceRecord> sources) { this.leftoverReferences = sources; return this; }
        public Builder leftoverTargetsCorrected(List<SourceRecord> sources) { this.leftoverTargetsCorrected = sources; return this; }
        public Builder leftoverTargetsOriginal(List<SourceRecord> sources) { this.leftoverTargetsOriginal = sources; return this; }
        public Builder rounds(List<RoundSummary> rounds) { this.rounds = rounds; return this; }
        public Builder finalState(ConvergenceState finalState) { this.finalState = finalState; return this; }
        public Builder raWrapped(boolean raWrapped) { this.raWrapped = raWrapped; return this; }
        public Builder fluxCalibration(FluxCalibrationModel model) { this.fluxCalibration = model; return this; }
        public Builder ledger(DecisionLedger ledger) { this.ledger = ledger; return this; }
        public Builder duration(Duration duration) { this.duration = duration; return this; }

        public CrossMatchResult build() {
            return new CrossMatchResult(this);
        }
    }
}
