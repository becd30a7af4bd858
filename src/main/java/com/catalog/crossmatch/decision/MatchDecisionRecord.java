package com.catalog.crossmatch.decision;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable record of one target source evaluated in one round.
 * Every evaluation produces one, including NO_CANDIDATES and BELOW_THRESHOLD outcomes.
 *
 * <p>The thresholds in force are captured so that each decision can be reconstructed
 * after the run.</p>
 */
public final class MatchDecisionRecord {

    private final String id;
    private final int round;
    private final String targetUuid;
    private final String referenceUuid;     // nullable when there were no candidates
    private final int candidateCount;
    private final double rawLikelihood;
    private final double normalizedLikelihood;
    private final double separationArcsec;
    private final DecisionOutcome outcome;

    // Thresholds snapshot at evaluation time
    private final double singleThreshold;
    private final double multipleThreshold;
    private final boolean forced;

    private final Instant evaluatedAt;

    private MatchDecisionRecord(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.round = builder.round;
        this.targetUuid = Objects.requireNonNull(builder.targetUuid, "targetUuid is required");
        this.referenceUuid = builder.referenceUuid;
        this.candidateCount = builder.candidateCount;
        this.rawLikelihood = builder.rawLikelihood;
        this.normalizedLikelihood = builder.normalizedLikelihood;
        this.separationArcsec = builder.separationArcsec;
        this.outcome = Objects.requireNonNull(builder.outcome, "outcome is required");
        this.singleThreshold = builder.singleThreshold;
        this.multipleThreshold = builder.multipleThreshold;
        this.forced = builder.forced;
        this.evaluatedAt = builder.evaluatedAt != null ? builder.evaluatedAt : Instant.now();
    }

    public String getId() { return id; }
    public int getRound() { return round; }
    public String getTargetUuid() { return targetUuid; }
    public String getReferenceUuid() { return referenceUuid; }
    public int getCandidateCount() { return candidateCount; }
    public double getRawLikelihood() { return rawLikelihood; }
    public double getNormalizedLikelihood() { return normalizedLikelihood; }
    public double getSeparationArcsec() { return separationArcsec; }
    public DecisionOutcome getOutcome() { return outcome; }
    public double getSingleThreshold() { return singleThreshold; }
    public double getMultipleThreshold() { return multipleThreshold; }
    public boolean isForced() { return forced; }
    public Instant getEvaluatedAt() { return evaluatedAt; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        MatchDecisionRecord that = (MatchDecisionRecord) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "MatchDecisionRecord{" +
                "round=" + round +
                ", target='" + targetUuid + '\'' +
                ", reference='" + referenceUuid + '\'' +
                ", candidates=" + candidateCount +
                ", rawLikelihood=" + rawLikelihood +
                ", outcome=" + outcome +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private int round;
        private String targetUuid;
        private String referenceUuid;
        private int candidateCount;
        private double rawLikelihood;
        private double normalizedLikelihood;
        private double separationArcsec = Double.NaN;
        private DecisionOutcome outcome;
        private double singleThreshold;
        private double multipleThreshold;
        private boolean forced;
        private Instant evaluatedAt;

        private Builder() {}

        public Builder id(String id) { this.id = id; return this; }
        public Builder round(int round) { this.round = round; return this; }
        public Builder targetUuid(String targetUuid) { this.targetUuid = targetUuid; return this; }
        public Builder referenceUuid(String referenceUuid) { this.referenceUuid = referenceUuid; return this; }
        public Builder candidateCount(int candidateCount) { this.candidateCount = candidateCount; return this; }
        public Builder rawLikelihood(double rawLikelihood) { this.rawLikelihood = rawLikelihood; return this; }
        public Builder normalizedLikelihood(double normalizedLikelihood) { this.normalizedLikelihood = normalizedLikelihood; return this; }
        public Builder separationArcsec(double separationArcsec) { this.separationArcsec = separationArcsec; return this; }
        public Builder outcome(DecisionOutcome outcome) { this.outcome = outcome; return this; }
        public Builder singleThreshold(double singleThreshold) { this.singleThreshold = singleThreshold; return this; }
        public Builder multipleThreshold(double multipleThreshold) { this.multipleThreshold = multipleThreshold; return this; }
        public Builder forced(boolean forced) { this.forced = forced; return this; }
        public Builder evaluatedAt(Instant evaluatedAt) { this.evaluatedAt = evaluatedAt; return this; }

        public MatchDecisionRecord build() {
            return new MatchDecisionRecord(this);
        }
    }
}
