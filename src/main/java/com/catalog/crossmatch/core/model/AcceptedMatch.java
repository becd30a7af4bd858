package com.catalog.crossmatch.core.model;

import java.util.Objects;

/**
 * A candidate promoted to a permanent match.
 *
 * <p>The target record holds the ORIGINAL (uncorrected) position; the position the
 * target was scored at, after offset correction, is kept separately.</p>
 */
public final class AcceptedMatch {

    private final SourceRecord target;
    private final SourceRecord reference;
    private final SkyPosition correctedTargetPosition;
    private final double rawLikelihood;
    private final Double normalizedLikelihood; // null for single-candidate matches
    private final int candidateCount;
    private final int round;
    private final double separationArcsec;
    private final MatchDecision decision;

    private AcceptedMatch(Builder builder) {
        this.target = Objects.requireNonNull(builder.target, "target is required");
        this.reference = Objects.requireNonNull(builder.reference, "reference is required");
        this.correctedTargetPosition = builder.correctedTargetPosition != null
                ? builder.correctedTargetPosition : builder.target.position();
        this.rawLikelihood = builder.rawLikelihood;
        this.normalizedLikelihood = builder.normalizedLikelihood;
        this.candidateCount = builder.candidateCount;
        this.round = builder.round;
        this.separationArcsec = builder.separationArcsec;
        this.decision = Objects.requireNonNull(builder.decision, "decision is required");
    }

    public SourceRecord getTarget() { return target; }
    public SourceRecord getReference() { return reference; }
    public SkyPosition getCorrectedTargetPosition() { return correctedTargetPosition; }
    public double getRawLikelihood() { return rawLikelihood; }
    public Double getNormalizedLikelihood() { return normalizedLikelihood; }
    public int getCandidateCount() { return candidateCount; }
    public int getRound() { return round; }
    public double getSeparationArcsec() { return separationArcsec; }
    public MatchDecision getDecision() { return decision; }

    /**
     * Measured RA offset, original target minus reference (degrees).
     */
    public double offsetRa() {
        return target.getRa() - reference.getRa();
    }

    /**
     * Measured Dec offset, original target minus reference (degrees).
     */
    public double offsetDec() {
        return target.getDec() - reference.getDec();
    }

    @Override
    public String toString() {
        return "AcceptedMatch{" +
                "target='" + target.getUuid() + '\'' +
                ", reference='" + reference.getUuid() + '\'' +
                ", rawLikelihood=" + rawLikelihood +
                ", normalizedLikelihood=" + normalizedLikelihood +
                ", candidates=" + candidateCount +
                ", round=" + round +
                ", decision=" + decision +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private SourceRecord target;
        private SourceRecord reference;
        private SkyPosition correctedTargetPosition;
        private double rawLikelihood;
        private Double normalizedLikelihood;
        private int candidateCount;
        private int round;
        private double separationArcsec;
        private MatchDecision decision;

        private Builder() {}

        public Builder target(SourceRecord target) { this.target = target; return this; }
        public Builder reference(SourceRecord reference) { this.reference = reference; return this; }
        public Builder correctedTargetPosition(SkyPosition position) { this.correctedTargetPosition = position; return this; }
        public Builder rawLikelihood(double rawLikelihood) { this.rawLikelihood = rawLikelihood; return this; }
        public Builder normalizedLikelihood(Double normalizedLikelihood) { this.normalizedLikelihood = normalizedLikelihood; return this; }
        public Builder candidateCount(int candidateCount) { this.candidateCount = candidateCount; return this; }
        public Builder round(int round) { this.round = round; return this; }
        public Builder separationArcsec(double separationArcsec) { this.separationArcsec = separationArcsec; return this; }
        public Builder decision(MatchDecision decision) { this.decision = decision; return this; }

        public AcceptedMatch build() {
            return new AcceptedMatch(this);
        }
    }
}
