package com.catalog.crossmatch.core.model;

/**
 * A target/reference pair found within the search radius during one round.
 *
 * @param targetIndex          index of the target source in the round's target pool
 * @param referenceIndex       index of the reference source in the round's reference pool
 * @param separationDeg        great-circle separation at the target's corrected position
 * @param fluxDifference       reference peak flux minus target peak flux
 * @param rawLikelihood        joint Gaussian likelihood, 1.0 for a perfect coincidence
 * @param normalizedLikelihood raw likelihood divided by the sum over the target's candidates
 */
public record MatchCandidate(
        int targetIndex,
        int referenceIndex,
        double separationDeg,
        double fluxDifference,
        double rawLikelihood,
        double normalizedLikelihood
) {
    public MatchCandidate {
        if (rawLikelihood < 0.0 || rawLikelihood > 1.0 || Double.isNaN(rawLikelihood)) {
            throw new IllegalArgumentException("rawLikelihood must be between 0.0 and 1.0, got " + rawLikelihood);
        }
    }

    /**
     * Returns a copy carrying the given normalized likelihood.
     */
    public MatchCandidate withNormalizedLikelihood(double normalized) {
        return new MatchCandidate(targetIndex, referenceIndex, separationDeg, fluxDifference,
                rawLikelihood, normalized);
    }

    public double separationArcsec() {
        return separationDeg * 3600.0;
    }
}
