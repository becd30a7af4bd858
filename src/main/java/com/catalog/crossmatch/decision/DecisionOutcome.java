package com.catalog.crossmatch.decision;

/**
 * Outcome of scoring one target source in one round.
 */
public enum DecisionOutcome {
    /** The best candidate reached its threshold and became a permanent match. */
    ACCEPTED,

    /** Candidates existed but none reached the applicable threshold; retried next round. */
    BELOW_THRESHOLD,

    /** No reference source within the search radius; retried next round. */
    NO_CANDIDATES,

    /** Accepted on its own, but a stronger claim took the same reference source this round. */
    CONFLICT_DEFERRED
}
