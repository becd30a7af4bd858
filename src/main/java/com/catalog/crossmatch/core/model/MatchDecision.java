package com.catalog.crossmatch.core.model;

/**
 * How an accepted match was decided.
 */
public enum MatchDecision {
    /**
     * The target source had exactly one candidate and its raw likelihood
     * reached the single-match threshold.
     */
    SINGLE_CANDIDATE,

    /**
     * The target source had several candidates and the best normalized
     * likelihood reached the multiple-match threshold.
     */
    MULTIPLE_CANDIDATES,

    /**
     * Accepted in the optional final round that ignores both thresholds.
     */
    FORCED
}
