package com.catalog.crossmatch.api;

/**
 * States of the convergence loop.
 */
public enum ConvergenceState {
    /** First round, optionally restricted to high-SNR target sources. */
    SEEDING,
    MATCHING,
    /** Refitting the offset model and repositioning unmatched target sources. */
    CORRECTING,
    /** A round produced no new acceptances, or nothing is left to match. */
    CONVERGED,
    /** Stopped by the round limit while rounds were still producing matches. */
    MAX_ROUNDS_REACHED,
    /** Stopped between rounds because the running thread was interrupted. */
    CANCELLED;

    public boolean isTerminal() {
        return this == CONVERGED || this == MAX_ROUNDS_REACHED || this == CANCELLED;
    }
}
