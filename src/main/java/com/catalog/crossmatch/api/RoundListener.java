package com.catalog.crossmatch.api;

/**
 * Observes a run as it progresses. Called on the thread executing the run.
 */
public interface RoundListener {

    void onRoundCompleted(RoundSummary summary);

    default void onStateChanged(ConvergenceState from, ConvergenceState to) {
    }

    /**
     * A listener that ignores every event.
     */
    RoundListener NOOP = summary -> {};
}
