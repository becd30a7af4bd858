package com.catalog.crossmatch.decision;

import com.catalog.crossmatch.core.model.MatchCandidate;
import com.catalog.crossmatch.core.model.MatchDecision;

import java.util.Optional;

/**
 * Decides whether a target source's best candidate becomes a permanent match.
 *
 * <ul>
 *   <li>one candidate: accept iff its raw likelihood is at least {@code singleThreshold}</li>
 *   <li>several candidates: accept the one with the highest normalized likelihood iff that
 *       value is at least {@code multipleThreshold}; the others are discarded</li>
 *   <li>no candidates: nothing to accept</li>
 * </ul>
 *
 * <p>Candidates whose normalized likelihood falls below {@code negligibleLikelihood} do not
 * count towards the set size, so a set with one strong and several hopeless candidates is
 * judged by the single-candidate rule.</p>
 */
public final class AcceptanceRule {

    private final double singleThreshold;
    private final double multipleThreshold;
    private final double negligibleLikelihood;
    private final boolean forced;

    public AcceptanceRule(double singleThreshold, double multipleThreshold, double negligibleLikelihood) {
        this(singleThreshold, multipleThreshold, negligibleLikelihood, false);
    }

    private AcceptanceRule(double singleThreshold, double multipleThreshold,
                           double negligibleLikelihood, boolean forced) {
        validate(singleThreshold, "singleThreshold");
        validate(multipleThreshold, "multipleThreshold");
        validate(negligibleLikelihood, "negligibleLikelihood");
        this.singleThreshold = singleThreshold;
        this.multipleThreshold = multipleThreshold;
        this.negligibleLikelihood = negligibleLikelihood;
        this.forced = forced;
    }

    /**
     * Rule used by the final forced round: every target with a candidate takes its most
     * likely one.
     */
    public static AcceptanceRule forced(double negligibleLikelihood) {
        return new AcceptanceRule(0.0, 0.0, negligibleLikelihood, true);
    }

    public Decision decide(CandidateSet set) {
        if (set.isEmpty()) {
            return new Decision(DecisionOutcome.NO_CANDIDATES, null, 0, null);
        }
        Optional<MatchCandidate> best = set.best();
        int effective = Math.max(1, set.countAbove(negligibleLikelihood));
        MatchCandidate chosen = best.orElseThrow();
        if (!forced && chosen.rawLikelihood() <= 0.0) {
            return new Decision(DecisionOutcome.BELOW_THRESHOLD, chosen, effective, null);
        }

        if (effective == 1) {
            if (chosen.rawLikelihood() >= singleThreshold) {
                return new Decision(DecisionOutcome.ACCEPTED, chosen, 1,
                        forced ? MatchDecision.FORCED : MatchDecision.SINGLE_CANDIDATE);
            }
            return new Decision(DecisionOutcome.BELOW_THRESHOLD, chosen, 1, null);
        }
        if (chosen.normalizedLikelihood() >= multipleThreshold) {
            return new Decision(DecisionOutcome.ACCEPTED, chosen, effective,
                    forced ? MatchDecision.FORCED : MatchDecision.MULTIPLE_CANDIDATES);
        }
        return new Decision(DecisionOutcome.BELOW_THRESHOLD, chosen, effective, null);
    }

    public double getSingleThreshold() {
        return singleThreshold;
    }

    public double getMultipleThreshold() {
        return multipleThreshold;
    }

    public double getNegligibleLikelihood() {
        return negligibleLikelihood;
    }

    public boolean isForced() {
        return forced;
    }

    private static void validate(double value, String name) {
        if (value < 0.0 || value > 1.0 || Double.isNaN(value)) {
            throw new IllegalArgumentException(name + " must be between 0.0 and 1.0");
        }
    }

    /**
     * Result of applying the rule to one candidate set.
     *
     * @param outcome        accepted or why not
     * @param candidate      the best candidate, null when there were none
     * @param candidateCount candidates that counted towards the rule
     * @param matchDecision  how the match was accepted, null unless accepted
     */
    public record Decision(
            DecisionOutcome outcome,
            MatchCandidate candidate,
            int candidateCount,
            MatchDecision matchDecision
    ) {
        public boolean isAccepted() {
            return outcome == DecisionOutcome.ACCEPTED;
        }
    }
}
