package com.catalog.crossmatch.matching;

import com.catalog.crossmatch.core.model.AcceptedMatch;
import com.catalog.crossmatch.decision.MatchDecisionRecord;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * What one matching round produced, expressed against the pools it was run on.
 *
 * @param round                     round number, starting at 1
 * @param accepted                  new permanent matches, in target pool order
 * @param acceptedTargetIndices     indices into the round's target pool
 * @param acceptedReferenceIndices  indices into the round's reference pool
 * @param decisions                 one record per evaluated target source
 * @param evaluated                 number of target sources scored
 * @param candidateSetSizes         evaluated target sources per candidate-set size
 */
public record RoundOutcome(
        int round,
        List<AcceptedMatch> accepted,
        Set<Integer> acceptedTargetIndices,
        Set<Integer> acceptedReferenceIndices,
        List<MatchDecisionRecord> decisions,
        int evaluated,
        Map<Integer, Long> candidateSetSizes
) {
    public RoundOutcome {
        accepted = List.copyOf(accepted);
        acceptedTargetIndices = Set.copyOf(acceptedTargetIndices);
        acceptedReferenceIndices = Set.copyOf(acceptedReferenceIndices);
        decisions = List.copyOf(decisions);
        candidateSetSizes = Map.copyOf(candidateSetSizes);
    }

    public int acceptedCount() {
        return accepted.size();
    }

    public boolean hasAcceptances() {
        return !accepted.isEmpty();
    }
}
