package com.catalog.crossmatch.decision;

import com.catalog.crossmatch.core.model.MatchCandidate;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * All candidates of one target source in one round, with normalized likelihoods.
 *
 * <p>Normalized likelihoods are the raw likelihoods divided by their sum, so they total 1.
 * When every raw likelihood is zero the set carries no evidence and all normalized
 * values are zero.</p>
 */
public record CandidateSet(int targetIndex, List<MatchCandidate> candidates) {

    public CandidateSet {
        candidates = List.copyOf(candidates);
    }

    /**
     * Builds a set from raw candidates, filling in normalized likelihoods.
     */
    public static CandidateSet normalize(int targetIndex, List<MatchCandidate> raw) {
        double sum = 0.0;
        for (MatchCandidate c : raw) {
            sum += c.rawLikelihood();
        }
        List<MatchCandidate> normalized = new ArrayList<>(raw.size());
        for (MatchCandidate c : raw) {
            normalized.add(c.withNormalizedLikelihood(sum > 0.0 ? c.rawLikelihood() / sum : 0.0));
        }
        return new CandidateSet(targetIndex, normalized);
    }

    public static CandidateSet empty(int targetIndex) {
        return new CandidateSet(targetIndex, List.of());
    }

    public int size() {
        return candidates.size();
    }

    public boolean isEmpty() {
        return candidates.isEmpty();
    }

    /**
     * Candidate with the highest normalized likelihood; ties go to the smaller separation.
     */
    public Optional<MatchCandidate> best() {
        return candidates.stream()
                .max(Comparator.comparingDouble(MatchCandidate::normalizedLikelihood)
                        .thenComparing(Comparator.comparingDouble(MatchCandidate::separationDeg).reversed()));
    }

    /**
     * Number of candidates whose normalized likelihood is at least {@code negligible}.
     */
    public int countAbove(double negligible) {
        int count = 0;
        for (MatchCandidate c : candidates) {
            if (c.normalizedLikelihood() >= negligible) {
                count++;
            }
        }
        return count;
    }
}
